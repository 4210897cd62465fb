/*
 *  Copyright (C) 2020-2025 Lucas Nishimura <lucas.nishimura at gmail.com>
 *
 *  This program is free software: you can redistribute it and/or modify
 *  it under the terms of the GNU General Public License as published by
 *  the Free Software Foundation, either version 3 of the License, or
 *  (at your option) any later version.
 *
 *  This program is distributed in the hope that it will be useful,
 *  but WITHOUT ANY WARRANTY; without even the implied warranty of
 *  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 *  GNU General Public License for more details.
 *
 *  You should have received a copy of the GNU General Public License
 *  along with this program.  If not, see <https://www.gnu.org/licenses/>
 */

package dev.nishisan.utilization.replay;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.nishisan.utilization.model.Snapshot;

import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;

/**
 * Frame encoding of snapshots in a log:
 * <pre>
 *   int length          bytes that follow
 *   int magic           "USNP"
 *   int version
 *   byte[length - 8]    the snapshot as JSON
 * </pre>
 */
final class SnapshotCodec {

    static final int FRAME_MAGIC = 0x55534E50; // "USNP"
    static final int FRAME_VERSION = 1;
    static final int HEADER_BYTES = 8;
    static final int MAX_FRAME_BYTES = 64 * 1024 * 1024;

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES);

    private SnapshotCodec() {
    }

    static byte[] encode(Snapshot snapshot) throws IOException {
        byte[] json = MAPPER.writeValueAsBytes(snapshot);
        ByteArrayOutputStream bos = new ByteArrayOutputStream(json.length + 12);
        try (DataOutputStream out = new DataOutputStream(bos)) {
            out.writeInt(HEADER_BYTES + json.length);
            out.writeInt(FRAME_MAGIC);
            out.writeInt(FRAME_VERSION);
            out.write(json);
        }
        return bos.toByteArray();
    }

    static Snapshot decode(byte[] json) throws IOException {
        return MAPPER.readValue(json, Snapshot.class);
    }
}
