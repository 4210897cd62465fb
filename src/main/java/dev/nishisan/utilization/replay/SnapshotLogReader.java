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

import dev.nishisan.utilization.model.Snapshot;

import java.io.BufferedInputStream;
import java.io.Closeable;
import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Reads a snapshot log front to back.
 * <p>
 * A frame cut short at the end of the file (the recorder died mid-append)
 * ends the log with a warning. A complete frame that fails to decode is
 * corruption and raises {@link SnapshotLogException}.
 */
public final class SnapshotLogReader implements Closeable {

    private static final Logger LOGGER = Logger.getLogger(SnapshotLogReader.class.getName());

    private final Path path;
    private final DataInputStream in;
    private long offset;
    private boolean exhausted;

    public SnapshotLogReader(Path path) throws IOException {
        this.path = Objects.requireNonNull(path, "path");
        this.in = new DataInputStream(new BufferedInputStream(Files.newInputStream(path)));
    }

    /**
     * Reads every snapshot of a log.
     */
    public static List<Snapshot> readAll(Path path) throws IOException {
        List<Snapshot> snapshots = new ArrayList<>();
        try (SnapshotLogReader reader = new SnapshotLogReader(path)) {
            Optional<Snapshot> next;
            while ((next = reader.next()).isPresent()) {
                snapshots.add(next.get());
            }
        }
        return snapshots;
    }

    /**
     * @return the next snapshot, or empty at the end of the log
     * @throws SnapshotLogException if the next frame is corrupt
     */
    public Optional<Snapshot> next() throws IOException {
        if (exhausted) {
            return Optional.empty();
        }
        long frameStart = offset;
        byte[] lengthBytes = new byte[4];
        int r = in.readNBytes(lengthBytes, 0, 4);
        if (r == 0) {
            exhausted = true;
            return Optional.empty();
        }
        if (r < 4) {
            return tornTail(frameStart);
        }
        int length = ByteBuffer.wrap(lengthBytes).getInt();
        if (length < SnapshotCodec.HEADER_BYTES || length > SnapshotCodec.MAX_FRAME_BYTES) {
            throw new SnapshotLogException(path, frameStart, "Invalid frame length " + length);
        }
        byte[] body = new byte[length];
        if (in.readNBytes(body, 0, length) < length) {
            return tornTail(frameStart);
        }
        offset = frameStart + 4L + length;

        ByteBuffer header = ByteBuffer.wrap(body, 0, SnapshotCodec.HEADER_BYTES);
        int magic = header.getInt();
        int version = header.getInt();
        if (magic != SnapshotCodec.FRAME_MAGIC) {
            throw new SnapshotLogException(path, frameStart, "Bad frame magic 0x" + Integer.toHexString(magic));
        }
        if (version != SnapshotCodec.FRAME_VERSION) {
            throw new SnapshotLogException(path, frameStart, "Unsupported frame version " + version);
        }
        byte[] json = new byte[length - SnapshotCodec.HEADER_BYTES];
        System.arraycopy(body, SnapshotCodec.HEADER_BYTES, json, 0, json.length);
        try {
            return Optional.of(SnapshotCodec.decode(json));
        } catch (EOFException e) {
            throw new SnapshotLogException(path, frameStart, "Truncated snapshot payload", e);
        } catch (IOException e) {
            throw new SnapshotLogException(path, frameStart, "Invalid snapshot payload", e);
        }
    }

    private Optional<Snapshot> tornTail(long frameStart) {
        exhausted = true;
        LOGGER.warning(() -> "Ignoring incomplete trailing frame in " + path + " at offset " + frameStart);
        return Optional.empty();
    }

    @Override
    public void close() throws IOException {
        in.close();
    }
}
