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

package dev.nishisan.utilization.sink;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.nishisan.utilization.model.UtilizationRecord;

import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Appends each record as one JSON object per line. A commit is written with
 * a single open/append/close so that readers never see half a commit unless
 * the write itself fails.
 */
public final class JsonLinesUtilizationSink implements UtilizationSink {

    private static final Logger LOGGER = Logger.getLogger(JsonLinesUtilizationSink.class.getName());

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private final Path path;

    public JsonLinesUtilizationSink(Path path) {
        this.path = Objects.requireNonNull(path, "path");
    }

    @Override
    public void write(List<UtilizationRecord> records) throws IOException {
        StringBuilder lines = new StringBuilder(records.size() * 256);
        for (UtilizationRecord record : records) {
            lines.append(MAPPER.writeValueAsString(record)).append('\n');
        }
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        // not a FileChannel: a pending interrupt must not abort the commit
        try (OutputStream out = new FileOutputStream(path.toFile(), true)) {
            out.write(lines.toString().getBytes(StandardCharsets.UTF_8));
        }
        LOGGER.fine(() -> "Appended " + records.size() + " records to " + path);
    }

    /**
     * Reads back every record of a file written by this sink.
     */
    public static List<UtilizationRecord> readAll(Path path) throws IOException {
        List<String> lines = Files.readAllLines(path, StandardCharsets.UTF_8);
        List<UtilizationRecord> records = new ArrayList<>(lines.size());
        for (String line : lines) {
            if (!line.isBlank()) {
                records.add(MAPPER.readValue(line, UtilizationRecord.class));
            }
        }
        return records;
    }

    public Path path() {
        return path;
    }
}
