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

import java.io.Closeable;
import java.io.FileOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Appends snapshots to a log file, one frame per snapshot. Existing content
 * is kept, so a restarted recorder continues the same log.
 * <p>
 * Frames go through a plain {@link FileOutputStream}: an interrupt pending on
 * the recording thread does not close the log the way it would close an
 * interruptible {@code FileChannel}.
 */
public final class SnapshotLogWriter implements Closeable {

    private static final Logger LOGGER = Logger.getLogger(SnapshotLogWriter.class.getName());

    private final Path path;
    private final boolean fsync;
    private final FileOutputStream out;
    private long appended;
    private boolean closed;

    /**
     * @param path  the log file, created if missing
     * @param fsync whether every append is forced to disk
     */
    public SnapshotLogWriter(Path path, boolean fsync) throws IOException {
        this.path = Objects.requireNonNull(path, "path");
        this.fsync = fsync;
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        this.out = new FileOutputStream(path.toFile(), true);
        LOGGER.fine(() -> "Recording snapshots to " + path);
    }

    public synchronized void append(Snapshot snapshot) throws IOException {
        out.write(SnapshotCodec.encode(snapshot));
        if (fsync) {
            out.getFD().sync();
        }
        appended++;
    }

    /**
     * @return snapshots appended through this writer
     */
    public synchronized long appended() {
        return appended;
    }

    public Path path() {
        return path;
    }

    @Override
    public synchronized void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        try {
            out.getFD().sync();
        } finally {
            out.close();
        }
    }
}
