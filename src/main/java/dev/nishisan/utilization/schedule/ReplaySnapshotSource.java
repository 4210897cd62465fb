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

package dev.nishisan.utilization.schedule;

import dev.nishisan.utilization.model.Snapshot;
import dev.nishisan.utilization.replay.SnapshotLogReader;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Feeds the snapshots of a recorded log in order, without waiting between
 * them. The source is exhausted at the end of the log.
 */
public final class ReplaySnapshotSource implements SnapshotSource {

    private static final Logger LOGGER = Logger.getLogger(ReplaySnapshotSource.class.getName());

    private final SnapshotLogReader reader;
    private long replayed;

    public ReplaySnapshotSource(Path log) throws IOException {
        this(new SnapshotLogReader(log));
        LOGGER.info(() -> "Replaying snapshots from " + log);
    }

    public ReplaySnapshotSource(SnapshotLogReader reader) {
        this.reader = Objects.requireNonNull(reader, "reader");
    }

    @Override
    public Optional<Snapshot> collect() throws IOException {
        Optional<Snapshot> next = reader.next();
        if (next.isPresent()) {
            replayed++;
        } else {
            LOGGER.fine(() -> "Replay finished after " + replayed + " snapshots");
        }
        return next;
    }

    @Override
    public void close() throws IOException {
        reader.close();
    }
}
