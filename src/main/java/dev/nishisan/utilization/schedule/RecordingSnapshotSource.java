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
import dev.nishisan.utilization.replay.SnapshotLogWriter;

import java.io.IOException;
import java.util.Objects;
import java.util.Optional;

/**
 * Passes snapshots through unchanged while appending each one to a log, so a
 * live run can later be replayed exactly.
 */
public final class RecordingSnapshotSource implements SnapshotSource {

    private final SnapshotSource delegate;
    private final SnapshotLogWriter writer;

    public RecordingSnapshotSource(SnapshotSource delegate, SnapshotLogWriter writer) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.writer = Objects.requireNonNull(writer, "writer");
    }

    @Override
    public void awaitNextTick() throws InterruptedException {
        delegate.awaitNextTick();
    }

    @Override
    public Optional<Snapshot> collect() throws IOException {
        Optional<Snapshot> snapshot = delegate.collect();
        if (snapshot.isPresent()) {
            writer.append(snapshot.get());
        }
        return snapshot;
    }

    @Override
    public void close() throws IOException {
        try {
            delegate.close();
        } finally {
            writer.close();
        }
    }
}
