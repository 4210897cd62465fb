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

import java.io.Closeable;
import java.io.IOException;
import java.util.Optional;

/**
 * Supplies the scheduler with one snapshot per tick, either sampled live or
 * read back from a recording.
 */
public interface SnapshotSource extends Closeable {

    /**
     * Blocks until the next tick is due. Replayed sources return immediately.
     *
     * @throws InterruptedException if the waiting thread is interrupted
     */
    default void awaitNextTick() throws InterruptedException {
    }

    /**
     * Produces the snapshot of the current tick.
     *
     * @return the snapshot, or empty when the source is exhausted
     */
    Optional<Snapshot> collect() throws IOException;

    @Override
    default void close() throws IOException {
    }
}
