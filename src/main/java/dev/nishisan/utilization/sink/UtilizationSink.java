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

import dev.nishisan.utilization.model.UtilizationRecord;

import java.io.IOException;
import java.util.List;

/**
 * Destination of committed records. Called once per commit boundary from the
 * sampling thread; a slow sink delays the next tick.
 */
@FunctionalInterface
public interface UtilizationSink {

    /**
     * Persists the records of one commit.
     *
     * @param records the records of the commit, host record first
     * @throws IOException if the records could not be persisted; the monitor
     *                     stops and does not retry
     */
    void write(List<UtilizationRecord> records) throws IOException;
}
