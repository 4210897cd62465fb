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

package dev.nishisan.utilization.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Everything collected during one tick. Snapshots are immutable and are the
 * unit written to and read from replay logs.
 *
 * @param timestamp when the tick woke up
 * @param system    the host-wide measurement
 * @param processes per-process measurements, in enumeration order
 */
public record Snapshot(Instant timestamp, SystemMeasurement system, List<ProcessMeasurement> processes) {

    public Snapshot {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(system, "system");
        processes = processes == null ? List.of() : List.copyOf(processes);
    }
}
