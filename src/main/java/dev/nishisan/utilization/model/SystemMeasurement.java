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
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Host-wide resource usage during one tick.
 *
 * @param timeStart   start of the measured interval
 * @param timeEnd     end of the measured interval
 * @param cpuFraction CPU used as a fraction of all logical cores
 * @param memFraction memory used as a fraction of total memory
 * @param users       owners seen during the tick, anonymous owners excluded
 * @param processes   identities of the processes seen during the tick
 */
public record SystemMeasurement(
        Instant timeStart,
        Instant timeEnd,
        double cpuFraction,
        double memFraction,
        Set<String> users,
        Set<ProcessIdentity> processes) implements TimedMeasurement {

    public SystemMeasurement {
        Objects.requireNonNull(timeStart, "timeStart");
        Objects.requireNonNull(timeEnd, "timeEnd");
        users = users == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(users));
        processes = processes == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(processes));
    }

    /**
     * Builds the system measurement of a tick from host counters and the
     * processes collected in the same tick.
     */
    public static SystemMeasurement of(Instant timeStart,
                                       Instant timeEnd,
                                       double cpuFraction,
                                       double memFraction,
                                       List<ProcessMeasurement> processes) {
        Set<String> users = new LinkedHashSet<>();
        Set<ProcessIdentity> identities = new LinkedHashSet<>();
        for (ProcessMeasurement process : processes) {
            process.identity().ifPresent(identities::add);
            if (!process.isAnonymous()) {
                users.add(process.username());
            }
        }
        return new SystemMeasurement(timeStart, timeEnd, cpuFraction, memFraction, users, identities);
    }
}
