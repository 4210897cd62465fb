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
 * The processes of one owner that matched a group during one tick, summed
 * into a single window entry.
 *
 * @param username    the common owner, {@code null} for anonymous processes
 * @param timeStart   the common interval start
 * @param timeEnd     the common interval end
 * @param cpuFraction summed CPU of the merged processes
 * @param memFraction summed memory of the merged processes
 * @param processes   union of the known process identities
 */
public record MergedMeasurement(
        String username,
        Instant timeStart,
        Instant timeEnd,
        double cpuFraction,
        double memFraction,
        Set<ProcessIdentity> processes) implements TimedMeasurement {

    public MergedMeasurement {
        Objects.requireNonNull(timeStart, "timeStart");
        Objects.requireNonNull(timeEnd, "timeEnd");
        processes = Collections.unmodifiableSet(new LinkedHashSet<>(processes));
    }

    /**
     * Merges measurements taken in the same tick for the same owner.
     *
     * @param items the measurements to merge
     * @return the merged measurement
     * @throws IllegalArgumentException if {@code items} is empty, or the items
     *                                  disagree on owner or interval
     */
    public static MergedMeasurement of(List<ProcessMeasurement> items) {
        if (items == null || items.isEmpty()) {
            throw new IllegalArgumentException("no measurements to merge");
        }
        ProcessMeasurement first = items.get(0);
        double cpu = 0.0;
        double mem = 0.0;
        Set<ProcessIdentity> identities = new LinkedHashSet<>();
        for (ProcessMeasurement item : items) {
            if (!Objects.equals(first.username(), item.username())) {
                throw new IllegalArgumentException("mismatching usernames: "
                        + first.username() + " != " + item.username());
            }
            if (!first.timeStart().equals(item.timeStart()) || !first.timeEnd().equals(item.timeEnd())) {
                throw new IllegalArgumentException("mismatching intervals for pid " + item.pid());
            }
            cpu += item.cpuFraction();
            mem += item.memFraction();
            item.identity().ifPresent(identities::add);
        }
        return new MergedMeasurement(first.username(), first.timeStart(), first.timeEnd(), cpu, mem, identities);
    }
}
