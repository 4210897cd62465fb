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

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Resource usage of one process during one tick.
 *
 * @param pid          the process id
 * @param username     the owner, or {@code null} when the owner is below the
 *                     configured minimum uid (anonymous)
 * @param timeStart    start of the measured interval
 * @param timeEnd      end of the measured interval
 * @param cpuFraction  CPU used, in cores (1.0 = one core fully busy)
 * @param memFraction  resident memory as a fraction of total host memory
 * @param command      the command line, or {@code null} if unavailable
 * @param creationTime the process start time, or {@code null} if unavailable
 */
public record ProcessMeasurement(
        int pid,
        String username,
        Instant timeStart,
        Instant timeEnd,
        double cpuFraction,
        double memFraction,
        List<String> command,
        Instant creationTime) {

    public ProcessMeasurement {
        Objects.requireNonNull(timeStart, "timeStart");
        Objects.requireNonNull(timeEnd, "timeEnd");
        if (command != null) {
            command = List.copyOf(command);
        }
    }

    /**
     * Returns the stable identity of this process. Measurements without a known
     * creation time have no identity and are not deduplicated.
     *
     * @return the identity, or empty if the creation time is unknown
     */
    public Optional<ProcessIdentity> identity() {
        if (creationTime == null) {
            return Optional.empty();
        }
        return Optional.of(new ProcessIdentity(pid, creationTime));
    }

    @JsonIgnore
    public boolean isAnonymous() {
        return username == null;
    }
}
