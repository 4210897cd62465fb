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
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * One committed window, as handed to a sink. Times are UTC truncated to whole
 * seconds.
 *
 * @param scope              whether this is a host or a group record
 * @param hostname           the sampled host
 * @param user               the owner, {@code null} for system records and anonymous processes
 * @param group              the group name, {@code null} for system records and the catch-all group
 * @param timeStart          start of the window
 * @param timeEnd            end of the window
 * @param averageCpu         time-weighted average CPU
 * @param averageMem         time-weighted average memory
 * @param peakCpu            highest CPU of a single tick
 * @param peakMem            highest memory of a single tick
 * @param uniqueProcessCount distinct processes seen in the window
 * @param userCount          distinct owners seen in the window, {@code 0} for group records
 */
public record UtilizationRecord(
        RecordScope scope,
        String hostname,
        String user,
        String group,
        Instant timeStart,
        Instant timeEnd,
        double averageCpu,
        double averageMem,
        double peakCpu,
        double peakMem,
        int uniqueProcessCount,
        int userCount) {

    public UtilizationRecord {
        Objects.requireNonNull(scope, "scope");
        Objects.requireNonNull(hostname, "hostname");
        timeStart = Objects.requireNonNull(timeStart, "timeStart").truncatedTo(ChronoUnit.SECONDS);
        timeEnd = Objects.requireNonNull(timeEnd, "timeEnd").truncatedTo(ChronoUnit.SECONDS);
    }
}
