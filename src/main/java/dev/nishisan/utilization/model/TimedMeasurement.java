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

import java.time.Duration;
import java.time.Instant;
import java.util.Set;

/**
 * A measurement covering the half-open interval {@code [timeStart, timeEnd)}.
 * Windows weight each entry by the length of that interval.
 */
public interface TimedMeasurement {

    Instant timeStart();

    Instant timeEnd();

    double cpuFraction();

    double memFraction();

    /**
     * Returns the identities of the processes that contributed to this measurement.
     *
     * @return the unique processes, never {@code null}
     */
    Set<ProcessIdentity> processes();

    /**
     * Returns the length of the measured interval in seconds, with nanosecond precision.
     *
     * @return the interval length, {@code 0} if the interval is empty
     */
    default double durationSeconds() {
        Duration duration = Duration.between(timeStart(), timeEnd());
        return duration.getSeconds() + duration.getNano() / 1_000_000_000.0;
    }
}
