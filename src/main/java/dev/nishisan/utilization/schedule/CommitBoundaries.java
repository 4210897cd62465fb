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

import java.time.Duration;
import java.time.Instant;

/**
 * Wall-clock alignment helpers. Boundaries are multiples of an interval
 * counted from the epoch, so a five minute interval commits at :00, :05, :10...
 */
public final class CommitBoundaries {

    private CommitBoundaries() {
    }

    /**
     * @return the first multiple of {@code interval} strictly after {@code time}
     */
    public static Instant next(Instant time, Duration interval) {
        long step = requirePositiveMillis(interval);
        long millis = time.toEpochMilli();
        return Instant.ofEpochMilli((Math.floorDiv(millis, step) + 1) * step);
    }

    /**
     * @return how long to sleep from {@code time} until the next multiple of
     * {@code interval}; a full interval when {@code time} is already aligned
     */
    public static Duration untilNext(Instant time, Duration interval) {
        return Duration.between(time, next(time, interval));
    }

    private static long requirePositiveMillis(Duration interval) {
        long step = interval.toMillis();
        if (step <= 0) {
            throw new IllegalArgumentException("interval must be at least one millisecond: " + interval);
        }
        return step;
    }
}
