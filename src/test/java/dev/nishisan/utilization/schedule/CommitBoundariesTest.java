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

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class CommitBoundariesTest {

    private static final Duration FIVE_MINUTES = Duration.ofMinutes(5);

    @Test
    void shouldAlignToWallClockMultiples() {
        assertEquals(Instant.parse("2024-03-01T10:05:00Z"),
                CommitBoundaries.next(Instant.parse("2024-03-01T10:02:13.400Z"), FIVE_MINUTES));
    }

    @Test
    void shouldMoveStrictlyPastAnAlignedInstant() {
        assertEquals(Instant.parse("2024-03-01T10:10:00Z"),
                CommitBoundaries.next(Instant.parse("2024-03-01T10:05:00Z"), FIVE_MINUTES));
    }

    @Test
    void shouldComputeSleepUntilNextTick() {
        Duration tick = Duration.ofSeconds(5);

        assertEquals(Duration.ofMillis(1800),
                CommitBoundaries.untilNext(Instant.parse("2024-03-01T10:00:03.200Z"), tick));
        assertEquals(tick, CommitBoundaries.untilNext(Instant.parse("2024-03-01T10:00:05Z"), tick));
    }

    @Test
    void shouldHandleInstantsBeforeEpoch() {
        assertEquals(Instant.parse("1969-12-31T23:55:00Z"),
                CommitBoundaries.next(Instant.parse("1969-12-31T23:51:00Z"), FIVE_MINUTES));
    }

    @Test
    void shouldRejectSubMillisecondInterval() {
        assertThrows(IllegalArgumentException.class,
                () -> CommitBoundaries.next(Instant.EPOCH, Duration.ofNanos(10)));
    }
}
