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

package dev.nishisan.utilization.clock;

import java.time.Duration;
import java.time.Instant;

/**
 * Wall-clock access for the sampling loop. Injected so that tests can drive
 * time explicitly instead of sleeping.
 */
public interface MonitorClock {

    Instant now();

    /**
     * Blocks the calling thread for the given duration.
     *
     * @param duration how long to sleep; non-positive durations return immediately
     * @throws InterruptedException if the thread is interrupted while sleeping
     */
    void sleep(Duration duration) throws InterruptedException;

    static MonitorClock system() {
        return SystemMonitorClock.INSTANCE;
    }
}
