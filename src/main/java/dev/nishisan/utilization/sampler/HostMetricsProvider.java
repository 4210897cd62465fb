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

package dev.nishisan.utilization.sampler;

import java.util.List;

/**
 * Source of host and process counters. The live implementation is
 * {@link OshiHostMetricsProvider}; tests substitute canned readings.
 * <p>
 * Both methods are called once per tick, {@link #systemUsage()} after every
 * probe returned by {@link #processes()} has been read.
 */
public interface HostMetricsProvider {

    /**
     * Enumerates the process table once.
     *
     * @return one probe per process present at enumeration time
     */
    List<ProcessProbe> processes();

    /**
     * Reads the global CPU and memory counters.
     *
     * @return usage since the previous call
     */
    SystemUsage systemUsage();
}
