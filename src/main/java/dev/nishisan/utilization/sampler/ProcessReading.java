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

import java.time.Instant;
import java.util.List;

/**
 * Raw attributes of one live process, as returned by a {@link ProcessProbe}.
 *
 * @param pid          the process id
 * @param uid          the effective user id, or {@code -1} if unknown
 * @param username     the owner's login name
 * @param creationTime the process start time, or {@code null} if unavailable
 * @param command      the argument list, or {@code null} if unavailable
 * @param cpuFraction  CPU used since the previous tick, in cores
 * @param memFraction  resident memory as a fraction of total memory
 */
public record ProcessReading(
        int pid,
        int uid,
        String username,
        Instant creationTime,
        List<String> command,
        double cpuFraction,
        double memFraction) {
}
