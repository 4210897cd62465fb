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

package dev.nishisan.utilization.support;

import dev.nishisan.utilization.model.ProcessMeasurement;
import dev.nishisan.utilization.model.Snapshot;
import dev.nishisan.utilization.model.SystemMeasurement;
import dev.nishisan.utilization.sampler.ProcessReading;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;

/**
 * Shorthand factories for test fixtures.
 */
public final class Measurements {

    public static final Instant BOOT = Instant.parse("2024-01-01T00:00:00Z");

    private Measurements() {
    }

    public static ProcessMeasurement process(int pid, String user, Instant start, Instant end,
                                             double cpu, double mem, String... command) {
        return new ProcessMeasurement(pid, user, start, end, cpu, mem,
                command.length == 0 ? null : Arrays.asList(command), BOOT.plusSeconds(pid));
    }

    public static ProcessReading reading(int pid, int uid, String user, double cpu, double mem, String... command) {
        return new ProcessReading(pid, uid, user, BOOT.plusSeconds(pid),
                command.length == 0 ? null : Arrays.asList(command), cpu, mem);
    }

    public static Snapshot snapshot(Instant start, Instant end, double cpu, double mem,
                                    ProcessMeasurement... processes) {
        List<ProcessMeasurement> list = List.of(processes);
        return new Snapshot(end, SystemMeasurement.of(start, end, cpu, mem, list), list);
    }
}
