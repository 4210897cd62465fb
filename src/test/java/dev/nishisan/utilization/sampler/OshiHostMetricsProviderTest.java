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

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OshiHostMetricsProviderTest {

    @Test
    void shouldReadOwnProcessFromLiveHost() {
        OshiHostMetricsProvider provider = new OshiHostMetricsProvider();
        int self = (int) ProcessHandle.current().pid();

        List<ProcessProbe> probes = provider.processes();
        assertFalse(probes.isEmpty());

        Optional<ProcessReading> own = probes.stream()
                .map(ProcessProbe::read)
                .flatMap(Optional::stream)
                .filter(r -> r.pid() == self)
                .findFirst();
        assertTrue(own.isPresent(), "current JVM should be in the process table");
        assertTrue(own.get().cpuFraction() >= 0.0);
        assertTrue(own.get().memFraction() > 0.0 && own.get().memFraction() <= 1.0);
    }

    @Test
    void shouldReportNoCpuForProcessNotSeenBefore() {
        OshiHostMetricsProvider provider = new OshiHostMetricsProvider();
        int self = (int) ProcessHandle.current().pid();

        Optional<ProcessReading> first = ownReading(provider.processes(), self);
        Optional<ProcessReading> second = ownReading(provider.processes(), self);

        assertTrue(first.isPresent());
        assertEquals(0.0, first.get().cpuFraction());
        assertTrue(second.isPresent());
        assertTrue(second.get().cpuFraction() >= 0.0);
    }

    @Test
    void shouldTakeEffectiveUidFromStatusLine() {
        assertEquals(0, OshiHostMetricsProvider.effectiveUid("1000\t0\t0\t0"));
        assertEquals(1001, OshiHostMetricsProvider.effectiveUid(" 1001 1001 1001 1001"));
        assertEquals(-1, OshiHostMetricsProvider.effectiveUid("1000"));
        assertEquals(-1, OshiHostMetricsProvider.effectiveUid(null));
        assertEquals(-1, OshiHostMetricsProvider.parseUid("S-1-5-21"));
    }

    @Test
    void shouldKeepSystemUsageWithinBounds() {
        OshiHostMetricsProvider provider = new OshiHostMetricsProvider();
        provider.processes();

        SystemUsage usage = provider.systemUsage();

        assertTrue(usage.cpuFraction() >= 0.0 && usage.cpuFraction() <= 1.0);
        assertTrue(usage.memFraction() > 0.0 && usage.memFraction() <= 1.0);
    }

    private static Optional<ProcessReading> ownReading(List<ProcessProbe> probes, int self) {
        return probes.stream()
                .map(ProcessProbe::read)
                .flatMap(Optional::stream)
                .filter(r -> r.pid() == self)
                .findFirst();
    }
}
