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

import dev.nishisan.utilization.model.ProcessMeasurement;
import dev.nishisan.utilization.model.Snapshot;
import dev.nishisan.utilization.stats.MonitorMetrics;
import dev.nishisan.utilization.stats.MonitorStats;
import dev.nishisan.utilization.support.FakeHostMetricsProvider;
import dev.nishisan.utilization.support.FakeMonitorClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static dev.nishisan.utilization.support.Measurements.reading;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProcessSamplerTest {

    private static final Instant START = Instant.parse("2024-03-01T10:00:00Z");

    private FakeMonitorClock clock;
    private FakeHostMetricsProvider provider;
    private MonitorStats stats;
    private ProcessSampler sampler;

    @BeforeEach
    void setUp() {
        clock = new FakeMonitorClock(START);
        provider = new FakeHostMetricsProvider();
        stats = new MonitorStats();
        sampler = new ProcessSampler(provider, clock, 1000, stats);
    }

    @Test
    void shouldStampEveryMeasurementWithTheSameInterval() {
        provider.usage(0.3, 0.6)
                .process(reading(100, 1001, "alice", 0.5, 0.2, "python3", "train.py"))
                .process(reading(101, 1002, "bob", 0.1, 0.05, "bash"));
        clock.advance(Duration.ofSeconds(5));

        Snapshot snapshot = sampler.collect();

        assertEquals(START.plusSeconds(5), snapshot.timestamp());
        assertEquals(START, snapshot.system().timeStart());
        assertEquals(START.plusSeconds(5), snapshot.system().timeEnd());
        assertEquals(0.3, snapshot.system().cpuFraction(), 1e-9);
        assertEquals(2, snapshot.processes().size());
        for (ProcessMeasurement process : snapshot.processes()) {
            assertEquals(START, process.timeStart());
            assertEquals(START.plusSeconds(5), process.timeEnd());
        }
        assertEquals(2, snapshot.system().users().size());
        assertEquals(2, snapshot.system().processes().size());
    }

    @Test
    void shouldChainIntervalsAcrossCollections() {
        clock.advance(Duration.ofSeconds(5));
        Snapshot first = sampler.collect();
        clock.advance(Duration.ofSeconds(7));
        Snapshot second = sampler.collect();

        assertEquals(first.system().timeEnd(), second.system().timeStart());
        assertEquals(START.plusSeconds(12), second.system().timeEnd());
        assertEquals(START.plusSeconds(12), sampler.lastCollect());
    }

    @Test
    void shouldMapSystemAccountsToAnonymousOwner() {
        provider.process(reading(1, 0, "root", 0.01, 0.01, "/sbin/init"))
                .process(reading(2, 999, "svc", 0.01, 0.01, "svc"))
                .process(reading(3, 1000, "carol", 0.01, 0.01, "vim"));
        clock.advance(Duration.ofSeconds(5));

        Snapshot snapshot = sampler.collect();

        assertNull(snapshot.processes().get(0).username());
        assertNull(snapshot.processes().get(1).username());
        assertEquals("carol", snapshot.processes().get(2).username());
        assertEquals(1, snapshot.system().users().size());
        assertEquals(3, snapshot.system().processes().size());
    }

    @Test
    void shouldTreatUnknownUidAsAnonymous() {
        provider.process(reading(5, -1, "ghost", 0.01, 0.01, "x"));
        clock.advance(Duration.ofSeconds(5));

        assertTrue(sampler.collect().processes().get(0).isAnonymous());
    }

    @Test
    void shouldOmitVanishedProcessesAndCountThem() {
        provider.process(reading(100, 1001, "alice", 0.5, 0.2, "python3"))
                .vanished()
                .vanished();
        clock.advance(Duration.ofSeconds(5));

        Snapshot snapshot = sampler.collect();

        assertEquals(1, snapshot.processes().size());
        assertEquals(1, stats.getCounterValue(MonitorMetrics.PROCESS_SAMPLED));
        assertEquals(2, stats.getCounterValue(MonitorMetrics.PROCESS_SKIPPED));
    }

    @Test
    void shouldKeepFullIntervalWhenEnumerationIsSlow() {
        provider.process(reading(100, 1001, "alice", 0.5, 0.2, "python3"))
                .onEnumerate(p -> clock.advance(Duration.ofMillis(1500)));
        clock.advance(Duration.ofSeconds(5));

        Snapshot snapshot = sampler.collect();

        assertEquals(START.plusSeconds(5), snapshot.system().timeEnd());
        assertEquals(START.plusSeconds(5), snapshot.processes().get(0).timeEnd());
        assertEquals(START.plusSeconds(5), snapshot.timestamp());
    }

    @Test
    void shouldCollapseIntervalWhenClockGoesBackwards() {
        clock.advance(Duration.ofSeconds(5));
        sampler.collect();
        clock.set(START);

        Snapshot snapshot = sampler.collect();

        assertEquals(snapshot.system().timeStart(), snapshot.system().timeEnd());
        assertEquals(0.0, snapshot.system().durationSeconds(), 1e-9);
    }

    @Test
    void shouldRejectNegativeMinimumUid() {
        assertThrows(IllegalArgumentException.class, () -> new ProcessSampler(provider, clock, -1, stats));
    }
}
