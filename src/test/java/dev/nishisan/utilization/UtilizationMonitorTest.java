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

package dev.nishisan.utilization;

import dev.nishisan.utilization.config.MonitorConfig;
import dev.nishisan.utilization.model.UtilizationRecord;
import dev.nishisan.utilization.replay.SnapshotLogReader;
import dev.nishisan.utilization.schedule.LiveSnapshotSource;
import dev.nishisan.utilization.schedule.RecordingSnapshotSource;
import dev.nishisan.utilization.schedule.ReplaySnapshotSource;
import dev.nishisan.utilization.sink.JsonLinesUtilizationSink;
import dev.nishisan.utilization.stats.MonitorMetrics;
import dev.nishisan.utilization.support.FakeHostMetricsProvider;
import dev.nishisan.utilization.support.FakeMonitorClock;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static dev.nishisan.utilization.support.Measurements.reading;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;

class UtilizationMonitorTest {

    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    @TempDir
    Path tempDir;

    @Test
    void shouldSampleLiveHostByDefault() throws IOException {
        MonitorConfig config = config().build();

        try (UtilizationMonitor monitor = new UtilizationMonitor(config, FakeHostMetricsProvider::new,
                new FakeMonitorClock(T0))) {
            assertInstanceOf(LiveSnapshotSource.class, monitor.source());
        }
    }

    @Test
    void shouldRecordAndReplayThroughConfiguration() throws Exception {
        Path log = tempDir.resolve("snapshots.log");
        FakeHostMetricsProvider provider = new FakeHostMetricsProvider()
                .usage(0.2, 0.3)
                .process(reading(100, 1001, "alice", 0.5, 0.2, "python3"));
        FakeMonitorClock clock = new FakeMonitorClock(T0);

        try (UtilizationMonitor recorder = new UtilizationMonitor(config().replaySave(log).build(),
                () -> provider, clock)) {
            assertInstanceOf(RecordingSnapshotSource.class, recorder.source());
            for (int i = 0; i < 3; i++) {
                recorder.source().awaitNextTick();
                recorder.source().collect();
            }
        }
        assertEquals(3, SnapshotLogReader.readAll(log).size());

        Path records = tempDir.resolve("replayed.jsonl");
        MonitorConfig replayConfig = config().sinkPath(records).replayLoad(log).build();
        try (UtilizationMonitor replayer = new UtilizationMonitor(replayConfig,
                () -> fail("replay must not touch the host"), new FakeMonitorClock(T0))) {
            assertInstanceOf(ReplaySnapshotSource.class, replayer.source());
            replayer.run();
        }
        // three ticks never reach the first boundary
        assertTrue(Files.notExists(records));
    }

    @Test
    void shouldCommitReplayedWindowToJsonLines() throws Exception {
        Path log = tempDir.resolve("snapshots.log");
        FakeHostMetricsProvider provider = new FakeHostMetricsProvider()
                .process(reading(100, 1001, "alice", 0.5, 0.2, "python3"));
        FakeMonitorClock clock = new FakeMonitorClock(T0);
        try (UtilizationMonitor recorder = new UtilizationMonitor(config().replaySave(log).build(),
                () -> provider, clock)) {
            for (int i = 0; i < 60; i++) {
                recorder.source().awaitNextTick();
                recorder.source().collect();
            }
        }

        Path records = tempDir.resolve("records.jsonl");
        try (UtilizationMonitor replayer = new UtilizationMonitor(
                config().sinkPath(records).replayLoad(log).build(), FakeHostMetricsProvider::new, clock)) {
            replayer.run();
            assertEquals(1, replayer.stats().getCounterValue(MonitorMetrics.COMMITS));
        }

        List<UtilizationRecord> written = JsonLinesUtilizationSink.readAll(records);
        assertEquals(2, written.size());
        assertEquals("alice", written.get(1).user());
        assertEquals(0.5, written.get(1).averageCpu(), 1e-9);
    }

    @Test
    void shouldReturnUsageErrorWithoutArguments() {
        assertEquals(UtilizationMonitorApp.EXIT_USAGE, UtilizationMonitorApp.run(new String[0]));
    }

    @Test
    void shouldReturnConfigErrorForInvalidFile() throws IOException {
        Path yamlFile = tempDir.resolve("bad.yml");
        Files.writeString(yamlFile, "hostname: box\ntickInterval: 0s\n");

        assertEquals(UtilizationMonitorApp.EXIT_CONFIG, UtilizationMonitorApp.run(new String[]{yamlFile.toString()}));
    }

    @Test
    void shouldReturnConfigErrorForMissingFile() {
        Path missing = tempDir.resolve("missing.yml");

        assertEquals(UtilizationMonitorApp.EXIT_CONFIG, UtilizationMonitorApp.run(new String[]{missing.toString()}));
    }

    private MonitorConfig.Builder config() {
        return MonitorConfig.builder()
                .hostname("node-1")
                .sinkPath(tempDir.resolve("records.jsonl"));
    }
}
