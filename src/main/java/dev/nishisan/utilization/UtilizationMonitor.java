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

import dev.nishisan.utilization.clock.MonitorClock;
import dev.nishisan.utilization.config.MonitorConfig;
import dev.nishisan.utilization.replay.SnapshotLogWriter;
import dev.nishisan.utilization.sampler.HostMetricsProvider;
import dev.nishisan.utilization.sampler.ProcessSampler;
import dev.nishisan.utilization.schedule.LiveSnapshotSource;
import dev.nishisan.utilization.schedule.RecordingSnapshotSource;
import dev.nishisan.utilization.schedule.ReplaySnapshotSource;
import dev.nishisan.utilization.schedule.SnapshotSource;
import dev.nishisan.utilization.schedule.UtilizationScheduler;
import dev.nishisan.utilization.sink.JsonLinesUtilizationSink;
import dev.nishisan.utilization.sink.UtilizationSink;
import dev.nishisan.utilization.stats.MonitorStats;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Wires a configured monitor: picks the snapshot source (live, replayed or
 * recorded), opens the sink and owns the scheduler.
 */
public final class UtilizationMonitor implements Closeable {

    private static final Logger LOGGER = Logger.getLogger(UtilizationMonitor.class.getName());

    private final MonitorConfig config;
    private final MonitorStats stats = new MonitorStats();
    private final SnapshotSource source;
    private final UtilizationScheduler scheduler;

    /**
     * @param config   the runtime configuration
     * @param provider creates the host metrics provider; not called when replaying
     * @param clock    the clock driving ticks
     */
    public UtilizationMonitor(MonitorConfig config, Supplier<HostMetricsProvider> provider, MonitorClock clock)
            throws IOException {
        this(config, provider, clock, new JsonLinesUtilizationSink(config.sinkPath()));
    }

    UtilizationMonitor(MonitorConfig config,
                       Supplier<HostMetricsProvider> provider,
                       MonitorClock clock,
                       UtilizationSink sink) throws IOException {
        this.config = Objects.requireNonNull(config, "config");
        Objects.requireNonNull(provider, "provider");
        Objects.requireNonNull(clock, "clock");
        this.source = createSource(provider, clock);
        this.scheduler = new UtilizationScheduler(config, source, sink, clock, stats);
    }

    private SnapshotSource createSource(Supplier<HostMetricsProvider> provider, MonitorClock clock)
            throws IOException {
        Optional<Path> load = config.replayLoad();
        if (load.isPresent()) {
            return new ReplaySnapshotSource(load.get());
        }
        ProcessSampler sampler = new ProcessSampler(provider.get(), clock, config.minUserId(), stats);
        SnapshotSource live = new LiveSnapshotSource(sampler, clock, config.tickInterval(),
                config.sleepWarnThreshold(), config.collectWarnThreshold(), stats);
        Optional<Path> save = config.replaySave();
        if (save.isPresent()) {
            LOGGER.info(() -> "Recording snapshots to " + save.get());
            return new RecordingSnapshotSource(live, new SnapshotLogWriter(save.get(), config.replayFsync()));
        }
        return live;
    }

    public void run() throws IOException {
        scheduler.run();
    }

    public void stop() {
        scheduler.stop();
    }

    public UtilizationScheduler scheduler() {
        return scheduler;
    }

    public MonitorStats stats() {
        return stats;
    }

    SnapshotSource source() {
        return source;
    }

    @Override
    public void close() throws IOException {
        scheduler.stop();
        source.close();
    }
}
