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

import dev.nishisan.utilization.clock.MonitorClock;
import dev.nishisan.utilization.model.Snapshot;
import dev.nishisan.utilization.sampler.ProcessSampler;
import dev.nishisan.utilization.stats.MonitorMetrics;
import dev.nishisan.utilization.stats.MonitorStats;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Samples the host on wall-clock aligned ticks.
 * <p>
 * Each wait sleeps until the next multiple of the tick interval instead of a
 * fixed period, so scheduling latency never accumulates. Oversleeping and slow
 * collections are reported as warnings; they shift a tick but do not skip it.
 */
public final class LiveSnapshotSource implements SnapshotSource {

    private static final Logger LOGGER = Logger.getLogger(LiveSnapshotSource.class.getName());

    private final ProcessSampler sampler;
    private final MonitorClock clock;
    private final Duration tickInterval;
    private final Duration sleepWarnThreshold;
    private final Duration collectWarnThreshold;
    private final MonitorStats stats;

    public LiveSnapshotSource(ProcessSampler sampler,
                              MonitorClock clock,
                              Duration tickInterval,
                              Duration sleepWarnThreshold,
                              Duration collectWarnThreshold,
                              MonitorStats stats) {
        this.sampler = Objects.requireNonNull(sampler, "sampler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.tickInterval = Objects.requireNonNull(tickInterval, "tickInterval");
        this.sleepWarnThreshold = Objects.requireNonNull(sleepWarnThreshold, "sleepWarnThreshold");
        this.collectWarnThreshold = Objects.requireNonNull(collectWarnThreshold, "collectWarnThreshold");
        this.stats = Objects.requireNonNull(stats, "stats");
    }

    @Override
    public void awaitNextTick() throws InterruptedException {
        Instant beforeSleep = clock.now();
        Duration expected = CommitBoundaries.untilNext(beforeSleep, tickInterval);
        clock.sleep(expected);
        Duration actual = Duration.between(beforeSleep, clock.now());
        Duration overslept = actual.minus(expected);
        if (overslept.compareTo(sleepWarnThreshold) >= 0) {
            stats.notifyHitCounter(MonitorMetrics.DRIFT_SLEEP);
            LOGGER.warning(() -> String.format(Locale.ROOT,
                    "Drift of %.1f seconds detected after sleep", seconds(overslept)));
        }
    }

    @Override
    public Optional<Snapshot> collect() {
        Instant start = clock.now();
        Snapshot snapshot = sampler.collect();
        Duration took = Duration.between(start, clock.now());
        stats.notifyAverageCounter(MonitorMetrics.COLLECT_MS, took.toMillis());
        if (took.compareTo(collectWarnThreshold) >= 0) {
            stats.notifyHitCounter(MonitorMetrics.DRIFT_COLLECT);
            LOGGER.warning(() -> String.format(Locale.ROOT,
                    "Drift of %.1f seconds during collection of process statistics", seconds(took)));
        }
        return Optional.of(snapshot);
    }

    static double seconds(Duration duration) {
        return duration.toNanos() / 1_000_000_000.0;
    }
}
