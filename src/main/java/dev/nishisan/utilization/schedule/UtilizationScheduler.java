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

import dev.nishisan.utilization.aggregate.UtilizationAggregator;
import dev.nishisan.utilization.clock.MonitorClock;
import dev.nishisan.utilization.config.MonitorConfig;
import dev.nishisan.utilization.model.RecordScope;
import dev.nishisan.utilization.model.Snapshot;
import dev.nishisan.utilization.model.UtilizationRecord;
import dev.nishisan.utilization.sink.UtilizationSink;
import dev.nishisan.utilization.stats.MonitorMetrics;
import dev.nishisan.utilization.stats.MonitorStats;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The sampling loop: wait for a tick, take a snapshot, fold it into the
 * windows and commit the windows whenever a commit boundary is reached.
 * <p>
 * Commit boundaries are wall-clock multiples of the commit interval. The first
 * boundary follows the start of the first snapshot's interval; every later one
 * is derived from the timestamp of the snapshot that committed, so a replayed
 * log produces the same records as the live run that recorded it.
 * <p>
 * {@link #run()} is meant to be called from a single thread. {@link #stop()}
 * may be called from any thread; the loop notices it before the next wait.
 */
public final class UtilizationScheduler {

    private static final Logger LOGGER = Logger.getLogger(UtilizationScheduler.class.getName());

    private final MonitorConfig config;
    private final SnapshotSource source;
    private final UtilizationSink sink;
    private final MonitorClock clock;
    private final MonitorStats stats;
    private final UtilizationAggregator aggregator;

    private volatile boolean stopped;
    private volatile SchedulerState state = SchedulerState.IDLE;
    private Instant nextCommit;

    public UtilizationScheduler(MonitorConfig config,
                                SnapshotSource source,
                                UtilizationSink sink,
                                MonitorClock clock,
                                MonitorStats stats) {
        this.config = Objects.requireNonNull(config, "config");
        this.source = Objects.requireNonNull(source, "source");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.stats = Objects.requireNonNull(stats, "stats");
        this.aggregator = new UtilizationAggregator(config.groupDefinitions());
    }

    /**
     * Runs until {@link #stop()} is called, the waiting thread is interrupted
     * or the source is exhausted. Data not yet committed is dropped on exit.
     *
     * @throws IOException if the source or the sink fails; the loop ends
     */
    public void run() throws IOException {
        LOGGER.info(() -> "Starting utilization monitor on " + config.hostname()
                + " (tick " + config.tickInterval() + ", commit " + config.commitInterval() + ")");
        try {
            while (!stopped) {
                state = SchedulerState.IDLE;
                try {
                    source.awaitNextTick();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    LOGGER.info("Interrupted while waiting for the next tick");
                    break;
                }
                if (stopped) {
                    break;
                }
                state = SchedulerState.SAMPLING;
                Optional<Snapshot> snapshot = source.collect();
                if (snapshot.isEmpty()) {
                    LOGGER.info("Snapshot source exhausted");
                    break;
                }
                tick(snapshot.get());
            }
        } catch (IOException | RuntimeException e) {
            LOGGER.log(Level.SEVERE, "Utilization monitor loop terminated", e);
            throw e;
        } finally {
            state = SchedulerState.STOPPED;
            stats.logSummary(Level.FINE);
        }
        LOGGER.info("Utilization monitor stopped");
    }

    /**
     * Asks the loop to end. Returns immediately.
     */
    public void stop() {
        stopped = true;
    }

    public SchedulerState state() {
        return state;
    }

    /**
     * @return the next commit boundary, empty before the first snapshot
     */
    public Optional<Instant> nextCommit() {
        return Optional.ofNullable(nextCommit);
    }

    public UtilizationAggregator aggregator() {
        return aggregator;
    }

    void tick(Snapshot snapshot) throws IOException {
        stats.notifyHitCounter(MonitorMetrics.TICKS);
        Instant timestamp = snapshot.timestamp();
        if (nextCommit == null) {
            nextCommit = CommitBoundaries.next(snapshot.system().timeStart(), config.commitInterval());
            LOGGER.fine(() -> "First commit boundary at " + nextCommit);
        }

        Duration late = Duration.between(nextCommit, timestamp);
        if (late.compareTo(config.driftTolerance()) >= 0 && !realign(snapshot, late)) {
            state = SchedulerState.IDLE;
            return;
        }

        state = SchedulerState.AGGREGATING;
        aggregator.add(snapshot);

        if (!timestamp.plus(config.commitTolerance()).isBefore(nextCommit)) {
            commit(timestamp);
        }
        state = SchedulerState.IDLE;
    }

    /**
     * Moves the commit boundary past a snapshot that arrived too late for the
     * current one.
     *
     * @return whether the snapshot still belongs in the windows; under
     * {@link DriftRecovery#DISCARD} a snapshot starting before the missed
     * boundary is dropped along with the partial windows
     */
    private boolean realign(Snapshot snapshot, Duration late) {
        stats.notifyHitCounter(MonitorMetrics.DRIFT_REALIGN);
        Instant missed = nextCommit;
        nextCommit = CommitBoundaries.next(snapshot.timestamp(), config.commitInterval());
        if (config.driftRecovery() == DriftRecovery.EXTEND) {
            LOGGER.warning(() -> String.format(Locale.ROOT,
                    "Missed commit boundary %s by %.1f seconds; uncommitted samples carried to %s",
                    missed, LiveSnapshotSource.seconds(late), nextCommit));
            return true;
        }

        boolean keep = !snapshot.system().timeStart().isBefore(missed);
        int dropped = aggregator.systemWindow().size() + (keep ? 0 : 1);
        aggregator.reset();
        LOGGER.warning(() -> String.format(Locale.ROOT,
                "Missed commit boundary %s by %.1f seconds; dropped %d uncommitted samples, next commit at %s",
                missed, LiveSnapshotSource.seconds(late), dropped, nextCommit));
        return keep;
    }

    private void commit(Instant timestamp) throws IOException {
        state = SchedulerState.COMMITTING;
        List<UtilizationRecord> records = aggregator.records(config.hostname());

        Instant start = clock.now();
        sink.write(records);
        Duration took = Duration.between(start, clock.now());

        stats.notifyAverageCounter(MonitorMetrics.COMMIT_MS, took.toMillis());
        if (took.compareTo(config.commitWarnThreshold()) >= 0) {
            stats.notifyHitCounter(MonitorMetrics.DRIFT_COMMIT);
            LOGGER.warning(() -> String.format(Locale.ROOT,
                    "Drift of %.1f seconds while writing utilization records", LiveSnapshotSource.seconds(took)));
        }
        stats.notifyHitCounter(MonitorMetrics.COMMITS);
        stats.notifyHitCounter(MonitorMetrics.RECORDS_WRITTEN, records.size());
        for (UtilizationRecord record : records) {
            if (record.scope() == RecordScope.GROUP) {
                stats.notifyHitCounter(MonitorMetrics.groupEntries(record.group()));
            }
        }

        aggregator.reset();
        Instant committed = nextCommit;
        nextCommit = CommitBoundaries.next(timestamp.plus(config.commitTolerance()), config.commitInterval());
        LOGGER.fine(() -> "Committed " + records.size() + " records for boundary " + committed
                + "; next commit at " + nextCommit);
    }
}
