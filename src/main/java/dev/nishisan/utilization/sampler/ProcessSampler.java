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

import dev.nishisan.utilization.clock.MonitorClock;
import dev.nishisan.utilization.model.ProcessMeasurement;
import dev.nishisan.utilization.model.Snapshot;
import dev.nishisan.utilization.model.SystemMeasurement;
import dev.nishisan.utilization.stats.MonitorMetrics;
import dev.nishisan.utilization.stats.MonitorStats;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Turns one pass over the process table into a {@link Snapshot}.
 * <p>
 * Every measurement of a snapshot covers the same interval, from the start of
 * the previous collection to the start of this one. The end is taken before
 * the process table is walked, so a slow walk never shortens the interval.
 */
public final class ProcessSampler {

    private static final Logger LOGGER = Logger.getLogger(ProcessSampler.class.getName());

    private final HostMetricsProvider provider;
    private final MonitorClock clock;
    private final int minUserId;
    private final MonitorStats stats;
    private Instant lastCollect;

    /**
     * @param provider  the host counters
     * @param clock     the clock stamping intervals
     * @param minUserId owners with a lower uid are recorded as anonymous
     * @param stats     receives sampled/skipped counters
     */
    public ProcessSampler(HostMetricsProvider provider, MonitorClock clock, int minUserId, MonitorStats stats) {
        this.provider = Objects.requireNonNull(provider, "provider");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.stats = Objects.requireNonNull(stats, "stats");
        if (minUserId < 0) {
            throw new IllegalArgumentException("minUserId must be >= 0");
        }
        this.minUserId = minUserId;
        this.lastCollect = clock.now();
    }

    /**
     * Collects one snapshot. Processes that cannot be read are left out of it.
     *
     * @return the snapshot, stamped with the collection start time
     */
    public Snapshot collect() {
        Instant timeStart = lastCollect;
        Instant timeEnd = clock.now();
        if (timeEnd.isBefore(timeStart)) {
            LOGGER.warning(() -> "Clock moved backwards from " + timeStart + "; collapsing interval");
            timeEnd = timeStart;
        }

        List<ProcessMeasurement> processes = new ArrayList<>();
        int skipped = 0;
        for (ProcessProbe probe : provider.processes()) {
            Optional<ProcessReading> reading = probe.read();
            if (reading.isEmpty()) {
                skipped++;
                continue;
            }
            processes.add(toMeasurement(reading.get(), timeStart, timeEnd));
        }
        SystemUsage usage = provider.systemUsage();

        stats.notifyHitCounter(MonitorMetrics.PROCESS_SAMPLED, processes.size());
        if (skipped > 0) {
            stats.notifyHitCounter(MonitorMetrics.PROCESS_SKIPPED, skipped);
            int count = skipped;
            LOGGER.finest(() -> count + " processes vanished or could not be read");
        }

        lastCollect = timeEnd;
        SystemMeasurement system = SystemMeasurement.of(timeStart, timeEnd,
                usage.cpuFraction(), usage.memFraction(), processes);
        return new Snapshot(timeEnd, system, processes);
    }

    Instant lastCollect() {
        return lastCollect;
    }

    private ProcessMeasurement toMeasurement(ProcessReading reading, Instant timeStart, Instant timeEnd) {
        String username = reading.uid() < minUserId ? null : reading.username();
        return new ProcessMeasurement(
                reading.pid(),
                username,
                timeStart,
                timeEnd,
                reading.cpuFraction(),
                reading.memFraction(),
                reading.command(),
                reading.creationTime());
    }
}
