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

package dev.nishisan.utilization.stats;

import dev.nishisan.utilization.stats.list.FixedSizeList;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Named hit counters and rolling averages describing the health of the
 * sampling loop (ticks, skipped processes, timing anomalies, commit latency).
 * Nothing here is persisted; it only feeds logs and tests.
 */
public class MonitorStats {

    private static final Logger LOGGER = Logger.getLogger(MonitorStats.class.getName());
    private static final int AVERAGE_WINDOW = 10;

    private final ConcurrentMap<String, AtomicLong> counters = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, FixedSizeList<Long>> averages = new ConcurrentHashMap<>();

    /**
     * Increments a hit counter by one, creating it on first use.
     *
     * @param counter the counter name
     */
    public void notifyHitCounter(String counter) {
        notifyHitCounter(counter, 1L);
    }

    public void notifyHitCounter(String counter, long delta) {
        counters.computeIfAbsent(counter, k -> new AtomicLong()).addAndGet(delta);
    }

    /**
     * Adds a value to a rolling average over the last ten samples.
     *
     * @param name  the average name
     * @param value the sample
     */
    public void notifyAverageCounter(String name, long value) {
        averages.computeIfAbsent(name, k -> new FixedSizeList<>(k, AVERAGE_WINDOW)).add(value);
    }

    /**
     * @return the counter value, or {@code 0} if the counter was never hit
     */
    public long getCounterValue(String counterName) {
        AtomicLong value = counters.get(counterName);
        return value == null ? 0L : value.get();
    }

    /**
     * @return the rolling average, or {@code -1.0} if nothing was recorded under that name
     */
    public double getAverage(String name) {
        FixedSizeList<Long> reads = averages.get(name);
        if (reads == null) {
            LOGGER.fine(() -> String.format("Average:[%s] Not Found", name));
            return -1D;
        }
        return reads.getAverage();
    }

    public Map<String, Long> counters() {
        Map<String, Long> out = new TreeMap<>();
        counters.forEach((k, v) -> out.put(k, v.get()));
        return out;
    }

    /**
     * Logs every counter and average, sorted by name.
     */
    public void logSummary(Level level) {
        if (!LOGGER.isLoggable(level)) {
            return;
        }
        counters().forEach((k, v) -> LOGGER.log(level, String.format("  Stats:   [%-35s]:=(%11d)", k, v)));
        new TreeMap<>(averages).forEach((k, v) ->
                LOGGER.log(level, String.format("  Average: [%-35s]:=[%10.3f]", k, v.getAverage())));
    }
}
