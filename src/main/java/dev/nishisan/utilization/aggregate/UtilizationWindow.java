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

package dev.nishisan.utilization.aggregate;

import dev.nishisan.utilization.model.ProcessIdentity;
import dev.nishisan.utilization.model.TimedMeasurement;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.ToDoubleFunction;

/**
 * Measurements accumulated between two commits.
 * <p>
 * Entries must be appended in time order with non-overlapping intervals.
 * Statistics weight each entry by its interval length, so irregular tick
 * spacing does not bias the average. Ticks in which nothing was appended do
 * not count as zero; they are simply absent.
 *
 * @param <E> the entry type
 */
public class UtilizationWindow<E extends TimedMeasurement> {

    private final List<E> entries = new ArrayList<>();

    /**
     * Appends an entry.
     *
     * @throws IllegalArgumentException if the entry ends before it starts or
     *                                  starts before the previous entry ended
     */
    public void add(E entry) {
        if (entry.timeEnd().isBefore(entry.timeStart())) {
            throw new IllegalArgumentException("interval ends before it starts: "
                    + entry.timeStart() + " > " + entry.timeEnd());
        }
        if (!entries.isEmpty()) {
            E last = entries.get(entries.size() - 1);
            if (entry.timeStart().isBefore(last.timeEnd())) {
                throw new IllegalArgumentException("overlapping interval: "
                        + entry.timeStart() + " < " + last.timeEnd());
            }
        }
        entries.add(entry);
    }

    public void clear() {
        entries.clear();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }

    public List<E> entries() {
        return Collections.unmodifiableList(entries);
    }

    public Optional<Instant> timeStart() {
        return entries.stream().map(TimedMeasurement::timeStart).min(Instant::compareTo);
    }

    public Optional<Instant> timeEnd() {
        return entries.stream().map(TimedMeasurement::timeEnd).max(Instant::compareTo);
    }

    public double averageCpu() {
        return timeWeightedAverage(TimedMeasurement::cpuFraction);
    }

    public double averageMem() {
        return timeWeightedAverage(TimedMeasurement::memFraction);
    }

    public double peakCpu() {
        return peak(TimedMeasurement::cpuFraction);
    }

    public double peakMem() {
        return peak(TimedMeasurement::memFraction);
    }

    /**
     * @return the number of distinct processes over all entries
     */
    public int uniqueProcessCount() {
        Set<ProcessIdentity> processes = new HashSet<>();
        for (E entry : entries) {
            processes.addAll(entry.processes());
        }
        return processes.size();
    }

    /**
     * Computes {@code sum(value * duration) / sum(duration)}. An empty window
     * averages to {@code 0}; a window whose entries all have zero length falls
     * back to the plain mean.
     */
    double timeWeightedAverage(ToDoubleFunction<E> value) {
        if (entries.isEmpty()) {
            return 0.0;
        }
        double weighted = 0.0;
        double totalDuration = 0.0;
        double plain = 0.0;
        for (E entry : entries) {
            double duration = entry.durationSeconds();
            double v = value.applyAsDouble(entry);
            weighted += v * duration;
            totalDuration += duration;
            plain += v;
        }
        if (totalDuration <= 0.0) {
            return plain / entries.size();
        }
        return weighted / totalDuration;
    }

    double peak(ToDoubleFunction<E> value) {
        double peak = 0.0;
        for (E entry : entries) {
            peak = Math.max(peak, value.applyAsDouble(entry));
        }
        return peak;
    }
}
