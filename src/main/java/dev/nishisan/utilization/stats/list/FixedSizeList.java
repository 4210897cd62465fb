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

package dev.nishisan.utilization.stats.list;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Keeps the most recent {@code capacity} values; adding past capacity evicts
 * the oldest one.
 *
 * @param <E> the numeric element type
 */
public class FixedSizeList<E extends Number> {
    private final Deque<E> values;
    private final int capacity;
    private final String name;

    public FixedSizeList(String name, int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive.");
        }
        this.name = Objects.requireNonNull(name, "name");
        this.capacity = capacity;
        this.values = new ArrayDeque<>(capacity);
    }

    public synchronized void add(E element) {
        Objects.requireNonNull(element, "element");
        if (values.size() == capacity) {
            values.removeFirst();
        }
        values.addLast(element);
    }

    public synchronized int size() {
        return values.size();
    }

    /**
     * @return the mean of the retained values, {@code 0.0} when empty
     */
    public synchronized double getAverage() {
        return values.stream()
                .mapToDouble(Number::doubleValue)
                .average()
                .orElse(0.0);
    }

    public synchronized E getLast() {
        return values.peekLast();
    }

    public synchronized List<E> toList() {
        return List.copyOf(values);
    }

    public String getName() {
        return name;
    }
}
