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

import dev.nishisan.utilization.model.MergedMeasurement;
import dev.nishisan.utilization.model.ProcessMeasurement;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The window of one group for one owner.
 */
public final class NamedGroup {

    private final GroupDefinition definition;
    private final UtilizationWindow<MergedMeasurement> window = new UtilizationWindow<>();

    public NamedGroup(GroupDefinition definition) {
        this.definition = Objects.requireNonNull(definition, "definition");
    }

    /**
     * Merges the matching measurements of one tick into a single entry.
     * Nothing is appended when no measurement matches.
     *
     * @param measurements the owner's measurements for one tick, not empty
     * @return whether an entry was appended
     * @throws IllegalArgumentException if {@code measurements} is empty or
     *                                  mixes owners or intervals
     */
    public boolean add(List<ProcessMeasurement> measurements) {
        if (measurements.isEmpty()) {
            throw new IllegalArgumentException("no measurements");
        }
        List<ProcessMeasurement> matching = new ArrayList<>(measurements.size());
        for (ProcessMeasurement measurement : measurements) {
            if (definition.filter().matches(measurement.command())) {
                matching.add(measurement);
            }
        }
        if (matching.isEmpty()) {
            return false;
        }
        window.add(MergedMeasurement.of(matching));
        return true;
    }

    public String name() {
        return definition.name();
    }

    public GroupDefinition definition() {
        return definition;
    }

    public UtilizationWindow<MergedMeasurement> window() {
        return window;
    }

    public void reset() {
        window.clear();
    }
}
