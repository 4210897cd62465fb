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

import dev.nishisan.utilization.filter.CommandFilter;

import java.util.Collection;
import java.util.Objects;

/**
 * A configured process group: a name and the rules selecting its processes.
 *
 * @param name   the group name, {@code null} only for the catch-all group
 * @param filter the selection rules
 */
public record GroupDefinition(String name, CommandFilter filter) {

    private static final GroupDefinition CATCH_ALL = new GroupDefinition(null, CommandFilter.allProcesses());

    public GroupDefinition {
        Objects.requireNonNull(filter, "filter");
        if (name != null && name.isBlank()) {
            throw new IllegalArgumentException("group name must not be blank");
        }
    }

    /**
     * Builds a named group from pattern strings.
     *
     * @throws IllegalArgumentException if {@code patterns} is empty
     */
    public static GroupDefinition of(String name, Collection<String> patterns) {
        Objects.requireNonNull(name, "name");
        try {
            return new GroupDefinition(name, CommandFilter.of(patterns));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("process group '" + name + "': " + e.getMessage(), e);
        }
    }

    /**
     * The group every process of an owner falls into.
     */
    public static GroupDefinition catchAll() {
        return CATCH_ALL;
    }

    public boolean isCatchAll() {
        return name == null;
    }
}
