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

package dev.nishisan.utilization.filter;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Decides whether a process belongs to a group, based on its command line.
 * <p>
 * Rules are either literal executable names, compared against the basename of
 * the first argument, or glob patterns matched against the whole command line
 * joined with spaces. Only strings containing {@code *}, {@code [} or
 * {@code ]} are treated as globs, so an ordinary executable name never matches
 * by accident.
 */
public sealed interface CommandFilter permits CommandFilter.AllProcesses, CommandFilter.NamedPattern {

    /** The single pattern that selects every process. */
    String MATCH_ALL = "*";

    /**
     * Tests a command line.
     *
     * @param command the argument list, or {@code null} when it could not be read
     * @return whether the process belongs to the group
     */
    boolean matches(List<String> command);

    /**
     * Returns the filter that accepts every process, including those whose
     * command line is unavailable.
     */
    static CommandFilter allProcesses() {
        return AllProcesses.INSTANCE;
    }

    /**
     * Builds a filter from configured pattern strings.
     *
     * @param patterns the rules, at least one
     * @return {@link AllProcesses} if the only rule is {@code *}, a {@link NamedPattern} otherwise
     * @throws IllegalArgumentException if no patterns are given or a pattern is blank
     */
    static CommandFilter of(Collection<String> patterns) {
        if (patterns == null || patterns.isEmpty()) {
            throw new IllegalArgumentException("no patterns");
        }
        Set<String> executables = new LinkedHashSet<>();
        Set<GlobPattern> globs = new LinkedHashSet<>();
        for (String pattern : patterns) {
            if (pattern == null || pattern.isBlank()) {
                throw new IllegalArgumentException("blank pattern");
            }
            if (GlobPattern.isGlob(pattern)) {
                globs.add(GlobPattern.compile(pattern));
            } else {
                executables.add(pattern);
            }
        }
        if (executables.isEmpty() && globs.size() == 1 && globs.iterator().next().isMatchAll()) {
            return allProcesses();
        }
        return new NamedPattern(executables, globs);
    }

    /**
     * Accepts every process.
     */
    final class AllProcesses implements CommandFilter {
        private static final AllProcesses INSTANCE = new AllProcesses();

        private AllProcesses() {
        }

        @Override
        public boolean matches(List<String> command) {
            return true;
        }

        @Override
        public String toString() {
            return "AllProcesses";
        }
    }

    /**
     * Accepts processes whose executable is in a literal set, or whose joined
     * command line matches one of a list of globs.
     *
     * @param executables literal executable basenames
     * @param globs       glob patterns over the joined command line
     */
    record NamedPattern(Set<String> executables, Set<GlobPattern> globs) implements CommandFilter {

        public NamedPattern {
            executables = Set.copyOf(Objects.requireNonNull(executables, "executables"));
            globs = Set.copyOf(Objects.requireNonNull(globs, "globs"));
            if (executables.isEmpty() && globs.isEmpty()) {
                throw new IllegalArgumentException("no patterns");
            }
        }

        @Override
        public boolean matches(List<String> command) {
            if (command == null || command.isEmpty()) {
                return globs.stream().anyMatch(GlobPattern::isMatchAll);
            }
            if (executables.contains(basename(command.get(0)))) {
                return true;
            }
            String joined = String.join(" ", command);
            for (GlobPattern glob : globs) {
                if (glob.matches(joined)) {
                    return true;
                }
            }
            return false;
        }

        private static String basename(String path) {
            int end = path.length();
            while (end > 1 && path.charAt(end - 1) == '/') {
                end--;
            }
            int slash = path.lastIndexOf('/', end - 1);
            return path.substring(slash + 1, end);
        }

        @Override
        public String toString() {
            return "NamedPattern" + executables + globs.stream()
                    .map(GlobPattern::pattern)
                    .collect(Collectors.toList());
        }
    }
}
