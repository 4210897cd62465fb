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

package dev.nishisan.utilization.model;

import java.time.Instant;
import java.util.Comparator;
import java.util.Objects;

/**
 * Identifies a process across samples. The pid alone is not enough because the
 * kernel recycles pids; the pair of pid and creation time is assumed unique.
 *
 * @param pid          the process id
 * @param creationTime the time the process was started
 */
public record ProcessIdentity(int pid, Instant creationTime) implements Comparable<ProcessIdentity> {

    private static final Comparator<ProcessIdentity> ORDER = Comparator
            .comparingInt(ProcessIdentity::pid)
            .thenComparing(ProcessIdentity::creationTime);

    public ProcessIdentity {
        Objects.requireNonNull(creationTime, "creationTime");
    }

    @Override
    public int compareTo(ProcessIdentity other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return pid + "@" + creationTime;
    }
}
