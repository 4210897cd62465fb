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

/**
 * Counter and average keys published by the monitor loop.
 */
public final class MonitorMetrics {
    public static final String TICKS = "monitor.ticks";
    public static final String COMMITS = "monitor.commits";
    public static final String RECORDS_WRITTEN = "monitor.records.written";
    public static final String PROCESS_SAMPLED = "monitor.process.sampled";
    public static final String PROCESS_SKIPPED = "monitor.process.skipped";
    public static final String DRIFT_SLEEP = "monitor.drift.sleep";
    public static final String DRIFT_COLLECT = "monitor.drift.collect";
    public static final String DRIFT_COMMIT = "monitor.drift.commit";
    public static final String DRIFT_REALIGN = "monitor.drift.realign";
    public static final String COLLECT_MS = "monitor.collect.ms";
    public static final String COMMIT_MS = "monitor.commit.ms";

    private static final String GROUP_ENTRIES_PREFIX = "monitor.group.entries.";

    private MonitorMetrics() {
    }

    public static String groupEntries(String groupName) {
        return GROUP_ENTRIES_PREFIX + (groupName == null ? "all" : groupName);
    }
}
