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
import dev.nishisan.utilization.model.RecordScope;
import dev.nishisan.utilization.model.Snapshot;
import dev.nishisan.utilization.model.SystemMeasurement;
import dev.nishisan.utilization.model.UtilizationRecord;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.logging.Logger;

/**
 * Accumulates snapshots into the host window and into one window per owner
 * and group, then turns them into records at commit time.
 * <p>
 * Every owner gets the configured groups plus a catch-all group. Anonymous
 * processes (owner below the minimum uid) only feed the catch-all group of
 * the anonymous owner. Not thread-safe: the scheduler is the only caller.
 */
public final class UtilizationAggregator {

    private static final Logger LOGGER = Logger.getLogger(UtilizationAggregator.class.getName());

    private final List<GroupDefinition> groups;
    private final SystemWindow system = new SystemWindow();
    private final Map<String, List<NamedGroup>> users = new TreeMap<>(Comparator.nullsFirst(Comparator.naturalOrder()));

    /**
     * @param groups the configured groups, in the order their records are emitted;
     *               the catch-all group is added automatically
     */
    public UtilizationAggregator(List<GroupDefinition> groups) {
        Objects.requireNonNull(groups, "groups");
        List<GroupDefinition> all = new ArrayList<>(groups.size() + 1);
        for (GroupDefinition group : groups) {
            if (group.isCatchAll()) {
                throw new IllegalArgumentException("the catch-all group cannot be configured explicitly");
            }
            all.add(group);
        }
        all.add(GroupDefinition.catchAll());
        this.groups = List.copyOf(all);
    }

    /**
     * Appends the host measurement of one tick.
     */
    public void addSystem(SystemMeasurement measurement) {
        system.add(measurement);
    }

    /**
     * Offers one owner's measurements of one tick to a group.
     *
     * @return whether the group appended an entry
     */
    public boolean addGroup(NamedGroup group, List<ProcessMeasurement> measurements) {
        return group.add(measurements);
    }

    /**
     * Feeds one snapshot: the host window unconditionally, then every owner's
     * processes to that owner's groups.
     */
    public void add(Snapshot snapshot) {
        addSystem(snapshot.system());
        for (Map.Entry<String, List<ProcessMeasurement>> entry : byOwner(snapshot.processes()).entrySet()) {
            for (NamedGroup group : groupsOf(entry.getKey())) {
                addGroup(group, entry.getValue());
            }
        }
    }

    /**
     * Builds the records of the current windows: the host record first, then
     * one record per owner and group holding data. Owners are sorted with the
     * anonymous owner first; groups keep configuration order with the
     * catch-all group last.
     *
     * @param hostname the host name stamped on every record
     * @return the records, empty if nothing was accumulated
     */
    public List<UtilizationRecord> records(String hostname) {
        List<UtilizationRecord> records = new ArrayList<>();
        if (!system.isEmpty()) {
            records.add(new UtilizationRecord(
                    RecordScope.SYSTEM,
                    hostname,
                    null,
                    null,
                    system.timeStart().orElseThrow(),
                    system.timeEnd().orElseThrow(),
                    system.averageCpu(),
                    system.averageMem(),
                    system.peakCpu(),
                    system.peakMem(),
                    system.uniqueProcessCount(),
                    system.userCount()));
        }
        users.forEach((user, userGroups) -> {
            for (NamedGroup group : userGroups) {
                UtilizationWindow<MergedMeasurement> window = group.window();
                if (window.isEmpty()) {
                    continue;
                }
                records.add(new UtilizationRecord(
                        RecordScope.GROUP,
                        hostname,
                        user,
                        group.name(),
                        window.timeStart().orElseThrow(),
                        window.timeEnd().orElseThrow(),
                        window.averageCpu(),
                        window.averageMem(),
                        window.peakCpu(),
                        window.peakMem(),
                        window.uniqueProcessCount(),
                        0));
            }
        });
        return records;
    }

    /**
     * Empties every window.
     */
    public void reset() {
        system.clear();
        users.clear();
        LOGGER.finest("Utilization windows reset");
    }

    /**
     * @return {@code true} if no window holds an entry
     */
    public boolean isEmpty() {
        if (!system.isEmpty()) {
            return false;
        }
        for (List<NamedGroup> userGroups : users.values()) {
            for (NamedGroup group : userGroups) {
                if (!group.window().isEmpty()) {
                    return false;
                }
            }
        }
        return true;
    }

    public SystemWindow systemWindow() {
        return system;
    }

    /**
     * Returns the groups tracked for an owner, creating them on first sight.
     *
     * @param user the owner, {@code null} for anonymous processes
     */
    public List<NamedGroup> groupsOf(String user) {
        return users.computeIfAbsent(user, this::newGroups);
    }

    public List<GroupDefinition> groups() {
        return groups;
    }

    private List<NamedGroup> newGroups(String user) {
        List<NamedGroup> created = new ArrayList<>(groups.size());
        for (GroupDefinition definition : groups) {
            if (user == null && !definition.isCatchAll()) {
                continue;
            }
            created.add(new NamedGroup(definition));
        }
        return List.copyOf(created);
    }

    private static Map<String, List<ProcessMeasurement>> byOwner(List<ProcessMeasurement> processes) {
        Map<String, List<ProcessMeasurement>> owners = new LinkedHashMap<>();
        for (ProcessMeasurement process : processes) {
            owners.computeIfAbsent(process.username(), k -> new ArrayList<>()).add(process);
        }
        return owners;
    }
}
