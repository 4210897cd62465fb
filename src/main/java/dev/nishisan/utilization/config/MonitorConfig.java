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

package dev.nishisan.utilization.config;

import dev.nishisan.utilization.aggregate.GroupDefinition;
import dev.nishisan.utilization.schedule.DriftRecovery;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable runtime configuration of the monitor.
 */
public final class MonitorConfig {

    public static final Duration DEFAULT_TICK_INTERVAL = Duration.ofSeconds(5);
    public static final Duration DEFAULT_COMMIT_INTERVAL = Duration.ofMinutes(5);
    public static final int DEFAULT_MIN_USER_ID = 1000;
    public static final Duration DEFAULT_DRIFT_TOLERANCE = Duration.ofSeconds(10);

    private final String hostname;
    private final Duration tickInterval;
    private final Duration commitInterval;
    private final int minUserId;
    private final Map<String, List<String>> processGroups;
    private final Duration driftTolerance;
    private final DriftRecovery driftRecovery;
    private final Duration sleepWarnThreshold;
    private final Duration collectWarnThreshold;
    private final Duration commitWarnThreshold;
    private final Duration commitTolerance;
    private final Path sinkPath;
    private final Path replayLoad;
    private final Path replaySave;
    private final boolean replayFsync;
    private final List<GroupDefinition> groupDefinitions;

    private MonitorConfig(Builder builder) {
        this.hostname = builder.hostname;
        this.tickInterval = builder.tickInterval;
        this.commitInterval = builder.commitInterval;
        this.minUserId = builder.minUserId;
        this.processGroups = Collections.unmodifiableMap(new LinkedHashMap<>(builder.processGroups));
        this.driftTolerance = builder.driftTolerance;
        this.driftRecovery = builder.driftRecovery;
        this.sleepWarnThreshold = builder.sleepWarnThreshold;
        this.collectWarnThreshold = builder.collectWarnThreshold;
        this.commitWarnThreshold = builder.commitWarnThreshold;
        this.commitTolerance = builder.commitTolerance;
        this.sinkPath = builder.sinkPath;
        this.replayLoad = builder.replayLoad;
        this.replaySave = builder.replaySave;
        this.replayFsync = builder.replayFsync;

        List<String> problems = new ArrayList<>();
        this.groupDefinitions = validate(problems);
        if (!problems.isEmpty()) {
            throw new MonitorConfigException(problems);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public String hostname() {
        return hostname;
    }

    public Duration tickInterval() {
        return tickInterval;
    }

    public Duration commitInterval() {
        return commitInterval;
    }

    public int minUserId() {
        return minUserId;
    }

    /** Pattern lists by group name, in declaration order. */
    public Map<String, List<String>> processGroups() {
        return processGroups;
    }

    /** The configured groups compiled to filters, in declaration order. */
    public List<GroupDefinition> groupDefinitions() {
        return groupDefinitions;
    }

    public Duration driftTolerance() {
        return driftTolerance;
    }

    public DriftRecovery driftRecovery() {
        return driftRecovery;
    }

    /** Oversleeping by at least this much is logged. */
    public Duration sleepWarnThreshold() {
        return sleepWarnThreshold;
    }

    /** A collection taking at least this long is logged. */
    public Duration collectWarnThreshold() {
        return collectWarnThreshold;
    }

    /** A sink write taking at least this long is logged. */
    public Duration commitWarnThreshold() {
        return commitWarnThreshold;
    }

    /** A tick this close before a boundary already commits it. */
    public Duration commitTolerance() {
        return commitTolerance;
    }

    public Path sinkPath() {
        return sinkPath;
    }

    public Optional<Path> replayLoad() {
        return Optional.ofNullable(replayLoad);
    }

    public Optional<Path> replaySave() {
        return Optional.ofNullable(replaySave);
    }

    public boolean replayFsync() {
        return replayFsync;
    }

    private List<GroupDefinition> validate(List<String> problems) {
        if (hostname == null || hostname.isBlank()) {
            problems.add("hostname must not be blank");
        }
        if (!isPositive(tickInterval)) {
            problems.add("tickInterval must be > 0");
        }
        if (!isPositive(commitInterval)) {
            problems.add("commitInterval must be > 0");
        }
        if (isPositive(tickInterval) && isPositive(commitInterval)
                && commitInterval.toMillis() % tickInterval.toMillis() != 0) {
            problems.add("commitInterval (" + commitInterval + ") must be a multiple of tickInterval ("
                    + tickInterval + ")");
        }
        if (minUserId < 0) {
            problems.add("minUserId must be >= 0");
        }
        if (driftTolerance == null || driftTolerance.isNegative()) {
            problems.add("driftTolerance cannot be negative");
        }
        if (driftRecovery == null) {
            problems.add("driftRecovery is required");
        }
        if (sinkPath == null) {
            problems.add("sink.path is required");
        }
        if (replayLoad != null && replayLoad.equals(replaySave)) {
            problems.add("replay.load and replay.save must not name the same file");
        }

        List<GroupDefinition> definitions = new ArrayList<>();
        for (Map.Entry<String, List<String>> entry : processGroups.entrySet()) {
            String name = entry.getKey();
            if (name == null || name.isBlank()) {
                problems.add("process group name must not be blank");
                continue;
            }
            try {
                definitions.add(GroupDefinition.of(name, entry.getValue() == null ? List.of() : entry.getValue()));
            } catch (IllegalArgumentException e) {
                problems.add(e.getMessage());
            }
        }
        return List.copyOf(definitions);
    }

    private static boolean isPositive(Duration duration) {
        return duration != null && duration.toMillis() > 0;
    }

    /**
     * Builder for {@link MonitorConfig}. Every value has a default except the
     * hostname and the sink path.
     */
    public static final class Builder {
        private String hostname;
        private Duration tickInterval = DEFAULT_TICK_INTERVAL;
        private Duration commitInterval = DEFAULT_COMMIT_INTERVAL;
        private int minUserId = DEFAULT_MIN_USER_ID;
        private final Map<String, List<String>> processGroups = new LinkedHashMap<>();
        private Duration driftTolerance = DEFAULT_DRIFT_TOLERANCE;
        private DriftRecovery driftRecovery = DriftRecovery.DISCARD;
        private Duration sleepWarnThreshold = Duration.ofMillis(500);
        private Duration collectWarnThreshold = Duration.ofSeconds(1);
        private Duration commitWarnThreshold = Duration.ofMillis(500);
        private Duration commitTolerance = Duration.ofMillis(100);
        private Path sinkPath;
        private Path replayLoad;
        private Path replaySave;
        private boolean replayFsync;

        private Builder() {
        }

        public Builder hostname(String hostname) {
            this.hostname = hostname;
            return this;
        }

        public Builder tickInterval(Duration tickInterval) {
            this.tickInterval = Objects.requireNonNull(tickInterval, "tickInterval");
            return this;
        }

        public Builder commitInterval(Duration commitInterval) {
            this.commitInterval = Objects.requireNonNull(commitInterval, "commitInterval");
            return this;
        }

        public Builder minUserId(int minUserId) {
            this.minUserId = minUserId;
            return this;
        }

        /** Adds a group; groups keep the order in which they are added. */
        public Builder processGroup(String name, List<String> patterns) {
            this.processGroups.put(name, patterns == null ? List.of() : List.copyOf(patterns));
            return this;
        }

        public Builder processGroups(Map<String, List<String>> groups) {
            this.processGroups.clear();
            if (groups != null) {
                groups.forEach(this::processGroup);
            }
            return this;
        }

        public Builder driftTolerance(Duration driftTolerance) {
            this.driftTolerance = Objects.requireNonNull(driftTolerance, "driftTolerance");
            return this;
        }

        public Builder driftRecovery(DriftRecovery driftRecovery) {
            this.driftRecovery = Objects.requireNonNull(driftRecovery, "driftRecovery");
            return this;
        }

        public Builder sleepWarnThreshold(Duration threshold) {
            this.sleepWarnThreshold = Objects.requireNonNull(threshold, "sleepWarnThreshold");
            return this;
        }

        public Builder collectWarnThreshold(Duration threshold) {
            this.collectWarnThreshold = Objects.requireNonNull(threshold, "collectWarnThreshold");
            return this;
        }

        public Builder commitWarnThreshold(Duration threshold) {
            this.commitWarnThreshold = Objects.requireNonNull(threshold, "commitWarnThreshold");
            return this;
        }

        public Builder commitTolerance(Duration tolerance) {
            this.commitTolerance = Objects.requireNonNull(tolerance, "commitTolerance");
            return this;
        }

        public Builder sinkPath(Path sinkPath) {
            this.sinkPath = sinkPath;
            return this;
        }

        public Builder replayLoad(Path replayLoad) {
            this.replayLoad = replayLoad;
            return this;
        }

        public Builder replaySave(Path replaySave) {
            this.replaySave = replaySave;
            return this;
        }

        public Builder replayFsync(boolean replayFsync) {
            this.replayFsync = replayFsync;
            return this;
        }

        /**
         * @throws MonitorConfigException listing every invalid setting
         */
        public MonitorConfig build() {
            return new MonitorConfig(this);
        }
    }
}
