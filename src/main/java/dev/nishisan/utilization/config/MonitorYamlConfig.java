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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MonitorYamlConfig {

    @JsonProperty("hostname")
    private String hostname;

    @JsonProperty("tickInterval")
    private String tickInterval;

    @JsonProperty("commitInterval")
    private String commitInterval;

    @JsonProperty("minUserId")
    private Integer minUserId;

    @JsonProperty("driftTolerance")
    private String driftTolerance;

    @JsonProperty("driftRecovery")
    private String driftRecovery;

    // Declaration order is the record order of the groups.
    @JsonProperty("processGroups")
    private Map<String, List<String>> processGroups = new LinkedHashMap<>();

    @JsonProperty("sink")
    private SinkConfig sink;

    @JsonProperty("replay")
    private ReplayConfig replay;

    public String getHostname() {
        return hostname;
    }

    public void setHostname(String hostname) {
        this.hostname = hostname;
    }

    public String getTickInterval() {
        return tickInterval;
    }

    public void setTickInterval(String tickInterval) {
        this.tickInterval = tickInterval;
    }

    public String getCommitInterval() {
        return commitInterval;
    }

    public void setCommitInterval(String commitInterval) {
        this.commitInterval = commitInterval;
    }

    public Integer getMinUserId() {
        return minUserId;
    }

    public void setMinUserId(Integer minUserId) {
        this.minUserId = minUserId;
    }

    public String getDriftTolerance() {
        return driftTolerance;
    }

    public void setDriftTolerance(String driftTolerance) {
        this.driftTolerance = driftTolerance;
    }

    public String getDriftRecovery() {
        return driftRecovery;
    }

    public void setDriftRecovery(String driftRecovery) {
        this.driftRecovery = driftRecovery;
    }

    public Map<String, List<String>> getProcessGroups() {
        return processGroups;
    }

    public void setProcessGroups(Map<String, List<String>> processGroups) {
        this.processGroups = processGroups;
    }

    public SinkConfig getSink() {
        return sink;
    }

    public void setSink(SinkConfig sink) {
        this.sink = sink;
    }

    public ReplayConfig getReplay() {
        return replay;
    }

    public void setReplay(ReplayConfig replay) {
        this.replay = replay;
    }
}
