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
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MonitorConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldLoadFullConfigurationWithInterpolation() throws IOException {
        Path yamlFile = copyFixture();
        Map<String, String> env = new HashMap<>();
        env.put("MONITOR_DATA", "/data/monitor");
        // MONITOR_HOST is missing, should use default

        MonitorConfig config = MonitorConfigLoader.convertToDomain(MonitorConfigLoader.load(yamlFile, env::get));

        assertEquals("gpu-node-7", config.hostname());
        assertEquals(Duration.ofSeconds(5), config.tickInterval());
        assertEquals(Duration.ofMinutes(5), config.commitInterval());
        assertEquals(1000, config.minUserId());
        assertEquals(Duration.ofSeconds(10), config.driftTolerance());
        assertEquals(DriftRecovery.DISCARD, config.driftRecovery());
        assertEquals(Path.of("/data/monitor/records.jsonl"), config.sinkPath());
        assertEquals(Path.of("/data/monitor/snapshots.log"), config.replaySave().orElseThrow());
        assertTrue(config.replayLoad().isEmpty());
        assertFalse(config.replayFsync());

        List<GroupDefinition> groups = config.groupDefinitions();
        assertEquals(List.of("python", "notebooks", "ssh"),
                groups.stream().map(GroupDefinition::name).collect(Collectors.toList()));
        assertTrue(groups.get(0).filter().matches(List.of("/usr/bin/python3")));
        assertTrue(groups.get(0).filter().matches(List.of("python", "run.py")));
        assertEquals(List.of("python3", "*.py"), config.processGroups().get("python"));
    }

    @Test
    void shouldFailWhenVariableMissingAndNoDefault() throws IOException {
        Path yamlFile = tempDir.resolve("missing.yml");
        Files.writeString(yamlFile, "sink:\n  path: ${SINK_PATH}\n");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> MonitorConfigLoader.load(yamlFile, name -> null));

        assertTrue(e.getMessage().contains("SINK_PATH"));
    }

    @Test
    void shouldApplyDefaultsForMinimalFile() throws IOException {
        Path yamlFile = tempDir.resolve("minimal.yml");
        Files.writeString(yamlFile, "hostname: box\nsink:\n  path: out.jsonl\n");

        MonitorConfig config = MonitorConfigLoader.convertToDomain(MonitorConfigLoader.load(yamlFile, name -> null));

        assertEquals(MonitorConfig.DEFAULT_TICK_INTERVAL, config.tickInterval());
        assertEquals(MonitorConfig.DEFAULT_COMMIT_INTERVAL, config.commitInterval());
        assertEquals(MonitorConfig.DEFAULT_MIN_USER_ID, config.minUserId());
        assertEquals(DriftRecovery.DISCARD, config.driftRecovery());
        assertEquals(Duration.ofMillis(100), config.commitTolerance());
        assertTrue(config.groupDefinitions().isEmpty());
    }

    @Test
    void shouldResolveLocalHostnameWhenBlank() throws IOException {
        Path yamlFile = tempDir.resolve("no-host.yml");
        Files.writeString(yamlFile, "sink:\n  path: out.jsonl\n");

        MonitorConfig config = MonitorConfigLoader.convertToDomain(MonitorConfigLoader.load(yamlFile, name -> null));

        assertFalse(config.hostname().isBlank());
    }

    @Test
    void shouldReportEveryProblemAtOnce() throws IOException {
        Path yamlFile = tempDir.resolve("broken.yml");
        Files.writeString(yamlFile, String.join("\n",
                "hostname: box",
                "tickInterval: 7s",
                "commitInterval: 5m",
                "minUserId: -3",
                "driftRecovery: sometimes",
                "processGroups:",
                "  empty: []",
                "  fine: [sshd]",
                ""));

        MonitorConfigException e = assertThrows(MonitorConfigException.class,
                () -> MonitorConfigLoader.convertToDomain(MonitorConfigLoader.load(yamlFile, name -> null)));

        List<String> problems = e.problems();
        assertEquals(5, problems.size(), problems.toString());
        assertTrue(problems.stream().anyMatch(p -> p.contains("driftRecovery")));
        assertTrue(problems.stream().anyMatch(p -> p.contains("multiple of tickInterval")));
        assertTrue(problems.stream().anyMatch(p -> p.contains("minUserId")));
        assertTrue(problems.stream().anyMatch(p -> p.contains("'empty'")));
        assertTrue(problems.stream().anyMatch(p -> p.contains("sink.path")));
    }

    @Test
    void shouldReportUnparsableDuration() throws IOException {
        Path yamlFile = tempDir.resolve("bad-duration.yml");
        Files.writeString(yamlFile, "hostname: box\ntickInterval: soon\nsink:\n  path: out.jsonl\n");

        MonitorConfigException e = assertThrows(MonitorConfigException.class,
                () -> MonitorConfigLoader.convertToDomain(MonitorConfigLoader.load(yamlFile, name -> null)));

        assertEquals(1, e.problems().size(), e.problems().toString());
        assertTrue(e.problems().get(0).startsWith("tickInterval"));
    }

    @Test
    void shouldParseDurationFormats() {
        assertEquals(Duration.ofMillis(500), MonitorConfigLoader.parseDuration("500ms"));
        assertEquals(Duration.ofSeconds(5), MonitorConfigLoader.parseDuration("5s"));
        assertEquals(Duration.ofSeconds(5), MonitorConfigLoader.parseDuration("5"));
        assertEquals(Duration.ofMillis(1500), MonitorConfigLoader.parseDuration("1.5s"));
        assertEquals(Duration.ofMinutes(5), MonitorConfigLoader.parseDuration("5m"));
        assertEquals(Duration.ofHours(1), MonitorConfigLoader.parseDuration("1h"));
        assertEquals(Duration.ofMinutes(5), MonitorConfigLoader.parseDuration("PT5M"));
        assertEquals(Duration.ofSeconds(30), MonitorConfigLoader.parseDuration(" 30 S "));
        assertNull(MonitorConfigLoader.parseDuration(" "));
        assertThrows(IllegalArgumentException.class, () -> MonitorConfigLoader.parseDuration("5 minutes"));
    }

    @Test
    void shouldSaveAndReloadYaml() throws IOException {
        MonitorYamlConfig yaml = new MonitorYamlConfig();
        yaml.setHostname("box");
        yaml.setCommitInterval("10m");
        yaml.getProcessGroups().put("python", List.of("python3"));
        SinkConfig sink = new SinkConfig();
        sink.setPath("/tmp/records.jsonl");
        yaml.setSink(sink);
        Path yamlFile = tempDir.resolve("saved.yml");

        MonitorConfigLoader.save(yamlFile, yaml);
        MonitorYamlConfig reloaded = MonitorConfigLoader.load(yamlFile, name -> null);

        assertEquals("box", reloaded.getHostname());
        assertEquals("10m", reloaded.getCommitInterval());
        assertEquals(List.of("python3"), reloaded.getProcessGroups().get("python"));
        assertEquals("/tmp/records.jsonl", reloaded.getSink().getPath());
        assertNull(reloaded.getReplay());
    }

    @Test
    void shouldRejectInvalidBuilderSettings() {
        MonitorConfigException e = assertThrows(MonitorConfigException.class, () -> MonitorConfig.builder()
                .hostname("box")
                .sinkPath(Path.of("out.jsonl"))
                .tickInterval(Duration.ZERO)
                .processGroup(" ", List.of("x"))
                .build());

        assertEquals(2, e.problems().size(), e.problems().toString());
    }

    private Path copyFixture() throws IOException {
        Path target = tempDir.resolve("monitor-config.yml");
        try (InputStream in = getClass().getResourceAsStream("/monitor-config.yml")) {
            Files.copy(in, target);
        }
        return target;
    }
}
