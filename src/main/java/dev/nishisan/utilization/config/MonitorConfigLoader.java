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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import dev.nishisan.utilization.schedule.DriftRecovery;

import java.io.IOException;
import java.math.BigDecimal;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class MonitorConfigLoader {

    private static final Logger LOGGER = Logger.getLogger(MonitorConfigLoader.class.getName());
    private static final Pattern VARIABLE = Pattern.compile("\\$\\{([^}]+)\\}");
    private static final Pattern SIMPLE_DURATION = Pattern.compile("(\\d+(?:\\.\\d+)?)\\s*(MS|S|M|H)?");

    private static final ObjectMapper mapper;

    static {
        YAMLFactory yamlFactory = new YAMLFactory()
                .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES);
        mapper = new ObjectMapper(yamlFactory);
    }

    private MonitorConfigLoader() {
    }

    public static MonitorYamlConfig load(Path yamlFile) throws IOException {
        return load(yamlFile, System::getenv);
    }

    public static MonitorYamlConfig load(Path yamlFile, Function<String, String> envProvider) throws IOException {
        String content = Files.readString(yamlFile);
        String processedContent = resolveVariables(content, envProvider);
        MonitorYamlConfig config = mapper.readValue(processedContent, MonitorYamlConfig.class);
        // An empty document maps to null
        return config == null ? new MonitorYamlConfig() : config;
    }

    public static void save(Path yamlFile, MonitorYamlConfig config) throws IOException {
        mapper.writeValue(yamlFile.toFile(), config);
    }

    /**
     * Loads a file and converts it in one step.
     *
     * @throws MonitorConfigException if the content is invalid
     */
    public static MonitorConfig loadDomain(Path yamlFile) throws IOException {
        return convertToDomain(load(yamlFile));
    }

    /**
     * Converts the YAML view into the runtime configuration. Parse errors and
     * validation errors are reported together.
     *
     * @throws MonitorConfigException listing every problem found
     */
    public static MonitorConfig convertToDomain(MonitorYamlConfig yamlConfig) {
        List<String> problems = new ArrayList<>();
        MonitorConfig.Builder builder = MonitorConfig.builder();

        builder.hostname(isBlank(yamlConfig.getHostname()) ? localHostname() : yamlConfig.getHostname().trim());

        Duration tick = parseDuration("tickInterval", yamlConfig.getTickInterval(), problems);
        if (tick != null) {
            builder.tickInterval(tick);
        }
        Duration commit = parseDuration("commitInterval", yamlConfig.getCommitInterval(), problems);
        if (commit != null) {
            builder.commitInterval(commit);
        }
        if (yamlConfig.getMinUserId() != null) {
            builder.minUserId(yamlConfig.getMinUserId());
        }
        Duration driftTolerance = parseDuration("driftTolerance", yamlConfig.getDriftTolerance(), problems);
        if (driftTolerance != null) {
            builder.driftTolerance(driftTolerance);
        }
        if (!isBlank(yamlConfig.getDriftRecovery())) {
            try {
                builder.driftRecovery(DriftRecovery.valueOf(yamlConfig.getDriftRecovery().trim().toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                problems.add("driftRecovery: unknown policy '" + yamlConfig.getDriftRecovery() + "'");
            }
        }

        builder.processGroups(yamlConfig.getProcessGroups());

        SinkConfig sink = yamlConfig.getSink();
        if (sink != null && !isBlank(sink.getPath())) {
            builder.sinkPath(Path.of(sink.getPath()));
        }

        ReplayConfig replay = yamlConfig.getReplay();
        if (replay != null) {
            if (!isBlank(replay.getLoad())) {
                builder.replayLoad(Path.of(replay.getLoad()));
            }
            if (!isBlank(replay.getSave())) {
                builder.replaySave(Path.of(replay.getSave()));
            }
            builder.replayFsync(replay.isFsync());
        }

        try {
            MonitorConfig config = builder.build();
            if (!problems.isEmpty()) {
                throw new MonitorConfigException(problems);
            }
            return config;
        } catch (MonitorConfigException e) {
            List<String> all = new ArrayList<>(problems);
            for (String problem : e.problems()) {
                if (!all.contains(problem)) {
                    all.add(problem);
                }
            }
            throw new MonitorConfigException(all);
        }
    }

    /**
     * Parses a duration. Accepts ISO-8601 ({@code PT5M}), a number with one of
     * the suffixes {@code ms}, {@code s}, {@code m}, {@code h}, or a plain
     * number of seconds.
     *
     * @return the duration, or {@code null} if {@code value} is blank
     * @throws IllegalArgumentException if the value cannot be parsed
     */
    public static Duration parseDuration(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        try {
            return Duration.parse(normalized);
        } catch (DateTimeParseException e) {
            Matcher matcher = SIMPLE_DURATION.matcher(normalized);
            if (!matcher.matches()) {
                throw new IllegalArgumentException("Invalid duration format: " + value, e);
            }
            BigDecimal amount = new BigDecimal(matcher.group(1));
            String unit = matcher.group(2) == null ? "S" : matcher.group(2);
            BigDecimal millis;
            switch (unit) {
                case "MS":
                    millis = amount;
                    break;
                case "M":
                    millis = amount.multiply(BigDecimal.valueOf(60_000));
                    break;
                case "H":
                    millis = amount.multiply(BigDecimal.valueOf(3_600_000));
                    break;
                default:
                    millis = amount.multiply(BigDecimal.valueOf(1_000));
                    break;
            }
            return Duration.ofMillis(millis.longValue());
        }
    }

    private static Duration parseDuration(String key, String value, List<String> problems) {
        try {
            return parseDuration(value);
        } catch (IllegalArgumentException e) {
            problems.add(key + ": " + e.getMessage());
            return null;
        }
    }

    private static String resolveVariables(String content, Function<String, String> envProvider) {
        // Handles ${VAR} and ${VAR:defaultValue}
        Matcher matcher = VARIABLE.matcher(content);
        StringBuilder builder = new StringBuilder();
        int i = 0;
        while (matcher.find()) {
            String replacement = getReplacement(matcher.group(1), envProvider);
            builder.append(content, i, matcher.start());
            builder.append(replacement);
            i = matcher.end();
        }
        builder.append(content.substring(i));
        return builder.toString();
    }

    private static String getReplacement(String group, Function<String, String> envProvider) {
        String[] parts = group.split(":", 2);
        String varName = parts[0];
        String defaultValue = parts.length > 1 ? parts[1] : null;

        String value = envProvider.apply(varName);
        if (value != null) {
            return value;
        }
        if (defaultValue != null) {
            return defaultValue;
        }
        throw new IllegalArgumentException(
                "Environment variable or property '" + varName + "' not found and no default value provided.");
    }

    private static String localHostname() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            LOGGER.warning(() -> "Could not resolve local hostname, using 'localhost': " + e.getMessage());
            return "localhost";
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
