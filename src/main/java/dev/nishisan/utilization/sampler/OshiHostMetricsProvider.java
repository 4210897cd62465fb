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

package dev.nishisan.utilization.sampler;

import oshi.PlatformEnum;
import oshi.SystemInfo;
import oshi.hardware.CentralProcessor;
import oshi.hardware.GlobalMemory;
import oshi.software.os.OSProcess;
import oshi.software.os.OperatingSystem;
import oshi.util.FileUtil;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link HostMetricsProvider} backed by OSHI.
 * <p>
 * Per-process CPU is computed from the delta against the same process in the
 * previous enumeration; the first reading of a process reports 0.
 * <p>
 * On Linux the owner uid is the effective uid from {@code /proc/<pid>/status};
 * elsewhere it is whatever OSHI reports. The username is always OSHI's.
 * Not thread-safe; the sampling loop is its only caller.
 */
public final class OshiHostMetricsProvider implements HostMetricsProvider {

    private final OperatingSystem os;
    private final CentralProcessor processor;
    private final GlobalMemory memory;
    private long[] previousTicks;
    private Map<Integer, OSProcess> previousProcesses = new HashMap<>();

    public OshiHostMetricsProvider() {
        this(new SystemInfo());
    }

    public OshiHostMetricsProvider(SystemInfo systemInfo) {
        this.os = systemInfo.getOperatingSystem();
        this.processor = systemInfo.getHardware().getProcessor();
        this.memory = systemInfo.getHardware().getMemory();
        this.previousTicks = processor.getSystemCpuLoadTicks();
    }

    @Override
    public List<ProcessProbe> processes() {
        long totalMemory = memory.getTotal();
        List<OSProcess> current = os.getProcesses();
        Map<Integer, OSProcess> seen = new HashMap<>(current.size() * 2);
        List<ProcessProbe> probes = new ArrayList<>(current.size());
        for (OSProcess process : current) {
            OSProcess prior = previousProcesses.get(process.getProcessID());
            seen.put(process.getProcessID(), process);
            probes.add(() -> read(process, prior, totalMemory));
        }
        previousProcesses = seen;
        return probes;
    }

    @Override
    public SystemUsage systemUsage() {
        double cpu = processor.getSystemCpuLoadBetweenTicks(previousTicks);
        previousTicks = processor.getSystemCpuLoadTicks();
        long total = memory.getTotal();
        double mem = total > 0 ? (double) (total - memory.getAvailable()) / total : 0.0;
        return new SystemUsage(clamp(cpu), clamp(mem));
    }

    private static final boolean LINUX = SystemInfo.getCurrentPlatform() == PlatformEnum.LINUX;

    private static Optional<ProcessReading> read(OSProcess process, OSProcess prior, long totalMemory) {
        OSProcess.State state = process.getState();
        if (state == OSProcess.State.ZOMBIE || state == OSProcess.State.INVALID) {
            return Optional.empty();
        }
        long startMillis = process.getStartTime();
        Instant creationTime = startMillis > 0 ? Instant.ofEpochMilli(startMillis) : null;
        List<String> arguments = process.getArguments();
        List<String> command = arguments == null || arguments.isEmpty() ? null : arguments;

        double cpu = 0.0;
        if (prior != null && prior.getStartTime() == startMillis) {
            cpu = process.getProcessCpuLoadBetweenTicks(prior);
        }
        double mem = totalMemory > 0 ? (double) process.getResidentSetSize() / totalMemory : 0.0;

        return Optional.of(new ProcessReading(
                process.getProcessID(),
                ownerUid(process),
                process.getUser(),
                creationTime,
                command,
                Math.max(0.0, cpu),
                Math.max(0.0, mem)));
    }

    private static int ownerUid(OSProcess process) {
        if (LINUX) {
            String uids = FileUtil.getKeyValueMapFromFile("/proc/" + process.getProcessID() + "/status", ":")
                    .get("Uid");
            int effective = effectiveUid(uids);
            if (effective >= 0) {
                return effective;
            }
        }
        return parseUid(process.getUserID());
    }

    /**
     * @param uids the {@code Uid:} value of a Linux status file: real,
     *             effective, saved and filesystem uid
     * @return the effective uid, or -1 when the value cannot be parsed
     */
    static int effectiveUid(String uids) {
        if (uids == null) {
            return -1;
        }
        String[] fields = uids.trim().split("\\s+");
        return fields.length > 1 ? parseUid(fields[1]) : -1;
    }

    static int parseUid(String userId) {
        if (userId == null || userId.isBlank()) {
            return -1;
        }
        try {
            return Integer.parseInt(userId.trim());
        } catch (NumberFormatException e) {
            // Windows SIDs and the like carry no numeric uid
            return -1;
        }
    }

    private static double clamp(double value) {
        if (Double.isNaN(value) || value < 0.0) {
            return 0.0;
        }
        return Math.min(1.0, value);
    }
}
