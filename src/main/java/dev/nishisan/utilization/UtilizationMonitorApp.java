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

package dev.nishisan.utilization;

import dev.nishisan.utilization.clock.MonitorClock;
import dev.nishisan.utilization.config.MonitorConfig;
import dev.nishisan.utilization.config.MonitorConfigException;
import dev.nishisan.utilization.config.MonitorConfigLoader;
import dev.nishisan.utilization.sampler.OshiHostMetricsProvider;
import dev.nishisan.utilization.schedule.SchedulerState;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Command line entry point: {@code utilization-monitor <config.yml>}.
 */
public class UtilizationMonitorApp {

    private static final Logger LOGGER = Logger.getLogger(UtilizationMonitorApp.class.getName());

    static final int EXIT_USAGE = 64;
    static final int EXIT_CONFIG = 78;
    static final int EXIT_IO = 74;

    public static void main(String[] args) {
        int status = run(args);
        if (status != 0) {
            System.exit(status);
        }
    }

    static int run(String[] args) {
        if (args.length != 1) {
            System.err.println("Usage: utilization-monitor <config.yml>");
            return EXIT_USAGE;
        }
        Path yamlFile = Paths.get(args[0]);

        MonitorConfig config;
        try {
            config = MonitorConfigLoader.loadDomain(yamlFile);
        } catch (MonitorConfigException e) {
            e.problems().forEach(problem -> LOGGER.severe("Configuration: " + problem));
            return EXIT_CONFIG;
        } catch (IOException | IllegalArgumentException e) {
            LOGGER.log(Level.SEVERE, "Failed to read configuration " + yamlFile, e);
            return EXIT_CONFIG;
        }

        try (UtilizationMonitor monitor = new UtilizationMonitor(config, OshiHostMetricsProvider::new,
                MonitorClock.system())) {
            Thread loop = Thread.currentThread();
            Thread hook = new Thread(() -> {
                monitor.stop();
                // only a waiting loop is woken; a tick in progress completes first
                if (monitor.scheduler().state() == SchedulerState.IDLE) {
                    loop.interrupt();
                }
                try {
                    loop.join(TimeUnit.SECONDS.toMillis(5));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }, "utilization-monitor-shutdown");
            Runtime.getRuntime().addShutdownHook(hook);
            try {
                monitor.run();
            } finally {
                removeHook(hook);
            }
            return 0;
        } catch (IOException e) {
            LOGGER.log(Level.SEVERE, "Utilization monitor failed", e);
            return EXIT_IO;
        }
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            LOGGER.fine("Shutdown in progress; keeping shutdown hook");
        }
    }
}
