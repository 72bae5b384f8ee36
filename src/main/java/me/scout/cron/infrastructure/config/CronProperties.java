package me.scout.cron.infrastructure.config;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Centralized configuration properties for the cron service, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code cron.*} prefix:
 * <ul>
 * <li>{@link StorageProperties} - where jobs, schedules and runs are kept</li>
 * <li>{@link DefaultsProperties} - values applied to job definitions that omit
 * them</li>
 * <li>{@link SchedulerProperties} - background tick loop</li>
 * <li>{@link RunnerProperties} - run execution</li>
 * <li>{@link JobsProperties} - job definition files imported at startup</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "cron")
@Data
public class CronProperties {

    private StorageProperties storage = new StorageProperties();
    private DefaultsProperties defaults = new DefaultsProperties();
    private SchedulerProperties scheduler = new SchedulerProperties();
    private RunnerProperties runner = new RunnerProperties();
    private JobsProperties jobs = new JobsProperties();

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
        /** Finished runs kept per job, newest first; 0 keeps all. */
        private int maxRunsPerJob = 200;
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.scout/cron";
    }

    @Data
    public static class DefaultsProperties {
        private String timezone = "America/New_York";
    }

    @Data
    public static class SchedulerProperties {
        private boolean enabled = true;
        private int tickIntervalSeconds = 30;
        private int maxCatchupRuns = 1000;
    }

    @Data
    public static class RunnerProperties {
        private boolean processPending = true;
        private String executor = "dry-run";
        private int defaultTimeoutSeconds = 300;
        private boolean saveArtifacts = true;
    }

    @Data
    public static class JobsProperties {
        private String directory = "";
    }
}
