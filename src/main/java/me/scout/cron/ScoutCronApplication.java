package me.scout.cron;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Entry point of the Scout cron service.
 *
 * <p>
 * Schedules agent jobs from cron expressions, tracks every run through its
 * lifecycle and enforces per-job concurrency policies. Jobs and runs are kept
 * as JSON documents on the local filesystem and managed over the
 * {@code /api/cron} HTTP API.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ScoutCronApplication {

    public static void main(String[] args) {
        SpringApplication.run(ScoutCronApplication.class, args);
    }
}
