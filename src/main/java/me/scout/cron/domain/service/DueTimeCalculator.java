package me.scout.cron.domain.service;

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

import me.scout.cron.domain.model.DueTime;
import me.scout.cron.domain.model.JobDefinition;
import me.scout.cron.infrastructure.config.CronProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Optional;
import java.util.Random;

/**
 * Computes the next eligible execution instant of a job.
 *
 * <p>
 * The result is the earliest occurrence of the job's cron expression in the
 * job's timezone, shifted by a random jitter in {@code [0, jitterMs]} and
 * clamped to the job's {@code notBefore}/{@code notAfter} window. Nothing here
 * touches persisted state; the only inputs besides the arguments are the clock
 * (when no reference instant is given) and the jitter source.
 *
 * <p>
 * Jitter only delays the due instant. Successive occurrences are always
 * computed from the raw occurrence, so a jitter wider than the cron interval
 * never skips one.
 */
@Service
@Slf4j
public class DueTimeCalculator {

    private static final int CRON_FIVE_FIELDS = 5;
    private static final int CRON_SIX_FIELDS = 6;

    private final Clock clock;
    private final Random jitterSource;
    private final CronProperties properties;

    public DueTimeCalculator(Clock clock, Random jitterSource, CronProperties properties) {
        this.clock = clock;
        this.jitterSource = jitterSource;
        this.properties = properties;
    }

    /**
     * Next due instant of {@code job}, jitter included.
     *
     * @see #nextDueTime(JobDefinition, Instant)
     */
    public Optional<Instant> nextDue(JobDefinition job, Instant from) {
        return nextDueTime(job, from).map(DueTime::dueAt);
    }

    /**
     * Next occurrence of {@code job} together with its jittered due instant.
     *
     * @param from
     *            occurrence to advance from; the result fires strictly after it.
     *            When {@code null} the occurrence may coincide with the current
     *            time.
     * @return the next occurrence, or empty if the job's window has no further
     *         occurrences
     */
    public Optional<DueTime> nextDueTime(JobDefinition job, Instant from) {
        CronExpression cron = CronExpression.parse(normalizeCronExpression(job.getSchedule()));
        ZoneId zone = resolveZone(job.getTimezone());

        ZonedDateTime reference = from != null
                ? from.atZone(zone)
                : clock.instant().atZone(zone).minusNanos(1);

        DueTime candidate = jittered(cron, reference, job.getJitterMs());

        // A window start behaves like a fresh reference instant; one retry
        // always lands at or after it.
        Instant notBefore = job.getNotBefore();
        if (candidate != null && notBefore != null && candidate.dueAt().isBefore(notBefore)) {
            candidate = jittered(cron, notBefore.atZone(zone).minusNanos(1), job.getJitterMs());
        }

        if (candidate == null) {
            return Optional.empty();
        }

        Instant notAfter = job.getNotAfter();
        if (notAfter != null && candidate.dueAt().isAfter(notAfter)) {
            return Optional.empty();
        }
        return Optional.of(candidate);
    }

    /**
     * Resolve a job's timezone, falling back to the configured default for
     * blank or unknown zone ids.
     */
    public ZoneId resolveZone(String timezone) {
        String zoneId = timezone != null && !timezone.isBlank()
                ? timezone.trim()
                : properties.getDefaults().getTimezone();
        try {
            return ZoneId.of(zoneId);
        } catch (DateTimeException e) {
            log.warn("[Scheduler] Unknown timezone '{}', using {}", zoneId, properties.getDefaults().getTimezone());
            return ZoneId.of(properties.getDefaults().getTimezone());
        }
    }

    long drawJitter(long jitterMs) {
        if (jitterMs <= 0) {
            return 0;
        }
        return jitterSource.nextLong(jitterMs + 1);
    }

    private DueTime jittered(CronExpression cron, ZonedDateTime reference, long jitterMs) {
        ZonedDateTime next = cron.next(reference);
        if (next == null) {
            return null;
        }
        Instant occurrence = next.toInstant();
        return new DueTime(occurrence, occurrence.plusMillis(drawJitter(jitterMs)));
    }

    /**
     * Normalize a cron expression: converts 5-field (minute-level) to 6-field
     * (Spring format with seconds). Validates the result.
     *
     * @throws IllegalArgumentException
     *             if the cron expression is invalid
     */
    public static String normalizeCronExpression(String input) {
        if (input == null || input.isBlank()) {
            throw new IllegalArgumentException("Cron expression cannot be empty");
        }

        String trimmed = input.trim();
        String[] parts = trimmed.split("\\s+");

        String sixFieldCron;
        if (parts.length == CRON_FIVE_FIELDS) {
            sixFieldCron = "0 " + trimmed;
        } else if (parts.length == CRON_SIX_FIELDS) {
            sixFieldCron = trimmed;
        } else {
            throw new IllegalArgumentException("Invalid cron expression: expected 5 or 6 fields, got " + parts.length);
        }

        try {
            CronExpression.parse(sixFieldCron);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid cron expression '" + trimmed + "': " + e.getMessage());
        }

        return sixFieldCron;
    }
}
