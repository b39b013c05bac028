package me.golemcore.scheduler.domain.model;

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

import me.golemcore.scheduler.domain.exception.InvalidPatternException;
import org.springframework.scheduling.support.CronExpression;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * Classified job pattern. The raw text is what gets persisted; the kind and
 * either the parsed cron expression or the fire instant are computed once at
 * classification time.
 *
 * <p>
 * Cron patterns follow Unix five-field syntax (minute precision) or Spring's
 * six-field syntax (with seconds) and are evaluated in UTC. Anything else must
 * parse as an ISO-8601 instant, an offset date-time, or a local date-time read
 * as UTC.
 */
public record JobPattern(String raw, JobKind kind, String cron, CronExpression expression, Instant fireAt) {

    private static final int CRON_FIVE_FIELDS = 5;
    private static final int CRON_SIX_FIELDS = 6;
    private static final List<DateTimeFormatter> LOCAL_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss"),
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm"));

    /**
     * Classify a pattern as recurring (valid cron) or one-off (concrete
     * date/time).
     *
     * @throws InvalidPatternException
     *             if the text is neither
     */
    public static JobPattern classify(String pattern) {
        if (pattern == null || pattern.isBlank()) {
            throw new InvalidPatternException(pattern, "pattern is empty");
        }
        String trimmed = pattern.trim();

        String cron = toSpringCron(trimmed);
        CronExpression expression = cron != null ? parseCron(cron) : null;
        if (expression != null) {
            return new JobPattern(trimmed, JobKind.RECURRING, cron, expression, null);
        }

        Instant instant = parseInstant(trimmed);
        if (instant != null) {
            return new JobPattern(trimmed, JobKind.ONE_OFF, null, null, instant);
        }

        throw new InvalidPatternException(trimmed, "not a cron expression or a date/time");
    }

    /**
     * One-off pattern for a concrete instant, stored in ISO-8601 form.
     */
    public static JobPattern at(Instant instant) {
        if (instant == null) {
            throw new IllegalArgumentException("Instant is required");
        }
        return new JobPattern(instant.toString(), JobKind.ONE_OFF, null, null, instant);
    }

    public boolean isRecurring() {
        return kind == JobKind.RECURRING;
    }

    /**
     * Next cron fire time strictly after the given instant, in UTC.
     *
     * @return next fire time, or null if the expression never fires again
     */
    public Instant nextAfter(Instant after) {
        if (!isRecurring()) {
            throw new IllegalStateException("One-off pattern has no cron schedule: " + raw);
        }
        ZonedDateTime next = expression.next(ZonedDateTime.ofInstant(after, ZoneOffset.UTC));
        return next != null ? next.toInstant() : null;
    }

    private static CronExpression parseCron(String cron) {
        try {
            return CronExpression.parse(cron);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private static String toSpringCron(String trimmed) {
        String[] parts = trimmed.split("\\s+");
        if (parts.length == CRON_FIVE_FIELDS) {
            return "0 " + trimmed;
        }
        if (parts.length == CRON_SIX_FIELDS) {
            return trimmed;
        }
        return null;
    }

    private static Instant parseInstant(String text) {
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException ignored) {
            // try the next format
        }
        try {
            return OffsetDateTime.parse(text).toInstant();
        } catch (DateTimeParseException ignored) {
            // try the next format
        }
        for (DateTimeFormatter format : LOCAL_FORMATS) {
            try {
                return LocalDateTime.parse(text, format).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException ignored) {
                // try the next format
            }
        }
        return null;
    }
}
