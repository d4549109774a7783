package me.golemcore.groupdesk.domain.service;

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

import me.golemcore.groupdesk.infrastructure.config.GroupDeskProperties;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts tenant-local {@code HH:MM} wall-clock times into UTC instants.
 *
 * <p>
 * Calendar dates are taken in tenant-local time ({@code now} shifted by
 * {@code groupdesk.dispatcher.tenant-utc-offset-hours}); the local date and
 * wall-clock time are then shifted back to UTC. The offset is the same for
 * every tenant.
 */
@Component
public class RecurrenceCalculator {

    private static final Pattern TIME_PATTERN = Pattern.compile("^(\\d{1,2}):(\\d{2})$");
    private static final int MAX_HOUR = 23;
    private static final int MAX_MINUTE = 59;

    private final GroupDeskProperties properties;
    private final Clock clock;

    public RecurrenceCalculator(GroupDeskProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Tomorrow's occurrence of a recurring time, tomorrow being the tenant's
     * local tomorrow. Always strictly after now.
     */
    public Instant nextDailyOccurrence(String recurringTime) {
        Instant now = clock.instant();
        Instant candidate = toUtc(localToday(now).plusDays(1), parseTime(recurringTime));
        while (!candidate.isAfter(now)) {
            candidate = candidate.plus(Duration.ofDays(1));
        }
        return candidate;
    }

    /**
     * Today's occurrence, or tomorrow's when today's has already passed.
     */
    public Instant firstOccurrence(String recurringTime) {
        Instant now = clock.instant();
        Instant candidate = toUtc(localToday(now), parseTime(recurringTime));
        if (!candidate.isAfter(now)) {
            candidate = candidate.plus(Duration.ofDays(1));
        }
        return candidate;
    }

    /**
     * Parse {@code HH:MM} (hour 0-23, minute 0-59).
     *
     * @throws IllegalArgumentException
     *             if the value is not a valid time
     */
    public static LocalTime parseTime(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Invalid time format: null. Use HH:MM format.");
        }
        Matcher matcher = TIME_PATTERN.matcher(value.trim());
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Invalid time format: " + value + ". Use HH:MM format.");
        }
        int hour = Integer.parseInt(matcher.group(1));
        int minute = Integer.parseInt(matcher.group(2));
        if (hour > MAX_HOUR || minute > MAX_MINUTE) {
            throw new IllegalArgumentException("Invalid time format: " + value + ". Use HH:MM format.");
        }
        return LocalTime.of(hour, minute);
    }

    private LocalDate localToday(Instant now) {
        return LocalDate.ofInstant(now.plus(offset()), ZoneOffset.UTC);
    }

    private Instant toUtc(LocalDate date, LocalTime localTime) {
        return date.atTime(localTime).toInstant(ZoneOffset.UTC).minus(offset());
    }

    private Duration offset() {
        return Duration.ofHours(properties.getDispatcher().getTenantUtcOffsetHours());
    }
}
