package com.ledgerwise.anomaly.service;

import com.ledgerwise.anomaly.model.BusinessHoursConfig;
import com.ledgerwise.anomaly.model.WorkingHours;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Works out when an alert may be delivered under a business-hours policy.
 * Working days use 0 = Sunday through 6 = Saturday; holidays are ISO dates in the policy's zone.
 */
@Component
public class BusinessHours {

    private static final Logger log = LoggerFactory.getLogger(BusinessHours.class);

    // a policy with no open day in a year is treated as always open
    private static final int MAX_LOOKAHEAD_DAYS = 366;

    /**
     * @return {@code now} when inside a working window, otherwise the start of the next one
     */
    public long nextDeliveryTime(BusinessHoursConfig config, long now) {
        if (config == null) return now;

        ZoneId zone = resolveZone(config.getTimezone());
        WorkingHours hours = config.getWorkingHours() == null ? new WorkingHours() : config.getWorkingHours();
        LocalTime start;
        LocalTime end;
        try {
            start = LocalTime.parse(hours.getStart() == null ? "09:00" : hours.getStart());
            end = LocalTime.parse(hours.getEnd() == null ? "17:00" : hours.getEnd());
        } catch (DateTimeException e) {
            log.warn("Invalid working hours {}, delivering immediately", config.getWorkingHours());
            return now;
        }
        if (!end.isAfter(start)) {
            log.warn("Working hours end {} is not after start {}, delivering immediately", end, start);
            return now;
        }

        Set<Integer> workingDays = new HashSet<>(config.getWorkingDays() == null ? List.of() : config.getWorkingDays());
        Set<LocalDate> holidays = parseHolidays(config.getHolidays());

        ZonedDateTime current = Instant.ofEpochMilli(now).atZone(zone);
        LocalDate day = current.toLocalDate();
        for (int i = 0; i < MAX_LOOKAHEAD_DAYS; i++, day = day.plusDays(1)) {
            if (!isWorkingDay(day, workingDays, holidays)) continue;

            long windowStart = day.atTime(start).atZone(zone).toInstant().toEpochMilli();
            long windowEnd = day.atTime(end).atZone(zone).toInstant().toEpochMilli();
            if (now < windowStart) return windowStart;
            if (now < windowEnd) return now;
        }
        return now;
    }

    public boolean isWithinBusinessHours(BusinessHoursConfig config, long now) {
        return nextDeliveryTime(config, now) == now;
    }

    private static boolean isWorkingDay(LocalDate day, Set<Integer> workingDays, Set<LocalDate> holidays) {
        return workingDays.contains(day.getDayOfWeek().getValue() % 7) && !holidays.contains(day);
    }

    private ZoneId resolveZone(String timezone) {
        if (timezone == null || timezone.isBlank()) return ZoneOffset.UTC;
        try {
            return ZoneId.of(timezone);
        } catch (DateTimeException e) {
            log.warn("Unknown timezone '{}', using UTC", timezone);
            return ZoneOffset.UTC;
        }
    }

    private Set<LocalDate> parseHolidays(List<String> holidays) {
        Set<LocalDate> parsed = new HashSet<>();
        if (holidays == null) return parsed;
        for (String holiday : holidays) {
            if (holiday == null) continue;
            try {
                parsed.add(LocalDate.parse(holiday.trim()));
            } catch (DateTimeException e) {
                log.warn("Ignoring invalid holiday '{}'", holiday);
            }
        }
        return parsed;
    }
}
