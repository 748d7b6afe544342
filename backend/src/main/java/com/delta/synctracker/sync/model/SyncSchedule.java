package com.delta.synctracker.sync.model;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Locale;

/**
 * A provider's fixed UTC sync slot: every day at {@code hourUtc:00}, or once a week on
 * {@code weekday} at {@code hourUtc:00}.
 *
 * <p>The next-run computations are pure functions of their inputs so they can be exercised
 * without a running worker.
 */
public record SyncSchedule(int hourUtc, DayOfWeek weekday) {

    public SyncSchedule {
        requireValidHour(hourUtc);
    }

    public static SyncSchedule daily(int hourUtc) {
        return new SyncSchedule(hourUtc, null);
    }

    public static SyncSchedule weekly(DayOfWeek weekday, int hourUtc) {
        if (weekday == null) {
            throw new IllegalArgumentException("weekday is required for a weekly schedule");
        }
        return new SyncSchedule(hourUtc, weekday);
    }

    public boolean isWeekly() {
        return weekday != null;
    }

    public Instant nextRunAfter(Instant now) {
        return weekday == null
            ? nextRunUtc(now, hourUtc)
            : nextRunUtc(now, hourUtc, weekday);
    }

    public String describe() {
        String time = String.format(Locale.ROOT, "%02d:00Z", hourUtc);
        return weekday == null ? "daily@" + time : "weekly " + weekday + "@" + time;
    }

    /** Today at the target hour if that is still ahead of {@code now}, otherwise tomorrow. */
    public static Instant nextRunUtc(Instant now, int targetHourUtc) {
        requireValidHour(targetHourUtc);
        ZonedDateTime todayRun = atHour(now.atZone(ZoneOffset.UTC).toLocalDate(), targetHourUtc);
        Instant candidate = todayRun.toInstant();
        return now.isBefore(candidate) ? candidate : todayRun.plusDays(1).toInstant();
    }

    /** The next {@code targetWeekday} at the target hour strictly after {@code now}. */
    public static Instant nextRunUtc(Instant now, int targetHourUtc, DayOfWeek targetWeekday) {
        requireValidHour(targetHourUtc);
        if (targetWeekday == null) {
            throw new IllegalArgumentException("targetWeekday must not be null");
        }
        LocalDate today = now.atZone(ZoneOffset.UTC).toLocalDate();
        int daysUntil = (targetWeekday.getValue() - today.getDayOfWeek().getValue() + 7) % 7;
        ZonedDateTime candidate = atHour(today.plusDays(daysUntil), targetHourUtc);
        if (!now.isBefore(candidate.toInstant())) {
            candidate = candidate.plusWeeks(1);
        }
        return candidate.toInstant();
    }

    private static ZonedDateTime atHour(LocalDate date, int hourUtc) {
        return date.atStartOfDay(ZoneOffset.UTC).plusHours(hourUtc);
    }

    private static void requireValidHour(int hourUtc) {
        if (hourUtc < 0 || hourUtc > 23) {
            throw new IllegalArgumentException("Sync hour must be between 0 and 23, got " + hourUtc);
        }
    }
}
