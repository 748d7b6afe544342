package com.delta.synctracker.sync.model;

import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

class SyncScheduleTest {

    @Test
    void dailyRunIsLaterTodayWhenTargetHourIsStillAhead() {
        Instant next = SyncSchedule.nextRunUtc(Instant.parse("2026-02-16T01:30:00Z"), 3);
        assertEquals(Instant.parse("2026-02-16T03:00:00Z"), next);
    }

    @Test
    void dailyRunRollsToTomorrowOncePastTargetHour() {
        Instant next = SyncSchedule.nextRunUtc(Instant.parse("2026-02-16T10:00:00Z"), 3);
        assertEquals(Instant.parse("2026-02-17T03:00:00Z"), next);
    }

    @Test
    void dailyRunAtExactlyTheTargetHourSchedulesTomorrow() {
        Instant next = SyncSchedule.nextRunUtc(Instant.parse("2026-02-16T03:00:00Z"), 3);
        assertEquals(Instant.parse("2026-02-17T03:00:00Z"), next);
    }

    @Test
    void weeklyRunFromSundayEveningLandsOnMondayMorning() {
        Instant next = SyncSchedule.nextRunUtc(Instant.parse("2026-02-15T22:00:00Z"), 5, DayOfWeek.MONDAY);
        assertEquals(Instant.parse("2026-02-16T05:00:00Z"), next);
    }

    @Test
    void weeklyRunPastTheHourOnTargetDayRollsToNextWeek() {
        Instant next = SyncSchedule.nextRunUtc(Instant.parse("2026-02-16T10:00:00Z"), 5, DayOfWeek.MONDAY);
        assertEquals(Instant.parse("2026-02-23T05:00:00Z"), next);
    }

    @Test
    void weeklyRunEarlierOnTargetDayStaysThisWeek() {
        Instant next = SyncSchedule.nextRunUtc(Instant.parse("2026-02-16T04:59:59Z"), 5, DayOfWeek.MONDAY);
        assertEquals(Instant.parse("2026-02-16T05:00:00Z"), next);
    }

    @Test
    void weeklyRunCrossesMonthBoundary() {
        Instant next = SyncSchedule.nextRunUtc(Instant.parse("2026-02-27T12:00:00Z"), 0, DayOfWeek.WEDNESDAY);
        assertEquals(Instant.parse("2026-03-04T00:00:00Z"), next);
    }

    @Test
    void scheduleDelegatesToTheMatchingComputation() {
        Instant now = Instant.parse("2026-02-15T22:00:00Z");
        assertEquals(Instant.parse("2026-02-16T03:00:00Z"), SyncSchedule.daily(3).nextRunAfter(now));
        assertEquals(
            Instant.parse("2026-02-16T05:00:00Z"),
            SyncSchedule.weekly(DayOfWeek.MONDAY, 5).nextRunAfter(now)
        );
    }

    @Test
    void nextRunIsAlwaysStrictlyAfterNow() {
        Instant now = Instant.parse("2026-02-16T00:00:00Z");
        for (int hour = 0; hour < 24; hour++) {
            for (DayOfWeek day : DayOfWeek.values()) {
                Instant next = SyncSchedule.nextRunUtc(now, hour, day);
                assertThat(next).isAfter(now);
                assertThat(next).isBeforeOrEqualTo(now.plusSeconds(7L * 24 * 3600));
            }
            assertThat(SyncSchedule.nextRunUtc(now, hour)).isAfter(now);
        }
    }

    @Test
    void hourOutsideDayIsRejected() {
        assertThatThrownBy(() -> SyncSchedule.daily(24)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SyncSchedule.nextRunUtc(Instant.now(), -1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SyncSchedule.weekly(null, 3)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void describeNamesTheSlot() {
        assertEquals("daily@03:00Z", SyncSchedule.daily(3).describe());
        assertEquals("weekly MONDAY@05:00Z", SyncSchedule.weekly(DayOfWeek.MONDAY, 5).describe());
    }
}
