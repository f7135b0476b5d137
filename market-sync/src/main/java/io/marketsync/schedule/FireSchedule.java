package io.marketsync.schedule;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZonedDateTime;

/**
 * Next fire times of the scheduler's timers. Pure; every result is strictly after {@code after}.
 * Trading-day filtering happens when a timer fires, so it can be recorded as a skipped run.
 */
public final class FireSchedule {
    private FireSchedule() {}

    public record NextFires(ZonedDateTime calendarRefresh, ZonedDateTime missingCheck, ZonedDateTime sync,
                            ZonedDateTime cleanup) {
        public ZonedDateTime earliest() {
            ZonedDateTime e = cleanup;
            if (calendarRefresh.isBefore(e)) e = calendarRefresh;
            if (missingCheck != null && missingCheck.isBefore(e)) e = missingCheck;
            if (sync != null && sync.isBefore(e)) e = sync;
            return e;
        }
    }

    /** Calendar refresh and cleanup keep firing while the schedule is disabled. */
    public static NextFires compute(ZonedDateTime after, ScheduleSettings s) {
        return new NextFires(
                nextOn(after, s.calendarRefreshTime(), Frequency.DAILY),
                s.enabled() ? nextOn(after, s.missingCheckTime(), Frequency.DAILY) : null,
                s.enabled() ? nextOn(after, s.syncTime(), s.frequency()) : null,
                nextOn(after, s.cleanupTime(), Frequency.DAILY));
    }

    public static ZonedDateTime nextOn(ZonedDateTime after, LocalTime at, Frequency frequency) {
        LocalDate day = after.toLocalDate();
        ZonedDateTime candidate = ZonedDateTime.of(day, at, after.getZone());
        while (!candidate.isAfter(after) || !frequency.includes(candidate.toLocalDate())) {
            day = day.plusDays(1);
            candidate = ZonedDateTime.of(day, at, after.getZone());
        }
        return candidate;
    }
}
