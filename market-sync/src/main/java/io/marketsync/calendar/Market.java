package io.marketsync.calendar;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.Month;
import java.time.temporal.TemporalAdjusters;
import java.util.HashSet;
import java.util.Set;

/**
 * Rule-based exchange calendars, used when no calendar file is available.
 */
public enum Market {
    /** Monday to Friday, no holidays. */
    WEEKDAYS {
        @Override
        Set<LocalDate> holidays(int year) { return Set.of(); }
    },
    /** NYSE full-day closures: observed fixed holidays, floating Mondays, Thanksgiving and Good Friday. */
    NYSE {
        @Override
        Set<LocalDate> holidays(int year) {
            Set<LocalDate> out = new HashSet<>();
            // New Year's Day falling on a Saturday is not observed on the Friday before.
            LocalDate newYear = LocalDate.of(year, Month.JANUARY, 1);
            if (newYear.getDayOfWeek() != DayOfWeek.SATURDAY) out.add(observed(newYear));
            if (year >= 2022) out.add(observed(LocalDate.of(year, Month.JUNE, 19)));
            out.add(observed(LocalDate.of(year, Month.JULY, 4)));
            out.add(observed(LocalDate.of(year, Month.DECEMBER, 25)));

            out.add(nth(year, Month.JANUARY, 3, DayOfWeek.MONDAY));
            out.add(nth(year, Month.FEBRUARY, 3, DayOfWeek.MONDAY));
            out.add(LocalDate.of(year, Month.MAY, 1).with(TemporalAdjusters.lastInMonth(DayOfWeek.MONDAY)));
            out.add(nth(year, Month.SEPTEMBER, 1, DayOfWeek.MONDAY));
            out.add(nth(year, Month.NOVEMBER, 4, DayOfWeek.THURSDAY));
            out.add(easterSunday(year).minusDays(2));
            return out;
        }
    };

    abstract Set<LocalDate> holidays(int year);

    public boolean isOpen(LocalDate d) {
        DayOfWeek dow = d.getDayOfWeek();
        if (dow == DayOfWeek.SATURDAY || dow == DayOfWeek.SUNDAY) return false;
        return !holidays(d.getYear()).contains(d);
    }

    private static LocalDate observed(LocalDate d) {
        return switch (d.getDayOfWeek()) {
            case SATURDAY -> d.minusDays(1);
            case SUNDAY -> d.plusDays(1);
            default -> d;
        };
    }

    private static LocalDate nth(int year, Month m, int n, DayOfWeek dow) {
        return LocalDate.of(year, m, 1).with(TemporalAdjusters.dayOfWeekInMonth(n, dow));
    }

    // Anonymous Gregorian computus.
    static LocalDate easterSunday(int year) {
        int a = year % 19;
        int b = year / 100;
        int c = year % 100;
        int h = (19 * a + b - b / 4 - (b - (b + 8) / 25 + 1) / 3 + 15) % 30;
        int l = (32 + 2 * (b % 4) + 2 * (c / 4) - h - c % 4) % 7;
        int m = (a + 11 * h + 22 * l) / 451;
        int month = (h + l - 7 * m + 114) / 31;
        int day = ((h + l - 7 * m + 114) % 31) + 1;
        return LocalDate.of(year, month, day);
    }
}
