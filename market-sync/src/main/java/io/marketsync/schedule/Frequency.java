package io.marketsync.schedule;

import java.time.DayOfWeek;
import java.time.LocalDate;

public enum Frequency {
    DAILY,
    WEEKDAYS;

    public boolean includes(LocalDate date) {
        if (this == DAILY) return true;
        DayOfWeek dow = date.getDayOfWeek();
        return dow != DayOfWeek.SATURDAY && dow != DayOfWeek.SUNDAY;
    }
}
