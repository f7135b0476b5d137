package io.marketsync.calendar;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Generates every calendar day of an inclusive year range from a {@link Market}'s rules.
 */
public class RuleCalendarSource implements CalendarSource {
    private final Market market;
    private final int fromYear;
    private final int toYear;

    public RuleCalendarSource(Market market, int fromYear, int toYear) {
        if (toYear < fromYear) throw new IllegalArgumentException("toYear " + toYear + " before fromYear " + fromYear);
        this.market = market;
        this.fromYear = fromYear;
        this.toYear = toYear;
    }

    @Override
    public List<TradingDay> load() {
        List<TradingDay> days = new ArrayList<>();
        LocalDate end = LocalDate.of(toYear, 12, 31);
        for (LocalDate d = LocalDate.of(fromYear, 1, 1); !d.isAfter(end); d = d.plusDays(1)) {
            days.add(new TradingDay(d, market.isOpen(d)));
        }
        return days;
    }

    @Override
    public String describe() { return market + ":" + fromYear + "-" + toYear; }
}
