package io.marketsync;

import io.marketsync.calendar.CalendarSource;
import io.marketsync.calendar.Market;
import io.marketsync.calendar.RuleCalendarSource;
import io.marketsync.calendar.TradingDay;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/** NYSE rules from 2024 on; the test decides whether the feed is reachable and how far it reaches. */
public class SwitchableCalendarSource implements CalendarSource {
    public final AtomicInteger loads = new AtomicInteger();
    private volatile boolean down;
    private volatile int toYear = 2024;

    public SwitchableCalendarSource down(boolean v) { this.down = v; return this; }

    public SwitchableCalendarSource throughYear(int year) { this.toYear = year; return this; }

    @Override
    public List<TradingDay> load() throws IOException {
        loads.incrementAndGet();
        if (down) throw new IOException("calendar feed unreachable");
        return new RuleCalendarSource(Market.NYSE, 2024, toYear).load();
    }

    @Override
    public String describe() { return "switchable"; }
}
