package io.marketsync.calendar;

import java.io.IOException;
import java.util.List;

/** Where the trading calendar comes from. Each call returns the complete calendar. */
public interface CalendarSource {
    List<TradingDay> load() throws IOException;

    default String describe() { return getClass().getSimpleName(); }
}
