package io.marketsync.calendar;

import java.time.LocalDate;

public record TradingDay(LocalDate date, boolean open) {}
