package io.marketsync.calendar;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NavigableSet;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Answers trading-day questions from an immutable snapshot of the calendar.
 *
 * <p>The snapshot is replaced wholesale by {@link #refresh()}; readers never see a partially
 * loaded calendar. Without a snapshot, or for dates outside the loaded range, every query throws
 * {@link CalendarUnavailableException}.
 */
public class TradeCalendarService {
    private static final Logger log = LoggerFactory.getLogger(TradeCalendarService.class);

    private final CalendarSource source;
    private final AtomicReference<Snapshot> snapshot = new AtomicReference<>();

    public record Coverage(LocalDate first, LocalDate last) {
        public boolean contains(LocalDate d) { return !d.isBefore(first) && !d.isAfter(last); }
    }

    private record Snapshot(NavigableSet<LocalDate> open, Coverage coverage) {}

    /** Loads eagerly. A failed first load is logged and leaves the service unavailable until a refresh succeeds. */
    public TradeCalendarService(CalendarSource source) {
        this.source = source;
        try {
            refresh();
        } catch (CalendarUnavailableException e) {
            log.error("Trade calendar not loaded from {}: {}", source.describe(), e.getMessage());
        }
    }

    /**
     * Reloads from the source and swaps the snapshot in one step. On failure the previous snapshot
     * stays in place and the failure is rethrown.
     */
    public void refresh() {
        List<TradingDay> days;
        try {
            days = source.load();
        } catch (IOException | RuntimeException e) {
            throw new CalendarUnavailableException("Cannot load trade calendar from " + source.describe() + ": " + e.getMessage(), e);
        }
        if (days == null || days.isEmpty()) {
            throw new CalendarUnavailableException("Trade calendar from " + source.describe() + " is empty");
        }
        TreeSet<LocalDate> open = new TreeSet<>();
        LocalDate first = null;
        LocalDate last = null;
        for (TradingDay d : days) {
            if (d.open()) open.add(d.date());
            if (first == null || d.date().isBefore(first)) first = d.date();
            if (last == null || d.date().isAfter(last)) last = d.date();
        }
        if (open.isEmpty()) {
            throw new CalendarUnavailableException("Trade calendar from " + source.describe() + " has no open days");
        }
        snapshot.set(new Snapshot(Collections.unmodifiableNavigableSet(open), new Coverage(first, last)));
        log.info("Trade calendar loaded from {}: {} trading days, {} .. {}", source.describe(), open.size(), first, last);
    }

    public boolean isLoaded() { return snapshot.get() != null; }

    public Coverage coverage() { return current().coverage(); }

    public int totalTradingDays() { return current().open().size(); }

    public boolean isTradingDay(LocalDate date) {
        Snapshot s = covering(date);
        return s.open().contains(date);
    }

    /** The {@code n} most recent trading days on or before {@code endDate}, ascending. */
    public List<LocalDate> recentTradingDays(int n, LocalDate endDate) {
        if (n <= 0) return List.of();
        Snapshot s = covering(endDate);
        List<LocalDate> out = new ArrayList<>(n);
        Iterator<LocalDate> it = s.open().headSet(endDate, true).descendingIterator();
        while (out.size() < n && it.hasNext()) out.add(it.next());
        if (out.size() < n) {
            throw new CalendarUnavailableException("Only " + out.size() + " trading days loaded on or before " + endDate
                    + ", " + n + " requested (calendar starts " + s.coverage().first() + ")");
        }
        Collections.reverse(out);
        return out;
    }

    /** Trading days in {@code [start, end]}, ascending; empty when start is after end. */
    public List<LocalDate> tradingDaysBetween(LocalDate start, LocalDate end) {
        if (start.isAfter(end)) return List.of();
        Snapshot s = covering(start);
        covering(end);
        return List.copyOf(s.open().subSet(start, true, end, true));
    }

    /** Last trading day strictly before {@code date}. */
    public LocalDate previousTradingDay(LocalDate date) {
        Snapshot s = covering(date);
        LocalDate prev = s.open().lower(date);
        if (prev == null) throw new CalendarUnavailableException("No trading day loaded before " + date);
        return prev;
    }

    /** First trading day strictly after {@code date}. */
    public LocalDate nextTradingDay(LocalDate date) {
        Snapshot s = covering(date);
        LocalDate next = s.open().higher(date);
        if (next == null) throw new CalendarUnavailableException("No trading day loaded after " + date);
        return next;
    }

    /**
     * Moves {@code offset} trading days from {@code date}. Offset 0 is the date itself if it is a
     * trading day, otherwise the trading day before it.
     */
    public LocalDate tradingDayOffset(LocalDate date, int offset) {
        LocalDate d = isTradingDay(date) ? date : previousTradingDay(date);
        for (int i = 0; i < offset; i++) d = nextTradingDay(d);
        for (int i = 0; i > offset; i--) d = previousTradingDay(d);
        return d;
    }

    private Snapshot current() {
        Snapshot s = snapshot.get();
        if (s == null) throw new CalendarUnavailableException("Trade calendar not loaded (" + source.describe() + ")");
        return s;
    }

    private Snapshot covering(LocalDate date) {
        Snapshot s = current();
        if (!s.coverage().contains(date)) {
            throw new CalendarUnavailableException(date + " is outside the loaded calendar " + s.coverage().first() + " .. " + s.coverage().last());
        }
        return s;
    }
}
