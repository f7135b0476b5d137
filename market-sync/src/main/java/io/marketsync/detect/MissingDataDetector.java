package io.marketsync.detect;

import io.marketsync.calendar.TradeCalendarService;
import io.marketsync.core.Cadence;
import io.marketsync.core.Partition;
import io.marketsync.core.UnitDescriptor;
import io.marketsync.registry.PluginRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Probes every enabled daily unit for each of the most recent trading days and reports the days
 * without data. A probe that throws counts as missing for that day.
 */
public class MissingDataDetector {
    private static final Logger log = LoggerFactory.getLogger(MissingDataDetector.class);

    private final TradeCalendarService calendar;
    private final PluginRegistry registry;
    private final Clock clock;

    public MissingDataDetector(TradeCalendarService calendar, PluginRegistry registry, Clock clock) {
        this.calendar = calendar;
        this.registry = registry;
        this.clock = clock;
    }

    /**
     * Checks the {@code lookbackDays} trading days ending at the last trading day strictly before
     * today. Today is left out even when it is a trading day: its data is not published until after
     * the close, so counting it would report a gap on every run.
     */
    public MissingDataReport detect(int lookbackDays) {
        return detect(lookbackDays, calendar.previousTradingDay(LocalDate.now(clock)));
    }

    /**
     * @throws io.marketsync.calendar.CalendarUnavailableException if the window cannot be resolved
     */
    public MissingDataReport detect(int lookbackDays, LocalDate endDate) {
        List<LocalDate> window = calendar.recentTradingDays(Math.max(1, lookbackDays), endDate);
        Map<String, List<LocalDate>> missing = new LinkedHashMap<>();
        for (UnitDescriptor unit : registry.enabledUnits()) {
            if (unit.cadence() != Cadence.DAILY) continue;
            List<LocalDate> gaps = new ArrayList<>();
            for (LocalDate day : window) {
                try {
                    if (!unit.probe().hasData(Partition.of(day))) gaps.add(day);
                } catch (Exception e) {
                    log.warn("Probe for {} on {} failed, counting the day as missing: {}", unit.name(), day, e.toString());
                    gaps.add(day);
                }
            }
            missing.put(unit.name(), gaps);
        }
        MissingDataReport report = new MissingDataReport(clock.instant(), window.get(0), window.get(window.size() - 1), missing);
        log.info("Missing data check {} .. {}: {} units, {} missing unit-days",
                report.windowStart(), report.windowEnd(), missing.size(), report.totalMissing());
        return report;
    }
}
