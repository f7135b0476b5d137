package io.marketsync.detect;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Result of one missing-data check. Every checked unit has an entry, possibly empty; units that
 * were not checked have none.
 */
public record MissingDataReport(Instant checkedAt, LocalDate windowStart, LocalDate windowEnd,
                                Map<String, List<LocalDate>> missing) {
    public MissingDataReport {
        Map<String, List<LocalDate>> copy = new LinkedHashMap<>();
        missing.forEach((k, v) -> copy.put(k, List.copyOf(v)));
        missing = Collections.unmodifiableMap(copy);
    }

    public Optional<List<LocalDate>> missingFor(String unitName) {
        return Optional.ofNullable(missing.get(unitName));
    }

    public int totalMissing() {
        return missing.values().stream().mapToInt(List::size).sum();
    }

    public boolean hasGaps() { return totalMissing() > 0; }
}
