package io.marketsync.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Smallest independently retryable slice of a task: one trading date, or the whole history.
 */
public record Partition(LocalDate date) implements Comparable<Partition> {
    public static final Partition ALL_HISTORY = new Partition(null);

    public static Partition of(LocalDate date) {
        return new Partition(Objects.requireNonNull(date, "date"));
    }

    /** Parses the form produced by {@link #key()}. */
    @JsonCreator
    public static Partition parse(String key) {
        if ("all".equals(key)) return ALL_HISTORY;
        return of(LocalDate.parse(key));
    }

    public boolean isAllHistory() { return date == null; }

    @JsonValue
    public String key() { return date == null ? "all" : date.toString(); }

    @Override
    public int compareTo(Partition o) {
        if (date == null) return o.date == null ? 0 : -1;
        if (o.date == null) return 1;
        return date.compareTo(o.date);
    }

    @Override
    public String toString() { return key(); }
}
