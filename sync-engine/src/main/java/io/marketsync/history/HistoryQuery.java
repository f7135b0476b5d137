package io.marketsync.history;

import io.marketsync.core.TaskKind;
import io.marketsync.core.TaskStatus;

import java.time.Instant;
import java.util.Comparator;
import java.util.function.Predicate;

/**
 * Filters, sort order and page for {@link TaskHistoryStore#query(HistoryQuery)}. Null filters
 * match everything. Pages are 1-based.
 */
public record HistoryQuery(
        String unitName,
        TaskKind kind,
        TaskStatus status,
        Instant completedAfter,
        Instant completedBefore,
        SortField sortBy,
        boolean ascending,
        int page,
        int pageSize
) {
    public static final int DEFAULT_PAGE_SIZE = 50;
    public static final int MAX_PAGE_SIZE = 500;

    public enum SortField { CREATED_AT, COMPLETED_AT, UNIT_NAME, STATUS }

    public HistoryQuery {
        if (sortBy == null) sortBy = SortField.COMPLETED_AT;
        page = Math.max(1, page);
        pageSize = Math.max(1, Math.min(MAX_PAGE_SIZE, pageSize));
    }

    public static Builder builder() { return new Builder(); }

    /** Everything, newest first, first page of 50. */
    public static HistoryQuery all() { return builder().build(); }

    public int offset() { return (page - 1) * pageSize; }

    Predicate<ExecutionRecord> predicate() {
        return r -> (unitName == null || unitName.equals(r.unitName()))
                && (kind == null || kind == r.kind())
                && (status == null || status == r.status())
                && (completedAfter == null || !r.completedAt().isBefore(completedAfter))
                && (completedBefore == null || r.completedAt().isBefore(completedBefore));
    }

    Comparator<ExecutionRecord> comparator() {
        Comparator<ExecutionRecord> c = switch (sortBy) {
            case CREATED_AT -> Comparator.comparing(ExecutionRecord::createdAt);
            case COMPLETED_AT -> Comparator.comparing(ExecutionRecord::completedAt);
            case UNIT_NAME -> Comparator.comparing(ExecutionRecord::unitName);
            case STATUS -> Comparator.comparing(r -> r.status().name());
        };
        if (!ascending) c = c.reversed();
        return c.thenComparing(ExecutionRecord::taskId);
    }

    public static final class Builder {
        private String unitName;
        private TaskKind kind;
        private TaskStatus status;
        private Instant completedAfter;
        private Instant completedBefore;
        private SortField sortBy = SortField.COMPLETED_AT;
        private boolean ascending = false;
        private int page = 1;
        private int pageSize = DEFAULT_PAGE_SIZE;

        public Builder unitName(String v) { this.unitName = v; return this; }
        public Builder kind(TaskKind v) { this.kind = v; return this; }
        public Builder status(TaskStatus v) { this.status = v; return this; }
        public Builder completedAfter(Instant v) { this.completedAfter = v; return this; }
        public Builder completedBefore(Instant v) { this.completedBefore = v; return this; }
        public Builder sortBy(SortField v, boolean asc) { this.sortBy = v; this.ascending = asc; return this; }
        public Builder page(int page, int pageSize) { this.page = page; this.pageSize = pageSize; return this; }

        public HistoryQuery build() {
            return new HistoryQuery(unitName, kind, status, completedAfter, completedBefore, sortBy, ascending, page, pageSize);
        }
    }
}
