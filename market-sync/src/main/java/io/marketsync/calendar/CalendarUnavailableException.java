package io.marketsync.calendar;

import io.marketsync.core.SyncException;

/**
 * No calendar data is loaded, or the requested date lies outside what is loaded. Nothing that
 * depends on trading days may guess in this situation.
 */
public class CalendarUnavailableException extends SyncException {
    public CalendarUnavailableException(String message) {
        super(message);
    }

    public CalendarUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
