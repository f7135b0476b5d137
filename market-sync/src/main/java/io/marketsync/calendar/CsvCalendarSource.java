package io.marketsync.calendar;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a {@code cal_date,is_open} CSV with a header line. Dates may be {@code yyyy-MM-dd} or
 * {@code yyyyMMdd}; {@code is_open} is {@code 1}/{@code 0} or {@code true}/{@code false}. Extra
 * columns are ignored. A malformed row fails the whole load.
 */
public class CsvCalendarSource implements CalendarSource {
    private static final DateTimeFormatter BASIC = DateTimeFormatter.BASIC_ISO_DATE;

    private final Path file;

    public CsvCalendarSource(Path file) {
        this.file = file;
    }

    @Override
    public List<TradingDay> load() throws IOException {
        List<TradingDay> days = new ArrayList<>();
        try (BufferedReader br = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String header = br.readLine();
            if (header == null) return days;
            String[] cols = header.trim().split(",");
            int dateCol = indexOf(cols, "cal_date");
            int openCol = indexOf(cols, "is_open");
            String line;
            int lineNo = 1;
            while ((line = br.readLine()) != null) {
                lineNo++;
                if (line.isBlank()) continue;
                String[] parts = line.split(",", -1);
                if (parts.length <= Math.max(dateCol, openCol)) {
                    throw new IOException(file + ":" + lineNo + ": expected at least " + (Math.max(dateCol, openCol) + 1) + " columns");
                }
                days.add(new TradingDay(parseDate(parts[dateCol].trim(), lineNo), parseOpen(parts[openCol].trim(), lineNo)));
            }
        }
        return days;
    }

    private int indexOf(String[] cols, String name) throws IOException {
        for (int i = 0; i < cols.length; i++) {
            if (cols[i].trim().equalsIgnoreCase(name)) return i;
        }
        throw new IOException(file + ": missing column " + name);
    }

    private LocalDate parseDate(String s, int lineNo) throws IOException {
        try {
            return s.length() == 8 ? LocalDate.parse(s, BASIC) : LocalDate.parse(s);
        } catch (DateTimeParseException e) {
            throw new IOException(file + ":" + lineNo + ": bad date '" + s + "'", e);
        }
    }

    private boolean parseOpen(String s, int lineNo) throws IOException {
        return switch (s.toLowerCase()) {
            case "1", "true" -> true;
            case "0", "false" -> false;
            default -> throw new IOException(file + ":" + lineNo + ": bad is_open '" + s + "'");
        };
    }

    @Override
    public String describe() { return "csv:" + file; }
}
