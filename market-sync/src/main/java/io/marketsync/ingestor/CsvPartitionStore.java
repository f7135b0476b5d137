package io.marketsync.ingestor;

import io.marketsync.core.ExistenceProbe;
import io.marketsync.core.FetchResult;
import io.marketsync.core.Partition;
import io.marketsync.core.PartitionFetcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.NavigableSet;
import java.util.concurrent.ConcurrentSkipListSet;

/**
 * One CSV file per unit, one row per date. The dates already in the file answer the existence
 * probe; the fetcher appends a row for each partition it is asked for. Stands in for a real
 * provider client plus warehouse table.
 */
public class CsvPartitionStore implements ExistenceProbe, PartitionFetcher {
    private static final Logger log = LoggerFactory.getLogger(CsvPartitionStore.class);
    static final String HEADER = "date,unit,value\n";

    private final String unitName;
    private final Path file;
    private final Clock clock;
    private final NavigableSet<LocalDate> dates = new ConcurrentSkipListSet<>();

    public CsvPartitionStore(Path dataDir, String unitName, Clock clock) {
        this.unitName = unitName;
        this.file = dataDir.resolve(unitName + ".csv");
        this.clock = clock;
        try {
            Files.createDirectories(dataDir);
            readExisting();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot open " + file, e);
        }
    }

    private void readExisting() throws IOException {
        if (!Files.exists(file)) return;
        try (BufferedReader br = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            boolean first = true;
            while ((line = br.readLine()) != null) {
                if (first) { first = false; continue; }
                if (line.isBlank()) continue;
                int comma = line.indexOf(',');
                if (comma <= 0) continue;
                try {
                    dates.add(LocalDate.parse(line.substring(0, comma)));
                } catch (DateTimeParseException e) {
                    log.warn("{}: skipping row with bad date '{}'", file, line);
                }
            }
        }
        log.info("{}: {} dates on disk", unitName, dates.size());
    }

    public Path file() { return file; }

    public NavigableSet<LocalDate> dates() { return Collections.unmodifiableNavigableSet(dates); }

    @Override
    public boolean hasData(Partition partition) {
        if (partition.isAllHistory()) return !dates.isEmpty();
        return dates.contains(partition.date());
    }

    @Override
    public boolean hasAnyData() { return !dates.isEmpty(); }

    /** A whole-history partition writes one snapshot row stamped with today's date. */
    @Override
    public synchronized FetchResult fetch(String unit, Partition partition) throws IOException {
        LocalDate date = partition.isAllHistory() ? LocalDate.now(clock) : partition.date();
        if (dates.contains(date)) return FetchResult.success(0);
        if (!Files.exists(file)) {
            Files.write(file, HEADER.getBytes(StandardCharsets.UTF_8), StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        }
        String row = date + "," + unit + "," + Math.floorMod((unit + date).hashCode(), 10_000) + "\n";
        Files.write(file, row.getBytes(StandardCharsets.UTF_8), StandardOpenOption.APPEND);
        dates.add(date);
        return FetchResult.success(1);
    }
}
