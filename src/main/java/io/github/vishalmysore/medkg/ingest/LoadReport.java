package io.github.vishalmysore.medkg.ingest;

import lombok.Getter;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Counters for one bulk operation over a table. Per-row failures never
 * abort a load; they end up here instead.
 */
@Getter
public class LoadReport {
    private final String tableName;
    private long rowsRead;
    private long added;
    private long duplicates;
    private final Map<SkipReason, Long> skips = new EnumMap<>(SkipReason.class);

    public LoadReport(String tableName) {
        this.tableName = tableName;
    }

    public void rowRead() {
        rowsRead++;
    }

    public void added() {
        added++;
    }

    public void duplicate() {
        duplicates++;
    }

    public void skip(SkipReason reason) {
        skips.merge(reason, 1L, Long::sum);
    }

    public Map<SkipReason, Long> getSkips() {
        return Collections.unmodifiableMap(skips);
    }

    public long getSkipped(SkipReason reason) {
        return skips.getOrDefault(reason, 0L);
    }

    public long getSkipped() {
        return skips.values().stream().mapToLong(Long::longValue).sum();
    }

    public String summary() {
        return tableName + ": " + rowsRead + " rows, " + added + " added, " + duplicates
                + " duplicates, " + getSkipped() + " skipped" + (skips.isEmpty() ? "" : " " + skips);
    }

    @Override
    public String toString() {
        return summary();
    }
}
