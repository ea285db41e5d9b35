package io.github.vishalmysore.medkg.ingest;

import io.github.vishalmysore.medkg.source.DelimitedTableReader;
import io.github.vishalmysore.medkg.source.MissingFieldException;
import io.github.vishalmysore.medkg.source.RecordMapper;
import io.github.vishalmysore.medkg.source.RowParseException;
import io.github.vishalmysore.medkg.source.TableFormatException;
import io.github.vishalmysore.medkg.source.TableHeader;
import io.github.vishalmysore.medkg.source.TableRow;

import java.io.IOException;
import java.nio.file.Path;
import java.util.function.Consumer;
import java.util.logging.Logger;

/**
 * Streams a table file through a record mapper. Rows that fail to map are
 * counted on the report and skipped; the consumer sees only good records.
 */
public final class TableScanner {
    private static final Logger log = Logger.getLogger(TableScanner.class.getName());

    /**
     * Binds a record mapper to a table header.
     */
    @FunctionalInterface
    public interface Binder<T> {
        RecordMapper<T> bind(TableHeader header) throws TableFormatException;
    }

    private TableScanner() {
    }

    public static <T> void scan(Path file, Binder<T> binder, LoadReport report, Consumer<T> consumer)
            throws IOException {
        try (DelimitedTableReader reader = DelimitedTableReader.open(file)) {
            RecordMapper<T> mapper = binder.bind(reader.header());
            TableRow row;
            while ((row = reader.next()) != null) {
                report.rowRead();
                T record;
                try {
                    record = mapper.map(row);
                } catch (MissingFieldException e) {
                    report.skip(SkipReason.MISSING_FIELD);
                    log.fine(report.getTableName() + " " + e.getMessage());
                    continue;
                } catch (RowParseException e) {
                    report.skip(SkipReason.PARSE_ERROR);
                    log.fine(report.getTableName() + " " + e.getMessage());
                    continue;
                }
                consumer.accept(record);
            }
        }
    }
}
