package io.github.vishalmysore.medkg.source;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Streams the rows of a delimited text table with a header row. Handles
 * quoted cells containing delimiters, doubled quotes and line breaks.
 * Blank lines are ignored.
 */
public class DelimitedTableReader implements Closeable {
    private static final char QUOTE = '"';

    private final BufferedReader reader;
    private final char delimiter;
    private final TableHeader header;

    private long physicalLine = 1;
    private boolean unterminated;

    public DelimitedTableReader(Reader source, char delimiter, String tableName) throws IOException {
        this.reader = source instanceof BufferedReader ? (BufferedReader) source : new BufferedReader(source);
        this.delimiter = delimiter;

        List<String> columns = nextNonBlankRecord();
        if (columns == null) {
            reader.close();
            throw new TableFormatException("Table '" + tableName + "' is empty, expected a header row");
        }
        if (!columns.isEmpty() && columns.get(0).startsWith("\uFEFF")) {
            columns.set(0, columns.get(0).substring(1));
        }
        this.header = new TableHeader(tableName, columns);
    }

    /**
     * Opens a table file as UTF-8. Files ending in .tsv or .tab are
     * tab-delimited, everything else comma-delimited.
     */
    public static DelimitedTableReader open(Path file) throws IOException {
        return new DelimitedTableReader(Files.newBufferedReader(file, StandardCharsets.UTF_8),
                delimiterFor(file), file.getFileName().toString());
    }

    public static char delimiterFor(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".tsv") || name.endsWith(".tab") ? '\t' : ',';
    }

    public TableHeader header() {
        return header;
    }

    /**
     * Next data row, or null at end of input.
     */
    public TableRow next() throws IOException {
        long line = physicalLine;
        List<String> values = nextNonBlankRecord();
        if (values == null) {
            return null;
        }
        String malformation = null;
        if (unterminated) {
            malformation = "unterminated quoted cell";
        } else if (values.size() > header.size()) {
            malformation = "expected " + header.size() + " cells but found " + values.size();
        }
        return new TableRow(header, values, line, malformation);
    }

    private List<String> nextNonBlankRecord() throws IOException {
        while (true) {
            List<String> record = readRecord();
            if (record == null) {
                return null;
            }
            if (record.size() > 1 || !record.get(0).isBlank()) {
                return record;
            }
        }
    }

    private List<String> readRecord() throws IOException {
        List<String> fields = new ArrayList<>();
        StringBuilder field = new StringBuilder();
        boolean inQuotes = false;
        boolean sawAny = false;
        unterminated = false;

        while (true) {
            int c = reader.read();
            if (c == -1) {
                if (!sawAny) {
                    return null;
                }
                unterminated = inQuotes;
                fields.add(field.toString());
                return fields;
            }
            sawAny = true;
            char ch = (char) c;

            if (inQuotes) {
                if (ch == QUOTE) {
                    reader.mark(1);
                    int next = reader.read();
                    if (next == QUOTE) {
                        field.append(QUOTE);
                    } else {
                        inQuotes = false;
                        if (next != -1) {
                            reader.reset();
                        }
                    }
                } else {
                    if (ch == '\n') {
                        physicalLine++;
                    }
                    field.append(ch);
                }
            } else if (ch == QUOTE && field.length() == 0) {
                inQuotes = true;
            } else if (ch == delimiter) {
                fields.add(field.toString());
                field.setLength(0);
            } else if (ch == '\n') {
                physicalLine++;
                fields.add(field.toString());
                return fields;
            } else if (ch != '\r') {
                field.append(ch);
            }
        }
    }

    @Override
    public void close() throws IOException {
        reader.close();
    }
}
