package io.github.vishalmysore.medkg.source;

import java.util.List;

/**
 * One data row of a delimited table. Cells beyond the end of a short row
 * read as blank.
 */
public class TableRow {
    private final TableHeader header;
    private final List<String> values;
    private final long lineNumber;
    private final String malformation;

    TableRow(TableHeader header, List<String> values, long lineNumber, String malformation) {
        this.header = header;
        this.values = values;
        this.lineNumber = lineNumber;
        this.malformation = malformation;
    }

    public long getLineNumber() {
        return lineNumber;
    }

    public TableHeader getHeader() {
        return header;
    }

    public int size() {
        return values.size();
    }

    /**
     * @throws RowParseException if the row has more cells than the header
     *                           or ends inside a quoted cell
     */
    public void checkWellFormed() throws RowParseException {
        if (malformation != null) {
            throw new RowParseException(lineNumber, malformation);
        }
    }

    /**
     * Trimmed cell text, or null when the cell is blank or absent.
     */
    public String text(int column) {
        if (column < 0 || column >= values.size()) {
            return null;
        }
        String value = values.get(column).trim();
        return value.isEmpty() ? null : value;
    }

    public String requireText(int column) throws MissingFieldException {
        String value = text(column);
        if (value == null) {
            throw new MissingFieldException(lineNumber, header.name(column));
        }
        return value;
    }

    /**
     * Reads an integer id. Accepts a trailing ".0" as written by tools that
     * export integer columns as floats.
     */
    public long requireId(int column) throws RowParseException {
        return parseId(requireText(column), lineNumber);
    }

    static long parseId(String text, long lineNumber) throws RowParseException {
        if (text == null) {
            throw new RowParseException(lineNumber, "missing id");
        }
        String value = text.trim();
        if (value.endsWith(".0")) {
            value = value.substring(0, value.length() - 2);
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new RowParseException(lineNumber, "not an integer id: '" + text + "'");
        }
    }
}
