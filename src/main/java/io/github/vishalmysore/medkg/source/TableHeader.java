package io.github.vishalmysore.medkg.source;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Column names of a table, looked up case-insensitively and by alias
 * (e.g. "node_index" or "id").
 */
public class TableHeader {
    private final String tableName;
    private final List<String> columns;

    public TableHeader(String tableName, List<String> columns) {
        this.tableName = tableName;
        this.columns = Collections.unmodifiableList(columns);
    }

    public String getTableName() {
        return tableName;
    }

    public List<String> getColumns() {
        return columns;
    }

    public int size() {
        return columns.size();
    }

    public String name(int column) {
        return columns.get(column);
    }

    /**
     * Position of the first column matching any alias, or -1.
     */
    public int find(String... aliases) {
        for (String alias : aliases) {
            for (int i = 0; i < columns.size(); i++) {
                if (columns.get(i).trim().toLowerCase(Locale.ROOT).equals(alias.toLowerCase(Locale.ROOT))) {
                    return i;
                }
            }
        }
        return -1;
    }

    public int require(String... aliases) throws TableFormatException {
        int column = find(aliases);
        if (column < 0) {
            throw new TableFormatException("Table '" + tableName + "' has no column "
                    + String.join(" or ", Arrays.asList(aliases)) + " (columns: " + columns + ")");
        }
        return column;
    }
}
