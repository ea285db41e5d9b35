package io.github.vishalmysore.medkg.source;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Record mappers for the node, edge, feature and cluster tables. Each
 * factory resolves its columns against the header once and fails with
 * {@link TableFormatException} when a required column is missing.
 */
public final class SourceRecords {
    private static final Pattern INTEGER = Pattern.compile("-?(0|[1-9]\\d{0,17})");
    private static final Pattern DECIMAL = Pattern.compile("-?(\\d+\\.\\d*|\\.\\d+|\\d+)([eE][-+]?\\d+)?");

    private SourceRecords() {
    }

    public static RecordMapper<NodeRecord> nodes(TableHeader header) throws TableFormatException {
        int idColumn = header.require("node_index", "id");
        int typeColumn = header.require("node_type", "type", "kind");
        int nameColumn = header.require("node_name", "name");
        int sourceColumn = header.find("node_source", "source");
        int sourceIdColumn = header.find("node_id");
        int externalIdColumn = sourceIdColumn == idColumn ? -1 : sourceIdColumn;

        return row -> {
            row.checkWellFormed();
            long id = row.requireId(idColumn);
            String type = row.requireText(typeColumn);
            String name = row.text(nameColumn);
            return NodeRecord.builder()
                    .id(id)
                    .type(type)
                    .name(name != null ? name : "")
                    .source(row.text(sourceColumn))
                    .sourceId(row.text(externalIdColumn))
                    .build();
        };
    }

    public static RecordMapper<EdgeRecord> edges(TableHeader header) throws TableFormatException {
        int fromColumn = header.require("x_index", "source");
        int toColumn = header.require("y_index", "target");
        int relationColumn = header.require("relation", "metaedge");
        int displayColumn = header.find("display_relation");
        int fromTypeColumn = header.find("x_type");
        int toTypeColumn = header.find("y_type");

        return row -> {
            row.checkWellFormed();
            String relation = row.requireText(relationColumn);
            String display = row.text(displayColumn);
            return EdgeRecord.builder()
                    .fromId(row.requireId(fromColumn))
                    .toId(row.requireId(toColumn))
                    .relation(relation)
                    .displayRelation(display != null ? display : relation)
                    .fromType(row.text(fromTypeColumn))
                    .toType(row.text(toTypeColumn))
                    .build();
        };
    }

    /**
     * Feature tables carry the node id in their first column; every other
     * column becomes an attribute.
     */
    public static RecordMapper<FeatureRecord> features(TableHeader header) throws TableFormatException {
        if (header.size() < 1) {
            throw new TableFormatException("Feature table '" + header.getTableName() + "' has no columns");
        }
        return row -> {
            row.checkWellFormed();
            FeatureRecord.FeatureRecordBuilder builder = FeatureRecord.builder().id(row.requireId(0));
            for (int column = 1; column < header.size(); column++) {
                String text = row.text(column);
                if (text != null) {
                    builder.value(header.name(column).trim(), scalar(text));
                }
            }
            return builder.build();
        };
    }

    public static RecordMapper<ClusterRecord> clusters(TableHeader header, String memberDelimiter)
            throws TableFormatException {
        int entityColumn = header.require("node_id", "node_index", "id");
        int membersColumn = header.require("group_id_bert", "group_id", "members");
        int labelColumn = header.find("group_name_bert", "group_name", "label");
        Pattern splitter = Pattern.compile(Pattern.quote(memberDelimiter));

        return row -> {
            row.checkWellFormed();
            long entityId = row.requireId(entityColumn);
            List<String> members = Arrays.stream(splitter.split(row.requireText(membersColumn)))
                    .map(String::trim)
                    .filter(member -> !member.isEmpty())
                    .collect(Collectors.toList());
            return ClusterRecord.builder()
                    .entityId(entityId)
                    .memberIds(members)
                    .label(row.text(labelColumn))
                    .build();
        };
    }

    /**
     * Parses a member id of a cluster row, with the same rules as id cells.
     */
    public static long parseId(String text) throws RowParseException {
        return TableRow.parseId(text, -1);
    }

    /**
     * Infers the scalar type of a feature cell: Long, Double, Boolean or
     * String. Numbers with leading zeros stay text, they are usually codes.
     */
    static Object scalar(String text) {
        if ("true".equalsIgnoreCase(text) || "false".equalsIgnoreCase(text)) {
            return Boolean.valueOf(text);
        }
        if (INTEGER.matcher(text).matches()) {
            return Long.valueOf(text);
        }
        if (DECIMAL.matcher(text).matches() && !text.matches("-?0\\d.*")) {
            return Double.valueOf(text);
        }
        return text;
    }
}
