package io.github.vishalmysore.medkg.snapshot;

import io.github.vishalmysore.medkg.domain.KgEdge;
import io.github.vishalmysore.medkg.domain.KgNode;
import io.github.vishalmysore.medkg.graph.GraphException;
import io.github.vishalmysore.medkg.graph.KnowledgeGraph;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Binary snapshot of a built graph, so ingestion does not have to be
 * repeated. The layout is: magic, version, node table (with typed
 * attributes), edge table in insertion order, per-node adjacency lists and
 * an end marker.
 *
 * Loading replays nodes and edges into a fresh store and then checks the
 * stored adjacency against the rebuilt one, so a restored graph has the same
 * indices, attributes, edge order and therefore the same path tie-breaks.
 * The format is private to this build; there is no cross-version promise.
 */
public class GraphSnapshot {
    private static final Logger log = Logger.getLogger(GraphSnapshot.class.getName());

    private static final int MAGIC = 0x4D4B4753; // "MKGS"
    private static final int END_MARKER = 0x454E4421; // "END!"
    private static final int FORMAT_VERSION = 1;
    private static final int MAX_STRING_BYTES = 64 * 1024 * 1024;

    private static final byte TAG_STRING = 'S';
    private static final byte TAG_LONG = 'L';
    private static final byte TAG_DOUBLE = 'D';
    private static final byte TAG_BOOLEAN = 'B';

    public byte[] toBytes(KnowledgeGraph graph) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try {
            write(graph, bytes);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return bytes.toByteArray();
    }

    public KnowledgeGraph fromBytes(byte[] bytes) throws SnapshotFormatException {
        try {
            return read(new ByteArrayInputStream(bytes));
        } catch (SnapshotFormatException e) {
            throw e;
        } catch (IOException e) {
            throw new SnapshotFormatException("Unreadable snapshot: " + e.getMessage(), e);
        }
    }

    public void save(KnowledgeGraph graph, Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(file))) {
            write(graph, out);
        }
        log.info("Snapshot saved to " + file + " (" + graph.nodeCount() + " nodes, " + graph.edgeCount() + " edges)");
    }

    public KnowledgeGraph load(Path file) throws IOException {
        try (InputStream in = new BufferedInputStream(Files.newInputStream(file))) {
            KnowledgeGraph graph = read(in);
            log.info("Snapshot loaded from " + file + " (" + graph.nodeCount() + " nodes, "
                    + graph.edgeCount() + " edges)");
            return graph;
        }
    }

    public void write(KnowledgeGraph graph, OutputStream stream) throws IOException {
        DataOutputStream out = new DataOutputStream(stream);
        out.writeInt(MAGIC);
        out.writeInt(FORMAT_VERSION);

        out.writeInt(graph.nodeCount());
        for (KgNode node : graph.getAllNodes()) {
            out.writeLong(node.getId());
            writeString(out, node.getType());
            writeString(out, node.getName());
            writeString(out, node.getSource());
            writeString(out, node.getSourceId());
            Map<String, Object> attributes = node.getAttributes();
            out.writeInt(attributes.size());
            for (Map.Entry<String, Object> attribute : attributes.entrySet()) {
                writeString(out, attribute.getKey());
                writeScalar(out, attribute.getValue());
            }
        }

        out.writeInt(graph.edgeCount());
        for (KgEdge edge : graph.getAllEdges()) {
            out.writeInt(edge.getSourceIndex());
            out.writeInt(edge.getTargetIndex());
            writeString(out, edge.getRelation());
            writeString(out, edge.getDisplayRelation());
        }

        for (int index = 0; index < graph.nodeCount(); index++) {
            writePositions(out, graph.outgoingEdges(index));
            writePositions(out, graph.incomingEdges(index));
        }
        out.writeInt(END_MARKER);
        out.flush();
    }

    /**
     * @throws SnapshotFormatException if the stream is not a complete,
     *                                 consistent snapshot
     */
    public KnowledgeGraph read(InputStream stream) throws IOException {
        DataInputStream in = new DataInputStream(stream);
        try {
            if (in.readInt() != MAGIC) {
                throw new SnapshotFormatException("Not a graph snapshot (bad magic number)");
            }
            int version = in.readInt();
            if (version != FORMAT_VERSION) {
                throw new SnapshotFormatException("Unsupported snapshot version " + version);
            }

            KnowledgeGraph graph = new KnowledgeGraph();
            int nodeCount = readCount(in, "node");
            for (int expected = 0; expected < nodeCount; expected++) {
                long id = in.readLong();
                String type = readString(in);
                String name = readString(in);
                String source = readString(in);
                String sourceId = readString(in);
                int index = graph.addNode(id, type, name, source, sourceId);
                if (index != expected) {
                    throw new SnapshotFormatException("Duplicate node " + type + ":" + id + " in snapshot");
                }
                int attributeCount = readCount(in, "attribute");
                for (int a = 0; a < attributeCount; a++) {
                    String key = readString(in);
                    graph.setAttribute(index, key, readScalar(in));
                }
            }

            int edgeCount = readCount(in, "edge");
            for (int position = 0; position < edgeCount; position++) {
                int source = in.readInt();
                int target = in.readInt();
                String relation = readString(in);
                String display = readString(in);
                if (!graph.addEdge(source, target, relation, display)) {
                    throw new SnapshotFormatException("Duplicate edge at position " + position);
                }
            }

            for (int index = 0; index < nodeCount; index++) {
                verifyPositions(in, graph.outgoingEdges(index), index, "outgoing");
                verifyPositions(in, graph.incomingEdges(index), index, "incoming");
            }
            if (in.readInt() != END_MARKER) {
                throw new SnapshotFormatException("Missing end marker");
            }
            return graph;
        } catch (EOFException e) {
            throw new SnapshotFormatException("Snapshot is truncated", e);
        } catch (GraphException | IllegalArgumentException e) {
            throw new SnapshotFormatException("Inconsistent snapshot: " + e.getMessage(), e);
        }
    }

    private static void writePositions(DataOutputStream out, List<Integer> positions) throws IOException {
        out.writeInt(positions.size());
        for (int position : positions) {
            out.writeInt(position);
        }
    }

    private static void verifyPositions(DataInputStream in, List<Integer> rebuilt, int index, String kind)
            throws IOException {
        int count = readCount(in, kind + " adjacency");
        if (count != rebuilt.size()) {
            throw new SnapshotFormatException("Node " + index + ": " + kind + " adjacency has " + count
                    + " entries, edge table implies " + rebuilt.size());
        }
        for (int i = 0; i < count; i++) {
            if (in.readInt() != rebuilt.get(i)) {
                throw new SnapshotFormatException("Node " + index + ": " + kind + " adjacency out of order");
            }
        }
    }

    private static int readCount(DataInputStream in, String what) throws IOException {
        int count = in.readInt();
        if (count < 0) {
            throw new SnapshotFormatException("Negative " + what + " count " + count);
        }
        return count;
    }

    private static void writeString(DataOutputStream out, String value) throws IOException {
        if (value == null) {
            out.writeInt(-1);
            return;
        }
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        out.writeInt(bytes.length);
        out.write(bytes);
    }

    private static String readString(DataInputStream in) throws IOException {
        int length = in.readInt();
        if (length == -1) {
            return null;
        }
        if (length < -1 || length > MAX_STRING_BYTES) {
            throw new SnapshotFormatException("Invalid string length " + length);
        }
        byte[] bytes = new byte[length];
        in.readFully(bytes);
        return new String(bytes, StandardCharsets.UTF_8);
    }

    private static void writeScalar(DataOutputStream out, Object value) throws IOException {
        if (value instanceof Long) {
            out.writeByte(TAG_LONG);
            out.writeLong((Long) value);
        } else if (value instanceof Double) {
            out.writeByte(TAG_DOUBLE);
            out.writeDouble((Double) value);
        } else if (value instanceof Boolean) {
            out.writeByte(TAG_BOOLEAN);
            out.writeBoolean((Boolean) value);
        } else {
            out.writeByte(TAG_STRING);
            writeString(out, value.toString());
        }
    }

    private static Object readScalar(DataInputStream in) throws IOException {
        byte tag = in.readByte();
        switch (tag) {
            case TAG_LONG:
                return in.readLong();
            case TAG_DOUBLE:
                return in.readDouble();
            case TAG_BOOLEAN:
                return in.readBoolean();
            case TAG_STRING:
                String value = readString(in);
                if (value == null) {
                    throw new SnapshotFormatException("Null attribute value");
                }
                return value;
            default:
                throw new SnapshotFormatException("Unknown attribute tag " + tag);
        }
    }
}
