package io.github.vishalmysore.medkg.domain;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A typed entity in the knowledge graph (gene/protein, drug, disease,
 * effect/phenotype, ...). The core fields are fixed at insertion; feature
 * values live in a separate open attribute map that only the owning
 * {@link io.github.vishalmysore.medkg.graph.KnowledgeGraph} writes to.
 */
@Getter
@Builder
@ToString
public class KgNode {
    // Dense internal position, the graph's primary key
    private final int index;

    // Stable external identifier from the source dataset (PrimeKG node_index)
    private final long id;

    private final String type;
    private final String name;
    private final String source;

    // Identifier inside the source database (PrimeKG node_id), may be null
    private final String sourceId;

    @Builder.Default
    @ToString.Exclude
    private final Map<String, Object> attributes = new LinkedHashMap<>();

    /**
     * Read-only view of the feature attributes attached to this node.
     */
    public Map<String, Object> getAttributes() {
        return Collections.unmodifiableMap(attributes);
    }

    public Object getAttribute(String key) {
        return attributes.get(key);
    }

    public boolean isOfType(String nodeType) {
        return type.equalsIgnoreCase(nodeType);
    }

    /**
     * JSON-LD identifier, unique per (type, id) like the node itself, e.g.
     * {@code urn:medkg:node:gene%2Fprotein:7157}.
     */
    public String getJsonLdId() {
        return "urn:medkg:node:" + URLEncoder.encode(type, StandardCharsets.UTF_8) + ":" + id;
    }

    /**
     * Converts this node to a JSON-LD representation for knowledge graph
     * interoperability.
     */
    public Map<String, Object> toJsonLd() {
        Map<String, Object> jsonLd = new LinkedHashMap<>();
        jsonLd.put("@id", getJsonLdId());
        jsonLd.put("@type", "medkg:" + NodeType.jsonLdName(type));
        jsonLd.put("name", name);
        jsonLd.put("medkg:nodeType", type);
        if (source != null) {
            jsonLd.put("medkg:source", source);
        }
        if (sourceId != null) {
            jsonLd.put("identifier", sourceId);
        }
        if (!attributes.isEmpty()) {
            jsonLd.put("additionalProperty", new LinkedHashMap<>(attributes));
        }
        return jsonLd;
    }
}
