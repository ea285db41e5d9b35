package io.github.vishalmysore.medkg.domain;

import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A directed, relation-typed edge between two node indices. Several edges
 * may join the same pair as long as their relations differ.
 */
@Value
@Builder
public class KgEdge {
    int sourceIndex;
    int targetIndex;

    // Machine-readable relation kind, e.g. "indication" or "bert_group"
    String relation;

    // Human-readable label for the same relation
    String displayRelation;

    /**
     * Converts this edge to a JSON-LD relationship. Endpoints are given as
     * the nodes' JSON-LD ids, so the caller passes those in.
     */
    public Map<String, Object> toJsonLd(String sourceRef, String targetRef) {
        Map<String, Object> jsonLd = new LinkedHashMap<>();
        jsonLd.put("@type", "Relationship");
        jsonLd.put("source", Map.of("@id", sourceRef));
        jsonLd.put("target", Map.of("@id", targetRef));
        jsonLd.put("relationshipType", relation);
        jsonLd.put("name", displayRelation);
        return jsonLd;
    }
}
