package io.github.vishalmysore.medkg.domain;

/**
 * Relations synthesized from similarity-cluster tables rather than read
 * from the primary edge table.
 */
public enum DerivedRelation {
    CLUSTER_SIMILARITY("bert_group", "BERT similarity"), // bulk linking of every co-cluster member
    CLUSTER_APPROX("bert_related", "BERT cluster approx"); // ad hoc linking by group label

    private final String relation;
    private final String displayRelation;

    DerivedRelation(String relation, String displayRelation) {
        this.relation = relation;
        this.displayRelation = displayRelation;
    }

    public String getRelation() {
        return relation;
    }

    public String getDisplayRelation() {
        return displayRelation;
    }
}
