package io.github.vishalmysore.medkg.domain;

/**
 * Node type labels used by the PrimeKG dataset. Node types stay plain
 * strings on {@link KgNode} because other datasets bring their own labels;
 * these constants name the ones the built-in queries rely on.
 */
public enum NodeType {
    GENE_PROTEIN("gene/protein"),
    DRUG("drug"),
    DISEASE("disease"),
    EFFECT_PHENOTYPE("effect/phenotype"),
    ANATOMY("anatomy"),
    BIOLOGICAL_PROCESS("biological_process"),
    MOLECULAR_FUNCTION("molecular_function"),
    CELLULAR_COMPONENT("cellular_component"),
    PATHWAY("pathway"),
    EXPOSURE("exposure");

    private final String label;

    NodeType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Turns a raw type label into a JSON-LD friendly class name,
     * e.g. "gene/protein" becomes "GeneProtein".
     */
    static String jsonLdName(String typeLabel) {
        StringBuilder sb = new StringBuilder();
        boolean upper = true;
        for (char c : typeLabel.toCharArray()) {
            if (!Character.isLetterOrDigit(c)) {
                upper = true;
                continue;
            }
            sb.append(upper ? Character.toUpperCase(c) : Character.toLowerCase(c));
            upper = false;
        }
        return sb.length() == 0 ? "Entity" : sb.toString();
    }
}
