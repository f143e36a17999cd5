package org.calista.tactica.tactic;

public enum DecompositionMethod {
    COMPONENTS("components"),
    FACTOR("factoring"),
    EXPAND("expansion"),
    OTHER("other");

    private final String label;

    DecompositionMethod(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
