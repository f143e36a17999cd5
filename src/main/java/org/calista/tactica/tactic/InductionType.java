package org.calista.tactica.tactic;

public enum InductionType {
    NATURAL("mathematical"),
    STRUCTURAL("structural"),
    TRANSFINITE("transfinite"),
    WELL_FOUNDED("well-founded"),
    OTHER("other");

    private final String label;

    InductionType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
