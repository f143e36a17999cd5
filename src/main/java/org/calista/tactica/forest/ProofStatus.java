package org.calista.tactica.forest;

/** Status of a proof node. Default on creation is {@link #IN_PROGRESS}. */
public enum ProofStatus {
    TODO("□"),
    IN_PROGRESS("→"),
    WIP("●"),
    COMPLETE("✓"),
    ABANDONED("✗");

    private final String glyph;

    ProofStatus(String glyph) {
        this.glyph = glyph;
    }

    /** One-character marker used by the forest transcript. */
    public String glyph() {
        return glyph;
    }
}
