package org.calista.tactica.tactic;

/** Which side of {@code l = r} is substituted at the rewrite target. */
public enum RewriteDirection {
    /** Target becomes the right side. */
    FORWARD("→", "forward"),
    /** Target becomes the left side. */
    BACKWARD("←", "backward");

    private final String arrow;
    private final String label;

    RewriteDirection(String arrow, String label) {
        this.arrow = arrow;
        this.label = label;
    }

    public String arrow() {
        return arrow;
    }

    public String label() {
        return label;
    }
}
