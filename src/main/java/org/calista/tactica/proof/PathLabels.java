package org.calista.tactica.proof;

import java.util.Objects;

/**
 * Display path labels ({@code p0}, {@code p0_1}, {@code p0_c2}, {@code p0_cases}).
 *
 * <p>Labels are derived from the node graph and only ever generated here; nothing parses them
 * to walk the forest.</p>
 */
public final class PathLabels {

    public static final String ROOT = "p0";

    private PathLabels() {}

    /** Increments a trailing numeric segment, otherwise appends {@code _1}. */
    public static String next(String label) {
        Objects.requireNonNull(label, "label");
        int cut = label.lastIndexOf('_');
        if (cut >= 0) {
            String last = label.substring(cut + 1);
            if (isNumber(last)) {
                return label.substring(0, cut + 1) + (Long.parseLong(last) + 1);
            }
        }
        return label + "_1";
    }

    /** Sibling label for an alternative approach from the same node. */
    public static String branch(String label, long branchId) {
        return Objects.requireNonNull(label, "label") + "_" + branchId;
    }

    /** Label of the i-th case (1-based) of a split at {@code label}. */
    public static String caseLabel(String label, int oneBasedIndex) {
        return Objects.requireNonNull(label, "label") + "_c" + oneBasedIndex;
    }

    /** Label of the case-split node itself. */
    public static String casesLabel(String label) {
        return Objects.requireNonNull(label, "label") + "_cases";
    }

    /** Fallback label for a cursor opened directly on a node id. */
    public static String forNode(long nodeId) {
        return "p" + nodeId;
    }

    private static boolean isNumber(String s) {
        if (s.isEmpty() || s.length() > 18) return false;
        for (int i = 0; i < s.length(); i++) {
            if (!Character.isDigit(s.charAt(i))) return false;
        }
        return true;
    }
}
