package org.calista.tactica.term;

import java.util.Locale;
import java.util.Objects;

/**
 * TypeView: operator that changes the theoretical reading of an expression
 * (a number read as an element of Z/nZ, a set read as a group, ...).
 *
 * @param kind    which reading
 * @param context optional structure label, e.g. {@code "Z/5Z"}; null when absent
 */
public record TypeView(Kind kind, String context) {

    public enum Kind {
        AS_GROUP_ELEMENT,
        AS_RING_ELEMENT,
        AS_FIELD_ELEMENT,
        AS_GROUP,
        AS_RING,
        AS_TOPOLOGICAL_SPACE,
        AS_HOMOMORPHISM,
        AS_CYCLIC_GROUP,
        AS_POINT,
        AS_FUNCTION,
        AS_LINEAR_TRANSFORMATION,
        CUSTOM
    }

    public TypeView {
        Objects.requireNonNull(kind, "kind");
        if (context != null && context.isBlank()) context = null;
    }

    public static TypeView of(Kind kind) {
        return new TypeView(kind, null);
    }

    public static TypeView of(Kind kind, String context) {
        return new TypeView(kind, context);
    }

    public String render() {
        String k = kind.name().toLowerCase(Locale.ROOT);
        return context == null ? k : k + "(" + context + ")";
    }
}
