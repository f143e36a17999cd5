package org.calista.tactica.term;

/**
 * Coarse classification of a bound value. Derived from the expression shape or,
 * when a view is supplied, from the view. Display/bookkeeping only; nothing type-checks on it.
 */
public enum MathObjectType {
    VARIABLE,
    NUMBER,
    OPERATION,
    PROPOSITION,
    GROUP_ELEMENT,
    RING_ELEMENT,
    FIELD_ELEMENT,
    GROUP,
    RING,
    TOPOLOGICAL_SPACE,
    MORPHISM,
    POINT,
    FUNCTION,
    LINEAR_TRANSFORMATION,
    CUSTOM;

    public static MathObjectType classify(MathExpression expression) {
        if (expression instanceof MathExpression.Var) return VARIABLE;
        if (expression instanceof MathExpression.Num) return NUMBER;
        if (expression instanceof MathExpression.Operation) return OPERATION;
        if (expression instanceof MathExpression.RelationExpr) return PROPOSITION;
        if (expression instanceof MathExpression.ViewAs v) return classify(v.view());
        throw new IllegalStateException("Unknown expression variant: " + expression);
    }

    public static MathObjectType classify(TypeView view) {
        return switch (view.kind()) {
            case AS_GROUP_ELEMENT -> GROUP_ELEMENT;
            case AS_RING_ELEMENT -> RING_ELEMENT;
            case AS_FIELD_ELEMENT -> FIELD_ELEMENT;
            case AS_GROUP, AS_CYCLIC_GROUP -> GROUP;
            case AS_RING -> RING;
            case AS_TOPOLOGICAL_SPACE -> TOPOLOGICAL_SPACE;
            case AS_HOMOMORPHISM -> MORPHISM;
            case AS_POINT -> POINT;
            case AS_FUNCTION -> FUNCTION;
            case AS_LINEAR_TRANSFORMATION -> LINEAR_TRANSFORMATION;
            case CUSTOM -> CUSTOM;
        };
    }
}
