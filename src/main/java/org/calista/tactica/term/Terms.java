package org.calista.tactica.term;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/** Shared helpers for the term variants (rendering, child checks). */
final class Terms {

    private Terms() {}

    static IllegalArgumentException noSuchChild(Term node, int index) {
        return new IllegalArgumentException("No child " + index + " in " + node.getClass().getSimpleName()
                + " '" + node.render() + "'");
    }

    static MathExpression expectExpression(Term parent, Term child) {
        if (child instanceof MathExpression e) return e;
        throw new IllegalArgumentException("Expected an expression under " + parent.getClass().getSimpleName()
                + ", got " + (child == null ? "null" : child.getClass().getSimpleName()));
    }

    static MathRelation expectRelation(Term parent, Term child) {
        if (child instanceof MathRelation r) return r;
        throw new IllegalArgumentException("Expected a relation under " + parent.getClass().getSimpleName()
                + ", got " + (child == null ? "null" : child.getClass().getSimpleName()));
    }

    static List<MathRelation> replaceRelation(Term parent, List<MathRelation> operands, int index, Term child) {
        if (index < 0 || index >= operands.size()) throw noSuchChild(parent, index);
        ArrayList<MathRelation> next = new ArrayList<>(operands);
        next.set(index, expectRelation(parent, child));
        return next;
    }

    static String renderJunction(String connective, List<MathRelation> operands) {
        if (operands.isEmpty()) return "()";
        if (operands.size() == 1) return operands.get(0).render();
        return operands.stream().map(Term::render).collect(Collectors.joining(connective, "(", ")"));
    }

    static String renderApplication(String operator, List<MathExpression> operands) {
        if (operands.size() == 2 && isSymbolic(operator)) {
            return "(" + operands.get(0).render() + " " + operator + " " + operands.get(1).render() + ")";
        }
        return operands.stream().map(Term::render).collect(Collectors.joining(", ", operator + "(", ")"));
    }

    private static boolean isSymbolic(String operator) {
        if (operator.isEmpty()) return false;
        for (int i = 0; i < operator.length(); i++) {
            if (Character.isLetterOrDigit(operator.charAt(i))) return false;
        }
        return true;
    }
}
