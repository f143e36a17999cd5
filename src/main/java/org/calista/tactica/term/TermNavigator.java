package org.calista.tactica.term;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * TermNavigator: locates and replaces subexpressions inside a statement by position.
 *
 * Contract:
 * - search is depth-first, pre-order, left-to-right; the first structural match wins
 * - a caller-supplied position is never trusted: the subterm is re-derived and compared with the pattern
 * - replace rebuilds only the nodes on the path, every other subtree is shared by reference
 *
 * Stateless; all methods are static.
 */
public final class TermNavigator {

    private static final Logger log = LogManager.getLogger(TermNavigator.class);

    private TermNavigator() {}

    /** A located subexpression together with the position it was found at. */
    public record Located(MathExpression subterm, Position position) {
        public Located {
            Objects.requireNonNull(subterm, "subterm");
            Objects.requireNonNull(position, "position");
        }
    }

    // ---------------------------------------------------------------------
    // Locate
    // ---------------------------------------------------------------------

    /**
     * Finds {@code pattern} in {@code statement}.
     *
     * @param position optional; when given, the subterm at that position must exist and equal the pattern
     */
    public static Optional<Located> locate(MathRelation statement, MathExpression pattern, Position position) {
        Objects.requireNonNull(statement, "statement");
        Objects.requireNonNull(pattern, "pattern");

        if (position != null) {
            Optional<Term> at = subtermAt(statement, position);
            if (at.isPresent() && pattern.equals(at.get())) {
                return Optional.of(new Located(pattern, position));
            }
            if (log.isDebugEnabled()) {
                log.debug("Position {} does not hold '{}' in '{}'", position, pattern.render(), statement.render());
            }
            return Optional.empty();
        }

        return search(statement, pattern).map(p -> new Located(pattern, p));
    }

    public static Optional<Located> locate(MathRelation statement, MathExpression pattern) {
        return locate(statement, pattern, null);
    }

    /** First position (pre-order) whose subterm structurally equals {@code pattern}. */
    public static Optional<Position> search(Term root, MathExpression pattern) {
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(pattern, "pattern");
        return Optional.ofNullable(searchFrom(root, pattern, Position.root()));
    }

    private static Position searchFrom(Term node, MathExpression pattern, Position at) {
        if (node instanceof MathExpression && pattern.equals(node)) return at;

        List<Term> children = node.children();
        for (int i = 0; i < children.size(); i++) {
            Position hit = searchFrom(children.get(i), pattern, at.child(i));
            if (hit != null) return hit;
        }
        return null;
    }

    /** Subterm denoted by {@code position}, or empty if the path leaves the tree. */
    public static Optional<Term> subtermAt(Term root, Position position) {
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(position, "position");

        Term cur = root;
        Position rest = position;
        while (!rest.isRoot()) {
            int idx = rest.head();
            List<Term> children = cur.children();
            if (idx >= children.size()) return Optional.empty();
            cur = children.get(idx);
            rest = rest.tail();
        }
        return Optional.of(cur);
    }

    // ---------------------------------------------------------------------
    // Replace
    // ---------------------------------------------------------------------

    /**
     * Returns a new statement with the expression at {@code position} replaced.
     *
     * @throws IllegalArgumentException if the position does not resolve to an expression
     */
    public static MathRelation replace(MathRelation statement, Position position, MathExpression replacement) {
        Objects.requireNonNull(statement, "statement");
        Objects.requireNonNull(position, "position");
        Objects.requireNonNull(replacement, "replacement");

        if (position.isRoot()) {
            throw new IllegalArgumentException("Cannot replace the whole statement with an expression");
        }
        return (MathRelation) rebuild(statement, position, replacement);
    }

    private static Term rebuild(Term node, Position rest, MathExpression replacement) {
        if (rest.isRoot()) {
            if (!(node instanceof MathExpression)) {
                throw new IllegalArgumentException("Position ends on a relation: '" + node.render() + "'");
            }
            return replacement;
        }

        int idx = rest.head();
        List<Term> children = node.children();
        if (idx >= children.size()) {
            throw new IllegalArgumentException("Position step " + idx + " out of range in '" + node.render() + "'");
        }
        Term updated = rebuild(children.get(idx), rest.tail(), replacement);
        return node.withChild(idx, updated);
    }
}
