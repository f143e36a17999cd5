package org.calista.tactica.term;

import java.util.List;

/**
 * Term: common view over the two halves of the statement grammar.
 *
 * <p>A statement is a {@link MathRelation}; its leaves are {@link MathExpression}s, and an
 * expression may embed a relation again ({@link MathExpression.RelationExpr}). Navigation only
 * needs two things from a node: its ordered children and a copy of it with one child swapped.</p>
 *
 * Rules:
 * - equality is structural (records)
 * - children() is finite and ordered; the index of a child is its position step
 * - withChild() never mutates, untouched children are shared by reference
 */
public sealed interface Term permits MathExpression, MathRelation {

    /** Ordered direct children. Empty for leaves. */
    List<Term> children();

    /**
     * Copy of this node with child {@code index} replaced.
     *
     * @throws IllegalArgumentException if the index is out of range or the child has the wrong sort
     */
    Term withChild(int index, Term child);

    /** Short, stable, human-readable rendering. */
    String render();
}
