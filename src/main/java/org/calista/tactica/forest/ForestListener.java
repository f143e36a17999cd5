package org.calista.tactica.forest;

/**
 * Observer of forest mutations. Called after the mutation is visible and outside the forest lock,
 * so a listener may read the forest.
 */
public interface ForestListener {

    default void onNodeAdded(ProofNode node) {}

    default void onStatusChanged(ProofNode node, ProofStatus previous) {}

    default void onBookmarked(String name, long nodeId) {}
}
