package org.calista.tactica.forest;

/**
 * Fatal precondition violation on the forest: unknown node id, missing parent, no root.
 * Indicates a bug in the caller and is not meant to be caught inside the engine.
 */
public class ProofForestException extends IllegalStateException {

    public ProofForestException(String message) {
        super(message);
    }

    static ProofForestException unknownNode(long id) {
        return new ProofForestException("Node " + id + " does not exist in the forest");
    }
}
