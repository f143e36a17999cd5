package org.calista.tactica.proof;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Locale;
import java.util.Objects;

/**
 * Theorem artifact produced by {@link TheoremBuilder#build()}.
 *
 * @param id                {@code thm_} + lower-cased name, spaces as underscores
 * @param initialProofState the state the derivation started from
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Theorem(String id, String name, String description, ProofState initialProofState) {

    public Theorem {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(initialProofState, "initialProofState");
    }

    public static Theorem of(String name, ProofState initialProofState) {
        return new Theorem(idFor(name), name, "Theorem: " + name, initialProofState);
    }

    public static String idFor(String name) {
        return "thm_" + name.toLowerCase(Locale.ROOT).replace(' ', '_');
    }
}
