package org.calista.tactica.proof;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.calista.tactica.term.MathObjectType;

import java.util.Objects;

/**
 * A quantified object of a statement, e.g. {@code ∀ n : NUMBER}.
 *
 * @param description optional human text; null when absent
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record QuantifiedObject(String variable,
                               MathObjectType type,
                               Quantification quantification,
                               String description) {

    public enum Quantification {
        UNIVERSAL,
        EXISTENTIAL,
        UNIQUE_EXISTENTIAL,
        DEFINED,
        FIXED
    }

    public QuantifiedObject {
        Objects.requireNonNull(variable, "variable");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(quantification, "quantification");
    }

    public static QuantifiedObject universal(String variable, MathObjectType type) {
        return new QuantifiedObject(variable, type, Quantification.UNIVERSAL, null);
    }

    public String render() {
        String q = switch (quantification) {
            case UNIVERSAL -> "∀";
            case EXISTENTIAL -> "∃";
            case UNIQUE_EXISTENTIAL -> "∃!";
            case DEFINED -> "def";
            case FIXED -> "fix";
        };
        return q + " " + variable + " : " + type;
    }
}
