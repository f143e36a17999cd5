package org.calista.tactica.proof;

import org.calista.tactica.term.MathExpression;
import org.calista.tactica.term.MathObjectType;

import java.util.Objects;

/** A name bound to a value in the proof environment. */
public record BoundVariable(String name, MathExpression value, MathObjectType type) {
    public BoundVariable {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(type, "type");
    }

    public String render() {
        return name + " := " + value.render() + " : " + type;
    }
}
