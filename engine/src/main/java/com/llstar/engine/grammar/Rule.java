package com.llstar.engine.grammar;

import java.util.Objects;

public record Rule(String name, Production definition) {

    public Rule {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(definition, "definition");
    }

    @Override
    public String toString() {
        return name + " := " + definition;
    }
}
