package com.llstar.engine.grammar;

import java.util.Objects;

/**
 * One branch of an alternation, optionally guarded. Guards are consulted only when lookahead
 * alone cannot tell the live alternatives apart.
 */
public record Alternative(Production body, Guard guard) {

    @FunctionalInterface
    public interface Guard {
        boolean holds();
    }

    public Alternative {
        Objects.requireNonNull(body, "body");
    }

    public static Alternative of(Production body) {
        return new Alternative(body, null);
    }

    public static Alternative guarded(Guard guard, Production body) {
        return new Alternative(body, Objects.requireNonNull(guard, "guard"));
    }

    public boolean isGuarded() {
        return guard != null;
    }
}
