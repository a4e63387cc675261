package com.llstar.engine.config;

import com.llstar.engine.atn.AtnState;
import java.util.Objects;

/** One simulation path: where it is, which alternative it started in, and where rules return to. */
public record AtnConfig(AtnState state, int alt, CallStack stack) {

    public AtnConfig {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(stack, "stack");
    }

    public AtnConfig moveTo(AtnState target) {
        return new AtnConfig(target, alt, stack);
    }

    @Override
    public String toString() {
        return "(" + state.id + "," + alt + "," + stack + ")";
    }
}
