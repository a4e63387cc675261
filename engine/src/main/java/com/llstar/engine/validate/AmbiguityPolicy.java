package com.llstar.engine.validate;

/** How statically detected shadowing is reported. Runtime resolution is always first-match. */
public enum AmbiguityPolicy {
    WARN,
    FATAL
}
