package com.llstar.engine.token;

import java.util.List;
import java.util.Objects;

/**
 * A terminal symbol of the grammar. A type may declare categories: a token of this type also
 * satisfies any transition expecting one of its categories, transitively.
 */
public final class TokenType {

    /** End of input. Matched like any other type so grammars may require it explicitly. */
    public static final TokenType EOF = new TokenType(-1, "EOF");

    public final int id;
    public final String name;
    public final List<TokenType> categories;

    public TokenType(int id, String name, TokenType... categories) {
        this.id = id;
        this.name = Objects.requireNonNull(name, "name");
        this.categories = List.of(categories);
    }

    /** Whether a token of this type satisfies a transition expecting {@code expected}. */
    public boolean matches(TokenType expected) {
        if (id == expected.id) {
            return true;
        }
        for (TokenType category : categories) {
            if (category.matches(expected)) {
                return true;
            }
        }
        return false;
    }

    /** Whether some token could satisfy both types. */
    public boolean overlaps(TokenType other) {
        return matches(other) || other.matches(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof TokenType other && other.id == id;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(id);
    }

    @Override
    public String toString() {
        return name;
    }
}
