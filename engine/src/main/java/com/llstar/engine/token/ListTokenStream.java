package com.llstar.engine.token;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Token stream backed by a materialized list of tokens. */
public final class ListTokenStream implements TokenStream {
    private final List<Token> tokens;
    private int position;

    public ListTokenStream(List<Token> tokens) {
        this.tokens = List.copyOf(Objects.requireNonNull(tokens, "tokens"));
    }

    /** Builds a stream with one token per type, using the type name as the image. */
    public static ListTokenStream of(TokenType... types) {
        List<Token> tokens = new ArrayList<>();
        for (int i = 0; i < types.length; i++) {
            tokens.add(new Token(types[i], types[i].name, i));
        }
        return new ListTokenStream(tokens);
    }

    @Override
    public Token peek(int k) {
        if (k < 1) {
            throw new IllegalArgumentException("lookahead is 1-indexed: " + k);
        }
        int index = position + k - 1;
        if (index < tokens.size()) {
            return tokens.get(index);
        }
        return Token.eof(tokens.size());
    }

    public Token consume() {
        Token token = peek(1);
        if (position < tokens.size()) {
            position++;
        }
        return token;
    }

    public int position() {
        return position;
    }
}
