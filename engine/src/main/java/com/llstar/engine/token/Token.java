package com.llstar.engine.token;

import java.util.Objects;

/** A lexed token as seen by the lookahead engine. */
public record Token(TokenType type, String image, int offset) {

    public Token {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(image, "image");
    }

    public static Token eof(int offset) {
        return new Token(TokenType.EOF, "", offset);
    }

    public int typeId() {
        return type.id;
    }

    @Override
    public String toString() {
        return type.name + "('" + image + "')@" + offset;
    }
}
