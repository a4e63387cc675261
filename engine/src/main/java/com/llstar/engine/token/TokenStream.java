package com.llstar.engine.token;

/**
 * Cursor over the token stream of the surrounding parser. Lookahead is 1-indexed and never
 * consumes; positions past the end of input yield an EOF token.
 */
public interface TokenStream {
    Token peek(int k);
}
