package com.llstar.engine.token;

import static com.llstar.engine.Grammars.A;
import static com.llstar.engine.Grammars.B;
import static com.llstar.engine.Grammars.IDENT;
import static com.llstar.engine.Grammars.NAME;
import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

final class ListTokenStreamTest {

    @Test
    void peekIsOneIndexedAndDoesNotConsume() {
        ListTokenStream stream = ListTokenStream.of(A, B);

        assertEquals(A, stream.peek(1).type());
        assertEquals(B, stream.peek(2).type());
        assertEquals(A, stream.peek(1).type());
        assertEquals(0, stream.position());
        assertThrows(IllegalArgumentException.class, () -> stream.peek(0));
    }

    @Test
    void pastTheEndYieldsEof() {
        ListTokenStream stream = ListTokenStream.of(A);

        assertEquals(TokenType.EOF, stream.peek(2).type());
        assertEquals(A, stream.consume().type());
        assertEquals(TokenType.EOF, stream.consume().type());
        assertEquals(TokenType.EOF, stream.peek(5).type());
        assertEquals(1, stream.position());
    }

    @Test
    void categoriesMatchTransitivelyButNotInReverse() {
        TokenType qualified = new TokenType(100, "QUALIFIED", NAME);

        assertTrue(NAME.matches(IDENT));
        assertTrue(qualified.matches(IDENT));
        assertFalse(IDENT.matches(NAME));
        assertTrue(IDENT.overlaps(qualified));
        assertFalse(A.overlaps(B));
    }
}
