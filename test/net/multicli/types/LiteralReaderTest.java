package net.multicli.types;

import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LiteralReaderTest {

    @Test
    void gather_stopsWhenBalanced() {
        List<String> rest = Arrays.asList("2,", "3]", "extra");
        assertEquals(Arrays.asList("[1,", "2,", "3]"),
                     LiteralReader.gather("[1,", rest));
    }

    @Test
    void gather_singleTokenWhenClosed() {
        assertEquals(Arrays.asList("[1,2]"),
            LiteralReader.gather("[1,2]", Arrays.asList("x")));
    }

    @Test
    void gather_takesEverythingWhileOpen() {
        assertEquals(Arrays.asList("{a=[1,", "2"),
            LiteralReader.gather("{a=[1,", Arrays.asList("2")));
    }

    @Test
    void balance_ignoresQuotedDelimiters() {
        LiteralReader.Balance b = new LiteralReader.Balance();
        b.feed("[\"]\"");
        assertTrue(b.isOpen());
        b.feed("]");
        assertFalse(b.isOpen());
        assertFalse(b.isBroken());
    }

    @Test
    void balance_quotesOnlyAtValueStart() {
        LiteralReader.Balance b = new LiteralReader.Balance();
        b.feed("[O'Brien,Smith]");
        assertFalse(b.isOpen());
        b = new LiteralReader.Balance();
        b.feed("{name=d'Arc,");
        b.feed("age=19}");
        assertFalse(b.isOpen());
        b = new LiteralReader.Balance();
        b.feed("[a,");
        b.feed("'b]");
        assertTrue(b.isOpen());
        b.feed("c']");
        assertFalse(b.isOpen());
    }

    @Test
    void gather_apostropheDoesNotSwallowTokens() {
        assertEquals(Arrays.asList("[O'Brien,", "Smith]"),
            LiteralReader.gather("[O'Brien,",
                                 Arrays.asList("Smith]", "2")));
    }

    @Test
    void balance_mismatchIsBroken() {
        LiteralReader.Balance b = new LiteralReader.Balance();
        b.feed("[1}");
        assertTrue(b.isBroken());
        assertFalse(b.isOpen());
    }

    @Test
    void reader_joinsPiecesWithSpaces() {
        LiteralReader r = new LiteralReader(Arrays.asList("[a,", "b]"), 3);
        assertEquals("[a, b]", r.getText());
        assertEquals(2, r.getPieceCount());
        assertEquals(3, r.tokenIndexAt(0));
        assertEquals(3, r.tokenIndexAt(3));
        assertEquals(4, r.tokenIndexAt(4));
        assertEquals(-1, new LiteralReader("x").tokenIndexAt(0));
    }

    @Test
    void reader_readsToEnd() {
        LiteralReader r = new LiteralReader("a b");
        assertEquals('a', r.read());
        r.skipWhitespace();
        assertEquals('b', r.peek());
        assertEquals('b', r.read());
        assertTrue(r.atEnd());
        assertEquals(LiteralReader.EOF, r.read());
    }

}
