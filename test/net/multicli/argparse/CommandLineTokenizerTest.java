package net.multicli.argparse;

import java.util.Arrays;
import java.util.Collections;
import net.multicli.types.LiteralException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class CommandLineTokenizerTest {

    @Test
    void splitsOnWhitespace() throws ParsingException {
        assertEquals(Arrays.asList("vms", "instances", "list", "--long"),
            CommandLineTokenizer.tokenize("  vms instances\tlist --long "));
        assertEquals(Collections.emptyList(),
                     CommandLineTokenizer.tokenize("   "));
    }

    @Test
    void quotesAndEscapes() throws ParsingException {
        assertEquals(Arrays.asList("user", "Jack Smith", "it's", ""),
            CommandLineTokenizer.tokenize(
                "user \"Jack Smith\" it\\'s ''"));
        assertEquals(Arrays.asList("a b"),
                     CommandLineTokenizer.tokenize("a\\ b"));
    }

    @Test
    void groupsKeptVerbatim() throws ParsingException {
        assertEquals(Arrays.asList("family",
                "[{name=Sara, age=34}, {name=Joe, age=33}]", "-q"),
            CommandLineTokenizer.tokenize(
                "family [{name=Sara, age=34}, {name=Joe, age=33}] -q"));
        assertEquals(Arrays.asList("person", "{name=\"a b\", age=1}"),
            CommandLineTokenizer.tokenize("person {name=\"a b\", age=1}"));
        assertEquals(Arrays.asList("--names=[a, b]"),
            CommandLineTokenizer.tokenize("--names=[a, b]"));
    }

    @Test
    void unterminatedGroup() {
        LiteralException exc = assertThrows(LiteralException.class,
            () -> CommandLineTokenizer.tokenize("children 3 [1, 2,"));
        assertEquals(ParseError.MALFORMED_LITERAL, exc.getKind());
        assertEquals(11, exc.getOffset());
        assertEquals(2, exc.getTokenIndex());
        assertEquals("]", exc.getExpected());
    }

    @Test
    void mismatchedGroup() {
        LiteralException exc = assertThrows(LiteralException.class,
            () -> CommandLineTokenizer.tokenize("x [1}"));
        assertEquals(ParseError.MALFORMED_LITERAL, exc.getKind());
        assertEquals(4, exc.getOffset());
    }

    @Test
    void unterminatedQuote() {
        LiteralException exc = assertThrows(LiteralException.class,
            () -> CommandLineTokenizer.tokenize("user \"Jack"));
        assertEquals(ParseError.MALFORMED_LITERAL, exc.getKind());
        assertEquals(5, exc.getOffset());
    }

}
