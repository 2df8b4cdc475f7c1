package net.multicli.argparse;

import java.util.Arrays;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;

class ArgumentSplitterTest {

    private static void assertArg(ArgumentSplitter.ArgType type,
                                  String value, int tokenIndex,
                                  ArgumentSplitter.ArgValue av) {
        assertEquals(type, av.getType());
        assertEquals(value, av.getValue());
        assertEquals(tokenIndex, av.getTokenIndex());
    }

    @Test
    void shortOptionCluster() {
        ArgumentSplitter s = new ArgumentSplitter(Arrays.asList("-abc"));
        ArgumentSplitter.Mode m = ArgumentSplitter.Mode.OPTIONS;
        assertArg(ArgumentSplitter.ArgType.SHORT_OPTION, "a", 0, s.next(m));
        assertArg(ArgumentSplitter.ArgType.SHORT_OPTION, "b", 0, s.next(m));
        assertArg(ArgumentSplitter.ArgType.SHORT_OPTION, "c", 0, s.next(m));
        assertNull(s.next(m));
        assertFalse(s.hasNext());
    }

    @Test
    void attachedValues() {
        ArgumentSplitter s = new ArgumentSplitter(
            Arrays.asList("--name=value", "-xval", "plain"));
        assertArg(ArgumentSplitter.ArgType.LONG_OPTION, "name", 0,
                  s.next(ArgumentSplitter.Mode.OPTIONS));
        assertArg(ArgumentSplitter.ArgType.VALUE, "value", 0,
                  s.next(ArgumentSplitter.Mode.OPTIONS));
        assertArg(ArgumentSplitter.ArgType.SHORT_OPTION, "x", 1,
                  s.next(ArgumentSplitter.Mode.OPTIONS));
        assertArg(ArgumentSplitter.ArgType.VALUE, "val", 1,
                  s.next(ArgumentSplitter.Mode.ARGUMENTS));
        assertArg(ArgumentSplitter.ArgType.ARGUMENT, "plain", 2,
                  s.next(ArgumentSplitter.Mode.OPTIONS));
    }

    @Test
    void specialTokens() {
        ArgumentSplitter s = new ArgumentSplitter(
            Arrays.asList("-", "--", "--"));
        assertArg(ArgumentSplitter.ArgType.ARGUMENT, "-", 0,
                  s.next(ArgumentSplitter.Mode.OPTIONS));
        assertArg(ArgumentSplitter.ArgType.SPECIAL, "--", 1,
                  s.next(ArgumentSplitter.Mode.OPTIONS));
        assertArg(ArgumentSplitter.ArgType.ARGUMENT, "--", 2,
                  s.next(ArgumentSplitter.Mode.FORCE_ARGUMENTS));
    }

    @Test
    void peekIsStable() {
        ArgumentSplitter s = new ArgumentSplitter(Arrays.asList("-v", "x"));
        ArgumentSplitter.ArgValue first = s.peek(
            ArgumentSplitter.Mode.OPTIONS);
        assertSame(first, s.peek(ArgumentSplitter.Mode.OPTIONS));
        assertArg(ArgumentSplitter.ArgType.ARGUMENT, "-v", 0,
                  s.peek(ArgumentSplitter.Mode.FORCE_ARGUMENTS));
        assertEquals(0, s.getTokenIndex());
    }

    @Test
    void drain_restOfCluster() {
        ArgumentSplitter s = new ArgumentSplitter(
            Arrays.asList("-qz", "tree", "x"));
        s.next(ArgumentSplitter.Mode.OPTIONS);
        s.peek(ArgumentSplitter.Mode.OPTIONS);
        assertEquals(Arrays.asList("-z", "tree", "x"), s.drain());
        assertFalse(s.hasNext());
    }

    @Test
    void iterator_wholeTokens() {
        ArgumentSplitter s = new ArgumentSplitter(
            Arrays.asList("a", "-b", "--c"));
        s.next(ArgumentSplitter.Mode.OPTIONS);
        StringBuilder sb = new StringBuilder();
        for (String tok : s) sb.append(tok).append(';');
        assertEquals("-b;--c;", sb.toString());
    }

}
