package net.multicli.types;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Character stream over a literal that may span several raw tokens.
 * The pieces are joined with single spaces; every offset can be mapped
 * back to the index of the raw token it came from.
 */
public class LiteralReader {

    /**
     * Tracks delimiter nesting over successive pieces, so that callers
     * know whether a literal continues into the next raw token.
     * <p>
     * Quote characters only open a quote at the start of a value (as
     * {@link LiteralParser} reads them); elsewhere, as in {@code O'Brien}
     * or in struct keys, they are ordinary text.
     */
    public static class Balance {

        private final Deque<Character> closers;
        private char quote;
        private boolean escape;
        private boolean broken;
        private boolean valueStart;
        private boolean keyPending;

        public Balance() {
            closers = new ArrayDeque<Character>();
            valueStart = true;
        }

        public void feed(String piece) {
            for (int i = 0; i < piece.length() && ! broken; i++) {
                char ch = piece.charAt(i);
                if (escape) {
                    escape = false;
                } else if (quote != 0) {
                    if (ch == '\\') {
                        escape = true;
                    } else if (ch == quote) {
                        quote = 0;
                    }
                } else if (Character.isWhitespace(ch)) {
                    continue;
                } else if (ch == '\\') {
                    escape = true;
                } else if ((ch == '"' || ch == '\'') && valueStart) {
                    quote = ch;
                } else if (ch == '[') {
                    closers.push(']');
                    valueStart = true;
                    continue;
                } else if (ch == '{') {
                    closers.push('}');
                    keyPending = true;
                } else if (ch == ',') {
                    keyPending = inStruct();
                    valueStart = ! keyPending;
                    continue;
                } else if (ch == ']' || ch == '}') {
                    if (closers.isEmpty() || closers.pop() != ch)
                        broken = true;
                } else if ((ch == '=' || ch == ':') && keyPending) {
                    keyPending = false;
                    valueStart = true;
                    continue;
                }
                valueStart = false;
            }
            // Escapes do not carry over a token boundary.
            escape = false;
        }

        private boolean inStruct() {
            return ! closers.isEmpty() && closers.peek() == '}';
        }

        /* Whether more input is needed to close every delimiter. */
        public boolean isOpen() {
            return ! broken && (quote != 0 || ! closers.isEmpty());
        }

        public boolean isBroken() {
            return broken;
        }

    }

    public static final int EOF = -1;

    private final String text;
    private final int[] pieceStarts;
    private final int firstToken;
    private int position;

    public LiteralReader(List<String> pieces, int firstToken) {
        if (pieces.isEmpty())
            throw new IllegalArgumentException(
                "Literal must consist of at least one piece");
        StringBuilder sb = new StringBuilder();
        pieceStarts = new int[pieces.size()];
        for (int i = 0; i < pieces.size(); i++) {
            if (i != 0) sb.append(' ');
            pieceStarts[i] = sb.length();
            sb.append(pieces.get(i));
        }
        this.text = sb.toString();
        this.firstToken = firstToken;
    }
    public LiteralReader(String text) {
        this(Collections.singletonList(text), -1);
    }

    public String getText() {
        return text;
    }

    public int getPieceCount() {
        return pieceStarts.length;
    }

    public int getPosition() {
        return position;
    }

    public int peek() {
        return (position < text.length()) ? text.charAt(position) : EOF;
    }

    public int read() {
        if (position >= text.length()) return EOF;
        return text.charAt(position++);
    }

    public boolean atEnd() {
        return position >= text.length();
    }

    public void skipWhitespace() {
        while (position < text.length() &&
               Character.isWhitespace(text.charAt(position)))
            position++;
    }

    /* Raw token index for the given offset, or -1 if not tracked. */
    public int tokenIndexAt(int offset) {
        if (firstToken < 0) return -1;
        int piece = 0;
        while (piece + 1 < pieceStarts.length &&
               pieceStarts[piece + 1] <= offset)
            piece++;
        return firstToken + piece;
    }

    /**
     * Collects the pieces of a literal starting with first: while the
     * nesting opened so far is unclosed, further raw tokens are taken from
     * rest. Returns the pieces, first included.
     */
    public static List<String> gather(String first, Iterable<String> rest) {
        List<String> ret = new ArrayList<String>();
        ret.add(first);
        Balance balance = new Balance();
        balance.feed(first);
        if (! balance.isOpen()) return ret;
        for (String piece : rest) {
            ret.add(piece);
            balance.feed(piece);
            if (! balance.isOpen()) break;
        }
        return ret;
    }

}
