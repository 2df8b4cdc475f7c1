package net.multicli.argparse;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import net.multicli.types.LiteralException;

/**
 * Splits a whole command line into raw tokens.
 * <p>
 * Whitespace separates tokens, except within quotes and within (nested)
 * bracket or brace groups. Outside groups, quotes are removed and a
 * backslash escapes the next character; inside groups, everything is kept
 * verbatim for the literal parser.
 */
public final class CommandLineTokenizer {

    private CommandLineTokenizer() {}

    public static List<String> tokenize(String cmdline)
            throws ParsingException {
        List<String> ret = new ArrayList<String>();
        Deque<Character> closers = new ArrayDeque<Character>();
        StringBuilder token = null;
        char quote = 0;
        int quoteStart = -1;
        Deque<Integer> openOffsets = new ArrayDeque<Integer>();
        for (int i = 0; i < cmdline.length(); i++) {
            char ch = cmdline.charAt(i);
            if (token == null) {
                if (Character.isWhitespace(ch)) continue;
                token = new StringBuilder();
            }
            boolean verbatim = ! closers.isEmpty();
            if (quote != 0) {
                if (ch == '\\' && i + 1 < cmdline.length()) {
                    if (verbatim) token.append(ch);
                    token.append(cmdline.charAt(++i));
                } else if (ch == quote) {
                    quote = 0;
                    if (verbatim) token.append(ch);
                } else {
                    token.append(ch);
                }
            } else if (ch == '\\') {
                if (i + 1 == cmdline.length())
                    throw error("Dangling backslash", null, ret.size(), i);
                if (verbatim) token.append(ch);
                token.append(cmdline.charAt(++i));
            } else if (ch == '"' || ch == '\'') {
                quote = ch;
                quoteStart = i;
                if (verbatim) token.append(ch);
            } else if (ch == '[' || ch == '{') {
                closers.push((ch == '[') ? ']' : '}');
                openOffsets.push(i);
                token.append(ch);
            } else if (verbatim && (ch == ']' || ch == '}')) {
                if (closers.peek() != ch)
                    throw error("Mismatched '" + ch + "'",
                        String.valueOf(closers.peek()), ret.size(), i);
                closers.pop();
                openOffsets.pop();
                token.append(ch);
            } else if (Character.isWhitespace(ch) && ! verbatim) {
                ret.add(token.toString());
                token = null;
            } else {
                token.append(ch);
            }
        }
        if (quote != 0)
            throw error("Unterminated quote " + quote, String.valueOf(quote),
                        ret.size(), quoteStart);
        if (! closers.isEmpty())
            throw error("Unterminated '" + ((closers.peek() == ']') ?
                '[' : '{') + "'", String.valueOf(closers.peek()),
                ret.size(), openOffsets.peek());
        if (token != null) ret.add(token.toString());
        return ret;
    }

    private static ParsingException error(String message, String expected,
                                          int tokenIndex, int offset) {
        return new LiteralException(ParseError.MALFORMED_LITERAL,
            message + " in command line", tokenIndex, expected, offset);
    }

}
