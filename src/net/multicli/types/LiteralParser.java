package net.multicli.types;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.multicli.argparse.Namespace;
import net.multicli.argparse.ParseError;
import net.multicli.argparse.ParsingException;
import net.multicli.util.Formats;

/**
 * Parses literal text against a {@link TypeSpec}.
 * <pre>
 * value  := scalar | array | struct
 * array  := '[' [ value (',' value)* ] ']'
 * struct := '{' [ field (',' field)* ] '}'
 * field  := identifier ('=' | ':') value
 * </pre>
 * Arrays yield unmodifiable {@link List}s, structs yield {@link Namespace}s
 * holding the fields in declaration order, scalars yield whatever the
 * scalar's {@link Converter} produces. Inside a compound literal, scalars
 * may be quoted with ' or "; a backslash escapes the next character.
 * <p>
 * Open arrays and structs are kept on an explicit stack rather than the
 * call stack, so nesting depth is bounded by the input only.
 */
public class LiteralParser {

    private abstract static class Frame {

        private final int openOffset;

        protected Frame(int openOffset) {
            this.openOffset = openOffset;
        }

        public int getOpenOffset() {
            return openOffset;
        }

        public abstract char getOpener();
        public abstract char getCloser();

        public abstract void add(Object value);

        public abstract Object finish() throws ParsingException;

    }

    private static class ArrayFrame extends Frame {

        private final ArraySpec spec;
        private final List<Object> items;

        public ArrayFrame(ArraySpec spec, int openOffset) {
            super(openOffset);
            this.spec = spec;
            this.items = new ArrayList<Object>();
        }

        public char getOpener() {
            return '[';
        }
        public char getCloser() {
            return ']';
        }

        public TypeSpec getElement() {
            return spec.getElement();
        }

        public void add(Object value) {
            items.add(value);
        }

        public Object finish() {
            return Collections.unmodifiableList(items);
        }

    }

    private class StructFrame extends Frame {

        private final StructSpec spec;
        private final Map<String, Object> values;
        private String pendingKey;

        public StructFrame(StructSpec spec, int openOffset) {
            super(openOffset);
            this.spec = spec;
            this.values = new LinkedHashMap<String, Object>();
        }

        public char getOpener() {
            return '{';
        }
        public char getCloser() {
            return '}';
        }

        public TypeSpec expectKey(String key, int keyOffset)
                throws ParsingException {
            TypeSpec ret = spec.getField(key);
            if (ret == null)
                throw error(ParseError.UNKNOWN_FIELD, "Unknown field " +
                    Formats.quote(key) + " for " + spec.formatName(),
                    spec.formatName(), keyOffset);
            if (values.containsKey(key))
                throw error(ParseError.DUPLICATE_FIELD, "Duplicate field " +
                    Formats.quote(key), key, keyOffset);
            pendingKey = key;
            return ret;
        }

        public void add(Object value) {
            values.put(pendingKey, value);
            pendingKey = null;
        }

        public Object finish() throws ParsingException {
            Namespace ret = new Namespace();
            for (String name : spec.getFields().keySet()) {
                if (values.containsKey(name)) {
                    ret.put(name, values.get(name));
                } else if (! spec.isOptional(name)) {
                    throw error(ParseError.MISSING_FIELD, "Missing field " +
                        Formats.quote(name) + " for " + spec.formatName(),
                        name, getOpenOffset());
                }
            }
            ret.freeze();
            return ret;
        }

    }

    private final LiteralReader reader;
    private final Deque<Frame> stack;

    public LiteralParser(LiteralReader reader) {
        this.reader = reader;
        this.stack = new ArrayDeque<Frame>();
    }

    public LiteralReader getReader() {
        return reader;
    }

    public Object parse(TypeSpec spec) throws ParsingException {
        if (spec.isScalar()) return parseScalar((ScalarSpec) spec);
        Object value = parseCompound(spec);
        reader.skipWhitespace();
        if (! reader.atEnd())
            throw error(ParseError.MALFORMED_LITERAL, "Unexpected " +
                describe(reader.peek()) + " after " + spec.formatName() +
                " literal", spec.formatName(), reader.getPosition());
        return value;
    }

    /* A stand-alone scalar is the whole (trimmed) text, quotes and all. */
    protected Object parseScalar(ScalarSpec spec) throws ParsingException {
        try {
            return spec.coerce(reader.getText());
        } catch (ParsingException exc) {
            throw new LiteralException(exc, reader.tokenIndexAt(0), 0, null);
        }
    }

    protected Object parseCompound(TypeSpec spec) throws ParsingException {
        TypeSpec want = spec;
        Object value = null;
        for (;;) {
            if (want != null) {
                /* Start a new value */
                reader.skipWhitespace();
                if (want.isScalar()) {
                    value = readScalar((ScalarSpec) want);
                    want = null;
                } else {
                    Frame frame = open(want);
                    reader.skipWhitespace();
                    if (reader.peek() == frame.getCloser()) {
                        reader.read();
                        stack.pop();
                        value = frame.finish();
                        want = null;
                    } else {
                        want = nextSpec(frame);
                        continue;
                    }
                }
            }
            /* A value is complete; hand it to the enclosing frame */
            for (;;) {
                if (stack.isEmpty()) return value;
                Frame top = stack.peek();
                top.add(value);
                reader.skipWhitespace();
                int offset = reader.getPosition();
                int ch = reader.read();
                if (ch == ',') {
                    want = nextSpec(top);
                    break;
                } else if (ch == top.getCloser()) {
                    stack.pop();
                    value = top.finish();
                } else if (ch == LiteralReader.EOF) {
                    throw unterminated();
                } else {
                    throw error(ParseError.MALFORMED_LITERAL, "Unexpected " +
                        describe(ch) + " in " + top.getOpener() +
                        "...; expected ',' or '" + top.getCloser() + "'",
                        String.valueOf(top.getCloser()), offset);
                }
            }
        }
    }

    private Frame open(TypeSpec spec) throws ParsingException {
        int offset = reader.getPosition();
        int ch = reader.peek();
        if (ch == LiteralReader.EOF && ! stack.isEmpty()) throw unterminated();
        if (ch == LiteralReader.EOF || ch == ',' || ch == ']' || ch == '}')
            throw error(ParseError.MALFORMED_LITERAL, "Missing " +
                spec.formatName() + " value before " + describe(ch),
                spec.formatName(), offset);
        if (ch != spec.getOpener())
            throw error(ParseError.INVALID_VALUE, "Expected '" +
                spec.getOpener() + "' to start " + spec.formatName() +
                ", got " + describe(ch), spec.formatName(), offset);
        reader.read();
        Frame ret;
        if (spec.getKind() == TypeSpec.Kind.ARRAY) {
            ret = new ArrayFrame((ArraySpec) spec, offset);
        } else {
            ret = new StructFrame((StructSpec) spec, offset);
        }
        stack.push(ret);
        return ret;
    }

    private TypeSpec nextSpec(Frame frame) throws ParsingException {
        if (frame instanceof ArrayFrame) {
            return ((ArrayFrame) frame).getElement();
        } else {
            StructFrame sf = (StructFrame) frame;
            reader.skipWhitespace();
            int offset = reader.getPosition();
            String key = readBare("=:", "field name").trim();
            if (key.isEmpty())
                throw error(ParseError.MALFORMED_LITERAL,
                    "Missing field name", "field name", offset);
            TypeSpec ret = sf.expectKey(key, offset);
            reader.read(); // The separator
            return ret;
        }
    }

    private Object readScalar(ScalarSpec spec) throws ParsingException {
        int offset = reader.getPosition();
        int ch = reader.peek();
        String raw;
        if (ch == '"' || ch == '\'') {
            raw = readQuoted();
            reader.skipWhitespace();
            int next = reader.peek();
            if (next != ',' && next != ']' && next != '}' &&
                    next != LiteralReader.EOF)
                throw error(ParseError.MALFORMED_LITERAL, "Unexpected " +
                    describe(next) + " after quoted value", spec.formatName(),
                    reader.getPosition());
        } else {
            raw = readBare(",]}", spec.formatName()).trim();
            if (raw.isEmpty())
                throw error(ParseError.MALFORMED_LITERAL,
                    "Missing " + spec.formatName() + " value",
                    spec.formatName(), offset);
        }
        try {
            return spec.getConverter().convert(raw);
        } catch (ParsingException exc) {
            throw new LiteralException(exc, reader.tokenIndexAt(offset),
                                       offset, null);
        }
    }

    /* Reads until one of the stop characters, which is left unconsumed. */
    private String readBare(String stops, String expected)
            throws ParsingException {
        StringBuilder sb = new StringBuilder();
        for (;;) {
            int ch = reader.peek();
            if (ch == LiteralReader.EOF) {
                throw unterminated();
            } else if (stops.indexOf(ch) != -1) {
                return sb.toString();
            } else if (ch == '[' || ch == '{' || ch == ']' || ch == '}' ||
                       ch == ',') {
                throw error(ParseError.MALFORMED_LITERAL, "Unexpected " +
                    describe(ch) + "; expected " + expected, expected,
                    reader.getPosition());
            } else if (ch == '\\') {
                reader.read();
                int esc = reader.read();
                if (esc == LiteralReader.EOF) throw unterminated();
                sb.append((char) esc);
            } else {
                sb.append((char) reader.read());
            }
        }
    }

    private String readQuoted() throws ParsingException {
        int offset = reader.getPosition();
        int quote = reader.read();
        StringBuilder sb = new StringBuilder();
        for (;;) {
            int ch = reader.read();
            if (ch == LiteralReader.EOF) {
                throw error(ParseError.MALFORMED_LITERAL,
                    "Unterminated quote " + (char) quote, String.valueOf(
                    (char) quote), offset);
            } else if (ch == quote) {
                return sb.toString();
            } else if (ch == '\\') {
                int esc = reader.read();
                if (esc == LiteralReader.EOF) continue;
                sb.append((char) esc);
            } else {
                sb.append((char) ch);
            }
        }
    }

    /* Reports the innermost delimiter left open at end of input. */
    private ParsingException unterminated() {
        Frame top = stack.peek();
        if (top == null)
            return error(ParseError.MALFORMED_LITERAL,
                "Unexpected end of literal", null, reader.getPosition());
        return error(ParseError.MALFORMED_LITERAL, "Unterminated '" +
            top.getOpener() + "'", String.valueOf(top.getCloser()),
            top.getOpenOffset());
    }

    private LiteralException error(ParseError kind, String message,
                                   String expected, int offset) {
        return new LiteralException(kind, message,
            reader.tokenIndexAt(offset), expected, offset);
    }

    private static String describe(int ch) {
        return (ch == LiteralReader.EOF) ? "end of literal" :
            "'" + (char) ch + "'";
    }

    public static Object parse(TypeSpec spec, String text)
            throws ParsingException {
        return new LiteralParser(new LiteralReader(text)).parse(spec);
    }

}
