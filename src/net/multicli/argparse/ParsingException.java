package net.multicli.argparse;

public class ParsingException extends Exception {

    private final ParseError kind;
    private final int tokenIndex;
    private final String expected;
    private final String source;

    public ParsingException(ParseError kind, String message, int tokenIndex,
                            String expected, String source) {
        super(message);
        this.kind = kind;
        this.tokenIndex = tokenIndex;
        this.expected = expected;
        this.source = source;
    }
    public ParsingException(ParseError kind, String message, int tokenIndex,
                            String expected) {
        this(kind, message, tokenIndex, expected, null);
    }
    public ParsingException(ParseError kind, String message) {
        this(kind, message, -1, null, null);
    }
    public ParsingException(ParseError kind, String message, String expected,
                            Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.tokenIndex = -1;
        this.expected = expected;
        this.source = null;
    }
    public ParsingException(ParsingException cause, int tokenIndex,
                            String newSource) {
        super(cause.getOriginalMessage(), cause);
        this.kind = cause.getKind();
        this.tokenIndex = tokenIndex;
        this.expected = cause.getExpected();
        this.source = newSource;
    }

    protected String getOriginalMessage() {
        return super.getMessage();
    }

    public String getMessage() {
        String ret = getOriginalMessage();
        if (ret == null) return null;
        String src = getSource();
        if (src != null) ret += " " + src;
        if (tokenIndex >= 0) ret += " (token " + tokenIndex + ")";
        return ret;
    }

    public ParseError getKind() {
        return kind;
    }

    /* Index into the raw token sequence, or -1 if unknown. */
    public int getTokenIndex() {
        return tokenIndex;
    }

    public String getExpected() {
        return expected;
    }

    public String getSource() {
        return source;
    }

}
