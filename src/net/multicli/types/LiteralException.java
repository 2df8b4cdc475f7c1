package net.multicli.types;

import net.multicli.argparse.ParseError;
import net.multicli.argparse.ParsingException;

public class LiteralException extends ParsingException {

    private final int offset;

    public LiteralException(ParseError kind, String message, int tokenIndex,
                            String expected, int offset) {
        super(kind, message, tokenIndex, expected);
        this.offset = offset;
    }
    public LiteralException(ParsingException cause, int tokenIndex,
                            int offset, String newSource) {
        super(cause, tokenIndex, newSource);
        this.offset = offset;
    }

    public String getMessage() {
        String ret = super.getMessage();
        if (ret == null) return null;
        return ret + " at offset " + offset;
    }

    /* Character offset inside the reassembled literal text. */
    public int getOffset() {
        return offset;
    }

}
