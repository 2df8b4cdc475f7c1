package net.multicli.argparse;

import net.multicli.util.Formats;

public class DefinitionException extends IllegalArgumentException {

    public enum Kind {
        DUPLICATE_NAME,     // Name already taken at the level
        INVALID_DEFINITION  // Incomplete or contradictory definition
    }

    private final Kind kind;

    public DefinitionException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }
    public DefinitionException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    public static DefinitionException duplicate(String what, String name,
                                                String where) {
        return new DefinitionException(Kind.DUPLICATE_NAME, "Duplicate " +
            what + " " + Formats.quote(name) + " in " + where);
    }

}
