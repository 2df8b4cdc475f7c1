package net.multicli.argparse;

public enum ParseError {
    UNKNOWN_OPTION,     // Option-marked token matching no visible option
    UNKNOWN_COMMAND,    // Token matching no group or command at a level
    MISSING_ARGUMENT,   // Declared argument (or option value) not given
    TOO_MANY_ARGUMENTS, // Positional token beyond the declared arguments
    MALFORMED_LITERAL,  // Unbalanced delimiters or broken literal syntax
    INVALID_VALUE,      // Scalar coercion failed or wrong literal shape
    UNKNOWN_FIELD,      // Struct key not declared by the type
    MISSING_FIELD,      // Declared struct field absent from the literal
    DUPLICATE_FIELD;    // Struct key repeated within one literal

    /* Errors which partial parsing may turn into leftover tokens. */
    public boolean isBoundary() {
        switch (this) {
            case UNKNOWN_OPTION:
            case UNKNOWN_COMMAND:
            case TOO_MANY_ARGUMENTS:
                return true;
            default:
                return false;
        }
    }

}
