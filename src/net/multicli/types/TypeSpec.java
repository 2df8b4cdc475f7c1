package net.multicli.types;

import net.multicli.argparse.DefinitionException;

/**
 * Type descriptor governing how a literal is parsed: a scalar, an array of
 * a single element type, or a struct of named fields.
 * Instances are immutable and may be shared between arguments and options.
 */
public abstract class TypeSpec {

    public enum Kind { SCALAR, ARRAY, STRUCT }

    public static final ScalarSpec STRING = scalar("string");
    public static final ScalarSpec INT = scalar("int");
    public static final ScalarSpec LONG = scalar("long");
    public static final ScalarSpec FLOAT = scalar("float");
    public static final ScalarSpec BOOL = scalar("bool");

    TypeSpec() {}

    public abstract Kind getKind();

    public boolean isScalar() {
        return getKind() == Kind.SCALAR;
    }

    /* Opening delimiter of compound literals; zero for scalars. */
    public char getOpener() {
        switch (getKind()) {
            case ARRAY : return '[';
            case STRUCT: return '{';
            default    : return 0;
        }
    }

    public abstract String formatName();

    public String toString() {
        return formatName();
    }

    public static ScalarSpec scalar(String kind) {
        Converter<?> cvt = Converter.get(kind);
        if (cvt == null)
            throw new DefinitionException(
                DefinitionException.Kind.INVALID_DEFINITION,
                "Unknown scalar kind '" + kind + "' (known: " +
                Converter.getNames() + ")");
        return new ScalarSpec(cvt);
    }

    public static ArraySpec array(TypeSpec element) {
        if (element == null)
            throw new DefinitionException(
                DefinitionException.Kind.INVALID_DEFINITION,
                "Array element type may not be null");
        return new ArraySpec(element);
    }

    public static StructSpec.Builder struct() {
        return new StructSpec.Builder();
    }

}
