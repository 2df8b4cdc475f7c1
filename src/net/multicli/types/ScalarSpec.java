package net.multicli.types;

import net.multicli.argparse.ParsingException;

public class ScalarSpec extends TypeSpec {

    private final Converter<?> converter;

    ScalarSpec(Converter<?> converter) {
        this.converter = converter;
    }

    public Kind getKind() {
        return Kind.SCALAR;
    }

    public Converter<?> getConverter() {
        return converter;
    }

    public Object coerce(String raw) throws ParsingException {
        return converter.convert(raw.trim());
    }

    public String formatName() {
        return converter.getName();
    }

    public boolean equals(Object other) {
        if (! (other instanceof ScalarSpec)) return false;
        return converter.equals(((ScalarSpec) other).getConverter());
    }

    public int hashCode() {
        return converter.hashCode();
    }

}
