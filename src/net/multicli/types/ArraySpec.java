package net.multicli.types;

public class ArraySpec extends TypeSpec {

    private final TypeSpec element;

    ArraySpec(TypeSpec element) {
        this.element = element;
    }

    public Kind getKind() {
        return Kind.ARRAY;
    }

    public TypeSpec getElement() {
        return element;
    }

    public String formatName() {
        return "[" + element.formatName() + "]";
    }

    public boolean equals(Object other) {
        if (! (other instanceof ArraySpec)) return false;
        return element.equals(((ArraySpec) other).getElement());
    }

    public int hashCode() {
        return element.hashCode() * 31 + 1;
    }

}
