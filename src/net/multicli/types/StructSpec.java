package net.multicli.types;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import net.multicli.argparse.DefinitionException;

public class StructSpec extends TypeSpec {

    public static class Builder {

        private final Map<String, TypeSpec> fields;
        private final Set<String> optional;

        Builder() {
            fields = new LinkedHashMap<String, TypeSpec>();
            optional = new LinkedHashSet<String>();
        }

        public Builder field(String name, TypeSpec type) {
            if (name == null || name.trim().isEmpty() ||
                    ! name.trim().equals(name))
                throw new DefinitionException(
                    DefinitionException.Kind.INVALID_DEFINITION,
                    "Invalid struct field name '" + name + "'");
            if (type == null)
                throw new DefinitionException(
                    DefinitionException.Kind.INVALID_DEFINITION,
                    "Struct field '" + name + "' has no type");
            if (fields.containsKey(name))
                throw DefinitionException.duplicate("struct field", name,
                                                    "struct type");
            fields.put(name, type);
            return this;
        }

        public Builder optionalField(String name, TypeSpec type) {
            field(name, type);
            optional.add(name);
            return this;
        }

        public StructSpec build() {
            return new StructSpec(fields, optional);
        }

    }

    private final Map<String, TypeSpec> fields;
    private final Set<String> optional;

    StructSpec(Map<String, TypeSpec> fields, Set<String> optional) {
        this.fields = Collections.unmodifiableMap(
            new LinkedHashMap<String, TypeSpec>(fields));
        this.optional = Collections.unmodifiableSet(
            new LinkedHashSet<String>(optional));
    }

    public Kind getKind() {
        return Kind.STRUCT;
    }

    public Map<String, TypeSpec> getFields() {
        return fields;
    }

    public TypeSpec getField(String name) {
        return fields.get(name);
    }

    public boolean isOptional(String name) {
        return optional.contains(name);
    }

    public String formatName() {
        StringBuilder sb = new StringBuilder("{");
        boolean first = true;
        for (Map.Entry<String, TypeSpec> e : fields.entrySet()) {
            if (first) {
                first = false;
            } else {
                sb.append(", ");
            }
            sb.append(e.getKey());
            if (isOptional(e.getKey())) sb.append('?');
            sb.append(": ").append(e.getValue().formatName());
        }
        return sb.append('}').toString();
    }

    public boolean equals(Object other) {
        if (! (other instanceof StructSpec)) return false;
        StructSpec so = (StructSpec) other;
        return fields.equals(so.getFields()) && optional.equals(so.optional);
    }

    public int hashCode() {
        return fields.hashCode() ^ optional.hashCode();
    }

}
