package net.multicli.argparse;

import net.multicli.types.TypeSpec;

/**
 * A named, non-positional parameter of a group or command, visible at its
 * owner and every level below it. Options without a type are flags.
 */
public final class Option {

    private final Node owner;
    private final Character shortName;
    private final String longName;
    private final String key;
    private final TypeSpec type;
    private final String description;
    private final String defaultLiteral;
    private final Object defaultValue;

    Option(Node owner, Character shortName, String longName, String key,
           TypeSpec type, String description, String defaultLiteral,
           Object defaultValue) {
        this.owner = owner;
        this.shortName = shortName;
        this.longName = longName;
        this.key = key;
        this.type = type;
        this.description = description;
        this.defaultLiteral = defaultLiteral;
        this.defaultValue = defaultValue;
    }

    public String toString() {
        return formatName() + ((type == null) ? "" : " " + type.formatName());
    }

    public Node getOwner() {
        return owner;
    }

    public Character getShortName() {
        return shortName;
    }

    public String getLongName() {
        return longName;
    }

    /* Name under which the value appears in namespaces. */
    public String getKey() {
        return key;
    }

    public TypeSpec getType() {
        return type;
    }

    public boolean isFlag() {
        return type == null;
    }

    public String getDescription() {
        return description;
    }

    public String getDefaultLiteral() {
        return defaultLiteral;
    }

    public boolean hasDefault() {
        return isFlag() || defaultLiteral != null;
    }

    public Object getDefault() {
        return (isFlag()) ? Boolean.FALSE : defaultValue;
    }

    public String formatName() {
        return "option " + formatFlags("/");
    }

    public String formatFlags(String sep) {
        if (shortName != null && longName != null)
            return "-" + shortName + sep + "--" + longName;
        return (longName != null) ? "--" + longName : "-" + shortName;
    }

}
