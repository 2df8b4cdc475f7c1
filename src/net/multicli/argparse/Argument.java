package net.multicli.argparse;

import net.multicli.types.TypeSpec;

public final class Argument {

    private final Command owner;
    private final String name;
    private final TypeSpec type;
    private final String description;
    private final int position;

    Argument(Command owner, String name, TypeSpec type, String description,
             int position) {
        this.owner = owner;
        this.name = name;
        this.type = type;
        this.description = description;
        this.position = position;
    }

    public String toString() {
        return formatName() + " " + type.formatName();
    }

    public Command getOwner() {
        return owner;
    }

    public String getName() {
        return name;
    }

    public TypeSpec getType() {
        return type;
    }

    public String getDescription() {
        return description;
    }

    /* Zero-based ordinal among the owner's arguments. */
    public int getPosition() {
        return position;
    }

    public String formatName() {
        return "argument <" + name + ">";
    }

}
