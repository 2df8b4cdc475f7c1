package net.multicli.argparse;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import net.multicli.types.TypeSpec;

/**
 * A leaf of the command tree, taking mandatory positional arguments in
 * declaration order and its own options.
 */
public class Command extends Node {

    private final List<Argument> arguments;
    private final Object context;

    protected Command(String name, Group parent, String description,
                      Object context) {
        super(name, parent, description);
        this.arguments = new ArrayList<Argument>();
        this.context = context;
    }

    public Collection<Node> getChildren() {
        return Collections.emptyList();
    }

    public List<Argument> getArguments() {
        return Collections.unmodifiableList(arguments);
    }

    public Argument getArgument(String name) {
        for (Argument a : arguments) {
            if (a.getName().equals(name)) return a;
        }
        return null;
    }

    /* Opaque value handed back with every result selecting this command. */
    public Object getContext() {
        return context;
    }

    public Argument addArgument(String name, TypeSpec type,
                                String description) {
        checkMutable();
        checkName(name, "argument name");
        if (type == null)
            throw new DefinitionException(
                DefinitionException.Kind.INVALID_DEFINITION,
                "Argument " + name + " of " + formatName() + " has no type");
        if (getArgument(name) != null)
            throw DefinitionException.duplicate("argument", name,
                                                formatName());
        if (getOption(name) != null)
            throw DefinitionException.duplicate("argument (clashing with " +
                "an option key)", name, formatName());
        Argument ret = new Argument(this, name, type, description,
                                    arguments.size());
        arguments.add(ret);
        return ret;
    }
    public Argument addArgument(String name, TypeSpec type) {
        return addArgument(name, type, null);
    }
    public Argument addArgument(String name) {
        return addArgument(name, TypeSpec.STRING, null);
    }

    protected void checkOptionKey(String key) {
        if (getArgument(key) != null)
            throw DefinitionException.duplicate("option key (clashing with " +
                "an argument)", key, formatName());
    }

}
