package net.multicli.argparse;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * A named level aggregating sub-groups and commands. Groups and commands
 * share one name space per level.
 */
public class Group extends Node {

    private static final Logger LOGGER = Logger.getLogger("Group");

    private final Map<String, Node> children;

    protected Group(String name, Group parent, String description) {
        super(name, parent, description);
        this.children = new LinkedHashMap<String, Node>();
    }

    public Collection<Node> getChildren() {
        return Collections.unmodifiableCollection(children.values());
    }

    public Node getChild(String name) {
        return children.get(name);
    }

    public List<Group> getGroups() {
        List<Group> ret = new ArrayList<Group>();
        for (Node n : children.values()) {
            if (n instanceof Group) ret.add((Group) n);
        }
        return ret;
    }

    public List<Command> getCommands() {
        List<Command> ret = new ArrayList<Command>();
        for (Node n : children.values()) {
            if (n instanceof Command) ret.add((Command) n);
        }
        return ret;
    }

    public Group addGroup(String name, String description) {
        checkMutable();
        checkChildName(name);
        Group ret = new Group(name, this, description);
        children.put(name, ret);
        LOGGER.finer("Added group " + ret.formatName());
        return ret;
    }
    public Group addGroup(String name) {
        return addGroup(name, null);
    }

    public Command addCommand(String name, String description,
                              Object context) {
        checkMutable();
        checkChildName(name);
        Command ret = new Command(name, this, description, context);
        children.put(name, ret);
        LOGGER.finer("Added command " + ret.formatName());
        return ret;
    }
    public Command addCommand(String name, String description) {
        return addCommand(name, description, null);
    }
    public Command addCommand(String name) {
        return addCommand(name, null, null);
    }

    private void checkChildName(String name) {
        if (children.containsKey(name))
            throw DefinitionException.duplicate("group or command", name,
                                                formatName());
    }

}
