package net.multicli.argparse;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import net.multicli.types.LiteralParser;
import net.multicli.types.TypeSpec;
import net.multicli.util.Formats;

/**
 * A level of the command tree: a group or a command.
 * Nodes are created through their parent group (or are the root parser)
 * and are never re-parented; the tree is built once and then frozen by the
 * first parse.
 */
public abstract class Node {

    private static final Logger LOGGER = Logger.getLogger("Node");

    private final String name;
    private final Group parent;
    private final String description;
    private final Map<String, Option> options;
    private final Map<String, Option> longOptions;
    private final Map<Character, Option> shortOptions;
    private Handler defaultHandler;
    private Handler helpHandler;
    private boolean helpEnabled;

    protected Node(String name, Group parent, String description) {
        if (parent != null) checkName(name, "name");
        this.name = name;
        this.parent = parent;
        this.description = description;
        this.options = new LinkedHashMap<String, Option>();
        this.longOptions = new LinkedHashMap<String, Option>();
        this.shortOptions = new LinkedHashMap<Character, Option>();
        this.helpEnabled = true;
    }

    public String toString() {
        String path = formatPath(".");
        return String.format("%s@%h[%s]", getClass().getSimpleName(), this,
                             (path.isEmpty()) ? name : path);
    }

    public String getName() {
        return name;
    }

    public Group getParent() {
        return parent;
    }

    public String getDescription() {
        return description;
    }

    public abstract Collection<? extends Node> getChildren();

    public Node getRoot() {
        return (parent == null) ? this : parent.getRoot();
    }

    /* Depth in the tree; the root is level zero. */
    public int getLevel() {
        return (parent == null) ? 0 : parent.getLevel() + 1;
    }

    public List<Node> getPath() {
        List<Node> ret = (parent == null) ? new ArrayList<Node>() :
            parent.getPath();
        ret.add(this);
        return ret;
    }

    /* Names from below the root down to this node, e.g. "vms.instances". */
    public String formatPath(String sep) {
        if (parent == null) return "";
        String up = parent.formatPath(sep);
        return (up.isEmpty()) ? name : up + sep + name;
    }

    public String formatName() {
        String path = formatPath(" ");
        return (path.isEmpty()) ? "root" : Formats.quote(path);
    }

    public Collection<Option> getOptions() {
        return Collections.unmodifiableCollection(options.values());
    }

    public Option getOption(String key) {
        return options.get(key);
    }

    /* Own options first, then inherited ones from the nearest ancestor. */
    public List<Option> getVisibleOptions() {
        List<Option> ret = new ArrayList<Option>(options.values());
        if (parent != null) ret.addAll(parent.getVisibleOptions());
        return ret;
    }

    public Option findShortOption(char shortName) {
        Option ret = shortOptions.get(shortName);
        if (ret == null && parent != null)
            ret = parent.findShortOption(shortName);
        return ret;
    }

    public Option findLongOption(String longName) {
        Option ret = longOptions.get(longName);
        if (ret == null && parent != null)
            ret = parent.findLongOption(longName);
        return ret;
    }

    public Option findOption(ArgumentSplitter.ArgValue av) {
        switch (av.getType()) {
            case SHORT_OPTION:
                return findShortOption(av.getValue().charAt(0));
            case LONG_OPTION:
                return findLongOption(av.getValue());
            default:
                throw new IllegalArgumentException("Trying to resolve " + av +
                                                   " as an option");
        }
    }

    public Option addOption(Character shortName, String longName,
                            String key, TypeSpec type, String description,
                            String defaultLiteral) {
        checkMutable();
        if (shortName == null && longName == null)
            throw new DefinitionException(
                DefinitionException.Kind.INVALID_DEFINITION,
                "Option in " + formatName() +
                " needs a short or a long name");
        if (shortName != null && ! Character.isLetterOrDigit(shortName))
            throw new DefinitionException(
                DefinitionException.Kind.INVALID_DEFINITION,
                "Invalid short option name '" + shortName + "'");
        if (longName != null) checkName(longName, "long option name");
        if (key == null)
            key = (longName != null) ? longName : String.valueOf(shortName);
        checkName(key, "option key");
        /* Names must be unique along the whole path through this node */
        for (Node n = this; n != null; n = n.getParent())
            n.checkOptionNames(shortName, longName, this);
        for (Node child : getChildren())
            child.checkDescendantOptionNames(shortName, longName);
        if (options.containsKey(key))
            throw DefinitionException.duplicate("option key", key,
                                                formatName());
        checkOptionKey(key);
        Object defaultValue = null;
        if (defaultLiteral != null) {
            if (type == null)
                throw new DefinitionException(
                    DefinitionException.Kind.INVALID_DEFINITION,
                    "Flag option " + key + " in " + formatName() +
                    " cannot have a default");
            try {
                defaultValue = LiteralParser.parse(type, defaultLiteral);
            } catch (ParsingException exc) {
                throw new DefinitionException(
                    DefinitionException.Kind.INVALID_DEFINITION,
                    "Invalid default " + Formats.quote(defaultLiteral) +
                    " for option " + key + ": " + exc.getMessage(), exc);
            }
        }
        Option ret = new Option(this, shortName, longName, key, type,
                                description, defaultLiteral, defaultValue);
        options.put(key, ret);
        if (longName != null) longOptions.put(longName, ret);
        if (shortName != null) shortOptions.put(shortName, ret);
        LOGGER.finer("Added " + ret.formatName() + " to " + formatName());
        return ret;
    }
    public Option addOption(Character shortName, String longName,
                            TypeSpec type, String description,
                            String defaultLiteral) {
        return addOption(shortName, longName, null, type, description,
                         defaultLiteral);
    }
    public Option addOption(Character shortName, String longName,
                            TypeSpec type, String description) {
        return addOption(shortName, longName, null, type, description, null);
    }
    public Option addFlag(Character shortName, String longName,
                          String description) {
        return addOption(shortName, longName, null, null, description, null);
    }

    private void checkOptionNames(Character shortName, String longName,
                                  Node target) {
        if (shortName != null && shortOptions.containsKey(shortName))
            throw DefinitionException.duplicate("option", "-" + shortName,
                target.formatName() + ((target == this) ? "" :
                " (inherited from " + formatName() + ")"));
        if (longName != null && longOptions.containsKey(longName))
            throw DefinitionException.duplicate("option", "--" + longName,
                target.formatName() + ((target == this) ? "" :
                " (inherited from " + formatName() + ")"));
    }

    private void checkDescendantOptionNames(Character shortName,
                                            String longName) {
        if (shortName != null && shortOptions.containsKey(shortName) ||
                longName != null && longOptions.containsKey(longName))
            throw new DefinitionException(
                DefinitionException.Kind.DUPLICATE_NAME,
                "Option name already defined by descendant " + formatName());
        for (Node child : getChildren())
            child.checkDescendantOptionNames(shortName, longName);
    }

    /* Hook for subclasses with further names sharing the option keys. */
    protected void checkOptionKey(String key) {}

    public Handler getDefaultHandler() {
        return defaultHandler;
    }
    public void setDefaultHandler(Handler h) {
        checkMutable();
        defaultHandler = h;
    }

    public Handler getHelpHandler() {
        return helpHandler;
    }
    public void setHelpHandler(Handler h) {
        checkMutable();
        helpHandler = h;
    }

    public boolean isHelpEnabled() {
        return helpEnabled;
    }
    public void setHelpEnabled(boolean enabled) {
        checkMutable();
        helpEnabled = enabled;
    }

    public Handler findDefaultHandler() {
        for (Node n = this; n != null; n = n.getParent()) {
            if (n.getDefaultHandler() != null) return n.getDefaultHandler();
        }
        return Handlers.RAISE_NO_COMMAND;
    }

    public Handler findHelpHandler() {
        for (Node n = this; n != null; n = n.getParent()) {
            if (n.getHelpHandler() != null) return n.getHelpHandler();
        }
        return Handlers.getDefaultHelpHandler();
    }

    protected boolean isFrozen() {
        return parent != null && parent.isFrozen();
    }

    protected void checkMutable() {
        if (isFrozen())
            throw new IllegalStateException("Command tree is frozen; " +
                "cannot modify " + formatName());
    }

    static void checkName(String name, String what) {
        boolean valid = (name != null && ! name.isEmpty() &&
                         name.charAt(0) != '-');
        for (int i = 0; valid && i < name.length(); i++) {
            char ch = name.charAt(i);
            valid = (Character.isLetterOrDigit(ch) || ch == '-' ||
                     ch == '_');
        }
        if (! valid)
            throw new DefinitionException(
                DefinitionException.Kind.INVALID_DEFINITION,
                "Invalid " + what + " " + Formats.quote(name));
    }

}
