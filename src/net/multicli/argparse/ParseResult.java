package net.multicli.argparse;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.json.JSONArray;
import org.json.JSONObject;

/**
 * The outcome of a successful parse.
 * <p>
 * Holds the selected command (if any), the group it lives in, one options
 * namespace per traversed level, the arguments namespace, and a global
 * namespace keyed by dotted paths such as {@code vms.instances.list.long}.
 */
public class ParseResult {

    private final Command command;
    private final List<Node> path;
    private final Map<Node, Namespace> levels;
    private final Namespace args;
    private final Namespace global;
    private final List<String> leftover;

    protected ParseResult(Command command, List<Node> path,
                          Map<Node, Namespace> levels, Namespace args,
                          Namespace global, List<String> leftover) {
        this.command = command;
        this.path = Collections.unmodifiableList(new ArrayList<Node>(path));
        this.levels = Collections.unmodifiableMap(levels);
        this.args = args;
        this.global = global;
        this.leftover = Collections.unmodifiableList(
            new ArrayList<String>(leftover));
    }

    public String toString() {
        return getClass().getSimpleName() + toJSONObject();
    }

    /* The selected command, or null if resolution ended at a group. */
    public Command getCommand() {
        return command;
    }

    /* The innermost group traversed. */
    public Group getGroup() {
        for (int i = path.size() - 1; i >= 0; i--) {
            if (path.get(i) instanceof Group) return (Group) path.get(i);
        }
        throw new AssertionError("Resolution path without root");
    }

    /* Traversed nodes, from the root down. */
    public List<Node> getPath() {
        return path;
    }

    public String getCommandPath() {
        return path.get(path.size() - 1).formatPath(".");
    }

    public Namespace getArgs() {
        return args;
    }

    public Namespace getLevel(Node node) {
        return levels.get(node);
    }
    public Namespace getLevel(int depth) {
        return levels.get(path.get(depth));
    }

    public List<Namespace> getLevels() {
        return new ArrayList<Namespace>(levels.values());
    }

    /* Options of the innermost level. */
    public Namespace getOptions() {
        return levels.get(path.get(path.size() - 1));
    }

    public Namespace getGlobal() {
        return global;
    }

    public Object get(String path) {
        return global.lookup(path);
    }

    public Object getContext() {
        return (command == null) ? null : command.getContext();
    }

    public List<String> getLeftover() {
        return leftover;
    }

    public JSONObject toJSONObject() {
        JSONArray levelArray = new JSONArray();
        for (Map.Entry<Node, Namespace> e : levels.entrySet()) {
            levelArray.put(new JSONObject()
                .put("path", e.getKey().formatPath("."))
                .put("options", e.getValue().toJSONObject()));
        }
        JSONObject ret = new JSONObject()
            .put("command", getCommandPath())
            .put("args", args.toJSONObject())
            .put("levels", levelArray)
            .put("global", global.toJSONObject())
            .put("leftover", new JSONArray(leftover));
        if (getContext() != null)
            ret.put("context", Namespace.toJSONValue(getContext()));
        return ret;
    }

}
