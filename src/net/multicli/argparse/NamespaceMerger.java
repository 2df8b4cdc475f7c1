package net.multicli.argparse;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the namespaces of a resolved parse from the values the resolver
 * collected.
 */
final class NamespaceMerger {

    private NamespaceMerger() {}

    public static ParseResult merge(List<Node> path, Command command,
                                    Map<Node, Map<String, Object>> explicit,
                                    Map<String, Object> arguments,
                                    List<String> leftover) {
        Map<Node, Namespace> levels = new LinkedHashMap<Node, Namespace>();
        Namespace global = new Namespace();
        for (Node level : path) {
            Namespace ns = mergeLevel(level, explicit.get(level));
            levels.put(level, ns);
            String prefix = prefixOf(level);
            for (Map.Entry<String, Object> e : ns.entrySet())
                global.put(prefix + e.getKey(), e.getValue());
        }
        Namespace args = new Namespace();
        if (command != null) {
            String prefix = prefixOf(command);
            for (Argument a : command.getArguments()) {
                if (! arguments.containsKey(a.getName())) continue;
                Object value = arguments.get(a.getName());
                args.put(a.getName(), value);
                global.put(prefix + a.getName(), value);
            }
        }
        args.freeze();
        global.freeze();
        return new ParseResult(command, path, levels, args, global, leftover);
    }

    /* Declared defaults overridden by explicit values, in declaration
     * order. */
    static Namespace mergeLevel(Node level, Map<String, Object> values) {
        Namespace ret = new Namespace();
        for (Option opt : level.getOptions()) {
            if (values != null && values.containsKey(opt.getKey())) {
                ret.put(opt.getKey(), values.get(opt.getKey()));
            } else if (opt.isFlag() || opt.hasDefault()) {
                ret.put(opt.getKey(), opt.getDefault());
            }
        }
        ret.freeze();
        return ret;
    }

    private static String prefixOf(Node level) {
        String path = level.formatPath(".");
        return (path.isEmpty()) ? "" : path + ".";
    }

}
