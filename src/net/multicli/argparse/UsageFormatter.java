package net.multicli.argparse;

import java.util.ArrayList;
import java.util.Formatter;
import java.util.List;
import net.multicli.util.config.Configuration;
import net.multicli.util.config.DynamicConfiguration;

/**
 * Renders usage text for a group or command.
 */
public class UsageFormatter {

    public static final String USAGE_LINE_HEADER = "USAGE: ";
    public static final int DEFAULT_WIDTH = 80;
    public static final String DEFAULT_PROG_NAME = "multicli";

    private final Configuration config;

    public UsageFormatter(Configuration config) {
        this.config = config;
    }
    public UsageFormatter() {
        this(Configuration.DEFAULT);
    }

    public int getWidth() {
        return DynamicConfiguration.getInt(config, Configuration.HELP_WIDTH,
                                           DEFAULT_WIDTH);
    }

    public String formatProgName(Node node) {
        String ret = node.getRoot().getName();
        if (ret == null || ret.isEmpty()) ret = config.get(
            Configuration.PROG_NAME);
        return (ret == null || ret.isEmpty()) ? DEFAULT_PROG_NAME : ret;
    }

    public String formatUsageLine(Node node) {
        StringBuilder sb = new StringBuilder(USAGE_LINE_HEADER);
        sb.append(formatProgName(node));
        String path = node.formatPath(" ");
        if (! path.isEmpty()) sb.append(' ').append(path);
        for (Option o : node.getOptions()) {
            sb.append(" [").append(o.formatFlags("|"));
            if (! o.isFlag())
                sb.append(" <").append(o.getType().formatName()).append('>');
            sb.append(']');
        }
        if (node instanceof Command) {
            for (Argument a : ((Command) node).getArguments()) {
                sb.append(" <").append(a.getName()).append('>');
            }
        } else if (! node.getChildren().isEmpty()) {
            List<String> names = new ArrayList<String>();
            for (Node child : node.getChildren()) names.add(child.getName());
            sb.append(" {").append(String.join("|", names)).append('}');
        }
        List<String> wrapped = HelpLine.wrap(sb.toString(), getWidth());
        return String.join(String.format("%n") + "        ", wrapped);
    }

    public String formatUsage(Node node) {
        StringBuilder sb = new StringBuilder(formatUsageLine(node));
        Formatter f = new Formatter(sb);
        if (node.getDescription() != null) {
            f.format("%n");
            for (String line : HelpLine.wrap(node.getDescription(),
                                             getWidth())) {
                f.format("%s%n", line);
            }
        } else {
            f.format("%n");
        }
        if (node instanceof Command) {
            List<HelpLine> args = new ArrayList<HelpLine>();
            for (Argument a : ((Command) node).getArguments()) {
                args.add(new HelpLine("<" + a.getName() + ">",
                    a.getType().formatName(), a.getDescription()));
            }
            section(f, "Arguments:", args);
        }
        List<HelpLine> opts = new ArrayList<HelpLine>();
        for (Option o : node.getVisibleOptions()) {
            HelpLine l = new HelpLine(o.formatFlags(", "),
                (o.isFlag()) ? "" : o.getType().formatName(),
                o.getDescription());
            if (o.getDefaultLiteral() != null)
                l.withAddendum("default " + o.getDefaultLiteral());
            if (o.getOwner() != node)
                l.withAddendum("from " + o.getOwner().formatName());
            opts.add(l);
        }
        section(f, "Options:", opts);
        if (node instanceof Group) {
            List<HelpLine> cmds = new ArrayList<HelpLine>();
            for (Command c : ((Group) node).getCommands()) {
                cmds.add(new HelpLine(c.getName(), null, c.getDescription()));
            }
            section(f, "Commands:", cmds);
            List<HelpLine> groups = new ArrayList<HelpLine>();
            for (Group g : ((Group) node).getGroups()) {
                groups.add(new HelpLine(g.getName(), null,
                                        g.getDescription()));
            }
            section(f, "Groups:", groups);
        }
        f.flush();
        return sb.toString().replaceAll("\\s+$", "");
    }

    private void section(Formatter f, String title, List<HelpLine> lines) {
        if (lines.isEmpty()) return;
        f.format("%n%s%n", title);
        HelpLine.format(lines, f, getWidth());
    }

}
