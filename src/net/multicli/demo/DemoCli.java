package net.multicli.demo;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import net.multicli.argparse.Command;
import net.multicli.argparse.Group;
import net.multicli.argparse.Handlers;
import net.multicli.argparse.MultiLevelParser;
import net.multicli.argparse.Node;
import net.multicli.argparse.ParseOutcome;
import net.multicli.argparse.ParseResult;
import net.multicli.argparse.ParsingException;
import net.multicli.argparse.UsageFormatter;
import net.multicli.types.TypeSpec;
import net.multicli.util.Logging;
import net.multicli.util.config.Configuration;

/**
 * Sample program exercising groups, commands, compound arguments and
 * global options. Prints the parse result as JSON.
 */
public class DemoCli {

    public static final String APPNAME = "multicli-demo";
    public static final String PARTIAL_SWITCH = "--partial";

    public static final int EXIT_OK = 0;
    public static final int EXIT_NO_COMMAND = 1;
    public static final int EXIT_ERROR = 2;

    private static final Logger LOGGER;

    static {
        Logging.initFormat();
        LOGGER = Logger.getLogger("DemoCli");
    }

    private final PrintStream out;
    private final PrintStream err;
    private final MultiLevelParser parser;

    public DemoCli(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
        this.parser = createParser(out);
    }

    public MultiLevelParser getParser() {
        return parser;
    }

    public int run(String[] args) {
        List<String> tokens = new ArrayList<String>(Arrays.asList(args));
        boolean partial = false;
        if (! tokens.isEmpty() && tokens.get(0).equals(PARTIAL_SWITCH)) {
            tokens.remove(0);
            partial = true;
        }
        ParseOutcome outcome;
        try {
            outcome = parser.parse(tokens, partial);
        } catch (ParsingException exc) {
            LOGGER.log(Level.FINE, "Parsing failed", exc);
            err.println("ERROR: " + exc.getMessage());
            return EXIT_ERROR;
        }
        switch (outcome.getStatus()) {
            case RESOLVED:
                return report(outcome.getResult());
            case NO_COMMAND:
                err.println("ERROR: No command given");
                err.println(new UsageFormatter().formatUsageLine(
                    outcome.getNode()));
                return EXIT_NO_COMMAND;
            case HELP:
            case EXIT:
                return EXIT_OK;
            default:
                throw new AssertionError("This should not happen!");
        }
    }

    protected int report(ParseResult r) {
        Command cmd = r.getCommand();
        boolean quiet = r.getGlobal().isSet("quiet");
        if (cmd != null && cmd.getName().equals("tree")) {
            Integer levels = r.getGlobal().getInt("treelevels");
            printTree(parser, 0, (levels == null) ? Integer.MAX_VALUE :
                      levels);
        } else if (cmd != null && cmd.getName().equals("syntax")) {
            out.println(new UsageFormatter().formatUsage(parser));
        } else if (! quiet) {
            out.println(r.toJSONObject().toString(2));
        }
        return EXIT_OK;
    }

    protected void printTree(Node node, int depth, int maxDepth) {
        if (depth > maxDepth) return;
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < depth; i++) sb.append("  ");
        sb.append((depth == 0) ? APPNAME : node.getName());
        if (node instanceof Group && depth != 0) sb.append('/');
        out.println(sb);
        for (Node child : node.getChildren())
            printTree(child, depth + 1, maxDepth);
    }

    public static MultiLevelParser createParser(PrintStream out) {
        MultiLevelParser cli = new MultiLevelParser(APPNAME,
            "Sample multi-level command line.");
        cli.setHelpHandler(Handlers.usageAndRaiseHelp(out));
        cli.addOption('t', "treelevels", TypeSpec.INT,
                      "max tree levels to process", "7");
        cli.addFlag('q', "quiet", "do not emit messages");

        Group vms = cli.addGroup("vms", "commands on virtual machines");
        Group instances = vms.addGroup("instances",
                                       "commands on vm instances");
        Command listInstances = instances.addCommand("list",
                                                     "list instances");
        listInstances.addFlag('l', "long", "use long listing");

        Group networks = cli.addGroup("networks", "commands on networks");
        networks.addCommand("list", "list networks");

        cli.addCommand("tree", "show command tree");
        cli.addCommand("syntax", "show command line syntax");

        Command user = cli.addCommand("user", "add user using parameters");
        user.addArgument("name", TypeSpec.STRING);
        user.addArgument("age", TypeSpec.INT, "in years");
        user.addArgument("weight", TypeSpec.FLOAT, "in KG");
        user.addFlag('m', "married", null);
        user.addOption(null, "spouse", TypeSpec.STRING, "name of spouse");

        Command children = cli.addCommand("children",
            "add children using array parameters and options");
        children.addArgument("number", TypeSpec.INT, "number of children");
        children.addArgument("ages", TypeSpec.array(TypeSpec.INT),
                             "age list of children");
        children.addOption(null, "names", TypeSpec.array(TypeSpec.STRING),
                           "name list of children");

        TypeSpec person = TypeSpec.struct()
            .field("name", TypeSpec.STRING)
            .field("age", TypeSpec.INT)
            .build();
        cli.addCommand("person", "add a person using a struct parameter")
            .addArgument("record", person, "a person record");

        TypeSpec member = TypeSpec.struct()
            .field("name", TypeSpec.STRING)
            .field("age", TypeSpec.INT)
            .optionalField("children", TypeSpec.array(person))
            .build();
        cli.addCommand("family", "add a family using a compound parameter")
            .addArgument("members", TypeSpec.array(member),
                         "member records");
        return cli;
    }

    public static void main(String[] args) {
        Logging.redirectToStream(System.err);
        Logging.setLevel(Logging.parseLevel(
            Configuration.DEFAULT.get(Configuration.LOG_LEVEL),
            Level.WARNING));
        System.exit(new DemoCli(System.out, System.err).run(args));
    }

}
