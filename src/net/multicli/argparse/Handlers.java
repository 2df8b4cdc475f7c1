package net.multicli.argparse;

import java.io.PrintStream;

/**
 * Stock handlers and the process-wide default help handler.
 */
public final class Handlers {

    public static final Handler CONTINUE = constant(HandlerAction.CONTINUE);
    public static final Handler RAISE_NO_COMMAND =
        constant(HandlerAction.NO_COMMAND);
    public static final Handler RAISE_HELP = constant(HandlerAction.HELP);

    private static volatile Handler defaultHelpHandler = RAISE_HELP;

    private Handlers() {}

    public static Handler getDefaultHelpHandler() {
        return defaultHelpHandler;
    }
    public static void setDefaultHelpHandler(Handler h) {
        if (h == null)
            throw new NullPointerException(
                "Default help handler may not be null");
        defaultHelpHandler = h;
    }

    public static Handler constant(final HandlerAction action) {
        return new Handler() {
            public HandlerAction handle(Node node) {
                return action;
            }
            public String toString() {
                return "Handlers.constant(" + action + ")";
            }
        };
    }

    public static Handler printUsage(final PrintStream out,
                                     final HandlerAction action) {
        return new Handler() {
            public HandlerAction handle(Node node) {
                out.println(new UsageFormatter().formatUsage(node));
                out.flush();
                return action;
            }
        };
    }

    public static Handler usageAndRaiseHelp(PrintStream out) {
        return printUsage(out, HandlerAction.HELP);
    }

    public static Handler usageAndRaiseNoCommand(PrintStream out) {
        return printUsage(out, HandlerAction.NO_COMMAND);
    }

    public static Handler usageAndExit(PrintStream out) {
        return printUsage(out, HandlerAction.EXIT);
    }

}
