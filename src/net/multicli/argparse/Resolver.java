package net.multicli.argparse;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import net.multicli.types.LiteralException;
import net.multicli.types.LiteralParser;
import net.multicli.types.LiteralReader;
import net.multicli.types.TypeSpec;
import net.multicli.util.Formats;

/**
 * Walks raw tokens through the command tree.
 * <p>
 * At a group, leading option tokens are consumed against the options
 * visible there, then the next token selects a child group (descend) or
 * command. At a command, option tokens are consumed likewise and every
 * other token fills the next declared argument. Option tokens are always
 * tried as options first.
 * <p>
 * A resolver is good for a single parse; the tree is only read.
 */
public class Resolver {

    public enum State {
        AT_GROUP,
        AT_COMMAND,
        RESOLVED,
        NO_COMMAND_SIGNALED,
        HELP_SIGNALED,
        EXIT_SIGNALED
    }

    public static final char HELP_SHORT = 'h';
    public static final String HELP_LONG = "help";

    private static final Logger LOGGER = Logger.getLogger("Resolver");

    private final Group root;
    private final boolean partial;
    private final ArgumentSplitter splitter;
    private final List<Node> path;
    private final Map<Node, Map<String, Object>> optionValues;
    private final Map<String, Object> argumentValues;
    private State state;
    private Node node;
    private int argumentCount;
    private boolean argumentsOnly;
    private List<String> leftover;

    public Resolver(Group root, List<String> tokens, boolean partial) {
        this.root = root;
        this.partial = partial;
        this.splitter = new ArgumentSplitter(tokens);
        this.path = new ArrayList<Node>();
        this.optionValues = new LinkedHashMap<Node, Map<String, Object>>();
        this.argumentValues = new LinkedHashMap<String, Object>();
        this.leftover = Collections.emptyList();
    }

    public State getState() {
        return state;
    }

    public Node getNode() {
        return node;
    }

    public boolean isPartial() {
        return partial;
    }

    public List<String> getLeftover() {
        return leftover;
    }

    public ParseOutcome resolve() throws ParsingException {
        if (state != null)
            throw new IllegalStateException("Resolver already used");
        enter(root);
        for (;;) {
            switch (state) {
                case AT_GROUP:
                    stepGroup();
                    break;
                case AT_COMMAND:
                    stepCommand();
                    break;
                default:
                    return finish();
            }
        }
    }

    private void enter(Node n) {
        node = n;
        path.add(n);
        optionValues.put(n, new LinkedHashMap<String, Object>());
        if (n instanceof Command) {
            LOGGER.fine("Selected command " + n.formatName());
            state = State.AT_COMMAND;
        } else {
            LOGGER.fine("Entered group " + n.formatName());
            state = State.AT_GROUP;
        }
    }

    private void stepGroup() throws ParsingException {
        ArgumentSplitter.ArgValue av = splitter.peek(
            ArgumentSplitter.Mode.OPTIONS);
        if (av == null) {
            noCommand();
            return;
        }
        switch (av.getType()) {
            case SHORT_OPTION:
            case LONG_OPTION:
                consumeOption(av);
                return;
            case VALUE:
                throw new AssertionError("Orphan " + av);
            default:
                break;
        }
        Node child = ((Group) node).getChild(av.getValue());
        if (child == null) {
            stop(ParseError.UNKNOWN_COMMAND, "Unknown command or group", av,
                 describeChildren((Group) node));
            if (state == State.AT_GROUP) noCommand();
            return;
        }
        splitter.next(ArgumentSplitter.Mode.OPTIONS);
        enter(child);
    }

    private void stepCommand() throws ParsingException {
        Command cmd = (Command) node;
        ArgumentSplitter.Mode mode = (argumentsOnly) ?
            ArgumentSplitter.Mode.FORCE_ARGUMENTS :
            ArgumentSplitter.Mode.OPTIONS;
        ArgumentSplitter.ArgValue av = splitter.peek(mode);
        if (av == null) {
            completeCommand();
            return;
        }
        switch (av.getType()) {
            case SHORT_OPTION:
            case LONG_OPTION:
                consumeOption(av);
                return;
            case SPECIAL:
                splitter.next(mode);
                argumentsOnly = true;
                return;
            case VALUE:
                throw new AssertionError("Orphan " + av);
            default:
                break;
        }
        List<Argument> args = cmd.getArguments();
        if (argumentCount >= args.size()) {
            stop(ParseError.TOO_MANY_ARGUMENTS, "Superfluous", av,
                 args.size() + " argument(s)");
            if (state == State.AT_COMMAND) completeCommand();
            return;
        }
        Argument arg = args.get(argumentCount++);
        splitter.next(mode);
        argumentValues.put(arg.getName(),
                           parseLiteral(arg.getType(), av, arg.formatName()));
    }

    private void completeCommand() throws ParsingException {
        Command cmd = (Command) node;
        int declared = cmd.getArguments().size();
        if (argumentCount < declared) {
            if (argumentCount == 0 && cmd.getDefaultHandler() != null) {
                HandlerAction action = cmd.getDefaultHandler().handle(cmd);
                LOGGER.fine("Default handler of " + cmd.formatName() +
                            " returned " + action);
                if (action != HandlerAction.CONTINUE) {
                    signal(action);
                    return;
                }
            }
            Argument missing = cmd.getArguments().get(argumentCount);
            throw new ParsingException(ParseError.MISSING_ARGUMENT,
                "Missing " + missing.formatName() + " (" + argumentCount +
                " of " + declared + " given) for", splitter.getTokenIndex(),
                missing.getType().formatName(), cmd.formatName());
        }
        state = State.RESOLVED;
    }

    private void noCommand() {
        Handler h = node.findDefaultHandler();
        HandlerAction action = h.handle(node);
        LOGGER.fine("No command after " + node.formatName() +
                    "; default handler returned " + action);
        if (action == HandlerAction.CONTINUE) {
            state = State.RESOLVED;
        } else {
            signal(action);
        }
    }

    private void consumeOption(ArgumentSplitter.ArgValue av)
            throws ParsingException {
        Option opt = node.findOption(av);
        if (opt == null) {
            if (node.isHelpEnabled() && isHelpMarker(av)) {
                splitter.next(ArgumentSplitter.Mode.OPTIONS);
                HandlerAction action = node.findHelpHandler().handle(node);
                LOGGER.fine("Help requested at " + node.formatName() +
                            "; handler returned " + action);
                if (action != HandlerAction.CONTINUE) signal(action);
                return;
            }
            stop(ParseError.UNKNOWN_OPTION, "Unrecognized", av,
                 "option of " + node.formatName());
            if (state == State.AT_GROUP) {
                noCommand();
            } else if (state == State.AT_COMMAND) {
                completeCommand();
            }
            return;
        }
        splitter.next(ArgumentSplitter.Mode.OPTIONS);
        Object value;
        if (opt.isFlag()) {
            ArgumentSplitter.ArgValue attached = splitter.peek(
                ArgumentSplitter.Mode.OPTIONS);
            if (attached != null &&
                    attached.getType() == ArgumentSplitter.ArgType.VALUE)
                throw new ParsingException(ParseError.INVALID_VALUE,
                    "Unexpected " + attached + " for flag",
                    attached.getTokenIndex(), null, opt.formatName());
            value = Boolean.TRUE;
        } else {
            ArgumentSplitter.ArgValue v = splitter.next(
                ArgumentSplitter.Mode.FORCE_ARGUMENTS);
            if (v == null)
                throw new ParsingException(ParseError.MISSING_ARGUMENT,
                    "Missing value for", splitter.getTokenIndex(),
                    opt.getType().formatName(), opt.formatName());
            value = parseLiteral(opt.getType(), v, opt.formatName());
        }
        optionValues.get(opt.getOwner()).put(opt.getKey(), value);
    }

    private Object parseLiteral(TypeSpec type, ArgumentSplitter.ArgValue av,
                                String source) throws ParsingException {
        List<String> pieces;
        if (type.isScalar()) {
            pieces = Collections.singletonList(av.getValue());
        } else {
            pieces = LiteralReader.gather(av.getValue(), splitter);
        }
        LiteralReader reader = new LiteralReader(pieces, av.getTokenIndex());
        try {
            return new LiteralParser(reader).parse(type);
        } catch (LiteralException exc) {
            throw new LiteralException(exc, exc.getTokenIndex(),
                                       exc.getOffset(), "for " + source);
        }
    }

    /* Fails, unless partial mode turns the error into leftover input. */
    private void stop(ParseError kind, String message,
                      ArgumentSplitter.ArgValue av, String expected)
            throws ParsingException {
        if (! partial || ! kind.isBoundary())
            throw new ParsingException(kind, message + " " + av,
                av.getTokenIndex(), expected, "in " + node.formatName());
        leftover = Collections.unmodifiableList(splitter.drain());
        LOGGER.fine("Partial parse stopped at " + av + " in " +
                    node.formatName() + "; leftover " +
                    Formats.formatTokens(leftover));
    }

    private void signal(HandlerAction action) {
        switch (action) {
            case NO_COMMAND:
                state = State.NO_COMMAND_SIGNALED;
                break;
            case HELP:
                state = State.HELP_SIGNALED;
                break;
            case EXIT:
                state = State.EXIT_SIGNALED;
                break;
            default:
                throw new IllegalArgumentException("Not a signal: " + action);
        }
    }

    private ParseOutcome finish() {
        switch (state) {
            case RESOLVED:
                Command cmd = (node instanceof Command) ? (Command) node : null;
                return ParseOutcome.resolved(NamespaceMerger.merge(path, cmd,
                    optionValues, argumentValues, leftover));
            case NO_COMMAND_SIGNALED:
                return ParseOutcome.signal(ParseOutcome.Status.NO_COMMAND,
                                           node, leftover);
            case HELP_SIGNALED:
                return ParseOutcome.signal(ParseOutcome.Status.HELP, node,
                                           leftover);
            case EXIT_SIGNALED:
                return ParseOutcome.signal(ParseOutcome.Status.EXIT, node,
                                           leftover);
            default:
                throw new AssertionError("Unfinished state " + state);
        }
    }

    static boolean isHelpMarker(ArgumentSplitter.ArgValue av) {
        switch (av.getType()) {
            case SHORT_OPTION:
                return av.getValue().charAt(0) == HELP_SHORT;
            case LONG_OPTION:
                return av.getValue().equals(HELP_LONG);
            default:
                return false;
        }
    }

    private static String describeChildren(Group g) {
        List<String> names = new ArrayList<String>();
        for (Node n : g.getChildren()) names.add(n.getName());
        return (names.isEmpty()) ? "no sub-command" :
            "one of " + Formats.join(", ", names);
    }

}
