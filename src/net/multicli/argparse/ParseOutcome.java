package net.multicli.argparse;

import java.util.Collections;
import java.util.List;

/**
 * What a parse ended with: either a {@link ParseResult}, or a control
 * signal raised by a default or help handler.
 */
public final class ParseOutcome {

    public enum Status {
        RESOLVED,   // A normal result is available
        NO_COMMAND, // No command was selected
        HELP,       // Help was requested
        EXIT        // A handler asked for normal termination
    }

    private final Status status;
    private final ParseResult result;
    private final Node node;
    private final List<String> leftover;

    private ParseOutcome(Status status, ParseResult result, Node node,
                         List<String> leftover) {
        this.status = status;
        this.result = result;
        this.node = node;
        this.leftover = leftover;
    }

    public String toString() {
        return "ParseOutcome[" + status + " at " + node.formatName() + "]";
    }

    public Status getStatus() {
        return status;
    }

    public boolean isResolved() {
        return status == Status.RESOLVED;
    }

    public ParseResult getResult() {
        if (result == null)
            throw new IllegalStateException("No result for outcome " +
                                            status);
        return result;
    }

    /* The node resolution ended at. */
    public Node getNode() {
        return node;
    }

    public List<String> getLeftover() {
        return leftover;
    }

    static ParseOutcome resolved(ParseResult result) {
        List<Node> path = result.getPath();
        return new ParseOutcome(Status.RESOLVED, result,
            path.get(path.size() - 1), result.getLeftover());
    }

    static ParseOutcome signal(Status status, Node node,
                               List<String> leftover) {
        if (status == Status.RESOLVED)
            throw new IllegalArgumentException("Not a signal: " + status);
        return new ParseOutcome(status, null, node,
                                Collections.unmodifiableList(leftover));
    }

}
