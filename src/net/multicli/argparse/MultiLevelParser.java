package net.multicli.argparse;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Logger;

/**
 * The root group of a command tree, and the entry point for parsing.
 * <p>
 * The tree is built through {@link #addGroup}, {@link #addCommand},
 * {@link #addOption} and friends, and is frozen by the first parse: later
 * modifications anywhere in the tree fail with an
 * {@link IllegalStateException}. Parsing a frozen tree is safe from
 * multiple threads.
 */
public class MultiLevelParser extends Group {

    private static final Logger LOGGER = Logger.getLogger("MultiLevelParser");

    private volatile boolean frozen;

    public MultiLevelParser(String progName, String description) {
        super(progName, null, description);
    }
    public MultiLevelParser(String progName) {
        this(progName, null);
    }
    public MultiLevelParser() {
        this(null, null);
    }

    protected boolean isFrozen() {
        return frozen;
    }

    public void freeze() {
        if (! frozen) LOGGER.finer("Freezing command tree");
        frozen = true;
    }

    public ParseOutcome parse(List<String> tokens, boolean partial)
            throws ParsingException {
        freeze();
        List<String> copy = new ArrayList<String>(tokens);
        LOGGER.fine("Parsing " + copy.size() + " token(s)" +
                    ((partial) ? " in partial mode" : ""));
        return new Resolver(this, copy, partial).resolve();
    }
    public ParseOutcome parse(List<String> tokens) throws ParsingException {
        return parse(tokens, false);
    }
    public ParseOutcome parse(String[] tokens, boolean partial)
            throws ParsingException {
        return parse(Arrays.asList(tokens), partial);
    }
    public ParseOutcome parse(String[] tokens) throws ParsingException {
        return parse(Arrays.asList(tokens), false);
    }

    /* Splits a single command line the way a shell would; see
     * CommandLineTokenizer. */
    public ParseOutcome parse(String cmdline, boolean partial)
            throws ParsingException {
        return parse(CommandLineTokenizer.tokenize(cmdline), partial);
    }
    public ParseOutcome parse(String cmdline) throws ParsingException {
        return parse(cmdline, false);
    }

}
