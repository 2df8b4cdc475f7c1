package net.multicli.argparse;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import net.multicli.util.Formats;

/**
 * Splits raw tokens into options, option values and arguments, keeping
 * track of the raw token every piece came from.
 */
public class ArgumentSplitter implements Iterable<String> {

    /* How the next piece of input is to be read. */
    public enum Mode {
        OPTIONS,        // Option syntax is recognized; "-abc" is a cluster
        ARGUMENTS,      // Text after "-a" in "-abc" is a value
        FORCE_ARGUMENTS // Whole tokens, option syntax ignored
    }

    public enum ArgType {
        SHORT_OPTION(true, false), // "-x", possibly within a cluster
        LONG_OPTION(true, false),  // "--name"
        VALUE(false, true),        // "value" in "--name=value" or "-xvalue"
        ARGUMENT(false, true),     // A whole plain token
        SPECIAL(false, false);     // The "--" end-of-options marker

        private final boolean option;
        private final boolean argument;

        private ArgType(boolean option, boolean argument) {
            this.option = option;
            this.argument = argument;
        }

        public boolean isOption() {
            return option;
        }

        public boolean isArgument() {
            return argument;
        }

        public boolean matches(Mode mode) {
            if (this == SPECIAL) return mode != Mode.FORCE_ARGUMENTS;
            switch (mode) {
                case OPTIONS:
                    return option || this == ARGUMENT;
                case ARGUMENTS:
                case FORCE_ARGUMENTS:
                    return argument;
                default:
                    throw new AssertionError("This should not happen!");
            }
        }

    }

    public static class ArgValue {

        private final ArgType type;
        private final String value;
        private final int tokenIndex;

        public ArgValue(ArgType type, String value, int tokenIndex) {
            this.type = type;
            this.value = value;
            this.tokenIndex = tokenIndex;
        }

        public String toString() {
            switch (type) {
                case SHORT_OPTION: return "option -"      +        value ;
                case LONG_OPTION : return "option --"     +        value ;
                case VALUE       : return "option value " + Formats.quote(value);
                case ARGUMENT    : return "token "        + Formats.quote(value);
                case SPECIAL     : return "token "        +        value ;
                default: throw new AssertionError("This should not happen!");
            }
        }

        public ArgType getType() {
            return type;
        }

        public String getValue() {
            return value;
        }

        public int getTokenIndex() {
            return tokenIndex;
        }

    }

    private final List<String> tokens;
    private int nextToken;
    private int valueToken;
    private String value;
    /* 0 at a token boundary; inside a short option cluster, the index of
     * the next letter; after "--name=", the negated start of the value. */
    private int index;
    private int nextIndex;
    private ArgValue peekValue;

    public ArgumentSplitter(List<String> tokens) {
        this.tokens = tokens;
    }

    public List<String> getTokens() {
        return tokens;
    }

    /* Whole raw tokens, as used for the continuation of literals. */
    public Iterator<String> iterator() {
        return new Iterator<String>() {

            public boolean hasNext() {
                return ArgumentSplitter.this.hasNext();
            }

            public String next() {
                ArgValue av = ArgumentSplitter.this.next(
                    Mode.FORCE_ARGUMENTS);
                if (av == null) throw new NoSuchElementException();
                return av.getValue();
            }

        };
    }

    public boolean hasNext() {
        if (peekValue != null || value != null) return true;
        return nextToken < tokens.size();
    }

    /* Index of the raw token the next value would come from. */
    public int getTokenIndex() {
        return (value != null) ? valueToken : nextToken;
    }

    public ArgValue peek(Mode mode) {
        if (peekValue != null && peekValue.getType().matches(mode))
            return peekValue;
        if (value == null && ! load()) return null;
        if (mode == Mode.FORCE_ARGUMENTS || index != 0) {
            peekValue = scanRest(mode);
        } else {
            peekValue = scanToken();
        }
        return peekValue;
    }

    public ArgValue next(Mode mode) {
        ArgValue ret = peek(mode);
        if (ret == null) return null;
        peekValue = null;
        index = nextIndex;
        if (index == 0 || index == value.length()) value = null;
        return ret;
    }

    private boolean load() {
        if (nextToken >= tokens.size()) return false;
        valueToken = nextToken++;
        value = tokens.get(valueToken);
        if (value == null)
            throw new NullPointerException("Null tokens not allowed");
        index = 0;
        return true;
    }

    /* Classifies a fresh token. */
    private ArgValue scanToken() {
        nextIndex = 0;
        if (value.equals("--"))
            return make(ArgType.SPECIAL, value);
        if (value.length() < 2 || value.charAt(0) != '-')
            return make(ArgType.ARGUMENT, value);
        if (value.charAt(1) != '-') {
            nextIndex = 2;
            return make(ArgType.SHORT_OPTION, value.substring(1, 2));
        }
        int eq = value.indexOf('=');
        if (eq == -1)
            return make(ArgType.LONG_OPTION, value.substring(2));
        nextIndex = -(eq + 1);
        return make(ArgType.LONG_OPTION, value.substring(2, eq));
    }

    /* Continues inside a partially consumed token, or takes a whole token
     * verbatim. */
    private ArgValue scanRest(Mode mode) {
        if (mode == Mode.OPTIONS && index > 0) {
            nextIndex = index + 1;
            return make(ArgType.SHORT_OPTION,
                        value.substring(index, index + 1));
        }
        nextIndex = 0;
        return make((index == 0) ? ArgType.ARGUMENT : ArgType.VALUE,
                    value.substring(Math.abs(index)));
    }

    private ArgValue make(ArgType type, String v) {
        return new ArgValue(type, v, valueToken);
    }

    /**
     * Unconsumed input as raw tokens. A partially consumed cluster of
     * short options is returned as an option token of its remainder.
     * The splitter is exhausted afterwards.
     */
    public List<String> drain() {
        List<String> ret = new ArrayList<String>();
        if (value != null) {
            if (index > 0) {
                ret.add("-" + value.substring(index));
            } else if (index < 0) {
                ret.add(value.substring(-index));
            } else {
                ret.add(value);
            }
        }
        ret.addAll(tokens.subList(nextToken, tokens.size()));
        value = null;
        peekValue = null;
        nextToken = tokens.size();
        return ret;
    }

}
