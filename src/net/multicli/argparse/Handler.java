package net.multicli.argparse;

/**
 * User-supplied fallback invoked for the group or command resolution
 * stopped at; either when no command was given (default handlers) or when
 * the help marker was seen (help handlers).
 */
public interface Handler {

    HandlerAction handle(Node node);

}
