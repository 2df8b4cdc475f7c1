package net.multicli.argparse;

public enum HandlerAction {
    CONTINUE,   // Carry on as if the handler had not been invoked
    EXIT,       // Caller should terminate normally
    NO_COMMAND, // Report that no command was selected
    HELP        // Report that help was requested
}
