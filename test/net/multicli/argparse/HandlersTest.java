package net.multicli.argparse;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HandlersTest {

    @Test
    void constants() {
        Node node = new MultiLevelParser("x");
        assertEquals(HandlerAction.CONTINUE, Handlers.CONTINUE.handle(node));
        assertEquals(HandlerAction.NO_COMMAND,
                     Handlers.RAISE_NO_COMMAND.handle(node));
        assertEquals(HandlerAction.HELP, Handlers.RAISE_HELP.handle(node));
    }

    @Test
    void usageAndExit_printsUsage() throws ParsingException {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        PrintStream out = new PrintStream(buf, true);
        MultiLevelParser cli = new MultiLevelParser("testcli");
        cli.addGroup("vms").setHelpHandler(Handlers.usageAndExit(out));
        ParseOutcome outcome = cli.parse(new String[] {"vms", "-h"});
        assertEquals(ParseOutcome.Status.EXIT, outcome.getStatus());
        String text = new String(buf.toByteArray(),
                                 StandardCharsets.UTF_8);
        assertTrue(text.startsWith("USAGE: testcli vms"), text);
    }

    @Test
    void usageAndRaiseNoCommand_asDefaultHandler() throws ParsingException {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        MultiLevelParser cli = new MultiLevelParser("testcli");
        cli.addCommand("run");
        cli.setDefaultHandler(Handlers.usageAndRaiseNoCommand(
            new PrintStream(buf, true)));
        assertEquals(ParseOutcome.Status.NO_COMMAND,
                     cli.parse(new String[0]).getStatus());
        assertTrue(buf.size() > 0);
    }

    @Test
    void defaultHelpHandler_processWide() throws ParsingException {
        Handler saved = Handlers.getDefaultHelpHandler();
        try {
            Handlers.setDefaultHelpHandler(Handlers.constant(
                HandlerAction.EXIT));
            MultiLevelParser cli = new MultiLevelParser("testcli");
            assertEquals(ParseOutcome.Status.EXIT,
                         cli.parse(new String[] {"--help"}).getStatus());
        } finally {
            Handlers.setDefaultHelpHandler(saved);
        }
        assertSame(saved, Handlers.getDefaultHelpHandler());
        assertThrows(NullPointerException.class,
                     () -> Handlers.setDefaultHelpHandler(null));
    }

}
