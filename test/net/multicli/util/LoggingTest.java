package net.multicli.util;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;
import net.multicli.argparse.MultiLevelParser;
import net.multicli.argparse.ParsingException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LoggingTest {

    @Test
    void parseLevel() {
        assertEquals(Level.FINE, Logging.parseLevel("fine", Level.INFO));
        assertEquals(Level.INFO, Logging.parseLevel("loud", Level.INFO));
        assertEquals(Level.WARNING, Logging.parseLevel(null, Level.WARNING));
    }

    @Test
    void redirect_capturesResolverTrace() throws ParsingException {
        Logger root = Logger.getLogger("");
        Handler[] saved = root.getHandlers();
        Level savedLevel = root.getLevel();
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        try {
            Logging.redirectToStream(buf);
            Logging.setLevel(Level.FINE);
            MultiLevelParser cli = new MultiLevelParser("testcli");
            cli.addGroup("vms").addCommand("list");
            cli.parse(new String[] {"vms", "list"});
        } finally {
            for (Handler h : root.getHandlers()) root.removeHandler(h);
            for (Handler h : saved) root.addHandler(h);
            root.setLevel(savedLevel);
        }
        String text = new String(buf.toByteArray(), StandardCharsets.UTF_8);
        assertTrue(text.contains("Entered group 'vms'"), text);
        assertTrue(text.contains("Selected command 'vms list'"), text);
    }

}
