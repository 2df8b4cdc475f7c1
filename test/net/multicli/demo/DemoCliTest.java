package net.multicli.demo;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import org.json.JSONObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DemoCliTest {

    private ByteArrayOutputStream outBuf;
    private ByteArrayOutputStream errBuf;
    private DemoCli demo;

    @BeforeEach
    void setUp() {
        outBuf = new ByteArrayOutputStream();
        errBuf = new ByteArrayOutputStream();
        demo = new DemoCli(new PrintStream(outBuf, true),
                           new PrintStream(errBuf, true));
    }

    private String out() {
        return new String(outBuf.toByteArray(), StandardCharsets.UTF_8);
    }

    private String err() {
        return new String(errBuf.toByteArray(), StandardCharsets.UTF_8);
    }

    @Test
    void resolvedPrintsJson() {
        assertEquals(DemoCli.EXIT_OK,
                     demo.run(new String[] {"vms", "instances", "list",
                                            "-l"}));
        JSONObject obj = new JSONObject(out());
        assertEquals("vms.instances.list", obj.getString("command"));
        assertTrue(obj.getJSONObject("global")
            .getBoolean("vms.instances.list.long"));
        assertEquals(7, obj.getJSONObject("global").getInt("treelevels"));
    }

    @Test
    void familyMembers() {
        assertEquals(DemoCli.EXIT_OK, demo.run(new String[] {"family",
            "[{name=Sara,age=34},", "{name=Joe,age=33,",
            "children=[{name=Mike,age=3}]}]"}));
        JSONObject joe = new JSONObject(out()).getJSONObject("args")
            .getJSONArray("members").getJSONObject(1);
        assertEquals("Mike", joe.getJSONArray("children").getJSONObject(0)
            .getString("name"));
    }

    @Test
    void partialSwitch() {
        assertEquals(DemoCli.EXIT_OK, demo.run(new String[] {"--partial",
            "user", "Jack", "28", "72.8", "-m", "--spouse", "Maria",
            "extra1", "extra2"}));
        JSONObject obj = new JSONObject(out());
        assertEquals(2, obj.getJSONArray("leftover").length());
        assertEquals("Maria", obj.getJSONObject("global")
            .getString("user.spouse"));
    }

    @Test
    void noCommand() {
        assertEquals(DemoCli.EXIT_NO_COMMAND, demo.run(new String[] {"-q"}));
        assertTrue(err().contains("No command given"), err());
        assertTrue(err().contains("USAGE: multicli-demo"), err());
    }

    @Test
    void parseError() {
        assertEquals(DemoCli.EXIT_ERROR,
                     demo.run(new String[] {"user", "Jack"}));
        assertTrue(err().startsWith("ERROR: Missing argument <age>"),
                   err());
        assertEquals(DemoCli.EXIT_ERROR,
                     demo.run(new String[] {"children", "2", "[1,"}));
    }

    @Test
    void help() {
        assertEquals(DemoCli.EXIT_OK,
                     demo.run(new String[] {"user", "--help"}));
        assertTrue(out().startsWith("USAGE: multicli-demo user"), out());
        assertTrue(out().contains("in years"), out());
    }

    @Test
    void quiet() {
        assertEquals(DemoCli.EXIT_OK, demo.run(new String[] {"-q", "person",
            "{name=joe,age=27}"}));
        assertEquals("", out());
    }

    @Test
    void tree() {
        assertEquals(DemoCli.EXIT_OK, demo.run(new String[] {"tree"}));
        assertTrue(out().contains("    instances/"), out());
        assertTrue(out().contains("      list"), out());
    }

    @Test
    void treeLevels() {
        assertEquals(DemoCli.EXIT_OK,
                     demo.run(new String[] {"-t", "1", "tree"}));
        assertTrue(out().contains("  vms/"), out());
        assertFalse(out().contains("instances"), out());
    }

}
