package net.multicli.util.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class DynamicConfigurationTest {

    private static Configuration constant(final String key,
                                          final String value) {
        return new Configuration() {
            public String get(String k) {
                return (k.equals(key)) ? value : null;
            }
        };
    }

    @Test
    void sourcesInOrder() {
        DynamicConfiguration config = new DynamicConfiguration();
        config.addSource(constant("a", "first"));
        config.addSource(constant("a", "second"));
        config.addSource(constant("b", "other"));
        assertEquals("first", config.get("a"));
        assertEquals("other", config.get("b"));
        assertNull(config.get("c"));
    }

    @Test
    void explicitValuesOverride() {
        DynamicConfiguration config = new DynamicConfiguration();
        config.addSource(constant(Configuration.HELP_WIDTH, "60"));
        config.put(Configuration.HELP_WIDTH, "100");
        assertEquals(100, config.getInt(Configuration.HELP_WIDTH, 80));
        config.remove(Configuration.HELP_WIDTH);
        assertEquals(60, config.getInt(Configuration.HELP_WIDTH, 80));
    }

    @Test
    void getInt_fallback() {
        DynamicConfiguration config = new DynamicConfiguration();
        config.put("width", "wide");
        assertEquals(80, config.getInt("width", 80));
        assertEquals(80, config.getInt("absent", 80));
        assertEquals(42, DynamicConfiguration.getInt(
            constant("width", " 42 "), "width", 80));
    }

    @Test
    void propertySource() {
        String key = "multicli.test.property";
        System.setProperty(key, "set");
        try {
            assertEquals("set", DynamicConfiguration.makeDefault().get(key));
        } finally {
            System.clearProperty(key);
        }
    }

}
