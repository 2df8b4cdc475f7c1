package net.multicli.argparse;

import java.util.Arrays;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NamespaceTest {

    private static Namespace sample() {
        Namespace record = new Namespace();
        record.put("name", "joe");
        record.put("age", 27);
        Namespace ns = new Namespace();
        ns.put("quiet", false);
        ns.put("vms.instances.list.long", true);
        ns.put("person.record", record);
        ns.put("children.ages", Arrays.asList(1, 2));
        ns.put("spouse", null);
        return ns;
    }

    @Test
    void lookup_exactKey() {
        Namespace ns = sample();
        assertEquals(Boolean.TRUE, ns.get("vms.instances.list.long"));
        assertEquals(Boolean.FALSE, ns.get("quiet"));
        assertTrue(ns.containsKey("spouse"));
        assertNull(ns.get("spouse"));
        assertNull(ns.get(42));
    }

    @Test
    void lookup_descendsIntoStructs() {
        Namespace ns = sample();
        assertEquals("joe", ns.getString("person.record.name"));
        assertEquals(Integer.valueOf(27), ns.getInt("person.record.age"));
        assertNull(ns.get("person.record.height"));
    }

    @Test
    void lookup_collectsPrefix() {
        Namespace ns = sample();
        Namespace list = ns.getNamespace("vms.instances.list");
        assertEquals(1, list.size());
        assertTrue(list.isSet("long"));
        assertTrue(ns.getNamespace("vms").isSet("instances.list.long"));
        assertEquals("joe", ns.getNamespace("person").get("record.name"));
        assertNull(ns.get("networks"));
    }

    @Test
    void containsKey_followsLookup() {
        Namespace ns = sample();
        assertTrue(ns.containsKey("person.record.name"));
        assertTrue(ns.containsKey("vms.instances"));
        assertFalse(ns.containsKey("person.record.height"));
        assertFalse(ns.containsKey(42));
    }

    @Test
    void frozenRejectsChanges() {
        Namespace ns = sample();
        ns.freeze();
        assertTrue(ns.isFrozen());
        assertThrows(UnsupportedOperationException.class,
                     () -> ns.put("quiet", true));
        assertThrows(UnsupportedOperationException.class,
                     () -> ns.remove("quiet"));
        assertThrows(UnsupportedOperationException.class, () -> ns.clear());
        assertTrue(ns.getNamespace("vms").isFrozen());
        assertEquals(Boolean.FALSE, ns.get("quiet"));
    }

    @Test
    void typedAccess() {
        Namespace ns = sample();
        assertEquals(Arrays.asList(1, 2), ns.getList("children.ages"));
        assertFalse(ns.isSet("quiet"));
        assertFalse(ns.isSet("missing"));
        assertThrows(ClassCastException.class,
                     () -> ns.getString("quiet"));
    }

    @Test
    void entriesAreReadOnly() {
        Namespace ns = sample();
        assertThrows(UnsupportedOperationException.class,
                     () -> ns.entrySet().clear());
        ns.remove("quiet");
        assertFalse(ns.containsKey("quiet"));
        assertThrows(NullPointerException.class, () -> ns.put(null, 1));
    }

    @Test
    void json_skipsAbsentValues() {
        JSONObject obj = sample().toJSONObject();
        assertFalse(obj.has("spouse"));
        assertTrue(obj.getBoolean("vms.instances.list.long"));
        assertEquals("joe", obj.getJSONObject("person.record")
            .getString("name"));
        assertEquals(2, obj.getJSONArray("children.ages").getInt(1));
    }

}
