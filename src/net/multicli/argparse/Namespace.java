package net.multicli.argparse;

import java.util.AbstractMap;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.json.JSONArray;
import org.json.JSONObject;

/**
 * Ordered mapping from names to parsed values, with dotted-path lookup.
 * <p>
 * Keys may themselves contain dots (the global namespace of a parse result
 * is keyed by full paths such as {@code vms.instances.list.long}). A lookup
 * of a path tries, in order: the exact key; descending into a nested
 * namespace (struct value) whose key is a prefix of the path; and finally
 * collecting every key under the path into a fresh sub-namespace.
 * {@link #containsKey} answers for the same paths {@link #get} resolves.
 * <p>
 * Namespaces handed out by a parse are frozen; mutating them throws
 * {@link UnsupportedOperationException}.
 */
public class Namespace extends AbstractMap<String, Object> {

    private final Map<String, Object> data;
    private boolean frozen;

    public Namespace() {
        data = new LinkedHashMap<String, Object>();
    }
    public Namespace(Map<String, ?> init) {
        this();
        data.putAll(init);
    }

    public Set<Entry<String, Object>> entrySet() {
        return Collections.unmodifiableMap(data).entrySet();
    }

    public boolean containsKey(Object key) {
        if (! (key instanceof String)) return false;
        return data.containsKey(key) || lookup((String) key) != null;
    }

    public Object get(Object key) {
        if (! (key instanceof String)) return null;
        return lookup((String) key);
    }

    public Object put(String key, Object value) {
        checkMutable();
        if (key == null)
            throw new NullPointerException("Namespace keys may not be null");
        return data.put(key, value);
    }

    public Object remove(Object key) {
        checkMutable();
        return data.remove(key);
    }

    public void clear() {
        checkMutable();
        data.clear();
    }

    public boolean isFrozen() {
        return frozen;
    }

    public void freeze() {
        frozen = true;
    }

    private void checkMutable() {
        if (frozen)
            throw new UnsupportedOperationException("Namespace is frozen");
    }

    public Object lookup(String path) {
        if (data.containsKey(path)) return data.get(path);
        /* Descend into nested namespaces */
        int dot = path.lastIndexOf('.');
        while (dot > 0) {
            Object head = data.get(path.substring(0, dot));
            if (head instanceof Namespace)
                return ((Namespace) head).lookup(path.substring(dot + 1));
            dot = path.lastIndexOf('.', dot - 1);
        }
        /* Collect everything under the prefix */
        String prefix = path + ".";
        Namespace sub = new Namespace();
        for (Map.Entry<String, Object> e : data.entrySet()) {
            if (e.getKey().startsWith(prefix))
                sub.put(e.getKey().substring(prefix.length()), e.getValue());
        }
        if (sub.isEmpty()) return null;
        if (frozen) sub.freeze();
        return sub;
    }

    public <T> T get(String path, Class<T> cls) {
        Object ret = lookup(path);
        if (ret == null) return null;
        if (! cls.isInstance(ret))
            throw new ClassCastException("Value at " + path + " is a " +
                ret.getClass().getName() + ", not a " + cls.getName());
        return cls.cast(ret);
    }

    public String getString(String path) {
        return get(path, String.class);
    }

    public Integer getInt(String path) {
        return get(path, Integer.class);
    }

    public boolean isSet(String path) {
        return Boolean.TRUE.equals(lookup(path));
    }

    public List<?> getList(String path) {
        return get(path, List.class);
    }

    public Namespace getNamespace(String path) {
        return get(path, Namespace.class);
    }

    public JSONObject toJSONObject() {
        JSONObject ret = new JSONObject();
        for (Map.Entry<String, Object> e : data.entrySet()) {
            if (e.getValue() == null) continue;
            ret.put(e.getKey(), toJSONValue(e.getValue()));
        }
        return ret;
    }

    static Object toJSONValue(Object value) {
        if (value instanceof Namespace) {
            return ((Namespace) value).toJSONObject();
        } else if (value instanceof List<?>) {
            JSONArray ret = new JSONArray();
            for (Object item : (List<?>) value) {
                ret.put((item == null) ? JSONObject.NULL : toJSONValue(item));
            }
            return ret;
        } else if (value instanceof Number || value instanceof Boolean ||
                   value instanceof String) {
            return value;
        } else {
            return String.valueOf(value);
        }
    }

}
