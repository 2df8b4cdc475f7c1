package net.multicli.util.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

public class DynamicConfiguration implements Configuration {

    public static final Configuration PROPERTY_SOURCE = new Configuration() {
        public String get(String key) {
            return System.getProperty(key);
        }
    };

    public static final Configuration ENV_SOURCE = new Configuration() {
        public String get(String key) {
            return System.getenv(key.toUpperCase().replace(".", "_"));
        }
    };

    private static final Logger LOGGER =
        Logger.getLogger("DynamicConfiguration");

    private final List<Configuration> sources;
    private final Map<String, String> data;

    public DynamicConfiguration() {
        sources = new ArrayList<Configuration>();
        data = new LinkedHashMap<String, String>();
    }

    public synchronized Map<String, String> getData() {
        return new LinkedHashMap<String, String>(data);
    }

    public synchronized String get(String key) {
        if (data.containsKey(key)) return data.get(key);
        String ret = null;
        for (Configuration src : sources) {
            ret = src.get(key);
            if (ret != null) break;
        }
        data.put(key, ret);
        return ret;
    }

    public synchronized void put(String key, String value) {
        data.put(key, value);
    }

    public synchronized void remove(String key) {
        data.remove(key);
    }

    public synchronized void addSource(Configuration source) {
        sources.add(source);
    }
    public synchronized void removeSource(Configuration source) {
        sources.remove(source);
    }

    public int getInt(String key, int fallback) {
        String value = get(key);
        if (value == null) return fallback;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException exc) {
            LOGGER.warning("Configuration value " + key + "=" + value +
                " is not an integer, using " + fallback);
            return fallback;
        }
    }

    public static int getInt(Configuration config, String key,
                             int fallback) {
        if (config instanceof DynamicConfiguration)
            return ((DynamicConfiguration) config).getInt(key, fallback);
        DynamicConfiguration wrapper = new DynamicConfiguration();
        wrapper.addSource(config);
        return wrapper.getInt(key, fallback);
    }

    public static DynamicConfiguration makeDefault() {
        DynamicConfiguration ret = new DynamicConfiguration();
        ret.addSource(PROPERTY_SOURCE);
        ret.addSource(ENV_SOURCE);
        return ret;
    }

}
