package net.multicli.types;

import java.io.File;
import java.math.BigDecimal;
import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import net.multicli.argparse.ParseError;
import net.multicli.argparse.ParsingException;
import net.multicli.util.Formats;

/**
 * Coercion from raw scalar text to a typed value, registered under a
 * scalar-kind name.
 * The built-in kinds are "string", "int", "long", "float", "double",
 * "decimal", "bool" and "file".
 */
public abstract class Converter<T> {

    private static final Map<String, Converter<?>> registry;

    static {
        registry = new ConcurrentHashMap<String, Converter<?>>();
        register(new Converter<String>("string", String.class) {
            public String convert(String data) {
                return data;
            }
        });
        register(new Converter<Integer>("int", Integer.class) {
            public Integer convert(String data) throws ParsingException {
                try {
                    return Integer.parseInt(data);
                } catch (NumberFormatException exc) {
                    throw invalid(data, exc);
                }
            }
        });
        register(new Converter<Long>("long", Long.class) {
            public Long convert(String data) throws ParsingException {
                try {
                    return Long.parseLong(data);
                } catch (NumberFormatException exc) {
                    throw invalid(data, exc);
                }
            }
        });
        register(new Converter<Double>("float", Double.class) {
            public Double convert(String data) throws ParsingException {
                try {
                    return Double.parseDouble(data);
                } catch (NumberFormatException exc) {
                    throw invalid(data, exc);
                }
            }
        });
        register(new Converter<Double>("double", Double.class) {
            public Double convert(String data) throws ParsingException {
                return get("float", Double.class).convert(data);
            }
        });
        register(new Converter<BigDecimal>("decimal", BigDecimal.class) {
            public BigDecimal convert(String data) throws ParsingException {
                try {
                    return new BigDecimal(data);
                } catch (NumberFormatException exc) {
                    throw invalid(data, exc);
                }
            }
        });
        register(new Converter<Boolean>("bool", Boolean.class) {
            public Boolean convert(String data) throws ParsingException {
                String d = data.toLowerCase();
                if (d.equals("true") || d.equals("yes") || d.equals("1"))
                    return Boolean.TRUE;
                if (d.equals("false") || d.equals("no") || d.equals("0"))
                    return Boolean.FALSE;
                throw invalid(data, null);
            }
        });
        register(new Converter<File>("file", File.class) {
            public File convert(String data) throws ParsingException {
                if (data.isEmpty()) throw invalid(data, null);
                return new File(data);
            }
        });
    }

    private final String name;
    private final Class<T> valueClass;

    protected Converter(String name, Class<T> valueClass) {
        if (name == null || name.isEmpty())
            throw new NullPointerException(
                "Converter name may not be null or empty");
        this.name = name;
        this.valueClass = valueClass;
    }

    public String getName() {
        return name;
    }

    public Class<T> getValueClass() {
        return valueClass;
    }

    public abstract T convert(String data) throws ParsingException;

    protected ParsingException invalid(String data, Throwable cause) {
        return new ParsingException(ParseError.INVALID_VALUE,
            "Invalid " + getName() + " value " + Formats.quote(data),
            getName(), cause);
    }

    public static void register(Converter<?> cvt) {
        registry.put(cvt.getName(), cvt);
    }
    public static void deregister(String name) {
        registry.remove(name);
    }
    public static Converter<?> get(String name) {
        return registry.get(name);
    }
    public static <X> Converter<X> get(String name, Class<X> cls) {
        Converter<?> ret = registry.get(name);
        if (ret == null || ! cls.isAssignableFrom(ret.getValueClass()))
            return null;
        @SuppressWarnings("unchecked")
        Converter<X> cast = (Converter<X>) ret;
        return cast;
    }
    public static Set<String> getNames() {
        return Collections.unmodifiableSet(
            new TreeSet<String>(registry.keySet()));
    }

}
