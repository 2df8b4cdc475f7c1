package net.multicli.util;

import java.util.Iterator;
import java.util.List;

public final class Formats {

    // Prevent construction.
    private Formats() {}

    public static String quote(String s) {
        if (s == null) return "null";
        return (s.contains("'")) ? '"' + s + '"' : "'" + s + "'";
    }

    public static String join(String sep, Iterable<?> items) {
        StringBuilder sb = new StringBuilder();
        boolean first = true;
        for (Object o : items) {
            if (first) {
                first = false;
            } else {
                sb.append(sep);
            }
            sb.append(o);
        }
        return sb.toString();
    }

    public static String formatTokens(List<String> tokens) {
        StringBuilder sb = new StringBuilder("[");
        Iterator<String> it = tokens.iterator();
        while (it.hasNext()) {
            sb.append(quote(it.next()));
            if (it.hasNext()) sb.append(", ");
        }
        return sb.append(']').toString();
    }

}
