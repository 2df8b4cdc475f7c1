package net.multicli.argparse;

import java.util.ArrayList;
import java.util.Formatter;
import java.util.List;

/**
 * One row of a usage listing: a name column, a parameter column and a
 * description, with optional parenthesized addenda (such as defaults).
 */
public class HelpLine {

    public static final String INDENT = "  ";

    private final String name;
    private final String params;
    private final String description;
    private final List<String> addenda;

    public HelpLine(String name, String params, String description) {
        this.name = adaptNull(name);
        this.params = adaptNull(params);
        this.description = adaptNull(description);
        this.addenda = new ArrayList<String>();
    }

    public String getName() {
        return name;
    }

    public String getParams() {
        return params;
    }

    public String getDescription() {
        return description;
    }

    public List<String> getAddenda() {
        return addenda;
    }
    public HelpLine withAddendum(String entry) {
        if (entry != null) addenda.add(entry);
        return this;
    }

    public String formatText() {
        StringBuilder sb = new StringBuilder(description);
        if (! addenda.isEmpty()) {
            if (sb.length() != 0) sb.append(' ');
            sb.append('(');
            boolean first = true;
            for (String a : addenda) {
                if (! first) sb.append(", ");
                sb.append(a);
                first = false;
            }
            sb.append(')');
        }
        return sb.toString();
    }

    private static String adaptNull(String s) {
        return (s == null) ? "" : s;
    }

    private static String leftpadFormat(int width) {
        // "%-0s" is a syntax error.
        return (width == 0) ? "%s" : "%-" + width + "s";
    }

    /* Lays out the lines in aligned columns, wrapping descriptions. */
    public static void format(List<HelpLine> lines, Formatter f, int width) {
        int nameWidth = 0, paramWidth = 0;
        for (HelpLine l : lines) {
            nameWidth = Math.max(nameWidth, l.getName().length());
            paramWidth = Math.max(paramWidth, l.getParams().length());
        }
        String prefixFormat = INDENT + leftpadFormat(nameWidth) +
            ((paramWidth != 0) ? " " + leftpadFormat(paramWidth) : "%s") +
            " ";
        int textColumn = INDENT.length() + nameWidth + 1 +
            ((paramWidth != 0) ? paramWidth + 1 : 0);
        for (HelpLine l : lines) {
            String prefix = String.format(prefixFormat, l.getName(),
                                          l.getParams());
            List<String> text = wrap(l.formatText(),
                                     Math.max(width - textColumn, 20));
            f.format("%s%s%n", prefix, (text.isEmpty()) ? "" : text.get(0));
            for (int i = 1; i < text.size(); i++) {
                f.format(leftpadFormat(textColumn) + "%s%n", "", text.get(i));
            }
        }
        f.flush();
    }

    public static List<String> wrap(String text, int width) {
        List<String> ret = new ArrayList<String>();
        StringBuilder line = new StringBuilder();
        for (String word : text.trim().split("\\s+")) {
            if (word.isEmpty()) continue;
            if (line.length() != 0 &&
                    line.length() + 1 + word.length() > width) {
                ret.add(line.toString());
                line.setLength(0);
            }
            if (line.length() != 0) line.append(' ');
            line.append(word);
        }
        if (line.length() != 0) ret.add(line.toString());
        return ret;
    }

}
