package net.chalk.util.argparse;

import java.util.Formatter;
import java.util.List;

public class HelpLine {

    private final String name;
    private final String params;
    private final String description;
    private final String addendum;

    public HelpLine(String name, String params, String description,
                    String addendum) {
        this.name = adaptNull(name);
        this.params = adaptNull(params);
        this.description = adaptNull(description);
        this.addendum = addendum;
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

    public String getAddendum() {
        return addendum;
    }

    private static String adaptNull(String s) {
        return (s == null) ? "" : s;
    }

    private static String leftpadFormat(int width) {
        // "%-0s" is a syntax error.
        return (width == 0) ? "%s" : "%-" + width + "s";
    }

    public static void format(List<HelpLine> lines, Formatter f) {
        int nameWidth = 0, paramWidth = 0;
        for (HelpLine l : lines) {
            nameWidth = Math.max(nameWidth, l.getName().length());
            paramWidth = Math.max(paramWidth, l.getParams().length());
        }
        String lineFormat = leftpadFormat(nameWidth) +
            ((nameWidth != 0 && paramWidth != 0) ? " " : "") +
            leftpadFormat(paramWidth) + ": %s";
        boolean firstLine = true;
        for (HelpLine l : lines) {
            if (firstLine) {
                firstLine = false;
            } else {
                f.format("%n");
            }
            f.format(lineFormat, l.getName(), l.getParams(),
                     l.getDescription());
            if (l.getAddendum() != null)
                f.format(" (%s)", l.getAddendum());
        }
    }

}
