package com.testflow.testflow_runner.variable;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Expands {@code Range:} entries into per-iteration values.
 *
 * <pre>
 *   (1,3),2.5          -> 2.5, 2.5, 2.5
 *   (1,5),(0,10,2.5)   -> 0, 2.5, 5, 7.5, 10
 *   (1,4),(0,1,0.4)    -> 0, 0.4, 0.8, 1      (clamped once the step overshoots)
 * </pre>
 */
public final class RangeExpander {

    private static final Pattern ENTRY = Pattern.compile("^\\(\\s*(\\d+)\\s*,\\s*(\\d+)\\s*\\)\\s*,\\s*(.*)$");
    private static final Pattern SWEEP = Pattern.compile("^\\(([^,]+),([^,]+),([^)]+)\\)$");
    private static final int PRECISION = 10;

    private RangeExpander() {
    }

    /**
     * @param definition the text after {@code Range:} / {@code Range(i/n):}
     * @param line       source line, used in error messages only
     */
    public static List<Double> expand(String definition, int line) {
        Matcher entry = ENTRY.matcher(definition.trim());
        if (!entry.matches()) {
            throw new RangeFormatException(line, "Invalid Range format: " + definition);
        }
        int first = Integer.parseInt(entry.group(1));
        int last  = Integer.parseInt(entry.group(2));
        int points = last - first + 1;
        if (first < 1 || points < 1) {
            throw new RangeFormatException(line, "Invalid iteration interval (" + first + "," + last + ")");
        }

        String value = entry.group(3).trim();
        if (!value.startsWith("(")) {
            return Collections.nCopies(points, number(value, line));
        }

        Matcher sweep = SWEEP.matcher(value);
        if (!sweep.matches()) {
            throw new RangeFormatException(line, "Invalid sweep, expected (start,end,step): " + value);
        }
        double start = number(sweep.group(1), line);
        double end   = number(sweep.group(2), line);
        double step  = number(sweep.group(3), line);

        List<Double> values = new ArrayList<>(points);
        double current = start;
        for (int i = 0; i < points; i++) {
            values.add(round(current));
            current += step;
            if ((step > 0 && current > end) || (step < 0 && current < end)) {
                current = end;
            }
        }
        return values;
    }

    private static double number(String text, int line) {
        try {
            return Double.parseDouble(text.trim());
        } catch (NumberFormatException e) {
            throw new RangeFormatException(line, "Not a number: '" + text.trim() + "'");
        }
    }

    private static double round(double value) {
        return BigDecimal.valueOf(value).setScale(PRECISION, RoundingMode.HALF_EVEN).doubleValue();
    }
}
