package io.minicron.core.cron;

import io.minicron.core.error.InvalidExpressionException;
import java.util.BitSet;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

public enum CronField {
    MINUTE("minute", 0, 59, 59, List.of()),
    HOUR("hour", 0, 23, 23, List.of()),
    DAY_OF_MONTH("day-of-month", 1, 31, 31, List.of()),
    MONTH("month", 1, 12, 12,
        List.of("JAN", "FEB", "MAR", "APR", "MAY", "JUN", "JUL", "AUG", "SEP", "OCT", "NOV", "DEC")),
    // 7 is accepted as an alias for Sunday; "*" only spans 0-6.
    DAY_OF_WEEK("day-of-week", 0, 7, 6, List.of("SUN", "MON", "TUE", "WED", "THU", "FRI", "SAT"));

    private static final Pattern NUMBER = Pattern.compile("\\d{1,4}");

    private final String label;
    private final int min;
    private final int max;
    private final int wildcardMax;
    private final List<String> names;

    CronField(String label, int min, int max, int wildcardMax, List<String> names) {
        this.label = label;
        this.min = min;
        this.max = max;
        this.wildcardMax = wildcardMax;
        this.names = names;
    }

    public String label() {
        return label;
    }

    public int min() {
        return min;
    }

    public int max() {
        return wildcardMax;
    }

    BitSet parse(String raw, String expression) {
        BitSet bits = new BitSet(max + 1);
        for (String part : raw.split(",", -1)) {
            if (part.isEmpty()) {
                throw invalid(expression, "empty list element in " + label + " field '" + raw + "'");
            }
            String range = part;
            int step = 1;
            int slash = part.indexOf('/');
            if (slash >= 0) {
                range = part.substring(0, slash);
                step = parseStep(part.substring(slash + 1), expression);
            }

            int start;
            int end;
            if ("*".equals(range)) {
                start = min;
                end = wildcardMax;
            } else if (range.indexOf('-') > 0) {
                String[] bounds = range.split("-", -1);
                if (bounds.length != 2) {
                    throw invalid(expression, "malformed range '" + range + "' in " + label + " field");
                }
                start = parseValue(bounds[0], expression);
                end = parseValue(bounds[1], expression);
                if (start > end) {
                    throw invalid(expression, "range " + range + " is reversed in " + label + " field");
                }
            } else {
                start = parseValue(range, expression);
                end = slash >= 0 ? wildcardMax : start;
            }

            for (int value = start; value <= end; value += step) {
                bits.set(normalize(value));
            }
        }
        return bits;
    }

    private int parseStep(String raw, String expression) {
        if (!NUMBER.matcher(raw).matches()) {
            throw invalid(expression, "invalid step '" + raw + "' in " + label + " field");
        }
        int step = Integer.parseInt(raw);
        if (step <= 0 || step > max) {
            throw invalid(expression, "step " + step + " out of range 1-" + max + " in " + label + " field");
        }
        return step;
    }

    private int parseValue(String raw, String expression) {
        int nameIndex = names.indexOf(raw.toUpperCase(Locale.ROOT));
        if (nameIndex >= 0) {
            return nameIndex + min;
        }
        if (!NUMBER.matcher(raw).matches()) {
            throw invalid(expression, "invalid value '" + raw + "' in " + label + " field");
        }
        int value = Integer.parseInt(raw);
        if (value < min || value > max) {
            throw invalid(expression, "value " + value + " out of range " + min + "-" + max + " in " + label + " field");
        }
        return value;
    }

    private int normalize(int value) {
        return this == DAY_OF_WEEK && value == 7 ? 0 : value;
    }

    private static InvalidExpressionException invalid(String expression, String reason) {
        return new InvalidExpressionException(expression, reason);
    }
}
