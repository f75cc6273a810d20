package io.minicron.core.cron;

import io.minicron.core.error.InvalidExpressionException;
import io.minicron.core.error.UnschedulableException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * A parsed five-field cron expression. When both day fields are restricted (do not start with
 * {@code *}) a day matches if either of them does, as in Vixie cron.
 */
public final class CronExpression {
    public static final int HORIZON_YEARS = 4;

    private static final Map<String, String> MACROS = Map.of(
        "@yearly", "0 0 1 1 *",
        "@annually", "0 0 1 1 *",
        "@monthly", "0 0 1 * *",
        "@weekly", "0 0 * * 0",
        "@daily", "0 0 * * *",
        "@midnight", "0 0 * * *",
        "@hourly", "0 * * * *"
    );

    private final String expression;
    private final Map<CronField, BitSet> fields;
    private final boolean dayOfMonthRestricted;
    private final boolean dayOfWeekRestricted;

    private CronExpression(String expression, Map<CronField, BitSet> fields, boolean dayOfMonthRestricted, boolean dayOfWeekRestricted) {
        this.expression = expression;
        this.fields = fields;
        this.dayOfMonthRestricted = dayOfMonthRestricted;
        this.dayOfWeekRestricted = dayOfWeekRestricted;
    }

    public static CronExpression parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new InvalidExpressionException(String.valueOf(expression), "expression is required");
        }
        String normalized = expression.trim().replaceAll("\\s+", " ");
        String source = normalized;
        if (normalized.startsWith("@")) {
            source = MACROS.get(normalized.toLowerCase(Locale.ROOT));
            if (source == null) {
                throw new InvalidExpressionException(normalized, "unknown macro");
            }
        }

        String[] parts = source.split(" ");
        if (parts.length != 5) {
            throw new InvalidExpressionException(normalized, "expected 5 fields but found " + parts.length);
        }

        Map<CronField, BitSet> fields = new EnumMap<>(CronField.class);
        CronField[] order = CronField.values();
        for (int i = 0; i < order.length; i++) {
            fields.put(order[i], order[i].parse(parts[i], normalized));
        }
        return new CronExpression(
            normalized,
            fields,
            !parts[2].startsWith("*"),
            !parts[4].startsWith("*")
        );
    }

    public String expression() {
        return expression;
    }

    public SortedSet<Integer> values(CronField field) {
        SortedSet<Integer> values = new TreeSet<>();
        fields.get(field).stream().forEach(values::add);
        return Collections.unmodifiableSortedSet(values);
    }

    public boolean isDayOfMonthRestricted() {
        return dayOfMonthRestricted;
    }

    public boolean isDayOfWeekRestricted() {
        return dayOfWeekRestricted;
    }

    public boolean matches(LocalDateTime time) {
        return fields.get(CronField.MINUTE).get(time.getMinute())
            && fields.get(CronField.HOUR).get(time.getHour())
            && fields.get(CronField.MONTH).get(time.getMonthValue())
            && dayMatches(time.toLocalDate());
    }

    public boolean matches(ZonedDateTime time) {
        return matches(time.toLocalDateTime());
    }

    public ZonedDateTime nextAfter(ZonedDateTime after) {
        ZoneId zone = after.getZone();
        Instant floor = after.toInstant();
        LocalDateTime time = after.toLocalDateTime().truncatedTo(ChronoUnit.MINUTES).plusMinutes(1);
        LocalDateTime limit = time.plusYears(HORIZON_YEARS);

        BitSet months = fields.get(CronField.MONTH);
        BitSet hours = fields.get(CronField.HOUR);
        BitSet minutes = fields.get(CronField.MINUTE);

        while (!time.isAfter(limit)) {
            if (!months.get(time.getMonthValue())) {
                time = time.toLocalDate().withDayOfMonth(1).plusMonths(1).atStartOfDay();
                continue;
            }
            if (!dayMatches(time.toLocalDate())) {
                time = time.toLocalDate().plusDays(1).atStartOfDay();
                continue;
            }
            int hour = hours.nextSetBit(time.getHour());
            if (hour < 0) {
                time = time.toLocalDate().plusDays(1).atStartOfDay();
                continue;
            }
            if (hour != time.getHour()) {
                time = time.toLocalDate().atTime(hour, 0);
            }
            int minute = minutes.nextSetBit(time.getMinute());
            if (minute < 0) {
                time = time.truncatedTo(ChronoUnit.HOURS).plusHours(1);
                continue;
            }
            time = time.withMinute(minute);

            // Local times inside a DST gap are shifted forward by the length of the gap.
            ZonedDateTime candidate = time.atZone(zone);
            if (candidate.toInstant().isAfter(floor)) {
                return candidate;
            }
            time = time.plusMinutes(1);
        }
        throw new UnschedulableException(expression, HORIZON_YEARS);
    }

    public Instant nextAfter(Instant after, ZoneId zone) {
        return nextAfter(after.atZone(zone)).toInstant();
    }

    public List<ZonedDateTime> nextOccurrences(ZonedDateTime after, int count) {
        List<ZonedDateTime> occurrences = new ArrayList<>();
        ZonedDateTime cursor = after;
        for (int i = 0; i < count; i++) {
            cursor = nextAfter(cursor);
            occurrences.add(cursor);
        }
        return occurrences;
    }

    private boolean dayMatches(LocalDate date) {
        boolean dayOfMonth = fields.get(CronField.DAY_OF_MONTH).get(date.getDayOfMonth());
        boolean dayOfWeek = fields.get(CronField.DAY_OF_WEEK).get(date.getDayOfWeek().getValue() % 7);
        if (dayOfMonthRestricted && dayOfWeekRestricted) {
            return dayOfMonth || dayOfWeek;
        }
        return dayOfMonth && dayOfWeek;
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof CronExpression that && expression.equals(that.expression);
    }

    @Override
    public int hashCode() {
        return expression.hashCode();
    }

    @Override
    public String toString() {
        return expression;
    }
}
