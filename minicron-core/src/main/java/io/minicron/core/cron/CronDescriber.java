package io.minicron.core.cron;

import java.time.DayOfWeek;
import java.time.Month;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.SortedSet;
import java.util.stream.Collectors;

public final class CronDescriber {

    private CronDescriber() {
    }

    public static String describe(String expression) {
        return describe(CronExpression.parse(expression));
    }

    public static String describe(CronExpression cron) {
        SortedSet<Integer> minutes = cron.values(CronField.MINUTE);
        SortedSet<Integer> hours = cron.values(CronField.HOUR);
        boolean everyMinute = isFull(minutes, CronField.MINUTE);
        boolean everyHour = isFull(hours, CronField.HOUR);

        String time;
        if (everyMinute && everyHour) {
            time = "every minute";
        } else if (everyMinute) {
            time = "every minute during hour " + join(hours);
        } else if (everyHour && minutes.size() == 1) {
            time = "at minute " + minutes.first() + " of every hour";
        } else if (everyHour) {
            time = "at minutes " + join(minutes) + " of every hour";
        } else if (minutes.size() == 1 && hours.size() == 1) {
            time = String.format(Locale.ROOT, "at %02d:%02d", hours.first(), minutes.first());
        } else {
            time = "at minutes " + join(minutes) + " past hour " + join(hours);
        }
        return time + " " + describeDays(cron);
    }

    private static String describeDays(CronExpression cron) {
        List<String> parts = new ArrayList<>();
        SortedSet<Integer> daysOfMonth = cron.values(CronField.DAY_OF_MONTH);
        SortedSet<Integer> daysOfWeek = cron.values(CronField.DAY_OF_WEEK);
        boolean allDaysOfMonth = isFull(daysOfMonth, CronField.DAY_OF_MONTH);
        boolean allDaysOfWeek = daysOfWeek.stream().map(day -> day % 7).distinct().count() == 7;

        String weekdays = daysOfWeek.stream()
            .map(day -> day % 7)
            .distinct()
            .map(day -> DayOfWeek.of(day == 0 ? 7 : day).getDisplayName(TextStyle.SHORT, Locale.ENGLISH))
            .collect(Collectors.joining(", "));
        if (cron.isDayOfMonthRestricted() && cron.isDayOfWeekRestricted()) {
            // Either field matching is enough.
            if (allDaysOfMonth || allDaysOfWeek) {
                parts.add("every day");
            } else {
                parts.add("on day " + join(daysOfMonth) + " of the month or on " + weekdays);
            }
        } else if (allDaysOfMonth && allDaysOfWeek) {
            parts.add("every day");
        } else if (allDaysOfWeek) {
            parts.add("on day " + join(daysOfMonth) + " of the month");
        } else if (allDaysOfMonth) {
            parts.add("on " + weekdays);
        } else {
            parts.add("on day " + join(daysOfMonth) + " of the month if it is a " + weekdays);
        }

        SortedSet<Integer> months = cron.values(CronField.MONTH);
        if (!isFull(months, CronField.MONTH)) {
            parts.add("in " + months.stream()
                .map(month -> Month.of(month).getDisplayName(TextStyle.SHORT, Locale.ENGLISH))
                .collect(Collectors.joining(", ")));
        }
        return String.join(" ", parts);
    }

    private static boolean isFull(SortedSet<Integer> values, CronField field) {
        return values.size() == field.max() - field.min() + 1;
    }

    private static String join(SortedSet<Integer> values) {
        return values.stream().map(String::valueOf).collect(Collectors.joining(","));
    }
}
