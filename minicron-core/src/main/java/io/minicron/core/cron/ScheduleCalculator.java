package io.minicron.core.cron;

import java.time.Instant;
import java.time.ZoneId;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

public final class ScheduleCalculator {
    private final ZoneId zone;
    private final Map<String, CronExpression> parsed = new ConcurrentHashMap<>();

    public ScheduleCalculator(ZoneId zone) {
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
    }

    public ZoneId zone() {
        return zone;
    }

    public CronExpression parse(String expression) {
        CronExpression cached = expression == null ? null : parsed.get(expression);
        if (cached != null) {
            return cached;
        }
        CronExpression cron = CronExpression.parse(expression);
        parsed.put(expression, cron);
        return cron;
    }

    public CronExpression validate(String expression, Instant now) {
        CronExpression cron = parse(expression);
        cron.nextAfter(now, zone);
        return cron;
    }

    public Instant nextRunAfter(String expression, Instant after) {
        return parse(expression).nextAfter(after, zone);
    }
}
