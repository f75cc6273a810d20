package io.minicron.cli;

import io.minicron.core.cron.CronDescriber;
import io.minicron.core.cron.CronExpression;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "next", description = "Describe a cron expression and list its upcoming occurrences")
public final class NextCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", description = "Cron expression, quoted, e.g. \"0 6 * * *\"")
    String expression;

    @Option(names = {"-n", "--count"}, description = "Number of occurrences", defaultValue = "5")
    int count;

    @Option(names = "--from", description = "Start instant, ISO-8601 (default: now)")
    String from;

    @Option(names = "--zone", description = "Time zone (default: scheduler.timezone from config)")
    String zone;

    public NextCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            if (count < 1 || count > 100) {
                throw new IllegalArgumentException("--count must be between 1 and 100");
            }
            ZoneId zoneId = zone == null || zone.isBlank()
                ? context.configService().load(context.configPath()).scheduler().zone()
                : ZoneId.of(zone.trim());
            CronExpression cron = CronExpression.parse(expression);
            System.out.println(cron.expression() + ": " + CronDescriber.describe(cron));
            for (ZonedDateTime next : cron.nextOccurrences(start(zoneId), count)) {
                System.out.println(DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(next));
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Next command failed: " + e.getMessage());
            return 1;
        }
    }

    private ZonedDateTime start(ZoneId zoneId) {
        if (from == null || from.isBlank()) {
            return ZonedDateTime.now(zoneId);
        }
        String raw = from.trim();
        try {
            return OffsetDateTime.parse(raw).atZoneSameInstant(zoneId);
        } catch (DateTimeParseException e) {
            // No offset: a wall-clock time in the chosen zone.
            return LocalDateTime.parse(raw).atZone(zoneId);
        }
    }
}
