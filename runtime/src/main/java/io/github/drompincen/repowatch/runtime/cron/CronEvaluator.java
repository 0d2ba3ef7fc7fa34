package io.github.drompincen.repowatch.runtime.cron;

import io.github.drompincen.repowatch.runtime.error.InvalidCronExpressionException;
import org.springframework.scheduling.support.CronExpression;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Standard five-field cron expression (minute hour day-of-month month day-of-week)
 * evaluated in a fixed zone. Spring's {@link CronExpression} carries a leading seconds
 * field, so a zero seconds field is prepended before parsing. Macros such as
 * {@code @hourly} are passed through unchanged.
 * <p>
 * When both day-of-month and day-of-week are restricted, a time matches if either one
 * does, as in crontab. Spring requires both, so such an expression is evaluated as two
 * Spring expressions (one per day field) and the earliest fire time wins.
 */
public final class CronEvaluator {

    private static final List<Duration> PREVIOUS_LOOKBACKS = List.of(
            Duration.ofMinutes(1),
            Duration.ofHours(1),
            Duration.ofDays(1),
            Duration.ofDays(32),
            Duration.ofDays(366),
            Duration.ofDays(8 * 366));

    private final String expression;
    private final List<CronExpression> crons;
    private final ZoneId zone;

    private CronEvaluator(String expression, List<CronExpression> crons, ZoneId zone) {
        this.expression = expression;
        this.crons = crons;
        this.zone = zone;
    }

    /**
     * @throws InvalidCronExpressionException if the expression is malformed or can never fire
     */
    public static CronEvaluator parse(String expression, ZoneId zone) {
        if (expression == null || expression.isBlank()) {
            throw new InvalidCronExpressionException(expression, "expression is empty");
        }
        String trimmed = expression.trim();
        List<String> springExpressions;
        if (trimmed.startsWith("@")) {
            springExpressions = List.of(trimmed);
        } else {
            String[] fields = trimmed.split("\\s+");
            if (fields.length != 5) {
                throw new InvalidCronExpressionException(expression,
                        "expected 5 fields but found " + fields.length);
            }
            String minute = fields[0];
            String hour = fields[1];
            String dayOfMonth = fields[2];
            String month = fields[3];
            String dayOfWeek = fields[4];
            if (isRestricted(dayOfMonth) && isRestricted(dayOfWeek)) {
                springExpressions = List.of(
                        String.join(" ", "0", minute, hour, dayOfMonth, month, "*"),
                        String.join(" ", "0", minute, hour, "*", month, dayOfWeek));
            } else {
                springExpressions = List.of("0 " + String.join(" ", fields));
            }
        }

        List<CronExpression> crons = new ArrayList<>(springExpressions.size());
        try {
            for (String springExpression : springExpressions) {
                crons.add(CronExpression.parse(springExpression));
            }
        } catch (IllegalArgumentException e) {
            throw new InvalidCronExpressionException(expression, e.getMessage());
        }
        CronEvaluator evaluator = new CronEvaluator(trimmed, List.copyOf(crons), zone);
        if (evaluator.next(ZonedDateTime.now(zone)) == null) {
            throw new InvalidCronExpressionException(expression, "expression never fires");
        }
        return evaluator;
    }

    // crontab treats a day field starting with '*' as unrestricted
    private static boolean isRestricted(String dayField) {
        return !dayField.startsWith("*") && !dayField.equals("?");
    }

    public static boolean isValid(String expression, ZoneId zone) {
        try {
            parse(expression, zone);
            return true;
        } catch (InvalidCronExpressionException e) {
            return false;
        }
    }

    public String expression() { return expression; }

    public ZoneId zone() { return zone; }

    /** First fire time at or after {@code reference}. */
    public Instant nextFire(Instant reference) {
        ZonedDateTime next = next(reference.atZone(zone).minusNanos(1));
        if (next == null) {
            throw new InvalidCronExpressionException(expression, "no fire time after " + reference);
        }
        return next.toInstant();
    }

    /** Last fire time at or before {@code reference}. */
    public Instant previousFire(Instant reference) {
        ZonedDateTime ref = reference.atZone(zone);
        for (Duration lookback : PREVIOUS_LOOKBACKS) {
            ZonedDateTime last = null;
            ZonedDateTime cursor = next(ref.minus(lookback));
            while (cursor != null && !cursor.isAfter(ref)) {
                last = cursor;
                cursor = next(cursor);
            }
            if (last != null) {
                return last.toInstant();
            }
        }
        throw new InvalidCronExpressionException(expression, "no fire time before " + reference);
    }

    /** Earliest fire strictly after {@code after} across all expressions, or null. */
    private ZonedDateTime next(ZonedDateTime after) {
        ZonedDateTime earliest = null;
        for (CronExpression cron : crons) {
            ZonedDateTime candidate = cron.next(after);
            if (candidate != null && (earliest == null || candidate.isBefore(earliest))) {
                earliest = candidate;
            }
        }
        return earliest;
    }

    /** Whole seconds until the next fire; 0 when {@code reference} sits on a fire time. */
    public long secondsUntilNext(Instant reference) {
        return Duration.between(reference, nextFire(reference)).getSeconds();
    }

    /** Whole seconds since the previous fire; 0 when {@code reference} sits on a fire time. */
    public long secondsSincePrevious(Instant reference) {
        return Duration.between(previousFire(reference), reference).getSeconds();
    }

    @Override
    public String toString() {
        return "CronEvaluator[" + expression + " @ " + zone + "]";
    }
}
