package it.unimib.datai.clout.controlplane.schedule;

import it.unimib.datai.clout.common.CloutException;
import org.springframework.scheduling.support.CronExpression;

import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Cron handling for timer triggers.
 *
 * <p>Expressions use the six-field form with a leading seconds field. Five-field expressions are
 * converted by prepending {@code 0} seconds and marking the unused day field with {@code ?}:
 * {@code "0/10 * * * *"} becomes {@code "0 0/10 * * * ?"}. Expressions with six
 * or more fields, and macros such as {@code @daily}, are passed through unchanged.</p>
 */
public final class CronExpressions {
    private static final String ANY = "*";
    private static final String NO_SPECIFIC_VALUE = "?";

    private CronExpressions() {
    }

    /**
     * Normalizes and validates an expression.
     *
     * @throws CloutException with kind {@code VALIDATION_FAILED} when the expression is blank or invalid
     */
    public static String normalize(String expression) {
        if (expression == null || expression.isBlank()) {
            throw CloutException.validation("cron", "Cron expression is required");
        }
        String trimmed = expression.trim();
        String[] fields = trimmed.split("\\s+");
        String normalized;
        if (fields.length == 5) {
            String dayOfMonth = fields[2];
            String dayOfWeek = fields[4];
            if (isWildcard(dayOfWeek)) {
                dayOfWeek = NO_SPECIFIC_VALUE;
            } else if (isWildcard(dayOfMonth)) {
                dayOfMonth = NO_SPECIFIC_VALUE;
            }
            normalized = String.join(" ", "0", fields[0], fields[1], dayOfMonth, fields[3], dayOfWeek);
        } else if (fields.length == 1 && trimmed.startsWith("@")) {
            normalized = trimmed;
        } else if (fields.length >= 6) {
            normalized = trimmed;
        } else {
            throw CloutException.validation("cron",
                    "Cron expression '" + trimmed + "' must have 5 or 6 fields, found " + fields.length);
        }
        parse(normalized);
        return normalized;
    }

    public static boolean isValid(String expression) {
        try {
            normalize(expression);
            return true;
        } catch (CloutException e) {
            return false;
        }
    }

    /**
     * Parses an already normalized expression.
     */
    public static CronExpression parse(String normalized) {
        try {
            return CronExpression.parse(normalized);
        } catch (IllegalArgumentException e) {
            throw CloutException.validation("cron", "Invalid cron expression '" + normalized + "': " + e.getMessage());
        }
    }

    /**
     * Next {@code count} fire times after {@code from}.
     */
    public static List<ZonedDateTime> nextFireTimes(String expression, ZonedDateTime from, int count) {
        CronExpression cron = parse(normalize(expression));
        List<ZonedDateTime> times = new ArrayList<>(count);
        ZonedDateTime cursor = from;
        while (times.size() < count) {
            cursor = cron.next(cursor);
            if (cursor == null) {
                break;
            }
            times.add(cursor);
        }
        return times;
    }

    public static List<ZonedDateTime> nextFireTimes(String expression, ZoneId zone, int count) {
        return nextFireTimes(expression, ZonedDateTime.now(zone), count);
    }

    private static boolean isWildcard(String field) {
        return ANY.equals(field) || NO_SPECIFIC_VALUE.equals(field);
    }
}
