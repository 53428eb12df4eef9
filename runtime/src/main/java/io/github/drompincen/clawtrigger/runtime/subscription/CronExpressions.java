package io.github.drompincen.clawtrigger.runtime.subscription;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.support.CronExpression;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZoneOffset;

public final class CronExpressions {

    private static final Logger log = LoggerFactory.getLogger(CronExpressions.class);

    private CronExpressions() {}

    /**
     * Parses a 5-field unix expression (a zero seconds field is prepended) or a 6-field Spring one.
     *
     * @throws IllegalArgumentException if the expression is malformed
     */
    public static CronExpression parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("Cron expression is empty");
        }
        String trimmed = expression.trim();
        String[] fields = trimmed.split("\\s+");
        return CronExpression.parse(fields.length == 5 ? "0 " + trimmed : trimmed);
    }

    /** Unknown zones fall back to UTC. */
    public static ZoneId zoneOrUtc(String timezone) {
        if (timezone == null || timezone.isBlank()) {
            return ZoneOffset.UTC;
        }
        try {
            return ZoneId.of(timezone.trim());
        } catch (DateTimeException e) {
            log.warn("Invalid timezone '{}', using UTC: {}", timezone, e.getMessage());
            return ZoneOffset.UTC;
        }
    }
}
