package org.tenantwarehouse.service.scheduling;

import org.tenantwarehouse.exceptions.ConfigurationException;
import org.springframework.scheduling.support.CronExpression;

/**
 * Accepts five-field Unix cron expressions as well as Spring's six-field form (leading seconds).
 */
public final class CronExpressions {

    private CronExpressions() {
    }

    public static String normalize(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new ConfigurationException("Cron expression is empty");
        }
        String trimmed = expression.trim().replaceAll("\\s+", " ");
        int fields = trimmed.split(" ").length;
        String normalized;
        if (fields == 5) {
            normalized = "0 " + trimmed;
        } else if (fields == 6) {
            normalized = trimmed;
        } else {
            throw new ConfigurationException("Cron expression must have 5 or 6 fields: " + expression);
        }
        try {
            CronExpression.parse(normalized);
        } catch (IllegalArgumentException exception) {
            throw new ConfigurationException("Invalid cron expression '" + expression + "': " + exception.getMessage(), exception);
        }
        return normalized;
    }
}
