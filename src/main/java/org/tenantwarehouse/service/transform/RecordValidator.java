package org.tenantwarehouse.service.transform;

import org.tenantwarehouse.models.enums.FieldType;
import org.tenantwarehouse.models.transform.ValidationRule;
import org.tenantwarehouse.utils.NumericValues;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

final class RecordValidator {

    private static final Pattern UUID_PATTERN =
            Pattern.compile("[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}");

    private RecordValidator() {
    }

    static List<String> violations(Map<String, Object> record, List<ValidationRule> rules) {
        List<String> violations = new ArrayList<>();
        for (ValidationRule rule : rules) {
            Object value = record.get(rule.field());
            if (value == null) {
                if (rule.required()) {
                    violations.add("field '" + rule.field() + "' is required");
                }
                continue;
            }
            if (rule.type() != null && !hasType(value, rule.type())) {
                violations.add("field '" + rule.field() + "' is not of type "
                        + rule.type().name().toLowerCase(Locale.ROOT) + ": " + value);
                continue;
            }
            if (rule.min() != null || rule.max() != null) {
                Optional<BigDecimal> number = NumericValues.toBigDecimal(value);
                if (number.isEmpty()) {
                    violations.add("field '" + rule.field() + "' is not numeric: " + value);
                    continue;
                }
                if (rule.min() != null && number.get().compareTo(rule.min()) < 0) {
                    violations.add("field '" + rule.field() + "' is below minimum " + rule.min() + ": " + value);
                }
                if (rule.max() != null && number.get().compareTo(rule.max()) > 0) {
                    violations.add("field '" + rule.field() + "' is above maximum " + rule.max() + ": " + value);
                }
            }
        }
        return violations;
    }

    static boolean hasType(Object value, FieldType type) {
        switch (type) {
            case NUMBER:
                return NumericValues.isNumeric(value);
            case INTEGER:
                return NumericValues.isWholeNumber(value);
            case STRING:
                return value instanceof CharSequence;
            case BOOLEAN:
                return value instanceof Boolean
                        || (value instanceof String text
                        && ("true".equalsIgnoreCase(text) || "false".equalsIgnoreCase(text)));
            case DATE:
                return isDate(value);
            default:
                return value instanceof UUID
                        || (value instanceof String text && UUID_PATTERN.matcher(text).matches());
        }
    }

    private static boolean isDate(Object value) {
        if (value instanceof LocalDate || value instanceof LocalDateTime || value instanceof OffsetDateTime
                || value instanceof Instant || value instanceof Date) {
            return true;
        }
        if (!(value instanceof String text)) {
            return false;
        }
        try {
            LocalDate.parse(text);
            return true;
        } catch (DateTimeParseException ignored) {
            // try the date-time forms
        }
        try {
            LocalDateTime.parse(text);
            return true;
        } catch (DateTimeParseException ignored) {
            // try the offset form
        }
        try {
            OffsetDateTime.parse(text);
            return true;
        } catch (DateTimeParseException ignored) {
            return false;
        }
    }
}
