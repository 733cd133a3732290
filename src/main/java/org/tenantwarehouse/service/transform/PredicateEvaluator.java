package org.tenantwarehouse.service.transform;

import org.tenantwarehouse.exceptions.ConfigurationException;
import org.tenantwarehouse.models.enums.FilterOperator;
import org.tenantwarehouse.models.transform.FilterCondition;
import org.tenantwarehouse.utils.NumericValues;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Evaluates filter conditions. Numbers (and numeric strings) compare by value, other values of the
 * same type by their natural order, anything else by string form. A null field value fails every
 * condition except {@code is_null}.
 */
final class PredicateEvaluator {

    private PredicateEvaluator() {
    }

    static void checkConfiguration(String stepId, FilterCondition condition) {
        if (condition.field() == null || condition.field().isBlank()) {
            throw new ConfigurationException("Filter step " + stepId + " has a condition without a field");
        }
        if (condition.operator() == null) {
            throw new ConfigurationException("Filter step " + stepId + " has a condition on "
                    + condition.field() + " without an operator");
        }
        FilterOperator operator = condition.operator();
        if (operator.requiresValue() && condition.value() == null) {
            throw new ConfigurationException("Filter step " + stepId + ": operator " + operator
                    + " on " + condition.field() + " needs a value");
        }
        if ((operator == FilterOperator.IN || operator == FilterOperator.NOT_IN)
                && !(condition.value() instanceof Collection<?>)) {
            throw new ConfigurationException("Filter step " + stepId + ": operator " + operator
                    + " on " + condition.field() + " needs a list value");
        }
    }

    static boolean matchesAll(Map<String, Object> record, List<FilterCondition> conditions) {
        for (FilterCondition condition : conditions) {
            if (!matches(record, condition)) {
                return false;
            }
        }
        return true;
    }

    static boolean matches(Map<String, Object> record, FilterCondition condition) {
        Object actual = record.get(condition.field());
        FilterOperator operator = condition.operator();
        if (operator == FilterOperator.IS_NULL) {
            return actual == null;
        }
        if (operator == FilterOperator.NOT_NULL) {
            return actual != null;
        }
        if (actual == null) {
            return false;
        }
        Object expected = condition.value();
        switch (operator) {
            case EQ:
                return valuesEqual(actual, expected);
            case NE:
                return !valuesEqual(actual, expected);
            case GT:
                return compareValues(actual, expected) > 0;
            case GTE:
                return compareValues(actual, expected) >= 0;
            case LT:
                return compareValues(actual, expected) < 0;
            case LTE:
                return compareValues(actual, expected) <= 0;
            case IN:
                return contains((Collection<?>) expected, actual);
            case NOT_IN:
                return !contains((Collection<?>) expected, actual);
            default:
                throw new IllegalStateException("Unhandled operator " + operator);
        }
    }

    static boolean valuesEqual(Object left, Object right) {
        if (left == null || right == null) {
            return left == right;
        }
        Optional<BigDecimal> leftNumber = NumericValues.toBigDecimal(left);
        Optional<BigDecimal> rightNumber = NumericValues.toBigDecimal(right);
        if (leftNumber.isPresent() && rightNumber.isPresent()) {
            return leftNumber.get().compareTo(rightNumber.get()) == 0;
        }
        if (Objects.equals(left, right)) {
            return true;
        }
        return String.valueOf(left).equals(String.valueOf(right));
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    static int compareValues(Object left, Object right) {
        Optional<BigDecimal> leftNumber = NumericValues.toBigDecimal(left);
        Optional<BigDecimal> rightNumber = NumericValues.toBigDecimal(right);
        if (leftNumber.isPresent() && rightNumber.isPresent()) {
            return leftNumber.get().compareTo(rightNumber.get());
        }
        if (left instanceof Comparable comparable && left.getClass().isInstance(right)) {
            return comparable.compareTo(right);
        }
        return String.valueOf(left).compareTo(String.valueOf(right));
    }

    private static boolean contains(Collection<?> candidates, Object actual) {
        for (Object candidate : candidates) {
            if (valuesEqual(actual, candidate)) {
                return true;
            }
        }
        return false;
    }
}
