package org.tenantwarehouse.service.transform;

import org.tenantwarehouse.models.enums.AggregationFunction;
import org.tenantwarehouse.models.transform.Measure;
import org.tenantwarehouse.utils.NumericValues;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Running state of one aggregate group. Null values are ignored by every function.
 */
final class GroupAccumulator {

    private final List<Measure> measures;
    private final MeasureState[] states;

    GroupAccumulator(List<Measure> measures) {
        this.measures = measures;
        this.states = new MeasureState[measures.size()];
        for (int i = 0; i < states.length; i++) {
            states[i] = new MeasureState();
        }
    }

    /**
     * @return why the record cannot be aggregated, or {@code null} if it can
     */
    static String rejectReason(List<Measure> measures, Map<String, Object> record) {
        for (Measure measure : measures) {
            if (measure.function() != AggregationFunction.SUM && measure.function() != AggregationFunction.AVG) {
                continue;
            }
            Object value = record.get(measure.field());
            if (value != null && !NumericValues.isNumeric(value)) {
                return "Field '" + measure.field() + "' is not numeric for " + measure.function().name().toLowerCase(Locale.ROOT)
                        + ": " + value;
            }
        }
        return null;
    }

    void accept(Map<String, Object> record) {
        for (int i = 0; i < states.length; i++) {
            Object value = record.get(measures.get(i).field());
            if (value != null) {
                states[i].accept(measures.get(i).function(), value);
            }
        }
    }

    void writeTo(Map<String, Object> output) {
        for (int i = 0; i < states.length; i++) {
            Measure measure = measures.get(i);
            output.put(measure.outputField(), states[i].result(measure.function()));
        }
    }

    private static final class MeasureState {

        private long count;
        private BigDecimal sum = BigDecimal.ZERO;
        private boolean allIntegral = true;
        private Object min;
        private Object max;
        private Object last;

        void accept(AggregationFunction function, Object value) {
            count++;
            last = value;
            if (function == AggregationFunction.SUM || function == AggregationFunction.AVG) {
                sum = sum.add(NumericValues.toBigDecimal(value).orElseThrow());
                allIntegral &= NumericValues.isIntegral(value);
            } else if (function == AggregationFunction.MIN) {
                if (min == null || PredicateEvaluator.compareValues(value, min) < 0) {
                    min = value;
                }
            } else if (function == AggregationFunction.MAX) {
                if (max == null || PredicateEvaluator.compareValues(value, max) > 0) {
                    max = value;
                }
            }
        }

        Object result(AggregationFunction function) {
            switch (function) {
                case SUM:
                    if (allIntegral) {
                        try {
                            return sum.longValueExact();
                        } catch (ArithmeticException overflow) {
                            return sum;
                        }
                    }
                    return sum;
                case AVG:
                    return count == 0 ? null : sum.divide(BigDecimal.valueOf(count), MathContext.DECIMAL64);
                case COUNT:
                    return count;
                case MIN:
                    return min;
                case MAX:
                    return max;
                default:
                    return last;
            }
        }
    }
}
