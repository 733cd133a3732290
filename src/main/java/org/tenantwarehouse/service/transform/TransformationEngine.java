package org.tenantwarehouse.service.transform;

import lombok.extern.slf4j.Slf4j;
import org.tenantwarehouse.configuration.AnalyticsProperties;
import org.tenantwarehouse.exceptions.ConfigurationException;
import org.tenantwarehouse.exceptions.RecordException;
import org.tenantwarehouse.models.transform.AggregateStep;
import org.tenantwarehouse.models.transform.Calculation;
import org.tenantwarehouse.models.transform.EnrichStep;
import org.tenantwarehouse.models.transform.EnrichmentJoin;
import org.tenantwarehouse.models.transform.FilterCondition;
import org.tenantwarehouse.models.transform.FilterStep;
import org.tenantwarehouse.models.transform.MapStep;
import org.tenantwarehouse.models.transform.Measure;
import org.tenantwarehouse.models.transform.TransformationStep;
import org.tenantwarehouse.models.transform.ValidateStep;
import org.tenantwarehouse.models.transform.ValidationRule;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Applies an ordered chain of typed steps to a batch of records.
 * <p>
 * Every step is checked and prepared (expressions parsed, enrichment datasets loaded) before the
 * first record is touched, so a malformed chain fails with {@link ConfigurationException} and
 * no partial output. Once running, a record that cannot be processed is counted as failed and
 * dropped; it never aborts the batch. Input maps are never mutated.
 */
@Slf4j
@Component
public class TransformationEngine {

    private final AuxiliaryDataProvider auxiliaryDataProvider;
    private final int maxErrorMessages;

    public TransformationEngine(AuxiliaryDataProvider auxiliaryDataProvider, AnalyticsProperties properties) {
        this.auxiliaryDataProvider = auxiliaryDataProvider;
        this.maxErrorMessages = Math.max(0, properties.getEtl().getMaxErrorMessages());
    }

    public TransformationResult apply(List<Map<String, Object>> records, List<TransformationStep> steps) {
        return apply(records, steps, TransformContext.none());
    }

    public TransformationResult apply(List<Map<String, Object>> records,
                                      List<TransformationStep> steps,
                                      TransformContext context) {
        List<TransformationStep> ordered = new ArrayList<>(steps == null ? List.of() : steps);
        ordered.sort(TransformationStep.EXECUTION_ORDER);

        List<PreparedStep> prepared = new ArrayList<>(ordered.size());
        for (TransformationStep step : ordered) {
            prepared.add(prepare(step, context == null ? TransformContext.none() : context));
        }

        List<Map<String, Object>> current = new ArrayList<>();
        if (records != null) {
            for (Map<String, Object> record : records) {
                current.add(new LinkedHashMap<>(record));
            }
        }

        RecordFailures failures = new RecordFailures(maxErrorMessages);
        for (PreparedStep step : prepared) {
            int before = current.size();
            current = step.apply(current, failures);
            log.debug("Step {} ({}) turned {} records into {}", step.id(), step.type(), before, current.size());
        }
        if (failures.count() > 0) {
            log.warn("Transformation rejected {} records", failures.count());
        }
        return new TransformationResult(current, failures.count(), failures.messages());
    }

    /**
     * Checks a step chain without running it. Enrichment datasets are not loaded.
     */
    public void validateConfiguration(List<TransformationStep> steps) {
        Set<String> ids = new HashSet<>();
        Set<Integer> orders = new HashSet<>();
        for (TransformationStep step : steps) {
            checkCommon(step);
            if (!ids.add(step.id())) {
                throw new ConfigurationException("Duplicate step id: " + step.id());
            }
            if (!orders.add(step.order())) {
                throw new ConfigurationException("Duplicate step order " + step.order() + " at step " + step.id());
            }
            if (step instanceof EnrichStep enrich) {
                checkEnrich(enrich);
            } else {
                prepare(step, TransformContext.none());
            }
        }
    }

    private PreparedStep prepare(TransformationStep step, TransformContext context) {
        checkCommon(step);
        if (step instanceof FilterStep filter) {
            return prepareFilter(filter);
        }
        if (step instanceof MapStep map) {
            return prepareMap(map);
        }
        if (step instanceof AggregateStep aggregate) {
            return prepareAggregate(aggregate);
        }
        if (step instanceof ValidateStep validate) {
            return prepareValidate(validate);
        }
        if (step instanceof EnrichStep enrich) {
            return prepareEnrich(enrich, context);
        }
        throw new ConfigurationException("Unsupported step type: " + step.getClass().getSimpleName());
    }

    private void checkCommon(TransformationStep step) {
        if (step == null) {
            throw new ConfigurationException("Step list contains a null step");
        }
        if (!StringUtils.hasText(step.id())) {
            throw new ConfigurationException("Step of type " + step.type() + " has no id");
        }
    }

    private PreparedStep prepareFilter(FilterStep step) {
        if (step.conditions().isEmpty()) {
            throw new ConfigurationException("Filter step " + step.id() + " has no conditions");
        }
        for (FilterCondition condition : step.conditions()) {
            PredicateEvaluator.checkConfiguration(step.id(), condition);
        }
        return new PreparedStep(step.id(), step.type()) {
            @Override
            List<Map<String, Object>> apply(List<Map<String, Object>> records, RecordFailures failures) {
                List<Map<String, Object>> kept = new ArrayList<>();
                for (Map<String, Object> record : records) {
                    if (PredicateEvaluator.matchesAll(record, step.conditions())) {
                        kept.add(record);
                    }
                }
                return kept;
            }
        };
    }

    private PreparedStep prepareMap(MapStep step) {
        if (step.calculations().isEmpty()) {
            throw new ConfigurationException("Map step " + step.id() + " has no calculations");
        }
        List<String> targets = new ArrayList<>();
        List<Expression> expressions = new ArrayList<>();
        for (Calculation calculation : step.calculations()) {
            if (!StringUtils.hasText(calculation.field())) {
                throw new ConfigurationException("Map step " + step.id() + " has a calculation without a target field");
            }
            targets.add(calculation.field());
            try {
                expressions.add(ExpressionParser.parse(calculation.expression()));
            } catch (ConfigurationException exception) {
                throw new ConfigurationException("Map step " + step.id() + ", field " + calculation.field()
                        + ": " + exception.getMessage(), exception);
            }
        }
        return new PreparedStep(step.id(), step.type()) {
            @Override
            List<Map<String, Object>> apply(List<Map<String, Object>> records, RecordFailures failures) {
                List<Map<String, Object>> mapped = new ArrayList<>(records.size());
                for (int i = 0; i < records.size(); i++) {
                    Map<String, Object> output = new LinkedHashMap<>(records.get(i));
                    try {
                        // Later calculations see the fields written by earlier ones.
                        for (int c = 0; c < targets.size(); c++) {
                            output.put(targets.get(c), expressions.get(c).evaluate(output));
                        }
                        mapped.add(output);
                    } catch (RecordException exception) {
                        failures.add(step.id(), i, exception.getMessage());
                    }
                }
                return mapped;
            }
        };
    }

    private PreparedStep prepareAggregate(AggregateStep step) {
        if (step.measures().isEmpty()) {
            throw new ConfigurationException("Aggregate step " + step.id() + " has no measures");
        }
        Set<String> outputs = new HashSet<>();
        for (String field : step.groupBy()) {
            if (!StringUtils.hasText(field) || !outputs.add(field)) {
                throw new ConfigurationException("Aggregate step " + step.id() + " has an empty or repeated group-by field");
            }
        }
        for (Measure measure : step.measures()) {
            if (!StringUtils.hasText(measure.field()) || measure.function() == null) {
                throw new ConfigurationException("Aggregate step " + step.id() + " has a measure without a field or function");
            }
            if (!outputs.add(measure.outputField())) {
                throw new ConfigurationException("Aggregate step " + step.id() + " writes field "
                        + measure.outputField() + " more than once");
            }
        }
        return new PreparedStep(step.id(), step.type()) {
            @Override
            List<Map<String, Object>> apply(List<Map<String, Object>> records, RecordFailures failures) {
                Map<List<Object>, GroupAccumulator> groups = new LinkedHashMap<>();
                for (int i = 0; i < records.size(); i++) {
                    Map<String, Object> record = records.get(i);
                    String problem = GroupAccumulator.rejectReason(step.measures(), record);
                    if (problem != null) {
                        failures.add(step.id(), i, problem);
                        continue;
                    }
                    List<Object> key = new ArrayList<>(step.groupBy().size());
                    for (String field : step.groupBy()) {
                        Object value = record.get(field);
                        key.add(value == null ? "" : value);
                    }
                    groups.computeIfAbsent(key, k -> new GroupAccumulator(step.measures())).accept(record);
                }
                List<Map<String, Object>> aggregated = new ArrayList<>(groups.size());
                groups.forEach((key, accumulator) -> {
                    Map<String, Object> output = new LinkedHashMap<>();
                    for (int g = 0; g < step.groupBy().size(); g++) {
                        output.put(step.groupBy().get(g), key.get(g));
                    }
                    accumulator.writeTo(output);
                    aggregated.add(output);
                });
                return aggregated;
            }
        };
    }

    private PreparedStep prepareValidate(ValidateStep step) {
        if (step.rules().isEmpty()) {
            throw new ConfigurationException("Validate step " + step.id() + " has no rules");
        }
        for (ValidationRule rule : step.rules()) {
            if (!StringUtils.hasText(rule.field())) {
                throw new ConfigurationException("Validate step " + step.id() + " has a rule without a field");
            }
            if (rule.min() != null && rule.max() != null && rule.min().compareTo(rule.max()) > 0) {
                throw new ConfigurationException("Validate step " + step.id() + ": min is greater than max for "
                        + rule.field());
            }
        }
        return new PreparedStep(step.id(), step.type()) {
            @Override
            List<Map<String, Object>> apply(List<Map<String, Object>> records, RecordFailures failures) {
                List<Map<String, Object>> valid = new ArrayList<>();
                for (int i = 0; i < records.size(); i++) {
                    List<String> violations = RecordValidator.violations(records.get(i), step.rules());
                    if (violations.isEmpty()) {
                        valid.add(records.get(i));
                    } else {
                        failures.add(step.id(), i, String.join("; ", violations));
                    }
                }
                return valid;
            }
        };
    }

    private void checkEnrich(EnrichStep step) {
        if (step.joins().isEmpty()) {
            throw new ConfigurationException("Enrich step " + step.id() + " has no joins");
        }
        for (EnrichmentJoin join : step.joins()) {
            if (!StringUtils.hasText(join.dataset()) || !StringUtils.hasText(join.on())) {
                throw new ConfigurationException("Enrich step " + step.id() + " has a join without dataset or key");
            }
            if (join.fields().isEmpty()) {
                throw new ConfigurationException("Enrich step " + step.id() + " copies no fields from " + join.dataset());
            }
        }
    }

    private PreparedStep prepareEnrich(EnrichStep step, TransformContext context) {
        checkEnrich(step);
        if (!StringUtils.hasText(context.tenantId())) {
            throw new ConfigurationException("Enrich step " + step.id() + " needs a tenant context");
        }
        List<Map<String, Map<String, Object>>> lookups = new ArrayList<>();
        for (EnrichmentJoin join : step.joins()) {
            lookups.add(auxiliaryDataProvider.load(context.tenantId(), join.dataset(), join.effectiveLookupKey()));
        }
        return new PreparedStep(step.id(), step.type()) {
            @Override
            List<Map<String, Object>> apply(List<Map<String, Object>> records, RecordFailures failures) {
                List<Map<String, Object>> enriched = new ArrayList<>(records.size());
                for (Map<String, Object> record : records) {
                    Map<String, Object> output = new LinkedHashMap<>(record);
                    for (int j = 0; j < step.joins().size(); j++) {
                        EnrichmentJoin join = step.joins().get(j);
                        Object key = record.get(join.on());
                        Map<String, Object> match = key == null ? null : lookups.get(j).get(String.valueOf(key));
                        if (match != null) {
                            for (String field : join.fields()) {
                                output.put(field, match.get(field));
                            }
                        }
                    }
                    enriched.add(output);
                }
                return enriched;
            }
        };
    }

    private abstract static class PreparedStep {

        private final String id;
        private final String type;

        PreparedStep(String id, String type) {
            this.id = id;
            this.type = type;
        }

        String id() {
            return id;
        }

        String type() {
            return type;
        }

        abstract List<Map<String, Object>> apply(List<Map<String, Object>> records, RecordFailures failures);
    }

    private static final class RecordFailures {

        private final int maxMessages;
        private final List<String> messages = new ArrayList<>();
        private int count;

        RecordFailures(int maxMessages) {
            this.maxMessages = maxMessages;
        }

        void add(String stepId, int index, String message) {
            count++;
            if (messages.size() < maxMessages) {
                messages.add("Step " + stepId + ", record " + index + ": " + message);
            }
        }

        int count() {
            return count;
        }

        List<String> messages() {
            return messages;
        }
    }
}
