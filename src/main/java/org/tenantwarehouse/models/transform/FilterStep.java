package org.tenantwarehouse.models.transform;

import java.util.List;

/**
 * Keeps records for which every condition holds.
 */
public record FilterStep(String id, int order, List<FilterCondition> conditions) implements TransformationStep {

    public FilterStep {
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
    }

    @Override
    public String type() {
        return "filter";
    }
}
