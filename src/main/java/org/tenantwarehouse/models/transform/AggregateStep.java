package org.tenantwarehouse.models.transform;

import java.util.List;

public record AggregateStep(String id, int order, List<String> groupBy, List<Measure> measures)
        implements TransformationStep {

    public AggregateStep {
        groupBy = groupBy == null ? List.of() : List.copyOf(groupBy);
        measures = measures == null ? List.of() : List.copyOf(measures);
    }

    @Override
    public String type() {
        return "aggregate";
    }
}
