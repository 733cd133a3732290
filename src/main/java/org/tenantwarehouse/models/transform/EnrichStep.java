package org.tenantwarehouse.models.transform;

import java.util.List;

public record EnrichStep(String id, int order, List<EnrichmentJoin> joins) implements TransformationStep {

    public EnrichStep {
        joins = joins == null ? List.of() : List.copyOf(joins);
    }

    @Override
    public String type() {
        return "enrich";
    }
}
