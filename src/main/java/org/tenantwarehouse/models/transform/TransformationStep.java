package org.tenantwarehouse.models.transform;

import java.util.Comparator;

/**
 * One typed stage of a pipeline's transformation chain. Steps run in ascending {@link #order()},
 * ties broken by {@link #id()}.
 */
public sealed interface TransformationStep
        permits FilterStep, MapStep, AggregateStep, ValidateStep, EnrichStep {

    Comparator<TransformationStep> EXECUTION_ORDER = Comparator
            .comparingInt(TransformationStep::order)
            .thenComparing(TransformationStep::id);

    String id();

    int order();

    String type();
}
