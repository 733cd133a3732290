package org.tenantwarehouse.models.transform;

import java.util.List;

/**
 * Adds or overwrites named fields from arithmetic expressions over the record's own fields.
 */
public record MapStep(String id, int order, List<Calculation> calculations) implements TransformationStep {

    public MapStep {
        calculations = calculations == null ? List.of() : List.copyOf(calculations);
    }

    @Override
    public String type() {
        return "map";
    }
}
