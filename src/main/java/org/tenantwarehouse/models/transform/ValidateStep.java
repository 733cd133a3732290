package org.tenantwarehouse.models.transform;

import java.util.List;

public record ValidateStep(String id, int order, List<ValidationRule> rules) implements TransformationStep {

    public ValidateStep {
        rules = rules == null ? List.of() : List.copyOf(rules);
    }

    @Override
    public String type() {
        return "validate";
    }
}
