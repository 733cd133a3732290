package org.tenantwarehouse.models.dto;

import java.util.List;

public record QueryValidationResult(boolean valid,
                                    List<String> errors,
                                    List<String> warnings,
                                    List<String> securityIssues) {
}
