package org.tenantwarehouse.models.dto;

import java.util.List;
import java.util.Set;

public record TenantAnalyticsStatus(String tenantId,
                                    String schema,
                                    List<String> pipelineIds,
                                    Set<String> triggers) {
}
