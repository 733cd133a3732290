package org.tenantwarehouse.models.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
public class QueryRequest {

    @NotBlank
    private String sql;

    private List<Object> parameters = new ArrayList<>();

    private boolean useCache = true;

    @PositiveOrZero
    private Long cacheTtlSeconds;

    @PositiveOrZero
    private Long timeoutMillis;
}
