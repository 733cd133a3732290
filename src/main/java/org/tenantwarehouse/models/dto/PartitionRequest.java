package org.tenantwarehouse.models.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class PartitionRequest {

    @NotBlank
    private String table;

    @NotNull
    private PartitionStrategy strategy;
}
