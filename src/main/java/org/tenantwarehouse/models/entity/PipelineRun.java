package org.tenantwarehouse.models.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.tenantwarehouse.models.enums.PipelineStatus;
import org.hibernate.annotations.ColumnDefault;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.List;

@Getter
@Setter
@Entity
@Table(name = "pipeline_run", schema = "analytics_meta",
        indexes = @Index(name = "idx_pipeline_run_pipeline_started", columnList = "pipeline_id, started_at"))
public class PipelineRun {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "pipeline_run_id", nullable = false)
    private Long id;

    @Column(name = "pipeline_run_uid", nullable = false, length = 40)
    private String pipelineRunUid;

    @Column(name = "pipeline_id", nullable = false, length = 200)
    private String pipelineId;

    @Column(name = "tenant_id", nullable = false, length = 100)
    private String tenantId;

    @Enumerated(EnumType.STRING)
    @Column(name = "run_status", nullable = false, length = 20)
    private PipelineStatus runStatus;

    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    @Column(name = "ended_at")
    private Instant endedAt;

    @ColumnDefault("0")
    @Column(name = "records_processed")
    private Integer recordsProcessed;

    @ColumnDefault("0")
    @Column(name = "records_successful")
    private Integer recordsSuccessful;

    @ColumnDefault("0")
    @Column(name = "records_failed")
    private Integer recordsFailed;

    @Column(name = "errors")
    @JdbcTypeCode(SqlTypes.JSON)
    private List<String> errors;

    @Column(name = "extract_ms")
    private Long extractMs;

    @Column(name = "transform_ms")
    private Long transformMs;

    @Column(name = "load_ms")
    private Long loadMs;

    @Column(name = "total_ms")
    private Long totalMs;
}
