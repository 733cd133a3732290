package org.tenantwarehouse.repository;

import org.tenantwarehouse.models.entity.PipelineRun;
import org.tenantwarehouse.models.enums.PipelineStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface PipelineRunRepository extends JpaRepository<PipelineRun, Long> {

    Optional<PipelineRun> findFirstByPipelineIdOrderByStartedAtDesc(String pipelineId);

    List<PipelineRun> findTop20ByPipelineIdOrderByStartedAtDesc(String pipelineId);

    @Query("select max(r.endedAt) from PipelineRun r where r.tenantId = :tenantId and r.runStatus = :status")
    Optional<Instant> findLastEndedAt(@Param("tenantId") String tenantId, @Param("status") PipelineStatus status);
}
