package org.tenantwarehouse.models.pipeline;

import lombok.Builder;
import lombok.Getter;
import org.tenantwarehouse.models.enums.PipelineStatus;
import org.tenantwarehouse.models.transform.TransformationStep;

import java.time.Instant;
import java.util.List;

/**
 * A registered pipeline. Everything but {@link #getLastRun()} and {@link #getStatus()} is fixed at
 * construction; the run state is written only by the pipeline runner while it holds the
 * pipeline's in-flight slot.
 */
@Getter
public class PipelineDefinition {

    private final String id;
    private final String tenantId;
    private final String name;
    private final SourceDescriptor source;
    private final List<TransformationStep> steps;
    private final Destination destination;
    private final Schedule schedule;
    private final boolean enabled;

    private volatile Instant lastRun;
    private volatile PipelineStatus status;

    @Builder
    public PipelineDefinition(String id,
                              String tenantId,
                              String name,
                              SourceDescriptor source,
                              List<TransformationStep> steps,
                              Destination destination,
                              Schedule schedule,
                              Boolean enabled,
                              Instant lastRun) {
        this.id = id;
        this.tenantId = tenantId;
        this.name = name;
        this.source = source;
        this.steps = steps == null ? List.of() : List.copyOf(steps);
        this.destination = destination;
        this.schedule = schedule;
        this.enabled = enabled == null || enabled;
        this.lastRun = lastRun;
        this.status = PipelineStatus.IDLE;
    }

    /**
     * Carries the watermark of the definition this one replaces, unless this one was built with its own.
     */
    public void inheritLastRun(PipelineDefinition previous) {
        if (this.lastRun == null && previous != null) {
            this.lastRun = previous.getLastRun();
        }
    }

    public void markRunning() {
        this.status = PipelineStatus.RUNNING;
    }

    public void markCompleted(Instant runStartedAt) {
        this.lastRun = runStartedAt;
        this.status = PipelineStatus.COMPLETED;
    }

    public void markFailed() {
        this.status = PipelineStatus.FAILED;
    }
}
