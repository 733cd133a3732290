package org.tenantwarehouse.exceptions;

public class PipelineNotFoundException extends AnalyticsException {

    public PipelineNotFoundException(String pipelineId) {
        super("Pipeline not found: " + pipelineId);
    }
}
