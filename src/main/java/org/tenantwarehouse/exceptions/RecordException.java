package org.tenantwarehouse.exceptions;

/**
 * A single record could not be transformed. Recovered by the transformation engine: the record
 * is counted as failed and excluded from the batch.
 */
public class RecordException extends AnalyticsException {

    public RecordException(String message) {
        super(message);
    }
}
