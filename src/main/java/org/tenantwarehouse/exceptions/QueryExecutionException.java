package org.tenantwarehouse.exceptions;

public class QueryExecutionException extends AnalyticsException {

    public QueryExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
