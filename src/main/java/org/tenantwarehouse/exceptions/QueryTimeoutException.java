package org.tenantwarehouse.exceptions;

import lombok.Getter;

import java.time.Duration;

/**
 * The query lost its race against the wall-clock timeout. No rows are ever returned alongside it.
 */
@Getter
public class QueryTimeoutException extends AnalyticsException {

    private final String queryId;
    private final Duration timeout;

    public QueryTimeoutException(String queryId, Duration timeout) {
        super("Query " + queryId + " exceeded timeout of " + timeout.toMillis() + " ms");
        this.queryId = queryId;
        this.timeout = timeout;
    }
}
