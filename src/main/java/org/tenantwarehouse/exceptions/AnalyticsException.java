package org.tenantwarehouse.exceptions;

/**
 * Root of every failure raised by the warehouse engine.
 */
public class AnalyticsException extends RuntimeException {

    public AnalyticsException(String message) {
        super(message);
    }

    public AnalyticsException(String message, Throwable cause) {
        super(message, cause);
    }
}
