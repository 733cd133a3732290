package org.tenantwarehouse.exceptions;

public class LoadException extends AnalyticsException {

    public LoadException(String message) {
        super(message);
    }

    public LoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
