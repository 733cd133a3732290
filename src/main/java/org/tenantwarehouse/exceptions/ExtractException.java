package org.tenantwarehouse.exceptions;

public class ExtractException extends AnalyticsException {

    public ExtractException(String message) {
        super(message);
    }

    public ExtractException(String message, Throwable cause) {
        super(message, cause);
    }
}
