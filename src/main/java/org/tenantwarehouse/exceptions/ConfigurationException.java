package org.tenantwarehouse.exceptions;

/**
 * A pipeline, step, partition or query definition is malformed. Raised before any work starts
 * and never retried automatically.
 */
public class ConfigurationException extends AnalyticsException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
