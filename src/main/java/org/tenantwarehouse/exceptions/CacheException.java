package org.tenantwarehouse.exceptions;

/**
 * The cache backend is unavailable. Callers degrade to uncached behaviour.
 */
public class CacheException extends AnalyticsException {

    public CacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
