package org.assetsync.client.common;

/**
 * Base class for failures talking to the DAM service API.
 */
public class ApiException extends RuntimeException {
    public ApiException(String message) {
        super(message);
    }

    public ApiException(String message, Throwable cause) {
        super(message, cause);
    }
}
