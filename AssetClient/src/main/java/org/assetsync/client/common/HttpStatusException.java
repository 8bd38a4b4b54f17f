package org.assetsync.client.common;

import lombok.Getter;

/**
 * The remote service answered a request with a non-2xx status.
 */
@Getter
public class HttpStatusException extends ApiException {
    private final String method;
    private final String path;
    private final int statusCode;
    private final String responseBody;

    public HttpStatusException(String method, String path, int statusCode, String responseBody) {
        super(method + " " + path + " failed with status " + statusCode
            + (responseBody == null || responseBody.isEmpty() ? "" : ": " + responseBody));
        this.method = method;
        this.path = path;
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    public boolean isClientError() {
        return statusCode >= 400 && statusCode < 500;
    }
}
