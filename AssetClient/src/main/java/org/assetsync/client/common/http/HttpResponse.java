package org.assetsync.client.common.http;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

import lombok.Getter;
import lombok.ToString;

/**
 * A fully-read HTTP response. Header lookups are case-insensitive.
 */
@Getter
@ToString(exclude = "body")
public class HttpResponse {
    private final int statusCode;
    private final String statusText;
    private final Map<String, String> headers;
    private final byte[] body;

    public HttpResponse(int statusCode, String statusText, Map<String, String> headers, byte[] body) {
        this.statusCode = statusCode;
        this.statusText = statusText;
        var caseInsensitive = new TreeMap<String, String>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            caseInsensitive.putAll(headers);
        }
        this.headers = Collections.unmodifiableMap(caseInsensitive);
        this.body = body;
    }

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }

    public String getHeader(String name) {
        return headers.get(name);
    }

    public boolean hasBody() {
        return body != null && body.length > 0;
    }

    public String getBodyAsString() {
        return body == null ? null : new String(body, StandardCharsets.UTF_8);
    }
}
