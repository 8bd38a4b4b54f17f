package org.assetsync.client.common.http;

import java.util.List;
import java.util.Map;

import reactor.core.publisher.Mono;

/**
 * Interface for HTTP client adapters. This abstraction keeps the rest clients
 * independent of the underlying HTTP library.
 */
public interface HttpClientAdapter {
    /**
     * Performs an HTTP request.
     *
     * @param method The HTTP method (GET, POST, PATCH, etc.)
     * @param path The request path, relative to the connection's base URI, or an absolute URL
     * @param body The request body, or null if no body
     * @param headers The request headers
     * @return A Mono that emits the HTTP response, whatever its status code
     */
    Mono<HttpResponse> request(String method, String path, String body, Map<String, List<String>> headers);

    /**
     * Performs a multipart/form-data POST carrying a single file part.
     *
     * @param path The request path
     * @param part The file part to send
     * @param headers The request headers; the content type is set by the adapter
     * @return A Mono that emits the HTTP response, whatever its status code
     */
    Mono<HttpResponse> multipart(String path, MultipartPart part, Map<String, List<String>> headers);
}
