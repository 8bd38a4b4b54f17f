package org.assetsync.client.common.http;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import lombok.Getter;
import reactor.core.publisher.Mono;

/**
 * Abstract base class for RestClient implementations.
 * Adds the default headers and the request transformer's credentials to every request;
 * responses are passed through whatever their status code.
 */
public abstract class AbstractRestClient implements AutoCloseable {
    @Getter
    protected final ConnectionContext connectionContext;
    protected final HttpClientAdapter httpClientAdapter;
    protected final RequestTransformer requestTransformer;

    private static final String USER_AGENT_HEADER_NAME = "User-Agent";
    private static final String CONTENT_TYPE_HEADER_NAME = "Content-Type";
    private static final String ACCEPT_HEADER_NAME = "Accept";

    private static final String USER_AGENT = "AssetSync-1.0";
    private static final String JSON_CONTENT_TYPE = "application/json";

    protected AbstractRestClient(
        ConnectionContext connectionContext,
        HttpClientAdapter httpClientAdapter,
        RequestTransformer requestTransformer
    ) {
        this.connectionContext = connectionContext;
        this.httpClientAdapter = httpClientAdapter;
        this.requestTransformer = requestTransformer;
    }

    /**
     * Performs an HTTP request.
     *
     * @param method The HTTP method
     * @param path The request path
     * @param body The request body
     * @param additionalHeaders Additional headers, overriding the defaults
     * @return A Mono that emits the HTTP response
     */
    public Mono<HttpResponse> asyncRequest(String method, String path, String body,
                                           Map<String, List<String>> additionalHeaders) {
        var headers = prepareHeaders(body != null, additionalHeaders);
        return requestTransformer.transform(method, path, headers)
            .flatMap(transformed -> httpClientAdapter.request(method, path, body, transformed));
    }

    /**
     * Prepares the headers for an HTTP request.
     *
     * @param hasJsonBody Whether a JSON content type should be declared
     * @param additionalHeaders Additional headers
     * @return The prepared headers
     */
    protected Map<String, List<String>> prepareHeaders(boolean hasJsonBody, Map<String, List<String>> additionalHeaders) {
        Map<String, List<String>> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        headers.put(USER_AGENT_HEADER_NAME, List.of(USER_AGENT));
        headers.put(ACCEPT_HEADER_NAME, List.of(JSON_CONTENT_TYPE));
        if (hasJsonBody) {
            headers.put(CONTENT_TYPE_HEADER_NAME, List.of(JSON_CONTENT_TYPE));
        }
        if (additionalHeaders != null) {
            headers.putAll(additionalHeaders);
        }
        return headers;
    }

    public Mono<HttpResponse> getAsync(String path) {
        return asyncRequest("GET", path, null, null);
    }

    public Mono<HttpResponse> postAsync(String path, String body, Map<String, List<String>> additionalHeaders) {
        return asyncRequest("POST", path, body, additionalHeaders);
    }

    public Mono<HttpResponse> patchAsync(String path, String body, Map<String, List<String>> additionalHeaders) {
        return asyncRequest("PATCH", path, body, additionalHeaders);
    }

    /**
     * Performs a multipart/form-data POST with a single file part.
     */
    public Mono<HttpResponse> multipartAsync(String path, MultipartPart part) {
        var headers = prepareHeaders(false, null);
        return requestTransformer.transform("POST", path, headers)
            .flatMap(transformed -> httpClientAdapter.multipart(path, part, transformed));
    }

    public HttpResponse get(String path) {
        return getAsync(path).block();
    }

    @Override
    public void close() {
        // Default no-op
    }
}
