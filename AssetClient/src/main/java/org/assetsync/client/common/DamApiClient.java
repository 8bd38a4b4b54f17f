package org.assetsync.client.common;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.assetsync.client.common.http.AbstractRestClient;
import org.assetsync.client.common.http.HttpResponse;
import org.assetsync.client.common.http.MultipartPart;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * The transport the change engine talks through. Every operation raises
 * {@link HttpStatusException} when the service answers with a non-2xx status.
 */
@Slf4j
public class DamApiClient implements AutoCloseable {
    private static final String CONTENT_TYPE_HEADER_NAME = "Content-Type";

    @Getter
    private final ObjectMapper objectMapper;
    private final AbstractRestClient restClient;

    public DamApiClient(AbstractRestClient restClient) {
        this(restClient, new ObjectMapper());
    }

    public DamApiClient(AbstractRestClient restClient, ObjectMapper objectMapper) {
        this.restClient = restClient;
        this.objectMapper = objectMapper;
    }

    public Mono<HttpResponse> get(String path) {
        return restClient.getAsync(path)
            .flatMap(response -> checkStatus("GET", path, response));
    }

    /**
     * POSTs {@code body} serialized as JSON under the given media type.
     */
    public Mono<HttpResponse> post(String path, String contentType, Object body) {
        return toJson(body)
            .flatMap(json -> restClient.postAsync(path, json, contentTypeHeader(contentType)))
            .flatMap(response -> checkStatus("POST", path, response));
    }

    /**
     * PATCHes {@code body} serialized as JSON under the given media type.
     */
    public Mono<HttpResponse> patch(String path, String contentType, Object body) {
        return toJson(body)
            .flatMap(json -> restClient.patchAsync(path, json, contentTypeHeader(contentType)))
            .flatMap(response -> checkStatus("PATCH", path, response));
    }

    public Mono<HttpResponse> postMultipart(String path, MultipartPart part) {
        return restClient.multipartAsync(path, part)
            .flatMap(response -> checkStatus("POST", path, response));
    }

    /**
     * Deserializes a response body, failing with an {@link ApiException} if it is missing or malformed.
     */
    public <T> Mono<T> readBody(HttpResponse response, Class<T> type) {
        if (!response.hasBody()) {
            return Mono.error(new ApiException("Expected a " + type.getSimpleName() + " body but the response was empty"));
        }
        return Mono.fromCallable(() -> objectMapper.readValue(response.getBody(), type))
            .onErrorMap(JsonProcessingException.class,
                e -> new ApiException("Unable to parse " + type.getSimpleName() + " from response", e));
    }

    private Mono<String> toJson(Object body) {
        return Mono.fromCallable(() -> objectMapper.writeValueAsString(body))
            .doOnNext(json -> log.atTrace().setMessage("Request body: {}").addArgument(json).log());
    }

    private static Map<String, List<String>> contentTypeHeader(String contentType) {
        return Map.of(CONTENT_TYPE_HEADER_NAME, List.of(contentType));
    }

    private static Mono<HttpResponse> checkStatus(String method, String path, HttpResponse response) {
        if (response.isSuccess()) {
            return Mono.just(response);
        }
        return Mono.error(new HttpStatusException(method, path, response.getStatusCode(), response.getBodyAsString()));
    }

    @Override
    public void close() {
        restClient.close();
    }
}
