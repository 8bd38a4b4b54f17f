package org.assetsync.changes;

import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

import org.assetsync.client.common.DamApiClient;
import org.assetsync.client.common.http.AbstractRestClient;
import org.assetsync.client.common.http.ConnectionParams;
import org.assetsync.client.common.http.HttpClientAdapter;
import org.assetsync.client.common.http.HttpResponse;
import org.assetsync.client.common.http.MultipartPart;
import org.assetsync.client.common.http.NoAuthTransformer;

import reactor.core.publisher.Mono;

/**
 * In-process stand-in for the DAM service. Responses are scripted per "METHOD path"; queued
 * responses are served in order and the last one repeats. Unscripted requests get a 404.
 */
public class ScriptedHttpClientAdapter implements HttpClientAdapter {

    public record RecordedRequest(
        String method,
        String path,
        String body,
        Map<String, List<String>> headers,
        MultipartPart part
    ) {
        public String header(String name) {
            return headers.entrySet().stream()
                .filter(e -> e.getKey().equalsIgnoreCase(name))
                .map(e -> String.join(",", e.getValue()))
                .findFirst()
                .orElse(null);
        }
    }

    private final List<RecordedRequest> requests = new CopyOnWriteArrayList<>();
    private final Map<String, Deque<HttpResponse>> scripts = new ConcurrentHashMap<>();

    public static HttpResponse response(int status, String body) {
        return new HttpResponse(status, "", Map.of("Content-Type", "application/json"),
            body == null ? null : body.getBytes(StandardCharsets.UTF_8));
    }

    public ScriptedHttpClientAdapter respond(String method, String path, int status, String body) {
        return respond(method, path, response(status, body));
    }

    public ScriptedHttpClientAdapter respond(String method, String path, HttpResponse response) {
        scripts.computeIfAbsent(method + " " + path, k -> new ArrayDeque<>()).add(response);
        return this;
    }

    public DamApiClient client() {
        var context = ConnectionParams.builder().host("http://dam.test").build().toConnectionContext();
        return new DamApiClient(new AbstractRestClient(context, this, NoAuthTransformer.INSTANCE) {});
    }

    @Override
    public Mono<HttpResponse> request(String method, String path, String body, Map<String, List<String>> headers) {
        return Mono.fromCallable(() -> serve(new RecordedRequest(method, path, body, headers, null)));
    }

    @Override
    public Mono<HttpResponse> multipart(String path, MultipartPart part, Map<String, List<String>> headers) {
        return Mono.fromCallable(() -> serve(new RecordedRequest("POST", path, null, headers, part)));
    }

    private HttpResponse serve(RecordedRequest request) {
        requests.add(request);
        var queue = scripts.get(request.method() + " " + request.path());
        if (queue == null || queue.isEmpty()) {
            return response(404, "{\"error\":\"not scripted\"}");
        }
        synchronized (queue) {
            return queue.size() > 1 ? queue.poll() : queue.peek();
        }
    }

    public List<RecordedRequest> requests() {
        return List.copyOf(requests);
    }

    public List<RecordedRequest> requests(String method, String path) {
        return requests.stream()
            .filter(r -> r.method().equals(method) && r.path().equals(path))
            .collect(Collectors.toList());
    }

    public List<RecordedRequest> requestsWithPrefix(String method, String pathPrefix) {
        return requests.stream()
            .filter(r -> r.method().equals(method) && r.path().startsWith(pathPrefix))
            .collect(Collectors.toList());
    }
}
