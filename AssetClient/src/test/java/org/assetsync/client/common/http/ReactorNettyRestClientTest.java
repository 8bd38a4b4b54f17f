package org.assetsync.client.common.http;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import org.assetsync.client.common.DamApiClient;
import org.assetsync.client.common.HttpStatusException;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;
import reactor.netty.http.server.HttpServer;
import reactor.netty.http.server.HttpServerRequest;
import reactor.netty.http.server.HttpServerResponse;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReactorNettyRestClientTest {
    private static final Duration TIMEOUT = Duration.ofSeconds(10);
    private static final String TOKEN_PATH = ConnectionContext.DEFAULT_TOKEN_PATH;

    private record Received(String method, String uri, String contentType, String authorization,
                            String userAgent, String body) {}

    private final List<Received> received = new CopyOnWriteArrayList<>();
    private final AtomicInteger tokenRequests = new AtomicInteger();
    private DisposableServer server;

    @BeforeEach
    void startServer() {
        server = HttpServer.create()
            .host("localhost")
            .port(0)
            .handle((request, response) -> request.receive().aggregate().asString(StandardCharsets.UTF_8)
                .defaultIfEmpty("")
                .flatMap(body -> {
                    var headers = request.requestHeaders();
                    received.add(new Received(request.method().name(), request.uri(), headers.get("Content-Type"),
                        headers.get("Authorization"), headers.get("User-Agent"), body));
                    return respond(request, response);
                }))
            .bindNow();
    }

    @AfterEach
    void stopServer() {
        server.disposeNow();
    }

    private Mono<Void> respond(HttpServerRequest request, HttpServerResponse response) {
        switch (request.uri()) {
            case TOKEN_PATH:
                tokenRequests.incrementAndGet();
                return response.header("Content-Type", "application/json")
                    .sendString(Mono.just("{\"access_token\":\"tok-1\",\"token_type\":\"bearer\",\"expires_in\":3600}"))
                    .then();
            case "/fotoweb/archives/":
                return response.header("Content-Type", "application/json")
                    .sendString(Mono.just("{\"name\":\"Photos\"}"))
                    .then();
            case "/missing":
                return response.status(404).sendString(Mono.just("{\"error\":\"no such asset\"}")).then();
            default:
                return response.status(200).sendString(Mono.just("{}")).then();
        }
    }

    private ReactorNettyRestClient client(String clientId, String clientSecret) {
        var context = ConnectionParams.builder()
            .host("http://localhost:" + server.port())
            .clientId(clientId)
            .clientSecret(clientSecret)
            .build()
            .toConnectionContext();
        return new ReactorNettyRestClient(context);
    }

    @Test
    void getReturnsStatusHeadersAndBody() {
        try (var restClient = client(null, null)) {
            var response = restClient.getAsync("/fotoweb/archives/").block(TIMEOUT);

            assertEquals(200, response.getStatusCode());
            assertEquals("{\"name\":\"Photos\"}", response.getBodyAsString());
            assertEquals("application/json", response.getHeader("content-type"));
            var request = received.get(0);
            assertEquals("GET", request.method());
            assertEquals("AssetSync-1.0", request.userAgent());
            assertNull(request.authorization());
        }
    }

    @Test
    void patchSendsJsonBodyWithRequestedMediaType() {
        try (var client = new DamApiClient(client(null, null))) {
            StepVerifier.create(client.patch("/fotoweb/archives/5000/a.jpg.info",
                    "application/vnd.fotoware.assetupdate+json", Map.of("metadata", Map.of())))
                .expectNextCount(1)
                .expectComplete()
                .verify(TIMEOUT);

            var request = received.get(0);
            assertEquals("PATCH", request.method());
            assertEquals("/fotoweb/archives/5000/a.jpg.info", request.uri());
            assertEquals("application/vnd.fotoware.assetupdate+json", request.contentType());
            assertEquals("{\"metadata\":{}}", request.body());
        }
    }

    @Test
    void multipartSendsOneNamedFilePart() {
        var content = "chunk-bytes-0123".getBytes(StandardCharsets.UTF_8);
        try (var client = new DamApiClient(client(null, null))) {
            StepVerifier.create(client.postMultipart("/fotoweb/api/uploads/s1/chunks/0",
                    MultipartPart.octetStream("chunk", "chunk", content)))
                .expectNextCount(1)
                .expectComplete()
                .verify(TIMEOUT);

            var request = received.get(0);
            assertEquals("POST", request.method());
            assertTrue(request.contentType().startsWith("multipart/form-data"), request.contentType());
            assertTrue(request.body().contains("name=\"chunk\""), request.body());
            assertTrue(request.body().contains("filename=\"chunk\""), request.body());
            assertTrue(request.body().contains("application/octet-stream"), request.body());
            assertTrue(request.body().contains("chunk-bytes-0123"), request.body());
        }
    }

    @Test
    void errorStatusBecomesHttpStatusException() {
        try (var client = new DamApiClient(client(null, null))) {
            StepVerifier.create(client.get("/missing"))
                .expectErrorSatisfies(e -> {
                    var status = assertInstanceOf(HttpStatusException.class, e);
                    assertEquals(404, status.getStatusCode());
                    assertEquals("GET", status.getMethod());
                    assertTrue(status.getResponseBody().contains("no such asset"));
                })
                .verify(TIMEOUT);
        }
    }

    @Test
    void bearerTokenIsFetchedOnceAndReused() {
        try (var restClient = client("sync-app", "s3cret&more")) {
            restClient.getAsync("/fotoweb/archives/").block(TIMEOUT);
            restClient.getAsync("/fotoweb/archives/").block(TIMEOUT);

            assertEquals(1, tokenRequests.get());
            var tokenRequest = received.get(0);
            assertEquals(TOKEN_PATH, tokenRequest.uri());
            assertEquals("application/x-www-form-urlencoded", tokenRequest.contentType());
            assertTrue(tokenRequest.body().contains("grant_type=client_credentials"));
            assertTrue(tokenRequest.body().contains("client_secret=s3cret%26more"));
            var apiRequests = received.stream()
                .filter(r -> !r.uri().equals(TOKEN_PATH))
                .collect(Collectors.toList());
            assertEquals(2, apiRequests.size());
            apiRequests.forEach(r -> assertEquals("Bearer tok-1", r.authorization()));
        }
    }
}
