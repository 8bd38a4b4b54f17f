package org.assetsync.client.common.http;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

import io.netty.buffer.Unpooled;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpMethod;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.netty.ByteBufMono;
import reactor.netty.http.client.HttpClient;
import reactor.netty.http.client.HttpClientResponse;

/**
 * Implementation of HttpClientAdapter using Reactor Netty.
 */
@Slf4j
public class ReactorNettyAdapter implements HttpClientAdapter {
    private final HttpClient client;

    public ReactorNettyAdapter(HttpClient client) {
        this.client = client;
    }

    @Override
    public Mono<HttpResponse> request(String method, String path, String body, Map<String, List<String>> headers) {
        return client
            .headers(h -> headers.forEach(h::add))
            .request(HttpMethod.valueOf(method))
            .uri(toUri(path))
            .send(Mono.justOrEmpty(body).map(b -> Unpooled.wrappedBuffer(b.getBytes(StandardCharsets.UTF_8))))
            .responseSingle(this::toHttpResponse)
            .doOnNext(response -> log.atDebug().setMessage("{} {} -> {}")
                .addArgument(method).addArgument(path).addArgument(response::getStatusCode).log());
    }

    @Override
    public Mono<HttpResponse> multipart(String path, MultipartPart part, Map<String, List<String>> headers) {
        return client
            .headers(h -> headers.forEach(h::add))
            .post()
            .uri(toUri(path))
            .sendForm((request, form) -> form
                .multipart(true)
                .file(part.name(), part.filename(), new ByteArrayInputStream(part.content()), part.contentType()))
            .responseSingle(this::toHttpResponse)
            .doOnNext(response -> log.atDebug().setMessage("POST {} ({} bytes multipart) -> {}")
                .addArgument(path).addArgument(part.content().length).addArgument(response::getStatusCode).log());
    }

    private Mono<HttpResponse> toHttpResponse(HttpClientResponse response, ByteBufMono bytes) {
        return bytes.asByteArray()
            .singleOptional()
            .map(bodyOp -> new HttpResponse(
                response.status().code(),
                response.status().reasonPhrase(),
                extractHeaders(response.responseHeaders()),
                bodyOp.orElse(null)
            ));
    }

    static String toUri(String path) {
        if (path.startsWith("http://") || path.startsWith("https://") || path.startsWith("/")) {
            return path;
        }
        return "/" + path;
    }

    private Map<String, String> extractHeaders(HttpHeaders headers) {
        return headers.entries().stream()
            .collect(Collectors.toMap(
                Map.Entry::getKey,
                Map.Entry::getValue,
                (v1, v2) -> v1 + "," + v2,
                () -> new TreeMap<>(String.CASE_INSENSITIVE_ORDER)
            ));
    }
}
