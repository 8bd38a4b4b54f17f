package org.assetsync.client.common.http;

import java.util.List;
import java.util.Map;

import reactor.core.publisher.Mono;

public class NoAuthTransformer implements RequestTransformer {
    public static final NoAuthTransformer INSTANCE = new NoAuthTransformer();

    private NoAuthTransformer() {}

    @Override
    public Mono<Map<String, List<String>>> transform(String method, String path, Map<String, List<String>> headers) {
        return Mono.just(headers);
    }
}
