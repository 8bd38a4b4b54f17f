package org.assetsync.client.common.http;

import java.util.List;
import java.util.Map;

import reactor.core.publisher.Mono;

/**
 * Decorates the headers of an outgoing request, e.g. with credentials.
 */
public interface RequestTransformer {
    Mono<Map<String, List<String>>> transform(String method, String path, Map<String, List<String>> headers);
}
