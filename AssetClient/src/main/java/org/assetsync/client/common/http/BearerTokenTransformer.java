package org.assetsync.client.common.http;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import lombok.RequiredArgsConstructor;
import reactor.core.publisher.Mono;

/**
 * Adds an {@code Authorization: Bearer} header obtained from a {@link ClientCredentialsTokenSource}.
 */
@RequiredArgsConstructor
public class BearerTokenTransformer implements RequestTransformer {
    private static final String AUTHORIZATION_HEADER_NAME = "Authorization";

    private final ClientCredentialsTokenSource tokenSource;

    @Override
    public Mono<Map<String, List<String>>> transform(String method, String path, Map<String, List<String>> headers) {
        return tokenSource.accessToken()
            .map(token -> {
                Map<String, List<String>> withAuth = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
                withAuth.putAll(headers);
                withAuth.put(AUTHORIZATION_HEADER_NAME, List.of("Bearer " + token));
                return withAuth;
            });
    }
}
