package org.assetsync.client.common.http;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.assetsync.client.common.ApiException;
import org.assetsync.client.common.HttpStatusException;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Fetches OAuth2 access tokens with the client-credentials grant and caches each
 * token until shortly before it expires. Concurrent callers share one in-flight fetch.
 */
@Slf4j
public class ClientCredentialsTokenSource {
    private static final ObjectMapper objectMapper = new ObjectMapper();
    static final Duration REFRESH_BEFORE_EXPIRY = Duration.ofSeconds(30);
    static final Duration DEFAULT_LIFETIME = Duration.ofMinutes(5);

    private final HttpClientAdapter httpClientAdapter;
    private final ConnectionContext connectionContext;
    private final Mono<TokenResponse> cachedToken;

    @JsonIgnoreProperties(ignoreUnknown = true)
    record TokenResponse(
        @JsonProperty("access_token") String accessToken,
        @JsonProperty("token_type") String tokenType,
        @JsonProperty("expires_in") Long expiresIn
    ) {
        Duration lifetime() {
            var lifetime = expiresIn == null ? DEFAULT_LIFETIME : Duration.ofSeconds(expiresIn);
            var usable = lifetime.minus(REFRESH_BEFORE_EXPIRY);
            return usable.isNegative() ? Duration.ZERO : usable;
        }
    }

    public ClientCredentialsTokenSource(HttpClientAdapter httpClientAdapter, ConnectionContext connectionContext) {
        if (!connectionContext.hasClientCredentials()) {
            throw new IllegalArgumentException("Connection has no client credentials configured");
        }
        this.httpClientAdapter = httpClientAdapter;
        this.connectionContext = connectionContext;
        this.cachedToken = Mono.defer(this::fetchToken)
            .cache(TokenResponse::lifetime, error -> Duration.ZERO, () -> Duration.ZERO);
    }

    public Mono<String> accessToken() {
        return cachedToken.map(TokenResponse::accessToken);
    }

    private Mono<TokenResponse> fetchToken() {
        var path = connectionContext.getTokenPath();
        var body = "grant_type=client_credentials"
            + "&client_id=" + URLEncoder.encode(connectionContext.getClientId(), StandardCharsets.UTF_8)
            + "&client_secret=" + URLEncoder.encode(connectionContext.getClientSecret(), StandardCharsets.UTF_8);
        Map<String, List<String>> headers = Map.of(
            "Content-Type", List.of("application/x-www-form-urlencoded"),
            "Accept", List.of("application/json")
        );
        log.debug("Requesting access token from {}", path);
        return httpClientAdapter.request("POST", path, body, headers)
            .flatMap(response -> {
                if (!response.isSuccess()) {
                    return Mono.error(new HttpStatusException("POST", path, response.getStatusCode(),
                        response.getBodyAsString()));
                }
                return Mono.fromCallable(() -> objectMapper.readValue(response.getBody(), TokenResponse.class));
            })
            .flatMap(token -> token.accessToken() == null || token.accessToken().isBlank()
                ? Mono.<TokenResponse>error(new ApiException("Token endpoint returned no access_token"))
                : Mono.just(token))
            .doOnNext(token -> log.info("Obtained access token, valid for {}", token.lifetime()));
    }
}
