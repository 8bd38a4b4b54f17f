package org.assetsync.client.common.http;

import lombok.Builder;
import lombok.Getter;

/**
 * Plain holder for {@link ConnectionContext.IParams}, for programmatic configuration.
 */
@Getter
@Builder
public class ConnectionParams implements ConnectionContext.IParams {
    private final String host;
    private final String clientId;
    private final String clientSecret;
    @Builder.Default
    private final String tokenPath = ConnectionContext.DEFAULT_TOKEN_PATH;
    private final boolean insecure;
}
