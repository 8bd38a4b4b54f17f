package org.assetsync.client.common.http;

import java.net.URI;
import java.net.URISyntaxException;

import lombok.Getter;
import lombok.ToString;

/**
 * Stores the connection details for one DAM service tenant.
 */
@Getter
@ToString(exclude = "clientSecret")
public class ConnectionContext {
    public static final String DEFAULT_TOKEN_PATH = "/fotoweb/oauth2/token";

    public enum Protocol {
        HTTP,
        HTTPS
    }

    private final URI uri;
    private final Protocol protocol;
    private final String clientId;
    private final String clientSecret;
    private final String tokenPath;
    private final boolean insecure;

    public interface IParams {
        String getHost();

        String getClientId();

        String getClientSecret();

        default String getTokenPath() {
            return DEFAULT_TOKEN_PATH;
        }

        boolean isInsecure();

        default ConnectionContext toConnectionContext() {
            return new ConnectionContext(this);
        }
    }

    public ConnectionContext(IParams params) {
        if (params.getHost() == null || params.getHost().isBlank()) {
            throw new IllegalArgumentException("Host must be provided");
        }
        try {
            this.uri = new URI(stripTrailingSlash(params.getHost()));
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid host URI: " + params.getHost(), e);
        }

        if ("http".equalsIgnoreCase(uri.getScheme())) {
            protocol = Protocol.HTTP;
        } else if ("https".equalsIgnoreCase(uri.getScheme())) {
            protocol = Protocol.HTTPS;
        } else {
            throw new IllegalArgumentException("Invalid protocol in host, expected http or https: " + params.getHost());
        }

        if ((params.getClientId() == null) != (params.getClientSecret() == null)) {
            throw new IllegalArgumentException("Both client id and client secret must be provided, or neither");
        }
        this.clientId = params.getClientId();
        this.clientSecret = params.getClientSecret();
        this.tokenPath = params.getTokenPath() == null ? DEFAULT_TOKEN_PATH : params.getTokenPath();
        this.insecure = params.isInsecure();

        if (insecure && protocol == Protocol.HTTP) {
            throw new IllegalArgumentException("Cannot allow insecure TLS on a plain http connection");
        }
    }

    public boolean hasClientCredentials() {
        return clientId != null;
    }

    private static String stripTrailingSlash(String host) {
        return host.endsWith("/") ? host.substring(0, host.length() - 1) : host;
    }
}
