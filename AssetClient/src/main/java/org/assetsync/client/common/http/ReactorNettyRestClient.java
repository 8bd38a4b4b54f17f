package org.assetsync.client.common.http;

import javax.net.ssl.SSLEngine;
import javax.net.ssl.SSLException;
import javax.net.ssl.SSLParameters;

import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.util.InsecureTrustManagerFactory;
import lombok.extern.slf4j.Slf4j;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;
import reactor.netty.tcp.SslProvider;

/**
 * Implementation of RestClient using Reactor Netty. Owns its connection pool,
 * which is released by {@link #close()}.
 */
@Slf4j
public class ReactorNettyRestClient extends AbstractRestClient {
    private static final int DEFAULT_MAX_CONNECTIONS = 16;

    private final ConnectionProvider connectionProvider;

    /**
     * Creates a new ReactorNettyRestClient with default connection settings.
     *
     * @param connectionContext The connection context
     */
    public ReactorNettyRestClient(ConnectionContext connectionContext) {
        this(connectionContext, DEFAULT_MAX_CONNECTIONS);
    }

    /**
     * Creates a new ReactorNettyRestClient with the specified maximum connections.
     *
     * @param connectionContext The connection context
     * @param maxConnections The maximum number of pooled connections
     */
    public ReactorNettyRestClient(ConnectionContext connectionContext, int maxConnections) {
        this(connectionContext, ConnectionProvider.create("AssetSyncRestClient", Math.max(1, maxConnections)));
    }

    private ReactorNettyRestClient(ConnectionContext connectionContext, ConnectionProvider connectionProvider) {
        this(connectionContext, connectionProvider, createAdapter(connectionContext, connectionProvider));
    }

    private ReactorNettyRestClient(
        ConnectionContext connectionContext,
        ConnectionProvider connectionProvider,
        ReactorNettyAdapter adapter
    ) {
        super(connectionContext, adapter, createTransformer(connectionContext, adapter));
        this.connectionProvider = connectionProvider;
    }

    private static RequestTransformer createTransformer(ConnectionContext connectionContext, HttpClientAdapter adapter) {
        if (connectionContext.hasClientCredentials()) {
            return new BearerTokenTransformer(new ClientCredentialsTokenSource(adapter, connectionContext));
        }
        return NoAuthTransformer.INSTANCE;
    }

    private static ReactorNettyAdapter createAdapter(ConnectionContext connectionContext,
                                                     ConnectionProvider connectionProvider) {
        var httpClient = HttpClient.create(connectionProvider)
            .baseUrl(connectionContext.getUri().toString())
            .followRedirect(false)
            .keepAlive(true);

        if (connectionContext.getProtocol() == ConnectionContext.Protocol.HTTPS) {
            var sslProvider = connectionContext.isInsecure()
                ? getInsecureSslProvider()
                : SslProvider.defaultClientProvider();
            httpClient = httpClient.secure(sslProvider);
        }
        return new ReactorNettyAdapter(httpClient);
    }

    private static SslProvider getInsecureSslProvider() {
        log.warn("TLS certificate verification is disabled for this connection");
        try {
            SslContext sslContext = SslContextBuilder.forClient()
                .trustManager(InsecureTrustManagerFactory.INSTANCE)
                .build();

            return SslProvider.builder()
                .sslContext(sslContext)
                .handlerConfigurator(sslHandler -> {
                    SSLEngine engine = sslHandler.engine();
                    SSLParameters sslParameters = engine.getSSLParameters();
                    sslParameters.setEndpointIdentificationAlgorithm(null);
                    engine.setSSLParameters(sslParameters);
                })
                .build();
        } catch (SSLException e) {
            throw new IllegalStateException("Unable to construct SslProvider", e);
        }
    }

    @Override
    public void close() {
        connectionProvider.dispose();
    }
}
