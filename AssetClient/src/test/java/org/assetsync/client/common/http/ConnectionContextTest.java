package org.assetsync.client.common.http;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConnectionContextTest {

    @Test
    void httpsHostWithCredentials() {
        var context = ConnectionParams.builder()
            .host("https://dam.example.com/")
            .clientId("app")
            .clientSecret("secret")
            .build()
            .toConnectionContext();

        assertEquals(ConnectionContext.Protocol.HTTPS, context.getProtocol());
        assertEquals("https://dam.example.com", context.getUri().toString());
        assertEquals(ConnectionContext.DEFAULT_TOKEN_PATH, context.getTokenPath());
        assertTrue(context.hasClientCredentials());
        assertFalse(context.toString().contains("secret"));
    }

    @Test
    void plainHostWithoutCredentials() {
        var context = ConnectionParams.builder().host("http://localhost:8080").build().toConnectionContext();
        assertEquals(ConnectionContext.Protocol.HTTP, context.getProtocol());
        assertFalse(context.hasClientCredentials());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "ftp://dam.example.com", "dam.example.com"})
    void unusableHostsAreRejected(String host) {
        var params = ConnectionParams.builder().host(host).build();
        assertThrows(IllegalArgumentException.class, params::toConnectionContext);
    }

    @Test
    void credentialsComeInPairs() {
        var params = ConnectionParams.builder().host("https://dam.example.com").clientId("app").build();
        assertThrows(IllegalArgumentException.class, params::toConnectionContext);
    }

    @Test
    void insecureTlsNeedsHttps() {
        var params = ConnectionParams.builder().host("http://dam.example.com").insecure(true).build();
        assertThrows(IllegalArgumentException.class, params::toConnectionContext);
    }

    @Test
    void relativePathsGetLeadingSlash() {
        assertEquals("/fotoweb/api/uploads", ReactorNettyAdapter.toUri("fotoweb/api/uploads"));
        assertEquals("/fotoweb/api/uploads", ReactorNettyAdapter.toUri("/fotoweb/api/uploads"));
        assertEquals("https://cdn.example.com/r/1", ReactorNettyAdapter.toUri("https://cdn.example.com/r/1"));
    }
}
