package com.questrail.homeshadow.protocol.isy.config;

import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class IsyConnectionConfigTest {

    @Test
    void derivesEndpointsFromBaseUri() {
        IsyConnectionConfig config = IsyConnectionConfig.builder()
                .withBaseUri("https://192.168.1.10:8443/")
                .withCredentials("admin", "admin")
                .build();

        assertTrue(config.secure());
        assertEquals("192.168.1.10", config.host());
        assertEquals(8443, config.port());
        assertEquals("", config.webRoot());
        assertEquals(URI.create("wss://192.168.1.10:8443/rest/subscribe"), config.websocketUri());
        assertEquals(TransportKind.WEBSOCKET, config.transport());
    }

    @Test
    void defaultPortsAndWebRoot() {
        IsyConnectionConfig config = IsyConnectionConfig.builder()
                .withBaseUri("http://isy.local/webroot//")
                .build();

        assertEquals(80, config.port());
        assertEquals("/webroot", config.webRoot());
        assertEquals(URI.create("ws://isy.local:80/webroot/rest/subscribe"), config.websocketUri());
    }

    @Test
    void basicAuthorizationHeader() {
        IsyConnectionConfig config = IsyConnectionConfig.builder()
                .withBaseUri("http://isy.local")
                .withCredentials("admin", "secret")
                .build();

        assertEquals("Basic YWRtaW46c2VjcmV0", config.basicAuthorization());
        assertFalse(config.toString().contains("secret"));
    }

    @Test
    void invalidSettingsAreRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> IsyConnectionConfig.builder().withBaseUri("ftp://isy.local").build());
        assertThrows(IllegalArgumentException.class,
                () -> IsyConnectionConfig.builder().withBaseUri("http:///nohost").build());
        assertThrows(IllegalArgumentException.class,
                () -> IsyConnectionConfig.builder().withBaseUri("http://isy.local")
                        .withConnectTimeout(Duration.ZERO).build());
        assertThrows(NullPointerException.class, () -> IsyConnectionConfig.builder().build());
    }

    @Test
    void runtimeConfigDefaults() {
        ShadowRuntimeConfig config = ShadowRuntimeConfig.builder()
                .withConnection(IsyConnectionConfig.builder().withBaseUri("http://isy.local").build())
                .build();

        assertEquals(ReseedPolicy.NEVER, config.reseedPolicy());
        assertEquals(Duration.ofSeconds(35), config.reconnectPolicy().watchdogWindow());
    }
}
