package com.questrail.homeshadow.protocol.isy.transport.netty;

import com.questrail.homeshadow.protocol.isy.config.IsyConnectionConfig;
import com.questrail.homeshadow.protocol.isy.config.TransportKind;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class SubscriptionMessagesTest {

    private final IsyConnectionConfig config = IsyConnectionConfig.builder()
            .withBaseUri("http://isy.local/webroot/")
            .withCredentials("admin", "secret")
            .withTransport(TransportKind.TCP_SOCKET)
            .build();

    @Test
    void subscribeRequestsReuseOfTheSocket() {
        String request = SubscriptionMessages.subscribe(config);

        assertTrue(request.startsWith("POST /webroot/services HTTP/1.1\r\n"));
        assertTrue(request.contains("Host: isy.local:80\r\n"));
        assertTrue(request.contains("Authorization: Basic YWRtaW46c2VjcmV0\r\n"));
        assertTrue(request.contains("SOAPAction: urn:udi-com:device:X_Insteon_Lighting_Service:1#Subscribe\r\n"));
        assertTrue(request.contains("<reportURL>REUSE_SOCKET</reportURL>"));
        assertTrue(request.contains("<duration>infinite</duration>"));
    }

    @Test
    void contentLengthMatchesBody() {
        String request = SubscriptionMessages.unsubscribe(config, "uuid:47");
        int split = request.indexOf("\r\n\r\n");
        String body = request.substring(split + 4);
        int declared = Integer.parseInt(request.replaceAll("(?s).*Content-Length: (\\d+)\r\n.*", "$1"));

        assertEquals(body.getBytes(StandardCharsets.UTF_8).length, declared);
        assertTrue(body.contains("<SID>uuid:47</SID>"));
        assertTrue(request.contains("#Unsubscribe\r\n"));
    }
}
