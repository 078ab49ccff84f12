package com.questrail.homeshadow.protocol.isy.transport.netty;

import com.questrail.homeshadow.protocol.isy.config.IsyConnectionConfig;

import java.nio.charset.StandardCharsets;

/**
 * SOAP requests written on the raw event-stream socket.
 */
final class SubscriptionMessages
{
    private static final String SERVICE = "urn:udi-com:service:X_Insteon_Lighting_Service:1";
    private static final String ACTION = "urn:udi-com:device:X_Insteon_Lighting_Service:1";

    private SubscriptionMessages() {
    }

    static String subscribe(IsyConnectionConfig config) {
        String body = "<s:Envelope><s:Body>\n"
                + "<u:Subscribe xmlns:u=\"" + SERVICE + "\">\n"
                + "<reportURL>REUSE_SOCKET</reportURL>\n"
                + "<duration>infinite</duration>\n"
                + "</u:Subscribe></s:Body></s:Envelope>\r\n";
        return request(config, "Subscribe", body);
    }

    static String unsubscribe(IsyConnectionConfig config, String streamId) {
        String body = "<s:Envelope><s:Body>\n"
                + "<u:Unsubscribe xmlns:u=\"" + SERVICE + "\">\n"
                + "<SID>" + streamId + "</SID>\n"
                + "</u:Unsubscribe></s:Body></s:Envelope>\r\n";
        return request(config, "Unsubscribe", body);
    }

    private static String request(IsyConnectionConfig config, String action, String body) {
        return "POST " + config.webRoot() + "/services HTTP/1.1\r\n"
                + "Host: " + config.host() + ":" + config.port() + "\r\n"
                + "Authorization: " + config.basicAuthorization() + "\r\n"
                + "Content-Length: " + body.getBytes(StandardCharsets.UTF_8).length + "\r\n"
                + "Content-Type: text/xml; charset=\"utf-8\"\r\n"
                + "SOAPAction: " + ACTION + "#" + action + "\r\n"
                + "\r\n"
                + body;
    }
}
