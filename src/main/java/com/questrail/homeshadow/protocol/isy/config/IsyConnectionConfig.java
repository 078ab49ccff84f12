package com.questrail.homeshadow.protocol.isy.config;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.Locale;
import java.util.Objects;

/**
 * Where and how to reach the controller's event stream.
 *
 * <p>{@code baseUri} is the controller's HTTP root, e.g.
 * {@code https://192.168.1.10:8443} or {@code http://isy.local/webroot}.
 * Controllers ship self-signed certificates, so {@code trustAllCertificates}
 * is commonly enabled on a LAN.</p>
 */
public record IsyConnectionConfig(
        URI baseUri,
        String username,
        String password,
        TransportKind transport,
        Duration connectTimeout,
        boolean trustAllCertificates
) {
    public IsyConnectionConfig {
        Objects.requireNonNull(baseUri, "baseUri");
        Objects.requireNonNull(username, "username");
        Objects.requireNonNull(password, "password");
        Objects.requireNonNull(transport, "transport");
        Objects.requireNonNull(connectTimeout, "connectTimeout");

        String scheme = baseUri.getScheme() == null ? "" : baseUri.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            throw new IllegalArgumentException("baseUri must be http or https: " + baseUri);
        }
        if (baseUri.getHost() == null) {
            throw new IllegalArgumentException("baseUri must name a host: " + baseUri);
        }
        if (connectTimeout.isNegative() || connectTimeout.isZero()) {
            throw new IllegalArgumentException("connectTimeout must be positive");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean secure() {
        return "https".equalsIgnoreCase(baseUri.getScheme());
    }

    public String host() {
        return baseUri.getHost();
    }

    public int port() {
        int port = baseUri.getPort();
        return port > 0 ? port : (secure() ? 443 : 80);
    }

    /**
     * Path prefix of the controller's web root, without a trailing slash;
     * empty for the default root.
     */
    public String webRoot() {
        String path = baseUri.getPath() == null ? "" : baseUri.getPath();
        while (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        return path;
    }

    public URI websocketUri() {
        return URI.create((secure() ? "wss" : "ws") + "://" + host() + ":" + port() + webRoot() + "/rest/subscribe");
    }

    /**
     * Value of the HTTP {@code Authorization} header.
     */
    public String basicAuthorization() {
        String credentials = username + ":" + password;
        return "Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public String toString() {
        return "IsyConnectionConfig{" + baseUri + ", user=" + username + ", transport=" + transport + "}";
    }

    public static final class Builder {
        private URI baseUri;
        private String username = "";
        private String password = "";
        private TransportKind transport = TransportKind.WEBSOCKET;
        private Duration connectTimeout = Duration.ofSeconds(10);
        private boolean trustAllCertificates;

        public Builder withBaseUri(URI baseUri) {
            this.baseUri = baseUri;
            return this;
        }

        public Builder withBaseUri(String baseUri) {
            this.baseUri = URI.create(baseUri);
            return this;
        }

        public Builder withCredentials(String username, String password) {
            this.username = username;
            this.password = password;
            return this;
        }

        public Builder withTransport(TransportKind transport) {
            this.transport = transport;
            return this;
        }

        public Builder withConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder withTrustAllCertificates(boolean trustAllCertificates) {
            this.trustAllCertificates = trustAllCertificates;
            return this;
        }

        public IsyConnectionConfig build() {
            return new IsyConnectionConfig(baseUri, username, password, transport, connectTimeout,
                    trustAllCertificates);
        }
    }
}
