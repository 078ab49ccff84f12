package com.questrail.homeshadow.protocol.isy.config;

import com.questrail.homeshadow.protocol.isy.internal.exec.ReconnectPolicy;

import java.util.Objects;

/**
 * Aggregated configuration for the shadow client runtime.
 */
public record ShadowRuntimeConfig(
    IsyConnectionConfig connection,
    ReconnectPolicy reconnectPolicy,
    ReseedPolicy reseedPolicy
) {
    public ShadowRuntimeConfig {
        Objects.requireNonNull(connection, "connection");
        Objects.requireNonNull(reconnectPolicy, "reconnectPolicy");
        Objects.requireNonNull(reseedPolicy, "reseedPolicy");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private IsyConnectionConfig connection;
        private ReconnectPolicy reconnectPolicy = ReconnectPolicy.defaults();
        private ReseedPolicy reseedPolicy = ReseedPolicy.NEVER;

        public Builder withConnection(IsyConnectionConfig connection) {
            this.connection = connection;
            return this;
        }

        public Builder withReconnectPolicy(ReconnectPolicy reconnectPolicy) {
            this.reconnectPolicy = reconnectPolicy;
            return this;
        }

        public Builder withReseedPolicy(ReseedPolicy reseedPolicy) {
            this.reseedPolicy = reseedPolicy;
            return this;
        }

        public ShadowRuntimeConfig build() {
            return new ShadowRuntimeConfig(connection, reconnectPolicy, reseedPolicy);
        }
    }
}
