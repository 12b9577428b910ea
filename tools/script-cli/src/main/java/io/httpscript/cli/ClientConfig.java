package io.httpscript.cli;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable transport settings for {@link ApacheScriptHttpClient}.
 */
public record ClientConfig(
    boolean acceptInvalidCertificates,
    Duration connectTimeout,
    Duration responseTimeout,
    boolean followRedirects
) {

    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_RESPONSE_TIMEOUT = Duration.ofSeconds(30);

    public ClientConfig {
        Objects.requireNonNull(connectTimeout, "Connect timeout cannot be null");
        Objects.requireNonNull(responseTimeout, "Response timeout cannot be null");

        if (connectTimeout.isNegative() || connectTimeout.isZero()) {
            throw new IllegalArgumentException("Connect timeout must be positive, got: " + connectTimeout);
        }
        if (responseTimeout.isNegative() || responseTimeout.isZero()) {
            throw new IllegalArgumentException("Response timeout must be positive, got: " + responseTimeout);
        }
    }

    public static ClientConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private boolean acceptInvalidCertificates = false;
        private Duration connectTimeout = DEFAULT_CONNECT_TIMEOUT;
        private Duration responseTimeout = DEFAULT_RESPONSE_TIMEOUT;
        private boolean followRedirects = true;

        public Builder acceptInvalidCertificates(boolean acceptInvalidCertificates) {
            this.acceptInvalidCertificates = acceptInvalidCertificates;
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder responseTimeout(Duration responseTimeout) {
            this.responseTimeout = responseTimeout;
            return this;
        }

        public Builder followRedirects(boolean followRedirects) {
            this.followRedirects = followRedirects;
            return this;
        }

        public ClientConfig build() {
            return new ClientConfig(acceptInvalidCertificates, connectTimeout, responseTimeout, followRedirects);
        }
    }
}
