package io.httpscript.cli;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ClientConfig validation")
class ClientConfigTest {

    @Test
    @DisplayName("Should verify certificates and follow redirects by default")
    void shouldUseSafeDefaults() {
        ClientConfig config = ClientConfig.defaults();

        assertThat(config.acceptInvalidCertificates()).isFalse();
        assertThat(config.followRedirects()).isTrue();
        assertThat(config.connectTimeout()).isEqualTo(ClientConfig.DEFAULT_CONNECT_TIMEOUT);
        assertThat(config.responseTimeout()).isEqualTo(ClientConfig.DEFAULT_RESPONSE_TIMEOUT);
    }

    @Test
    @DisplayName("Should reject non-positive timeouts")
    void shouldRejectNonPositiveTimeouts() {
        assertThatThrownBy(() -> ClientConfig.builder().connectTimeout(Duration.ZERO).build())
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Connect timeout");
        assertThatThrownBy(() -> ClientConfig.builder().responseTimeout(Duration.ofSeconds(-1)).build())
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Response timeout");
    }

    @Test
    @DisplayName("Should reject null timeouts")
    void shouldRejectNullTimeouts() {
        assertThatThrownBy(() -> ClientConfig.builder().connectTimeout(null).build())
            .isInstanceOf(NullPointerException.class);
    }
}
