package com.polaris.sentiment.service.config;

import com.polaris.sentiment.config.ConfigSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.logging.Level;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ServiceConfigTest {

    @Test
    @DisplayName("Should apply documented defaults")
    void shouldApplyDefaults() {
        ServiceConfig config = ServiceConfig.from(ConfigSource.of(Map.of(), Map.of()));

        assertThat(config.getPort()).isEqualTo(8080);
        assertThat(config.getRequestTimeout()).isEqualTo(Duration.ofSeconds(1));
        assertThat(config.getHttpTimeout()).isEqualTo(Duration.ofSeconds(10));
        assertThat(config.getShutdownGrace()).isEqualTo(Duration.ofMinutes(1));
        assertThat(config.getLogLevel()).isEqualTo(Level.INFO);
        assertThat(config.getProviderEndpoint()).isEqualTo("language.googleapis.com:443");
        assertThat(config.getProviderApiKey()).isEmpty();
        assertThat(config.getCacheConfig().getMaxSizeMb()).isEqualTo(64);
        assertThat(config.getCacheConfig().getEntryTtl()).isEqualTo(Duration.ofMinutes(10));
    }

    @Test
    @DisplayName("Should read environment and property overrides")
    void shouldReadOverrides() {
        ConfigSource source = ConfigSource.of(
                Map.of("SERVER_PORT", "9000",
                        "SENTIMENT_REQUEST_TIMEOUT", "250ms",
                        "PROVIDER_API_KEY", "secret",
                        "CACHE_ENTRY_TTL", "1h"),
                Map.of("server.http.timeout", "PT5S",
                        "log.level", "debug",
                        "provider.endpoint", "localhost:9999"));

        ServiceConfig config = ServiceConfig.from(source);

        assertThat(config.getPort()).isEqualTo(9000);
        assertThat(config.getRequestTimeout()).isEqualTo(Duration.ofMillis(250));
        assertThat(config.getHttpTimeout()).isEqualTo(Duration.ofSeconds(5));
        assertThat(config.getLogLevel()).isEqualTo(Level.FINE);
        assertThat(config.getProviderEndpoint()).isEqualTo("localhost:9999");
        assertThat(config.getProviderApiKey()).contains("secret");
        assertThat(config.getCacheConfig().getEntryTtl()).isEqualTo(Duration.ofHours(1));
        assertThat(config.toString()).doesNotContain("secret");
    }

    @Test
    @DisplayName("Should map common log level names")
    void shouldMapLogLevels() {
        assertThat(ServiceConfig.parseLogLevel("DEBUG")).isEqualTo(Level.FINE);
        assertThat(ServiceConfig.parseLogLevel("info")).isEqualTo(Level.INFO);
        assertThat(ServiceConfig.parseLogLevel("WARN")).isEqualTo(Level.WARNING);
        assertThat(ServiceConfig.parseLogLevel("ERROR")).isEqualTo(Level.SEVERE);
        assertThat(ServiceConfig.parseLogLevel("FINEST")).isEqualTo(Level.FINEST);
        assertThat(ServiceConfig.parseLogLevel("loud")).isEqualTo(Level.INFO);
    }

    @Test
    @DisplayName("Should keep defaults for unparsable values")
    void shouldKeepDefaultsForInvalidValues() {
        ServiceConfig config = ServiceConfig.from(ConfigSource.of(
                Map.of("SERVER_PORT", "eighty", "SENTIMENT_REQUEST_TIMEOUT", "fast"), Map.of()));

        assertThat(config.getPort()).isEqualTo(ServiceConfig.DEFAULT_PORT);
        assertThat(config.getRequestTimeout()).isEqualTo(ServiceConfig.DEFAULT_REQUEST_TIMEOUT);
    }

    @Test
    @DisplayName("Should keep the default endpoint unless given host:port")
    void shouldValidateEndpoint() {
        for (String endpoint : new String[]{"https://language.googleapis.com", "localhost", "localhost:", "host:99999"}) {
            ServiceConfig config = ServiceConfig.from(ConfigSource.of(Map.of("PROVIDER_ENDPOINT", endpoint), Map.of()));
            assertThat(config.getProviderEndpoint()).as(endpoint).isEqualTo(ServiceConfig.DEFAULT_PROVIDER_ENDPOINT);
        }
    }

    @Test
    @DisplayName("Should reject structurally invalid settings")
    void shouldRejectInvalidSettings() {
        assertThatThrownBy(() -> ServiceConfig.builder().port(70000).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ServiceConfig.builder().requestTimeout(Duration.ZERO).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ServiceConfig.from(ConfigSource.of(Map.of("SERVER_PORT", "-1"), Map.of())))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
