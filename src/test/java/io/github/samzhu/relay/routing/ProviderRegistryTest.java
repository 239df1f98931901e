package io.github.samzhu.relay.routing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.junit.jupiter.api.Test;

import io.github.samzhu.relay.config.ProviderProperties;
import io.github.samzhu.relay.config.RelayProperties;

class ProviderRegistryTest {

    @Test
    void shouldKeepConfiguredOrderAndDefaults() {
        ProviderRegistry registry = registry(provider("b"), provider("a"));

        assertThat(registry.all()).extracting(ProviderProfile::id).containsExactly("b", "a");
        ProviderProfile profile = registry.find("a").orElseThrow();
        assertThat(profile.isHealthy()).isTrue();
        assertThat(profile.weight()).isEqualTo(1);
        assertThat(profile.maxOutputTokens()).isEqualTo(8192);
    }

    @Test
    void shouldRejectDuplicateIds() {
        assertThatThrownBy(() -> registry(provider("a"), provider("a")))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("a");
    }

    @Test
    void shouldApplyMonitorUpdates() {
        ProviderRegistry registry = registry(provider("a"));

        registry.updateHealth("a", false);
        registry.updateWeight("a", 5);

        ProviderProfile profile = registry.find("a").orElseThrow();
        assertThat(profile.isHealthy()).isFalse();
        assertThat(profile.weight()).isEqualTo(5);
        assertThatThrownBy(() -> registry.updateHealth("missing", true))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private static ProviderRegistry registry(ProviderProperties... providers) {
        return new ProviderRegistry(new RelayProperties(List.of(providers), null, null, null, null));
    }

    private static ProviderProperties provider(String id) {
        return new ProviderProperties(id, Protocol.OPENAI, "http://localhost", null, null, null, null, null, null,
            null);
    }
}
