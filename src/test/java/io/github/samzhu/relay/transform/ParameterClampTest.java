package io.github.samzhu.relay.transform;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.github.samzhu.relay.routing.Protocol;
import io.github.samzhu.relay.routing.ProviderProfile;
import io.github.samzhu.relay.service.RelayMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

class ParameterClampTest {

    private final ProviderProfile provider = TransformFixtures.provider(Protocol.OPENAI);
    private SimpleMeterRegistry meterRegistry;
    private ParameterClamp clamp;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        clamp = new ParameterClamp(new RelayMetrics(meterRegistry));
    }

    @Test
    void shouldClampOutOfRangeValues() {
        assertThat(clamp.temperature(provider, 3.5)).isEqualTo(2.0);
        assertThat(clamp.temperature(provider, -1.0)).isEqualTo(0.0);
        assertThat(clamp.topP(provider, 1.5)).isEqualTo(1.0);
        assertThat(clamp.maxTokens(provider, 100_000)).isEqualTo(4096);

        assertThat(meterRegistry.counter("relay.transform.clamps", "provider", provider.id(), "param", "temperature")
            .count()).isEqualTo(2.0);
        assertThat(meterRegistry.counter("relay.transform.clamps", "provider", provider.id(), "param", "max_tokens")
            .count()).isEqualTo(1.0);
    }

    @Test
    void shouldPassThroughInRangeAndMissingValues() {
        assertThat(clamp.temperature(provider, 0.7)).isEqualTo(0.7);
        assertThat(clamp.topP(provider, null)).isNull();
        assertThat(clamp.maxTokens(provider, 4096)).isEqualTo(4096);
        assertThat(meterRegistry.find("relay.transform.clamps").counters()).isEmpty();
    }
}
