package io.github.samzhu.relay.provider;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import io.github.resilience4j.retry.RetryRegistry;
import io.github.samzhu.relay.config.ProviderAuthConfig;
import io.github.samzhu.relay.config.RelayProperties;
import io.github.samzhu.relay.config.ResilienceConfig;
import io.github.samzhu.relay.routing.Protocol;
import io.github.samzhu.relay.routing.ProviderProfile;

final class ProviderFixtures {

    private ProviderFixtures() {
    }

    static RetryRegistry retryRegistry(int maxAttempts) {
        RelayProperties properties = new RelayProperties(null, null,
            new RelayProperties.Retry(maxAttempts, Duration.ofMillis(1), 1.0), null, null);
        return new ResilienceConfig().retryRegistry(properties);
    }

    static ProviderProfile profile(String id, Protocol protocol, String endpoint, ProviderAuthConfig auth) {
        return new ProviderProfile(id, protocol, endpoint, auth, 1, List.of(), Duration.ofSeconds(5), 4096,
            "arn:aws:profile/test", true);
    }

    static List<ProviderChunk> drain(ProviderStream stream) {
        List<ProviderChunk> chunks = new ArrayList<>();
        try (stream) {
            while (stream.hasNext()) {
                chunks.add(stream.next());
            }
        }
        return chunks;
    }
}
