package io.github.samzhu.relay.routing;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import io.github.samzhu.relay.config.ProviderProperties;
import io.github.samzhu.relay.config.RelayProperties;

/**
 * Provider 註冊表
 *
 * <p>啟動時從 {@code relay.providers} 建立一次，之後集合本身不再變動。
 * {@link #updateHealth} 與 {@link #updateWeight} 是外部健康監控的寫入介面。
 */
@Component
public class ProviderRegistry {

    private static final Logger log = LoggerFactory.getLogger(ProviderRegistry.class);

    private final Map<String, ProviderProfile> profiles;

    public ProviderRegistry(RelayProperties properties) {
        Map<String, ProviderProfile> byId = new LinkedHashMap<>();
        for (ProviderProperties provider : properties.providers()) {
            if (byId.putIfAbsent(provider.id(), ProviderProfile.from(provider)) != null) {
                throw new IllegalStateException("Duplicate provider id: " + provider.id());
            }
        }
        this.profiles = Collections.unmodifiableMap(byId);
        log.info("Provider registry initialized with {} providers: {}", profiles.size(), profiles.keySet());
    }

    public Optional<ProviderProfile> find(String providerId) {
        return Optional.ofNullable(profiles.get(providerId));
    }

    public Collection<ProviderProfile> all() {
        return profiles.values();
    }

    public int size() {
        return profiles.size();
    }

    /**
     * 由外部監控更新健康狀態
     */
    public void updateHealth(String providerId, boolean healthy) {
        ProviderProfile profile = require(providerId);
        if (profile.isHealthy() != healthy) {
            log.info("Provider {} health changed: {} -> {}", providerId, profile.isHealthy(), healthy);
        }
        profile.setHealthy(healthy);
    }

    /**
     * 由外部監控更新權重
     */
    public void updateWeight(String providerId, int weight) {
        ProviderProfile profile = require(providerId);
        log.info("Provider {} weight changed: {} -> {}", providerId, profile.weight(), weight);
        profile.setWeight(weight);
    }

    private ProviderProfile require(String providerId) {
        ProviderProfile profile = profiles.get(providerId);
        if (profile == null) {
            throw new IllegalArgumentException("Unknown provider: " + providerId);
        }
        return profile;
    }
}
