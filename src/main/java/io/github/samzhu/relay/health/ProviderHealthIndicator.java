package io.github.samzhu.relay.health;

import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import io.github.samzhu.relay.provider.KeyRotationService;
import io.github.samzhu.relay.routing.ProviderProfile;
import io.github.samzhu.relay.routing.ProviderRegistry;

/**
 * Provider 健康指標
 *
 * <p>健康狀態：
 * <ul>
 *   <li>UP - 至少一個 provider 標記為健康</li>
 *   <li>DOWN - 沒有配置 provider，或全部標記為不健康</li>
 * </ul>
 *
 * <p>{@code keys} 列出需要認證的 provider 各 key 是否在 429 冷卻中；冷卻不影響 UP / DOWN。
 *
 * <p>存取方式：{@code GET /actuator/health}
 *
 * <p>回應範例：
 * <pre>{@code
 * {
 *   "components": {
 *     "provider": {
 *       "status": "UP",
 *       "details": {
 *         "count": 2,
 *         "healthy": 1,
 *         "providers": { "openai-main": "UP", "gemini-main": "DOWN" },
 *         "keys": { "openai-main": { "primary": "AVAILABLE", "backup": "COOLING_DOWN" } }
 *       }
 *     }
 *   }
 * }
 * }</pre>
 *
 * @see ProviderRegistry
 * @see KeyRotationService
 */
@Component
public class ProviderHealthIndicator implements HealthIndicator {

    private static final Logger log = LoggerFactory.getLogger(ProviderHealthIndicator.class);

    private final ProviderRegistry registry;
    private final KeyRotationService keyRotation;

    public ProviderHealthIndicator(ProviderRegistry registry, KeyRotationService keyRotation) {
        this.registry = registry;
        this.keyRotation = keyRotation;
    }

    @Override
    public Health health() {
        Map<String, String> providers = new LinkedHashMap<>();
        Map<String, Map<String, String>> keys = new LinkedHashMap<>();
        int healthy = 0;
        for (ProviderProfile provider : registry.all()) {
            providers.put(provider.id(), provider.isHealthy() ? "UP" : "DOWN");
            if (keyRotation.getKeyCount(provider) > 0) {
                keys.put(provider.id(), keyRotation.keyStatus(provider));
            }
            if (provider.isHealthy()) {
                healthy++;
            }
        }

        if (healthy == 0) {
            log.warn("Provider health check failed: {} configured, none healthy", providers.size());
            return Health.down()
                .withDetail("count", providers.size())
                .withDetail("healthy", 0)
                .withDetail("providers", providers)
                .withDetail("keys", keys)
                .build();
        }

        log.debug("Provider health check passed: {}/{} healthy", healthy, providers.size());
        return Health.up()
            .withDetail("count", providers.size())
            .withDetail("healthy", healthy)
            .withDetail("providers", providers)
            .withDetail("keys", keys)
            .build();
    }
}
