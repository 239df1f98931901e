package io.github.samzhu.relay.provider;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReferenceArray;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.github.samzhu.relay.config.ProviderAuthConfig;
import io.github.samzhu.relay.config.ProviderKeyConfig;
import io.github.samzhu.relay.routing.ProviderProfile;

/**
 * Provider Key 輪換服務
 *
 * <p>每個 provider 各有一個 key 池，使用 Round Robin（循環輪換）策略分配，實現：
 * <ul>
 *   <li>負載分散：將請求平均分配到多組 key</li>
 *   <li>配額管理：回應 429 的 key 進入冷卻，冷卻期間跳過</li>
 *   <li>容錯能力：全部 key 都在冷卻時，使用最早恢復的 key，交給重試與 failover 處理</li>
 * </ul>
 *
 * <p>執行緒安全：輪換位置使用 {@link AtomicInteger}，冷卻期限使用 {@link AtomicReferenceArray}。
 *
 * @see ProviderAuthConfig
 * @see KeySelection
 */
@Service
public class KeyRotationService {

    private static final Logger log = LoggerFactory.getLogger(KeyRotationService.class);

    public static final String STATUS_AVAILABLE = "AVAILABLE";
    public static final String STATUS_COOLING_DOWN = "COOLING_DOWN";

    private final Clock clock;
    private final Map<String, KeyPool> pools = new ConcurrentHashMap<>();

    public KeyRotationService() {
        this(Clock.systemUTC());
    }

    public KeyRotationService(Clock clock) {
        this.clock = clock;
    }

    /**
     * Round Robin 取得下一個未冷卻的 key
     *
     * @return KeySelection；provider 不需要認證時返回 null
     */
    public KeySelection select(ProviderProfile provider) {
        KeyPool pool = pool(provider);
        if (pool.keys.isEmpty()) {
            return null;
        }
        Instant now = clock.instant();
        int size = pool.keys.size();
        int start = Math.abs(pool.counter.getAndIncrement() % size);
        int soonest = start;
        for (int i = 0; i < size; i++) {
            int index = (start + i) % size;
            Instant until = pool.coolingUntil.get(index);
            if (until == null || !now.isBefore(until)) {
                return pool.selection(index);
            }
            if (until.isBefore(pool.coolingUntil.get(soonest))) {
                soonest = index;
            }
        }
        log.debug("All {} key(s) of provider {} are cooling down, using {}", size, provider.id(),
            pool.keys.get(soonest).alias());
        return pool.selection(soonest);
    }

    /**
     * 回應 429 後讓 key 進入冷卻
     */
    public void markRateLimited(ProviderProfile provider, KeySelection key) {
        KeyPool pool = pool(provider);
        Instant until = clock.instant().plus(pool.cooldown);
        pool.coolingUntil.set(key.index(), until);
        log.warn("Key {} of provider {} rate limited, cooling down until {}", key.alias(), provider.id(), until);
    }

    /**
     * 是否還有未冷卻的 key
     */
    public boolean hasAvailableKey(ProviderProfile provider) {
        KeyPool pool = pool(provider);
        Instant now = clock.instant();
        for (int i = 0; i < pool.keys.size(); i++) {
            Instant until = pool.coolingUntil.get(i);
            if (until == null || !now.isBefore(until)) {
                return true;
            }
        }
        return false;
    }

    public int getKeyCount(ProviderProfile provider) {
        return pool(provider).keys.size();
    }

    /**
     * 各 key 的狀態（alias → {@code AVAILABLE} / {@code COOLING_DOWN}），依配置順序
     */
    public Map<String, String> keyStatus(ProviderProfile provider) {
        KeyPool pool = pool(provider);
        Instant now = clock.instant();
        Map<String, String> status = new LinkedHashMap<>();
        for (int i = 0; i < pool.keys.size(); i++) {
            Instant until = pool.coolingUntil.get(i);
            status.put(pool.keys.get(i).alias(),
                until == null || !now.isBefore(until) ? STATUS_AVAILABLE : STATUS_COOLING_DOWN);
        }
        return status;
    }

    private KeyPool pool(ProviderProfile provider) {
        return pools.computeIfAbsent(provider.id(), id -> {
            KeyPool pool = new KeyPool(provider.auth().effectiveKeys(), provider.auth().keyCooldown());
            if (!pool.keys.isEmpty()) {
                log.info("Loaded {} key(s) for provider {}: {}", pool.keys.size(), id,
                    pool.keys.stream().map(ProviderKeyConfig::alias).toList());
            }
            return pool;
        });
    }

    private static final class KeyPool {

        private final List<ProviderKeyConfig> keys;
        private final Duration cooldown;
        private final AtomicInteger counter = new AtomicInteger(0);
        private final AtomicReferenceArray<Instant> coolingUntil;

        KeyPool(List<ProviderKeyConfig> keys, Duration cooldown) {
            this.keys = keys;
            this.cooldown = cooldown;
            this.coolingUntil = new AtomicReferenceArray<>(keys.size());
        }

        KeySelection selection(int index) {
            ProviderKeyConfig key = keys.get(index);
            return new KeySelection(index, key.alias(), key.value());
        }
    }
}
