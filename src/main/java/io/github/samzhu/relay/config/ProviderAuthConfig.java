package io.github.samzhu.relay.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Provider 認證配置
 *
 * <p>每個 provider 的認證包含：
 * <ul>
 *   <li>{@code type} - {@code bearer}、{@code api-key} 或 {@code none}</li>
 *   <li>{@code value} - 單一 token 或 API Key（別名為 {@code default}）</li>
 *   <li>{@code keys} - 多組 key，依 Round Robin 輪換；回應 429 的 key 進入冷卻</li>
 *   <li>{@code key-cooldown} - 429 之後的冷卻時間（預設 60 秒）</li>
 * </ul>
 *
 * <p>{@code none} 以外，{@code value} 與 {@code keys} 至少需要一個。
 *
 * <p>配置範例：
 * <pre>
 * relay:
 *   providers:
 *     - id: gemini-main
 *       auth:
 *         type: api-key
 *         key-cooldown: 60s
 *         keys:
 *           - alias: primary
 *             value: ${GEMINI_API_KEY}
 *           - alias: backup
 *             value: ${GEMINI_API_KEY_BACKUP}
 * </pre>
 *
 * @param type        認證方式
 * @param value       單一 token 或 API Key
 * @param keys        輪換用的 key 列表
 * @param keyCooldown 429 後的冷卻時間
 * @see ProviderProperties
 * @see ProviderKeyConfig
 */
public record ProviderAuthConfig(
    Type type,
    String value,
    List<ProviderKeyConfig> keys,
    Duration keyCooldown
) {
    public enum Type {
        BEARER,
        API_KEY,
        NONE
    }

    public static final String DEFAULT_ALIAS = "default";

    public static final ProviderAuthConfig NONE = new ProviderAuthConfig(Type.NONE, null, null, null);

    public ProviderAuthConfig {
        if (type == null) {
            type = Type.NONE;
        }
        if (keys == null) {
            keys = List.of();
        }
        if (keyCooldown == null || keyCooldown.isNegative() || keyCooldown.isZero()) {
            keyCooldown = Duration.ofSeconds(60);
        }
        if (type != Type.NONE && (value == null || value.isBlank()) && keys.isEmpty()) {
            throw new IllegalArgumentException("Provider auth requires a value or keys for type " + type);
        }
        Set<String> aliases = new HashSet<>();
        if (value != null && !value.isBlank()) {
            aliases.add(DEFAULT_ALIAS);
        }
        for (ProviderKeyConfig key : keys) {
            if (!aliases.add(key.alias())) {
                throw new IllegalArgumentException("Duplicate provider key alias: " + key.alias());
            }
        }
    }

    /**
     * 單一 key 的認證
     */
    public static ProviderAuthConfig single(Type type, String value) {
        return new ProviderAuthConfig(type, value, null, null);
    }

    /**
     * 實際參與輪換的 key：{@code value}（若有）在前，接著是 {@code keys}
     */
    public List<ProviderKeyConfig> effectiveKeys() {
        if (type == Type.NONE) {
            return List.of();
        }
        List<ProviderKeyConfig> effective = new ArrayList<>();
        if (value != null && !value.isBlank()) {
            effective.add(new ProviderKeyConfig(DEFAULT_ALIAS, value));
        }
        effective.addAll(keys);
        return List.copyOf(effective);
    }

    @Override
    public String toString() {
        // 不輸出實際的 key
        return "ProviderAuthConfig[type=" + type + ", keys=" + effectiveKeys().size() + "]";
    }
}
