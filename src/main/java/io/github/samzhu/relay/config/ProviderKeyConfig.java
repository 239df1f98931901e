package io.github.samzhu.relay.config;

/**
 * Provider API Key 配置
 *
 * <p>每個 key 包含：
 * <ul>
 *   <li>{@code alias} - 人類可讀的別名，用於日誌、指標與健康檢查（不暴露實際 Key）</li>
 *   <li>{@code value} - 實際的 token 或 API Key</li>
 * </ul>
 *
 * @param alias key 別名（必填，同一 provider 內不可重複）
 * @param value 實際的 key（必填）
 * @see ProviderAuthConfig
 */
public record ProviderKeyConfig(
    String alias,
    String value
) {
    public ProviderKeyConfig {
        if (alias == null || alias.isBlank()) {
            throw new IllegalArgumentException("Provider key alias cannot be blank");
        }
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Provider key value cannot be blank: " + alias);
        }
    }

    @Override
    public String toString() {
        return "ProviderKeyConfig[alias=" + alias + "]";
    }
}
