package io.github.samzhu.relay.config;

import java.time.Duration;
import java.util.List;

import io.github.samzhu.relay.routing.Protocol;

/**
 * 單一 provider 配置
 *
 * <p>配置範例：
 * <pre>
 * relay:
 *   providers:
 *     - id: lmstudio-local
 *       protocol: openai
 *       endpoint: http://localhost:1234/v1
 *       weight: 1
 *       models: [qwen3-coder-30b]
 *       timeout: 120s
 *       max-output-tokens: 8192
 * </pre>
 *
 * @param id              provider 識別碼（路由表引用）
 * @param protocol        原生協定
 * @param endpoint        API 基礎 URL
 * @param auth            認證配置
 * @param weight          預設權重（越小優先序越高）
 * @param models          支援的模型
 * @param timeout         單次呼叫的硬性逾時
 * @param maxOutputTokens max tokens 的上限（clamp 用）
 * @param profileArn      CodeWhisperer profile ARN（其他協定忽略）
 * @param healthy         啟動時的健康狀態
 */
public record ProviderProperties(
    String id,
    Protocol protocol,
    String endpoint,
    ProviderAuthConfig auth,
    Integer weight,
    List<String> models,
    Duration timeout,
    Integer maxOutputTokens,
    String profileArn,
    Boolean healthy
) {
    public ProviderProperties {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Provider id cannot be blank");
        }
        if (protocol == null) {
            throw new IllegalArgumentException("Provider protocol is required: " + id);
        }
        if (endpoint == null || endpoint.isBlank()) {
            throw new IllegalArgumentException("Provider endpoint is required: " + id);
        }
        if (auth == null) {
            auth = ProviderAuthConfig.NONE;
        }
        if (weight == null) {
            weight = 1;
        }
        if (models == null) {
            models = List.of();
        }
        if (timeout == null) {
            timeout = Duration.ofSeconds(120);
        }
        if (maxOutputTokens == null) {
            maxOutputTokens = 8192;
        }
        if (healthy == null) {
            healthy = Boolean.TRUE;
        }
    }
}
