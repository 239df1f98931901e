package io.github.samzhu.relay.config;

import java.time.Duration;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Relay 閘道配置屬性
 *
 * <p>從 application.yaml 中的 {@code relay} 前綴載入配置：
 * <ul>
 *   <li>{@code providers} - 後端 provider 列表（啟動時載入一次）</li>
 *   <li>{@code routing} - 類別路由表、模型規則、長上下文門檻</li>
 *   <li>{@code retry} - 單一 provider 的暫時性錯誤重試</li>
 *   <li>{@code streaming} - SSE 逾時與 tool call 還原的緩衝視窗</li>
 *   <li>{@code security} - 是否啟用 JWT 驗證</li>
 * </ul>
 *
 * @param providers provider 配置列表
 * @param routing   路由配置
 * @param retry     重試配置
 * @param streaming 串流配置
 * @param security  安全配置
 * @see ProviderProperties
 * @see RoutingProperties
 */
@ConfigurationProperties(prefix = "relay")
public record RelayProperties(
    List<ProviderProperties> providers,
    RoutingProperties routing,
    Retry retry,
    Streaming streaming,
    Security security
) {
    public RelayProperties {
        if (providers == null) {
            providers = List.of();
        }
        if (routing == null) {
            routing = new RoutingProperties(null, null, null, null);
        }
        if (retry == null) {
            retry = new Retry(null, null, null);
        }
        if (streaming == null) {
            streaming = new Streaming(null, null);
        }
        if (security == null) {
            security = new Security(false);
        }
    }

    /**
     * @param maxAttempts    同一 provider 的最大嘗試次數（含第一次）
     * @param initialBackoff 第一次重試前的等待時間
     * @param multiplier     指數退避倍數
     */
    public record Retry(Integer maxAttempts, Duration initialBackoff, Double multiplier) {
        public Retry {
            if (maxAttempts == null || maxAttempts < 1) {
                maxAttempts = 2;
            }
            if (initialBackoff == null) {
                initialBackoff = Duration.ofMillis(250);
            }
            if (multiplier == null || multiplier < 1.0) {
                multiplier = 2.0;
            }
        }
    }

    /**
     * @param sseTimeout     SSE 回應的最長時間
     * @param recoveryWindow tool call 還原時最多保留的字元數
     */
    public record Streaming(Duration sseTimeout, Integer recoveryWindow) {
        public Streaming {
            if (sseTimeout == null) {
                sseTimeout = Duration.ofMinutes(10);
            }
            if (recoveryWindow == null || recoveryWindow <= 0) {
                recoveryWindow = 64 * 1024;
            }
        }
    }

    /**
     * @param jwtEnabled 是否要求 OAuth2 JWT（需同時設定 jwk-set-uri）
     */
    public record Security(boolean jwtEnabled) {}
}
