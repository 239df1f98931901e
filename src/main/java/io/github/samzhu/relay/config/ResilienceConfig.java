package io.github.samzhu.relay.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import io.github.samzhu.relay.provider.ProviderHttpException;
import io.github.samzhu.relay.provider.ProviderTimeoutException;

/**
 * Resilience4j 配置
 *
 * <p>每個 provider 各自取得一個 {@code Retry} 實例（以 provider id 命名），共用同一份預設配置：
 * <ul>
 *   <li>只重試暫時性錯誤：連線失敗、逾時、408、429、5xx</li>
 *   <li>其他 4xx 直接交給 failover 判斷</li>
 *   <li>指數退避，由 {@code relay.retry.*} 控制</li>
 * </ul>
 *
 * <p>同一 provider 重試用盡後才會換到下一個路由目標。
 *
 * @see io.github.samzhu.relay.provider.AbstractProviderClient
 */
@Configuration
public class ResilienceConfig {

    private static final Logger log = LoggerFactory.getLogger(ResilienceConfig.class);

    @Bean
    public RetryRegistry retryRegistry(RelayProperties properties) {
        RelayProperties.Retry retry = properties.retry();
        RetryConfig config = RetryConfig.custom()
            .maxAttempts(retry.maxAttempts())
            .intervalFunction(IntervalFunction.ofExponentialBackoff(retry.initialBackoff(), retry.multiplier()))
            .retryOnException(ResilienceConfig::isRetryable)
            .build();
        log.info("Provider retry: maxAttempts={}, initialBackoff={}, multiplier={}",
            retry.maxAttempts(), retry.initialBackoff(), retry.multiplier());
        return RetryRegistry.of(config);
    }

    static boolean isRetryable(Throwable e) {
        if (e instanceof ProviderTimeoutException) {
            return true;
        }
        return e instanceof ProviderHttpException http && http.isTransient();
    }
}
