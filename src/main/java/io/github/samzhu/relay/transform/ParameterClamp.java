package io.github.samzhu.relay.transform;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import io.github.samzhu.relay.routing.ProviderProfile;
import io.github.samzhu.relay.service.RelayMetrics;

/**
 * 取樣參數範圍限制
 *
 * <p>超出 provider 合法範圍的值會被夾回範圍內（不拒絕請求），並記錄 WARN 與計數。
 */
@Component
public class ParameterClamp {

    private static final Logger log = LoggerFactory.getLogger(ParameterClamp.class);

    public static final double TEMPERATURE_MIN = 0.0;
    public static final double TEMPERATURE_MAX = 2.0;
    public static final double TOP_P_MIN = 0.0;
    public static final double TOP_P_MAX = 1.0;

    private final RelayMetrics metrics;

    public ParameterClamp(RelayMetrics metrics) {
        this.metrics = metrics;
    }

    public Double temperature(ProviderProfile provider, Double value) {
        return clamp(provider, "temperature", value, TEMPERATURE_MIN, TEMPERATURE_MAX);
    }

    public Double topP(ProviderProfile provider, Double value) {
        return clamp(provider, "top_p", value, TOP_P_MIN, TOP_P_MAX);
    }

    public Integer maxTokens(ProviderProfile provider, Integer value) {
        if (value == null) {
            return null;
        }
        int limit = provider.maxOutputTokens();
        if (value > limit) {
            record(provider, "max_tokens", value, limit);
            return limit;
        }
        return value;
    }

    private Double clamp(ProviderProfile provider, String param, Double value, double min, double max) {
        if (value == null || value.isNaN()) {
            return null;
        }
        if (value < min) {
            record(provider, param, value, min);
            return min;
        }
        if (value > max) {
            record(provider, param, value, max);
            return max;
        }
        return value;
    }

    private void record(ProviderProfile provider, String param, Object requested, Object clamped) {
        log.warn("Clamped {} for provider {}: {} -> {}", param, provider.id(), requested, clamped);
        metrics.clamp(provider.id(), param);
    }
}
