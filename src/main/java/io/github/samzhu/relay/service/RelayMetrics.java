package io.github.samzhu.relay.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

/**
 * 閘道計數器
 *
 * <p>所有 failover、重試、tool call 還原、參數 clamp 與串流取消都必須計數，
 * 不允許無聲丟棄。可在 {@code /actuator/metrics} 查詢：
 * <ul>
 *   <li>{@code relay.failover} - tags: category, provider, reason</li>
 *   <li>{@code relay.provider.retry} - tags: provider</li>
 *   <li>{@code relay.provider.key.cooldown} - tags: provider, key（key 別名）</li>
 *   <li>{@code relay.recovery} - tags: outcome（extracted、failed、finish_inferred、window_released）</li>
 *   <li>{@code relay.transform.clamps} - tags: provider, param</li>
 *   <li>{@code relay.normalize.tool_input_invalid} - tags: provider</li>
 *   <li>{@code relay.stream.cancelled} - tags: cause</li>
 *   <li>{@code relay.routing.exhausted} - tags: category</li>
 *   <li>{@code relay.requests} - tags: provider, category, outcome</li>
 * </ul>
 */
@Component
public class RelayMetrics {

    public static final String FAILOVER = "relay.failover";
    public static final String RETRY = "relay.provider.retry";
    public static final String KEY_COOLDOWN = "relay.provider.key.cooldown";
    public static final String RECOVERY = "relay.recovery";
    public static final String CLAMPS = "relay.transform.clamps";
    public static final String TOOL_INPUT_INVALID = "relay.normalize.tool_input_invalid";
    public static final String STREAM_CANCELLED = "relay.stream.cancelled";
    public static final String ROUTING_EXHAUSTED = "relay.routing.exhausted";
    public static final String REQUESTS = "relay.requests";

    private final MeterRegistry registry;

    public RelayMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void failover(String category, String providerId, String reason) {
        increment(FAILOVER, "category", category, "provider", providerId, "reason", reason);
    }

    public void retry(String providerId) {
        increment(RETRY, "provider", providerId);
    }

    public void keyCooldown(String providerId, String keyAlias) {
        increment(KEY_COOLDOWN, "provider", providerId, "key", keyAlias);
    }

    public void recovery(String outcome) {
        increment(RECOVERY, "outcome", outcome);
    }

    public void clamp(String providerId, String param) {
        increment(CLAMPS, "provider", providerId, "param", param);
    }

    public void toolInputInvalid(String providerId) {
        increment(TOOL_INPUT_INVALID, "provider", providerId);
    }

    public void streamCancelled(String cause) {
        increment(STREAM_CANCELLED, "cause", cause);
    }

    public void routingExhausted(String category) {
        increment(ROUTING_EXHAUSTED, "category", category);
    }

    public void request(String providerId, String category, String outcome) {
        increment(REQUESTS, "provider", providerId, "category", category, "outcome", outcome);
    }

    private void increment(String name, String... tags) {
        Counter.builder(name)
            .tags(tags)
            .register(registry)
            .increment();
    }
}
