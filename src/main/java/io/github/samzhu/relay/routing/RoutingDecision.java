package io.github.samzhu.relay.routing;

import java.time.Instant;

/**
 * 路由決策
 *
 * <p>由 {@link Router#select} 產生一次，之後在管線中唯讀傳遞。
 *
 * @param provider        選中的 provider
 * @param model           provider 端的模型名稱
 * @param category        請求類別
 * @param ruleId          符合的模型規則 id（無則為 null）
 * @param selectionMethod 選擇方式
 * @param timestamp       決策時間
 * @param selectionNanos  選擇耗時（單調時鐘，奈秒）
 */
public record RoutingDecision(
    ProviderProfile provider,
    String model,
    RoutingCategory category,
    String ruleId,
    SelectionMethod selectionMethod,
    Instant timestamp,
    long selectionNanos
) {

    public String providerId() {
        return provider.id();
    }
}
