package io.github.samzhu.relay.routing;

/**
 * 路由表中的單一目標
 *
 * @param providerId provider id
 * @param model      provider 端的模型名稱
 * @param weight     指定的權重；{@code null} 表示沿用 provider 目前的權重
 */
public record RoutingTarget(String providerId, String model, Integer weight) {

    /**
     * 實際參與分層的權重
     */
    public int effectiveWeight(ProviderProfile provider) {
        return weight != null ? weight : provider.weight();
    }
}
