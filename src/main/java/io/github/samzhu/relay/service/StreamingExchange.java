package io.github.samzhu.relay.service;

import io.github.samzhu.relay.normalize.NormalizationContext;
import io.github.samzhu.relay.normalize.StreamNormalizer;
import io.github.samzhu.relay.provider.ProviderStream;
import io.github.samzhu.relay.routing.RoutingDecision;

/**
 * 已取得上游回應標頭、尚未開始轉送的串流
 *
 * @param decision   路由決策
 * @param stream     已套用 tool call 還原的 provider 串流
 * @param normalizer 此請求的串流正規化器
 * @param context    正規化參數
 */
public record StreamingExchange(
    RoutingDecision decision,
    ProviderStream stream,
    StreamNormalizer normalizer,
    NormalizationContext context
) {
}
