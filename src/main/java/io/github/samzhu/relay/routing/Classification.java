package io.github.samzhu.relay.routing;

/**
 * 請求分類結果
 *
 * @param category        類別
 * @param ruleId          造成此分類的規則 id；內建判斷使用 {@code builtin:*}
 * @param estimatedTokens 估算的輸入 token 數
 */
public record Classification(RoutingCategory category, String ruleId, int estimatedTokens) {
}
