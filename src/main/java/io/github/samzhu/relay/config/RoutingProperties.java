package io.github.samzhu.relay.config;

import java.util.List;
import java.util.Map;

/**
 * 路由表配置
 *
 * <p>配置範例：
 * <pre>
 * relay:
 *   routing:
 *     long-context-threshold: 60000
 *     max-failover-attempts: 3
 *     rules:
 *       - id: haiku-background
 *         model-pattern: ".*haiku.*"
 *         category: background
 *     categories:
 *       default:
 *         - provider: openai-main
 *           model: gpt-4o
 *           weight: 1
 *         - provider: gemini-main
 *           model: gemini-2.5-pro
 *           weight: 2
 * </pre>
 *
 * <p>{@code long-context-threshold} 是以 chars/4 估算的近似 token 數，並非精確值。
 *
 * @param longContextThreshold 長上下文門檻（估算 token，等於門檻即視為長上下文）
 * @param maxFailoverAttempts  單一請求最多嘗試的路由目標數
 * @param rules                模型名稱規則（依序比對，先符合者勝出）
 * @param categories           各類別的路由目標
 */
public record RoutingProperties(
    Integer longContextThreshold,
    Integer maxFailoverAttempts,
    List<ModelRule> rules,
    Map<String, List<Target>> categories
) {
    public RoutingProperties {
        if (longContextThreshold == null || longContextThreshold <= 0) {
            longContextThreshold = 60_000;
        }
        if (maxFailoverAttempts == null || maxFailoverAttempts <= 0) {
            maxFailoverAttempts = 3;
        }
        if (rules == null) {
            rules = List.of();
        }
        if (categories == null) {
            categories = Map.of();
        }
    }

    /**
     * @param id           規則識別碼（寫入 RoutingDecision.ruleId）
     * @param modelPattern 模型名稱的正規表示式（完整比對）
     * @param category     目標類別
     */
    public record ModelRule(String id, String modelPattern, String category) {
        public ModelRule {
            if (modelPattern == null || modelPattern.isBlank()) {
                throw new IllegalArgumentException("Routing rule model-pattern cannot be blank");
            }
            if (category == null || category.isBlank()) {
                throw new IllegalArgumentException("Routing rule category cannot be blank");
            }
            if (id == null || id.isBlank()) {
                id = category + ":" + modelPattern;
            }
        }
    }

    /**
     * @param provider provider id
     * @param model    provider 端的模型名稱
     * @param weight   權重；未設定時使用 provider 的權重
     */
    public record Target(String provider, String model, Integer weight) {
        public Target {
            if (provider == null || provider.isBlank()) {
                throw new IllegalArgumentException("Routing target provider cannot be blank");
            }
            if (model == null || model.isBlank()) {
                throw new IllegalArgumentException("Routing target model cannot be blank: " + provider);
            }
        }
    }
}
