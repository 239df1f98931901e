package io.github.samzhu.relay.routing;

import java.util.List;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import io.github.samzhu.relay.config.RelayProperties;
import io.github.samzhu.relay.config.RoutingProperties;
import io.github.samzhu.relay.model.CanonicalRequest;
import io.github.samzhu.relay.model.ToolDefinition;

/**
 * 請求分類器
 *
 * <p>判斷順序（先符合者勝出）：
 * <ol>
 *   <li>{@code relay.routing.rules} 的模型名稱規則</li>
 *   <li>帶有網頁搜尋工具 → {@code search}</li>
 *   <li>啟用 extended thinking → {@code thinking}</li>
 *   <li>估算 token 數 {@code >=} 長上下文門檻 → {@code longcontext}</li>
 *   <li>其他 → {@code default}</li>
 * </ol>
 */
@Component
public class RequestClassifier {

    private static final Logger log = LoggerFactory.getLogger(RequestClassifier.class);

    static final String RULE_SEARCH = "builtin:search";
    static final String RULE_THINKING = "builtin:thinking";
    static final String RULE_LONG_CONTEXT = "builtin:longcontext";
    static final String RULE_DEFAULT = "builtin:default";

    private final List<CompiledRule> rules;
    private final int longContextThreshold;

    public RequestClassifier(RelayProperties properties) {
        RoutingProperties routing = properties.routing();
        this.rules = routing.rules().stream()
            .map(rule -> new CompiledRule(rule.id(), Pattern.compile(rule.modelPattern(), Pattern.CASE_INSENSITIVE),
                RoutingCategory.fromValue(rule.category())))
            .toList();
        this.longContextThreshold = routing.longContextThreshold();
    }

    public Classification classify(CanonicalRequest request) {
        int estimated = TokenEstimator.estimate(request);

        String model = request.model() != null ? request.model() : "";
        for (CompiledRule rule : rules) {
            if (rule.pattern().matcher(model).matches()) {
                return logged(request, new Classification(rule.category(), rule.id(), estimated));
            }
        }
        if (request.tools().stream().anyMatch(ToolDefinition::isWebSearch)) {
            return logged(request, new Classification(RoutingCategory.SEARCH, RULE_SEARCH, estimated));
        }
        if (request.thinkingEnabled()) {
            return logged(request, new Classification(RoutingCategory.THINKING, RULE_THINKING, estimated));
        }
        if (estimated >= longContextThreshold) {
            return logged(request, new Classification(RoutingCategory.LONG_CONTEXT, RULE_LONG_CONTEXT, estimated));
        }
        return logged(request, new Classification(RoutingCategory.DEFAULT, RULE_DEFAULT, estimated));
    }

    private Classification logged(CanonicalRequest request, Classification classification) {
        log.debug("Classified model={} as category={}, rule={}, estimatedTokens={}",
            request.model(), classification.category().value(), classification.ruleId(),
            classification.estimatedTokens());
        return classification;
    }

    private record CompiledRule(String id, Pattern pattern, RoutingCategory category) {
    }
}
