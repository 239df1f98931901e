package io.github.samzhu.relay.routing;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import io.github.samzhu.relay.config.RelayProperties;
import io.github.samzhu.relay.config.RoutingProperties;
import io.github.samzhu.relay.model.CanonicalRequest;
import io.github.samzhu.relay.model.Message;
import io.github.samzhu.relay.model.ToolDefinition;

class RequestClassifierTest {

    private final RequestClassifier classifier = new RequestClassifier(new RelayProperties(
        List.of(),
        new RoutingProperties(100, null,
            List.of(new RoutingProperties.ModelRule("haiku-background", ".*haiku.*", "background")), null),
        null, null, null));

    @Test
    void shouldClassifyAtThresholdAsLongContext() {
        Classification classification = classifier.classify(request("claude-sonnet", "x".repeat(400), false, List.of()));

        assertThat(classification.estimatedTokens()).isEqualTo(100);
        assertThat(classification.category()).isEqualTo(RoutingCategory.LONG_CONTEXT);
        assertThat(classification.ruleId()).isEqualTo("builtin:longcontext");
    }

    @Test
    void shouldClassifyBelowThresholdAsDefault() {
        Classification classification = classifier.classify(request("claude-sonnet", "x".repeat(396), false, List.of()));

        assertThat(classification.estimatedTokens()).isEqualTo(99);
        assertThat(classification.category()).isEqualTo(RoutingCategory.DEFAULT);
    }

    @Test
    void shouldApplyModelRuleBeforeBuiltins() {
        Classification classification = classifier.classify(
            request("Claude-3-5-HAIKU-latest", "x".repeat(1000), true, List.of()));

        assertThat(classification.category()).isEqualTo(RoutingCategory.BACKGROUND);
        assertThat(classification.ruleId()).isEqualTo("haiku-background");
    }

    @Test
    void shouldPreferSearchOverThinking() {
        ToolDefinition webSearch = new ToolDefinition.Flattened("web_search", null,
            JsonNodeFactory.instance.objectNode(), "web_search_20250305");

        Classification classification = classifier.classify(request("claude-sonnet", "hi", true, List.of(webSearch)));

        assertThat(classification.category()).isEqualTo(RoutingCategory.SEARCH);
    }

    @Test
    void shouldClassifyThinkingRequests() {
        Classification classification = classifier.classify(request("claude-sonnet", "hi", true, List.of()));

        assertThat(classification.category()).isEqualTo(RoutingCategory.THINKING);
        assertThat(classification.ruleId()).isEqualTo("builtin:thinking");
    }

    private static CanonicalRequest request(String model, String text, boolean thinking, List<ToolDefinition> tools) {
        return new CanonicalRequest(model, List.of(Message.user(text)), null, tools, null, 1024,
            null, null, null, false, thinking);
    }
}
