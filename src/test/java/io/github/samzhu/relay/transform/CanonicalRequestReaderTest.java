package io.github.samzhu.relay.transform;

import static io.github.samzhu.relay.transform.TransformFixtures.TOOL_CONVERSATION;
import static io.github.samzhu.relay.transform.TransformFixtures.request;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

import io.github.samzhu.relay.model.CanonicalRequest;
import io.github.samzhu.relay.model.TextBlock;
import io.github.samzhu.relay.model.ToolChoice;
import io.github.samzhu.relay.model.ToolDefinition;
import io.github.samzhu.relay.model.ToolResultBlock;
import io.github.samzhu.relay.model.ToolUseBlock;

class CanonicalRequestReaderTest {

    @Test
    void shouldReadToolConversation() {
        CanonicalRequest request = request(TOOL_CONVERSATION);

        assertThat(request.model()).isEqualTo("claude-sonnet-4");
        assertThat(request.system()).isEqualTo("You are terse.");
        assertThat(request.maxTokens()).isEqualTo(1024);
        assertThat(request.stream()).isFalse();
        assertThat(request.toolChoice()).isEqualTo(ToolChoice.tool("read_file"));
        assertThat(request.tools()).singleElement().isInstanceOf(ToolDefinition.Flattened.class);
        assertThat(request.messages()).hasSize(3);
        assertThat(request.messages().get(0).content()).containsExactly(new TextBlock("Open a.txt"));
        assertThat(request.messages().get(1).content().get(1)).isInstanceOf(ToolUseBlock.class);
        assertThat(request.messages().get(2).content().get(0))
            .isEqualTo(new ToolResultBlock("toolu_1", "hello", null));
    }

    @Test
    void shouldAcceptNestedFunctionToolShape() {
        CanonicalRequest request = request("""
            {"model": "m", "messages": [{"role": "user", "content": "hi"}],
             "tools": [{"type": "function", "function": {"name": "f", "parameters": {"type": "object"}}}]}
            """);

        assertThat(request.tools()).singleElement().isInstanceOf(ToolDefinition.NestedFunction.class);
        assertThat(request.tools().get(0).name()).isEqualTo("f");
    }

    @Test
    void shouldSkipThinkingBlocksAndEnableThinking() {
        CanonicalRequest request = request("""
            {"model": "m", "thinking": {"type": "enabled", "budget_tokens": 1024},
             "messages": [
               {"role": "user", "content": "hi"},
               {"role": "assistant", "content": [{"type": "thinking", "thinking": "hmm"}, {"type": "text", "text": "yo"}]}
             ]}
            """);

        assertThat(request.thinkingEnabled()).isTrue();
        assertThat(request.messages().get(1).content()).containsExactly(new TextBlock("yo"));
    }

    @Test
    void shouldRejectUnrecognizedToolShape() {
        assertThatThrownBy(() -> request("""
            {"model": "m", "messages": [{"role": "user", "content": "hi"}], "tools": [{"parameters": {}}]}
            """))
            .isInstanceOf(TransformValidationException.class)
            .hasMessageContaining("tools.0");
    }

    @Test
    void shouldRejectInvalidRequests() {
        assertThatThrownBy(() -> request("{\"messages\": [{\"role\": \"user\", \"content\": \"hi\"}]}"))
            .isInstanceOf(TransformValidationException.class)
            .hasMessageContaining("model");
        assertThatThrownBy(() -> request("{\"model\": \"m\", \"messages\": []}"))
            .hasMessageContaining("messages");
        assertThatThrownBy(() -> request("{\"model\": \"m\", \"messages\": [{\"role\": \"system\", \"content\": \"x\"}]}"))
            .hasMessageContaining("role");
        assertThatThrownBy(() -> request(
            "{\"model\": \"m\", \"max_tokens\": 0, \"messages\": [{\"role\": \"user\", \"content\": \"x\"}]}"))
            .hasMessageContaining("max_tokens");
        assertThatThrownBy(() -> request("not json"))
            .isInstanceOf(TransformValidationException.class);
    }

    @Test
    void shouldMapValidationErrorToInvalidRequest() {
        TransformValidationException e = new TransformValidationException("model: field required");

        assertThat(e.httpStatus().value()).isEqualTo(400);
        assertThat(e.toGatewayError().error().type()).isEqualTo("invalid_request_error");
        assertThat(e.isFailoverEligible()).isFalse();
    }
}
