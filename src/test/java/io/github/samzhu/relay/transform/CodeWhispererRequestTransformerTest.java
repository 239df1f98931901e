package io.github.samzhu.relay.transform;

import static io.github.samzhu.relay.transform.TransformFixtures.TOOL_CONVERSATION;
import static io.github.samzhu.relay.transform.TransformFixtures.provider;
import static io.github.samzhu.relay.transform.TransformFixtures.request;
import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;

import io.github.samzhu.relay.routing.Protocol;

class CodeWhispererRequestTransformerTest {

    private final CodeWhispererRequestTransformer transformer = new CodeWhispererRequestTransformer();

    @Test
    void shouldBuildConversationState() {
        JsonNode body = transformer.transform(request(TOOL_CONVERSATION), provider(Protocol.CODEWHISPERER),
            "CLAUDE_SONNET_4").body();

        assertThat(body.path("profileArn").asText()).isEqualTo("arn:aws:profile/test");
        JsonNode state = body.path("conversationState");
        assertThat(state.path("chatTriggerType").asText()).isEqualTo("MANUAL");
        assertThat(state.path("conversationId").asText()).isNotBlank();

        JsonNode history = state.path("history");
        assertThat(history).hasSize(2);
        JsonNode firstUser = history.get(0).path("userInputMessage");
        assertThat(firstUser.path("content").asText()).isEqualTo("You are terse.\n\nOpen a.txt");
        assertThat(firstUser.path("modelId").asText()).isEqualTo("CLAUDE_SONNET_4");
        JsonNode assistant = history.get(1).path("assistantResponseMessage");
        assertThat(assistant.path("content").asText()).isEqualTo("Reading.");
        assertThat(assistant.path("toolUses").get(0).path("toolUseId").asText()).isEqualTo("toolu_1");
        assertThat(assistant.path("toolUses").get(0).path("input").path("path").asText()).isEqualTo("a.txt");

        JsonNode current = state.path("currentMessage").path("userInputMessage");
        assertThat(current.path("content").asText()).isEqualTo("Summarize it.");
        JsonNode context = current.path("userInputMessageContext");
        JsonNode result = context.path("toolResults").get(0);
        assertThat(result.path("toolUseId").asText()).isEqualTo("toolu_1");
        assertThat(result.path("status").asText()).isEqualTo("success");
        assertThat(result.path("content").get(0).path("text").asText()).isEqualTo("hello");
        JsonNode toolSpec = context.path("tools").get(0).path("toolSpecification");
        assertThat(toolSpec.path("name").asText()).isEqualTo("read_file");
        assertThat(toolSpec.path("inputSchema").path("json").path("type").asText()).isEqualTo("object");
    }

    @Test
    void shouldContinueAfterTrailingAssistantMessage() {
        JsonNode state = transformer.transform(request("""
            {"model": "m", "system": "sys", "messages": [
              {"role": "user", "content": "hi"},
              {"role": "assistant", "content": "partial answer"}
            ]}
            """), provider(Protocol.CODEWHISPERER), "CLAUDE_SONNET_4").body().path("conversationState");

        assertThat(state.path("history")).hasSize(2);
        assertThat(state.path("history").get(1).path("assistantResponseMessage").path("content").asText())
            .isEqualTo("partial answer");
        assertThat(state.path("currentMessage").path("userInputMessage").path("content").asText())
            .isEqualTo("Continue");
    }
}
