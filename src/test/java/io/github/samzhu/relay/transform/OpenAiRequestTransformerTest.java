package io.github.samzhu.relay.transform;

import static io.github.samzhu.relay.transform.TransformFixtures.TOOL_CONVERSATION;
import static io.github.samzhu.relay.transform.TransformFixtures.provider;
import static io.github.samzhu.relay.transform.TransformFixtures.request;
import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;

import io.github.samzhu.relay.routing.Protocol;
import io.github.samzhu.relay.service.RelayMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

class OpenAiRequestTransformerTest {

    private final OpenAiRequestTransformer transformer =
        new OpenAiRequestTransformer(new ParameterClamp(new RelayMetrics(new SimpleMeterRegistry())));

    @Test
    void shouldTranslateToolConversation() throws Exception {
        NativeRequest nativeRequest = transformer.transform(request(TOOL_CONVERSATION), provider(Protocol.OPENAI), "gpt-4o");
        JsonNode body = nativeRequest.body();

        assertThat(nativeRequest.protocol()).isEqualTo(Protocol.OPENAI);
        assertThat(body.path("model").asText()).isEqualTo("gpt-4o");
        JsonNode messages = body.path("messages");
        assertThat(messages).hasSize(5);
        assertThat(messages.get(0).path("role").asText()).isEqualTo("system");
        assertThat(messages.get(0).path("content").asText()).isEqualTo("You are terse.");
        assertThat(messages.get(1).path("content").asText()).isEqualTo("Open a.txt");

        JsonNode assistant = messages.get(2);
        assertThat(assistant.path("content").asText()).isEqualTo("Reading.");
        JsonNode call = assistant.path("tool_calls").get(0);
        assertThat(call.path("id").asText()).isEqualTo("toolu_1");
        assertThat(call.path("function").path("name").asText()).isEqualTo("read_file");
        assertThat(TransformFixtures.MAPPER.readTree(call.path("function").path("arguments").asText())
            .path("path").asText()).isEqualTo("a.txt");

        assertThat(messages.get(3).path("role").asText()).isEqualTo("tool");
        assertThat(messages.get(3).path("tool_call_id").asText()).isEqualTo("toolu_1");
        assertThat(messages.get(3).path("content").asText()).isEqualTo("hello");
        assertThat(messages.get(4).path("role").asText()).isEqualTo("user");
        assertThat(messages.get(4).path("content").asText()).isEqualTo("Summarize it.");

        JsonNode function = body.path("tools").get(0).path("function");
        assertThat(function.path("name").asText()).isEqualTo("read_file");
        assertThat(function.path("parameters").path("type").asText()).isEqualTo("object");
        assertThat(body.path("tool_choice").path("function").path("name").asText()).isEqualTo("read_file");
        assertThat(body.path("max_tokens").asInt()).isEqualTo(1024);
        assertThat(body.path("stream").asBoolean()).isFalse();
        assertThat(body.has("stream_options")).isFalse();
    }

    @Test
    void shouldRequestUsageWhenStreamingAndClampParameters() {
        NativeRequest nativeRequest = transformer.transform(request("""
            {"model": "m", "stream": true, "max_tokens": 100000, "temperature": 5, "stop_sequences": ["END"],
             "messages": [{"role": "user", "content": "hi"}]}
            """), provider(Protocol.OPENAI), "gpt-4o");
        JsonNode body = nativeRequest.body();

        assertThat(nativeRequest.stream()).isTrue();
        assertThat(body.path("stream_options").path("include_usage").asBoolean()).isTrue();
        assertThat(body.path("max_tokens").asInt()).isEqualTo(4096);
        assertThat(body.path("temperature").asDouble()).isEqualTo(2.0);
        assertThat(body.path("stop").get(0).asText()).isEqualTo("END");
        assertThat(body.has("tools")).isFalse();
        assertThat(body.has("tool_choice")).isFalse();
    }

    @Test
    void shouldSendNullContentForToolOnlyAssistantTurn() {
        NativeRequest nativeRequest = transformer.transform(request("""
            {"model": "m", "messages": [
              {"role": "user", "content": "go"},
              {"role": "assistant", "content": [{"type": "tool_use", "id": "t", "name": "f", "input": {}}]}
            ]}
            """), provider(Protocol.OPENAI), "gpt-4o");

        JsonNode assistant = nativeRequest.body().path("messages").get(1);
        assertThat(assistant.get("content").isNull()).isTrue();
        assertThat(assistant.path("tool_calls").get(0).path("function").path("arguments").asText()).isEqualTo("{}");
    }
}
