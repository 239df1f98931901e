package io.github.samzhu.relay.provider;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

import org.springframework.http.client.ClientHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.github.resilience4j.retry.RetryRegistry;
import io.github.samzhu.relay.routing.Protocol;
import io.github.samzhu.relay.routing.ProviderProfile;
import io.github.samzhu.relay.service.RelayMetrics;
import io.github.samzhu.relay.transform.NativeRequest;

/**
 * OpenAI 相容 {@code /chat/completions} 呼叫
 *
 * <p>unary 回應讀取 {@code choices[0].message}；串流回應逐行讀取 {@code data:}，
 * {@code delta.tool_calls[]} 以 {@code index} 識別同一個工具呼叫，直到 {@code data: [DONE]}。
 */
@Component
public class OpenAiProviderClient extends AbstractProviderClient {

    public OpenAiProviderClient(RestClient.Builder restClientBuilder, RetryRegistry retryRegistry,
                                KeyRotationService keyRotation, RelayMetrics metrics, ObjectMapper objectMapper) {
        super(restClientBuilder, retryRegistry, keyRotation, metrics, objectMapper);
    }

    @Override
    public Protocol protocol() {
        return Protocol.OPENAI;
    }

    @Override
    protected String path(NativeRequest request) {
        return "/chat/completions";
    }

    @Override
    protected List<ProviderChunk> parseUnary(ProviderProfile provider, byte[] body) throws IOException {
        JsonNode root = objectMapper.readTree(body);
        List<ProviderChunk> chunks = new ArrayList<>();
        JsonNode choice = root.path("choices").path(0);
        JsonNode message = choice.path("message");

        JsonNode content = message.get("content");
        if (content != null && content.isTextual() && !content.asText().isEmpty()) {
            chunks.add(new ProviderChunk.TextDelta(content.asText()));
        }
        JsonNode toolCalls = message.path("tool_calls");
        for (int i = 0; i < toolCalls.size(); i++) {
            JsonNode call = toolCalls.get(i);
            String key = "call:" + i;
            chunks.add(new ProviderChunk.ToolUseStart(key, call.path("id").asText(null),
                call.path("function").path("name").asText()));
            chunks.add(new ProviderChunk.ToolInputDelta(key, arguments(call.path("function").get("arguments"))));
        }

        usage(root.get("usage"), chunks::add);
        String finishReason = choice.path("finish_reason").asText(null);
        if (finishReason != null) {
            chunks.add(ProviderChunk.Finish.raw(finishReason));
        }
        return chunks;
    }

    @Override
    protected ProviderStream openStream(ProviderProfile provider, ClientHttpResponse response) throws IOException {
        return new LineChunkStream(provider, response, sseParser, this::handleStreamChunk);
    }

    private void handleStreamChunk(JsonNode json, LineChunkStream stream) {
        JsonNode choice = json.path("choices").path(0);
        JsonNode delta = choice.path("delta");

        JsonNode content = delta.get("content");
        if (content != null && content.isTextual() && !content.asText().isEmpty()) {
            stream.emit(new ProviderChunk.TextDelta(content.asText()));
        }

        JsonNode toolCalls = delta.path("tool_calls");
        for (JsonNode call : toolCalls) {
            String key = "call:" + call.path("index").asInt(0);
            JsonNode function = call.path("function");
            String name = function.path("name").asText(null);
            if (name != null && !name.isEmpty()) {
                stream.emit(new ProviderChunk.ToolUseStart(key, call.path("id").asText(null), name));
            }
            JsonNode arguments = function.get("arguments");
            if (arguments != null && !arguments.isNull()) {
                String fragment = arguments(arguments);
                if (!fragment.isEmpty()) {
                    stream.emit(new ProviderChunk.ToolInputDelta(key, fragment));
                }
            }
        }

        usage(json.get("usage"), stream::emit);
        String finishReason = choice.path("finish_reason").asText(null);
        if (finishReason != null && !finishReason.isEmpty()) {
            stream.finishWith(finishReason);
        }
    }

    private static String arguments(JsonNode arguments) {
        if (arguments == null || arguments.isNull()) {
            return "";
        }
        // 部分本地推論伺服器直接回傳物件而非 JSON 字串
        return arguments.isTextual() ? arguments.asText() : arguments.toString();
    }

    private static void usage(JsonNode usage, Consumer<ProviderChunk> sink) {
        if (usage == null || !usage.isObject()) {
            return;
        }
        sink.accept(new ProviderChunk.UsageUpdate(
            intOrNull(usage.get("prompt_tokens")), intOrNull(usage.get("completion_tokens"))));
    }
}
