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
 * Gemini {@code generateContent} / {@code streamGenerateContent} 呼叫
 *
 * <p>{@code candidates[0].content.parts[]} 中的 {@code text} 轉為文字增量，
 * {@code functionCall} 一次到齊，轉為完整的工具呼叫。串流使用 {@code alt=sse}，
 * 每個 {@code data:} 行都是一個完整的 GenerateContentResponse。
 */
@Component
public class GeminiProviderClient extends AbstractProviderClient {

    public GeminiProviderClient(RestClient.Builder restClientBuilder, RetryRegistry retryRegistry,
                                KeyRotationService keyRotation, RelayMetrics metrics, ObjectMapper objectMapper) {
        super(restClientBuilder, retryRegistry, keyRotation, metrics, objectMapper);
    }

    @Override
    public Protocol protocol() {
        return Protocol.GEMINI;
    }

    @Override
    protected String path(NativeRequest request) {
        return request.stream()
            ? "/models/" + request.model() + ":streamGenerateContent?alt=sse"
            : "/models/" + request.model() + ":generateContent";
    }

    @Override
    protected String apiKeyHeader() {
        return "x-goog-api-key";
    }

    @Override
    protected List<ProviderChunk> parseUnary(ProviderProfile provider, byte[] body) throws IOException {
        List<ProviderChunk> chunks = new ArrayList<>();
        String finishReason = readResponse(objectMapper.readTree(body), chunks::add);
        if (finishReason != null) {
            chunks.add(ProviderChunk.Finish.raw(finishReason));
        }
        return chunks;
    }

    @Override
    protected ProviderStream openStream(ProviderProfile provider, ClientHttpResponse response) throws IOException {
        return new LineChunkStream(provider, response, sseParser, (json, stream) -> {
            String finishReason = readResponse(json, stream::emit);
            if (finishReason != null) {
                stream.finishWith(finishReason);
            }
        });
    }

    /**
     * @return finishReason（無則 null）
     */
    private String readResponse(JsonNode root, Consumer<ProviderChunk> sink) {
        JsonNode candidate = root.path("candidates").path(0);
        for (JsonNode part : candidate.path("content").path("parts")) {
            if (part.path("thought").asBoolean(false)) {
                continue;
            }
            JsonNode functionCall = part.get("functionCall");
            if (functionCall != null && functionCall.isObject()) {
                JsonNode args = functionCall.get("args");
                sink.accept(new ProviderChunk.ToolUseComplete(
                    functionCall.path("id").asText(null),
                    functionCall.path("name").asText(),
                    args != null && args.isObject() ? args : objectMapper.createObjectNode()));
            } else if (part.hasNonNull("text") && !part.get("text").asText().isEmpty()) {
                sink.accept(new ProviderChunk.TextDelta(part.get("text").asText()));
            }
        }

        JsonNode usage = root.get("usageMetadata");
        if (usage != null && usage.isObject()) {
            sink.accept(new ProviderChunk.UsageUpdate(
                intOrNull(usage.get("promptTokenCount")), intOrNull(usage.get("candidatesTokenCount"))));
        }
        String finishReason = candidate.path("finishReason").asText(null);
        return finishReason != null && !finishReason.isEmpty() ? finishReason : null;
    }
}
