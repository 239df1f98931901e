package io.github.samzhu.relay.normalize;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.github.samzhu.relay.model.StopReason;
import io.github.samzhu.relay.provider.ProviderChunk;
import io.github.samzhu.relay.routing.TokenEstimator;

/**
 * 串流正規化（每個請求一個實例）
 *
 * <p>區塊編號規則與 {@link io.github.samzhu.relay.stream.StreamReemitter} 相同：
 * 非文字區塊之後的文字開新區塊，每個工具呼叫都是新區塊。只含空白、後面接著工具呼叫的文字不開區塊。
 */
public class StreamNormalizer {

    private static final Logger log = LoggerFactory.getLogger(StreamNormalizer.class);

    private enum Kind { NONE, TEXT, TOOL }

    private final NormalizationContext context;
    private final ResponseNormalizer owner;
    private final Set<String> startedKeys = new HashSet<>();

    private Kind current = Kind.NONE;
    private String currentKey;
    private int blockIndex = -1;
    private String pendingWhitespace = "";
    private boolean toolSeen;
    private long outputChars;
    private Integer inputTokens;
    private Integer outputTokens;
    private StopReason declared;

    StreamNormalizer(NormalizationContext context, ResponseNormalizer owner) {
        this.context = context;
        this.owner = owner;
    }

    public List<NormalizedDelta> accept(ProviderChunk chunk) {
        if (chunk instanceof ProviderChunk.TextDelta delta) {
            return text(delta.text());
        }
        if (chunk instanceof ProviderChunk.ToolUseStart start) {
            if (!startedKeys.add(start.key())) {
                return List.of();
            }
            currentKey = start.key();
            return List.of(openTool(start.id(), start.name()));
        }
        if (chunk instanceof ProviderChunk.ToolInputDelta delta) {
            if (current == Kind.TOOL && delta.key().equals(currentKey)) {
                outputChars += delta.partialJson().length();
                return List.of(new NormalizedDelta.ToolInput(delta.partialJson()));
            }
            log.warn("Dropping tool input for tool key {} that is not the open block (provider {})",
                delta.key(), context.providerId());
            owner.metrics().toolInputInvalid(context.providerId());
            return List.of();
        }
        if (chunk instanceof ProviderChunk.ToolUseComplete complete) {
            currentKey = null;
            String json = complete.input().toString();
            outputChars += json.length();
            return List.of(openTool(complete.id(), complete.name()), new NormalizedDelta.ToolInput(json));
        }
        if (chunk instanceof ProviderChunk.UsageUpdate usage) {
            if (usage.inputTokens() != null) {
                inputTokens = usage.inputTokens();
            }
            if (usage.outputTokens() != null) {
                outputTokens = usage.outputTokens();
            }
            return List.of();
        }
        if (chunk instanceof ProviderChunk.Finish finish) {
            declared = owner.finishReason(finish, context);
        }
        return List.of();
    }

    private List<NormalizedDelta> text(String text) {
        if (text.isEmpty()) {
            return List.of();
        }
        if (current != Kind.TEXT) {
            if (text.isBlank()) {
                pendingWhitespace += text;
                return List.of();
            }
            text = pendingWhitespace + text;
            pendingWhitespace = "";
            current = Kind.TEXT;
            blockIndex++;
        }
        outputChars += text.length();
        return List.of(new NormalizedDelta.Text(text));
    }

    private NormalizedDelta openTool(String providerId, String name) {
        pendingWhitespace = "";
        current = Kind.TOOL;
        toolSeen = true;
        blockIndex++;
        return new NormalizedDelta.ToolStart(providerId != null ? providerId : context.toolUseId(blockIndex), name);
    }

    /**
     * 最終結束原因（有工具呼叫一律為 {@code tool_use}）
     */
    public StopReason stopReason() {
        return StopReasonMapper.resolve(declared, toolSeen);
    }

    public boolean hasToolUse() {
        return toolSeen;
    }

    public int inputTokens() {
        return inputTokens != null ? inputTokens : context.estimatedInputTokens();
    }

    public int outputTokens() {
        return outputTokens != null ? outputTokens : TokenEstimator.toTokens(outputChars);
    }
}
