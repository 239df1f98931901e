package io.github.samzhu.relay.normalize;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.github.samzhu.relay.model.CanonicalResponse;
import io.github.samzhu.relay.model.ContentBlock;
import io.github.samzhu.relay.model.StopReason;
import io.github.samzhu.relay.model.TextBlock;
import io.github.samzhu.relay.model.ToolUseBlock;
import io.github.samzhu.relay.model.Usage;
import io.github.samzhu.relay.provider.ProviderChunk;
import io.github.samzhu.relay.routing.TokenEstimator;
import io.github.samzhu.relay.service.RelayMetrics;

/**
 * Provider 片段 → Canonical 回應
 *
 * <p>unary 規則：
 * <ul>
 *   <li>連續的文字片段合併為一個 text 區塊，只含空白的 text 區塊捨棄</li>
 *   <li>工具 id 使用 provider 提供的值，否則為 {@code toolu_<messageKey>_<blockIndex>}</li>
 *   <li>工具輸入片段串接後解析；無法解析時輸入為 {@code {}}，記錄 WARN 並計數</li>
 *   <li>結束原因依協定對照表轉換，有工具呼叫時一律為 {@code tool_use}</li>
 *   <li>provider 未回報用量時以 chars/4 估算</li>
 * </ul>
 *
 * <p>串流使用 {@link #streaming(NormalizationContext)} 建立的 {@link StreamNormalizer}，規則相同。
 */
@Component
public class ResponseNormalizer {

    private static final Logger log = LoggerFactory.getLogger(ResponseNormalizer.class);

    private final ObjectMapper objectMapper;
    private final RelayMetrics metrics;

    public ResponseNormalizer(ObjectMapper objectMapper, RelayMetrics metrics) {
        this.objectMapper = objectMapper;
        this.metrics = metrics;
    }

    public StreamNormalizer streaming(NormalizationContext context) {
        return new StreamNormalizer(context, this);
    }

    /**
     * 把完整的片段序列組成 canonical 回應
     */
    public CanonicalResponse normalize(Iterable<ProviderChunk> chunks, NormalizationContext context) {
        List<Object> pending = new ArrayList<>();
        Map<String, ToolBuilder> toolsByKey = new HashMap<>();
        StringBuilder text = null;
        Integer inputTokens = null;
        Integer outputTokens = null;
        StopReason declared = null;

        for (ProviderChunk chunk : chunks) {
            if (chunk instanceof ProviderChunk.TextDelta delta) {
                if (text == null) {
                    text = new StringBuilder();
                    pending.add(text);
                }
                text.append(delta.text());
            } else if (chunk instanceof ProviderChunk.ToolUseStart start) {
                ToolBuilder existing = toolsByKey.get(start.key());
                if (existing == null) {
                    ToolBuilder builder = new ToolBuilder(start.id(), start.name());
                    toolsByKey.put(start.key(), builder);
                    pending.add(builder);
                    text = null;
                } else if (existing.id == null) {
                    existing.id = start.id();
                }
            } else if (chunk instanceof ProviderChunk.ToolInputDelta delta) {
                ToolBuilder builder = toolsByKey.get(delta.key());
                if (builder == null) {
                    log.warn("Dropping tool input for unknown tool key {} from provider {}",
                        delta.key(), context.providerId());
                    metrics.toolInputInvalid(context.providerId());
                } else {
                    builder.input.append(delta.partialJson());
                }
            } else if (chunk instanceof ProviderChunk.ToolUseComplete complete) {
                pending.add(new ToolUseBlock(complete.id(), complete.name(), complete.input()));
                text = null;
            } else if (chunk instanceof ProviderChunk.UsageUpdate usage) {
                if (usage.inputTokens() != null) {
                    inputTokens = usage.inputTokens();
                }
                if (usage.outputTokens() != null) {
                    outputTokens = usage.outputTokens();
                }
            } else if (chunk instanceof ProviderChunk.Finish finish) {
                declared = finishReason(finish, context);
            }
        }

        List<ContentBlock> content = new ArrayList<>();
        long outputChars = 0;
        for (Object item : pending) {
            if (item instanceof StringBuilder sb) {
                if (!sb.toString().isBlank()) {
                    content.add(new TextBlock(sb.toString()));
                    outputChars += sb.length();
                }
            } else if (item instanceof ToolBuilder builder) {
                int index = content.size();
                JsonNode input = parseToolInput(builder.name, builder.input.toString(), context);
                content.add(new ToolUseBlock(builder.id != null ? builder.id : context.toolUseId(index),
                    builder.name, input));
                outputChars += builder.input.length();
            } else if (item instanceof ToolUseBlock block) {
                int index = content.size();
                content.add(block.id() != null ? block
                    : new ToolUseBlock(context.toolUseId(index), block.name(), block.input()));
                outputChars += block.input().toString().length();
            }
        }

        boolean hasToolUse = content.stream().anyMatch(ToolUseBlock.class::isInstance);
        StopReason stopReason = StopReasonMapper.resolve(declared, hasToolUse);
        Usage usage = new Usage(
            inputTokens != null ? inputTokens : context.estimatedInputTokens(),
            outputTokens != null ? outputTokens : TokenEstimator.toTokens(outputChars));

        return CanonicalResponse.of(context.messageId(), context.model(), content, stopReason, usage);
    }

    RelayMetrics metrics() {
        return metrics;
    }

    StopReason finishReason(ProviderChunk.Finish finish, NormalizationContext context) {
        if (finish.inferred() != null) {
            return finish.inferred();
        }
        return StopReasonMapper.map(context.protocol(), finish.rawReason());
    }

    /**
     * 解析串接後的工具輸入；空字串視為 {@code {}}
     */
    JsonNode parseToolInput(String toolName, String json, NormalizationContext context) {
        if (json.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            JsonNode node = objectMapper.readTree(json);
            if (node != null && node.isObject()) {
                return node;
            }
        } catch (Exception e) {
            log.debug("Tool input parse error for {}: {}", toolName, e.getMessage());
        }
        log.warn("Invalid tool input JSON for tool {} from provider {}, using empty object",
            toolName, context.providerId());
        metrics.toolInputInvalid(context.providerId());
        return objectMapper.createObjectNode();
    }

    private static final class ToolBuilder {
        private String id;
        private final String name;
        private final StringBuilder input = new StringBuilder();

        private ToolBuilder(String id, String name) {
            this.id = id;
            this.name = name;
        }
    }
}
