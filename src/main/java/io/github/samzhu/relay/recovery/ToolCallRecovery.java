package io.github.samzhu.relay.recovery;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.github.samzhu.relay.config.RelayProperties;
import io.github.samzhu.relay.provider.ProviderStream;
import io.github.samzhu.relay.service.RelayMetrics;

/**
 * Tool call 還原
 *
 * <p>部分後端把工具呼叫當成一般文字輸出，例如：
 * <pre>
 * 我來查一下天氣。Tool call: get_weather({"city": "Taipei"})
 * </pre>
 * 此步驟把這段文字換成結構化的工具呼叫，原文不會留在輸出中；JSON 無法解析時保留原文並計數。
 * 後端沒有送出結束原因時，依是否出現過工具呼叫補上 {@code tool_use} 或 {@code end_turn}。
 *
 * <p>unary 與串流共用同一個 {@link RecoveringProviderStream}。
 */
@Component
public class ToolCallRecovery {

    public static final String OUTCOME_EXTRACTED = "extracted";
    public static final String OUTCOME_FAILED = "failed";
    public static final String OUTCOME_FINISH_INFERRED = "finish_inferred";
    public static final String OUTCOME_WINDOW_RELEASED = "window_released";

    private final ObjectMapper objectMapper;
    private final RelayMetrics metrics;
    private final int window;

    @Autowired
    public ToolCallRecovery(ObjectMapper objectMapper, RelayMetrics metrics, RelayProperties properties) {
        this(objectMapper, metrics, properties.streaming().recoveryWindow());
    }

    ToolCallRecovery(ObjectMapper objectMapper, RelayMetrics metrics, int window) {
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.window = window;
    }

    public ProviderStream wrap(ProviderStream upstream) {
        return new RecoveringProviderStream(upstream, this, window);
    }

    /**
     * 解析括號內的 JSON；必須是物件
     */
    JsonNode parseArguments(String toolName, String json) throws ToolCallRecoveryException {
        JsonNode node;
        try {
            node = objectMapper.readTree(json);
        } catch (Exception e) {
            throw new ToolCallRecoveryException(toolName, "Invalid JSON arguments for tool " + toolName, e);
        }
        if (node == null || !node.isObject()) {
            throw new ToolCallRecoveryException(toolName, "Arguments for tool " + toolName + " are not an object",
                null);
        }
        return node;
    }

    void count(String outcome) {
        metrics.recovery(outcome);
    }
}
