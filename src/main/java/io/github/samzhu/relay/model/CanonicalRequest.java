package io.github.samzhu.relay.model;

import java.util.List;

/**
 * Canonical（Anthropic Messages）請求
 *
 * <p>入站後不可變，由 {@link io.github.samzhu.relay.transform.CanonicalRequestReader} 建立。
 *
 * @param model           客戶端要求的模型名稱
 * @param messages        對話訊息
 * @param system          系統提示（已攤平為字串，可能為 null）
 * @param tools           工具定義
 * @param toolChoice      工具選擇模式（可能為 null）
 * @param maxTokens       最大輸出 token
 * @param temperature     取樣溫度（可能為 null）
 * @param topP            nucleus 取樣（可能為 null）
 * @param stopSequences   停止序列
 * @param stream          是否串流
 * @param thinkingEnabled 是否啟用 extended thinking
 */
public record CanonicalRequest(
    String model,
    List<Message> messages,
    String system,
    List<ToolDefinition> tools,
    ToolChoice toolChoice,
    Integer maxTokens,
    Double temperature,
    Double topP,
    List<String> stopSequences,
    boolean stream,
    boolean thinkingEnabled
) {
    public CanonicalRequest {
        messages = messages == null ? List.of() : List.copyOf(messages);
        tools = tools == null ? List.of() : List.copyOf(tools);
        stopSequences = stopSequences == null ? List.of() : List.copyOf(stopSequences);
    }

    public boolean hasTools() {
        return !tools.isEmpty();
    }

    public boolean hasSystem() {
        return system != null && !system.isBlank();
    }
}
