package io.github.samzhu.relay.model;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Canonical（Anthropic Messages）非串流回應
 *
 * <p>回應結構：
 * <pre>{@code
 * {
 *   "id": "msg_xxx",
 *   "type": "message",
 *   "role": "assistant",
 *   "model": "claude-...",
 *   "content": [ ... ],
 *   "stop_reason": "end_turn",
 *   "stop_sequence": null,
 *   "usage": { "input_tokens": 10, "output_tokens": 5 }
 * }
 * }</pre>
 *
 * <p>不變式：{@code stopReason == TOOL_USE} 若且唯若 {@code content} 含有 {@link ToolUseBlock}。
 */
public record CanonicalResponse(
    String id,
    String type,
    String role,
    String model,
    List<ContentBlock> content,
    @JsonProperty("stop_reason")
    StopReason stopReason,
    @JsonProperty("stop_sequence")
    String stopSequence,
    Usage usage
) {
    public CanonicalResponse {
        content = content == null ? List.of() : List.copyOf(content);
    }

    public static CanonicalResponse of(String id, String model, List<ContentBlock> content,
                                       StopReason stopReason, Usage usage) {
        return new CanonicalResponse(id, "message", "assistant", model, content, stopReason, null, usage);
    }

    public List<ToolUseBlock> toolUses() {
        return content.stream()
            .filter(ToolUseBlock.class::isInstance)
            .map(ToolUseBlock.class::cast)
            .toList();
    }
}
