package io.github.samzhu.relay.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Canonical SSE 串流事件
 *
 * <p>對應 Claude Streaming API 的事件類型：
 * <ul>
 *   <li>{@code message_start} - 訊息開始，包含 message id、model、input_tokens</li>
 *   <li>{@code content_block_start} - 內容區塊開始（text 或 tool_use）</li>
 *   <li>{@code content_block_delta} - 內容區塊增量（{@code text_delta} / {@code input_json_delta}）</li>
 *   <li>{@code content_block_stop} - 內容區塊結束</li>
 *   <li>{@code message_delta} - 最終 stop_reason 與 output_tokens</li>
 *   <li>{@code message_stop} - 訊息結束（永遠送出且只送一次）</li>
 * </ul>
 *
 * <p>{@code payload} 即 SSE {@code data:} 的完整 JSON 內容；{@code index} 對區塊層級事件有意義，
 * 其餘事件為 {@code -1}。
 *
 * @see io.github.samzhu.relay.stream.StreamReemitter
 * @see <a href="https://docs.anthropic.com/en/docs/build-with-claude/streaming">Claude Streaming</a>
 */
public record StreamEvent(
    Type type,
    int index,
    ObjectNode payload
) {

    public enum Type {
        MESSAGE_START("message_start"),
        PING("ping"),
        CONTENT_BLOCK_START("content_block_start"),
        CONTENT_BLOCK_DELTA("content_block_delta"),
        CONTENT_BLOCK_STOP("content_block_stop"),
        MESSAGE_DELTA("message_delta"),
        MESSAGE_STOP("message_stop");

        private final String eventName;

        Type(String eventName) {
            this.eventName = eventName;
        }

        public String eventName() {
            return eventName;
        }
    }

    private static final JsonNodeFactory JSON = JsonNodeFactory.instance;

    public static StreamEvent messageStart(String messageId, String model, int inputTokens) {
        ObjectNode payload = JSON.objectNode();
        payload.put("type", Type.MESSAGE_START.eventName());
        ObjectNode message = payload.putObject("message");
        message.put("id", messageId);
        message.put("type", "message");
        message.put("role", "assistant");
        message.put("model", model);
        message.putArray("content");
        message.putNull("stop_reason");
        message.putNull("stop_sequence");
        ObjectNode usage = message.putObject("usage");
        usage.put("input_tokens", inputTokens);
        usage.put("output_tokens", 0);
        return new StreamEvent(Type.MESSAGE_START, -1, payload);
    }

    public static StreamEvent ping() {
        ObjectNode payload = JSON.objectNode();
        payload.put("type", Type.PING.eventName());
        return new StreamEvent(Type.PING, -1, payload);
    }

    public static StreamEvent textBlockStart(int index) {
        ObjectNode payload = blockPayload(Type.CONTENT_BLOCK_START, index);
        ObjectNode block = payload.putObject("content_block");
        block.put("type", "text");
        block.put("text", "");
        return new StreamEvent(Type.CONTENT_BLOCK_START, index, payload);
    }

    public static StreamEvent toolUseBlockStart(int index, String id, String name) {
        ObjectNode payload = blockPayload(Type.CONTENT_BLOCK_START, index);
        ObjectNode block = payload.putObject("content_block");
        block.put("type", "tool_use");
        block.put("id", id);
        block.put("name", name);
        block.putObject("input");
        return new StreamEvent(Type.CONTENT_BLOCK_START, index, payload);
    }

    public static StreamEvent textDelta(int index, String text) {
        ObjectNode payload = blockPayload(Type.CONTENT_BLOCK_DELTA, index);
        ObjectNode delta = payload.putObject("delta");
        delta.put("type", "text_delta");
        delta.put("text", text);
        return new StreamEvent(Type.CONTENT_BLOCK_DELTA, index, payload);
    }

    public static StreamEvent inputJsonDelta(int index, String partialJson) {
        ObjectNode payload = blockPayload(Type.CONTENT_BLOCK_DELTA, index);
        ObjectNode delta = payload.putObject("delta");
        delta.put("type", "input_json_delta");
        delta.put("partial_json", partialJson);
        return new StreamEvent(Type.CONTENT_BLOCK_DELTA, index, payload);
    }

    public static StreamEvent blockStop(int index) {
        return new StreamEvent(Type.CONTENT_BLOCK_STOP, index, blockPayload(Type.CONTENT_BLOCK_STOP, index));
    }

    public static StreamEvent messageDelta(StopReason stopReason, int outputTokens) {
        ObjectNode payload = JSON.objectNode();
        payload.put("type", Type.MESSAGE_DELTA.eventName());
        ObjectNode delta = payload.putObject("delta");
        delta.put("stop_reason", stopReason.wireValue());
        delta.putNull("stop_sequence");
        payload.putObject("usage").put("output_tokens", outputTokens);
        return new StreamEvent(Type.MESSAGE_DELTA, -1, payload);
    }

    public static StreamEvent messageStop() {
        ObjectNode payload = JSON.objectNode();
        payload.put("type", Type.MESSAGE_STOP.eventName());
        return new StreamEvent(Type.MESSAGE_STOP, -1, payload);
    }

    private static ObjectNode blockPayload(Type type, int index) {
        ObjectNode payload = JSON.objectNode();
        payload.put("type", type.eventName());
        payload.put("index", index);
        return payload;
    }

    /**
     * 從 message_delta 事件取得 stop_reason
     */
    public String stopReason() {
        if (type != Type.MESSAGE_DELTA) {
            return null;
        }
        JsonNode reason = payload.path("delta").path("stop_reason");
        return reason.isTextual() ? reason.asText() : null;
    }

    public String eventName() {
        return type.eventName();
    }
}
