package io.github.samzhu.relay.normalize;

/**
 * 串流正規化後的增量，由 {@link io.github.samzhu.relay.stream.StreamReemitter} 轉為 SSE 事件
 */
public sealed interface NormalizedDelta {

    record Text(String text) implements NormalizedDelta {
    }

    /**
     * 開始新的工具區塊；id 已確定，之後不會再變
     */
    record ToolStart(String id, String name) implements NormalizedDelta {
    }

    /**
     * 目前工具區塊的輸入 JSON 片段
     */
    record ToolInput(String partialJson) implements NormalizedDelta {
    }
}
