package io.github.samzhu.relay.provider.eventstream;

/**
 * 從 frame payload 還原的語意事件，依 frame 順序排列
 */
public sealed interface DecodedEvent {

    record TextDelta(String text) implements DecodedEvent {
    }

    /**
     * 工具呼叫開始（尚無輸入）
     */
    record ToolUseStart(String toolUseId, String name) implements DecodedEvent {
    }

    /**
     * 工具輸入 JSON 片段，同一 {@code toolUseId} 的片段依序串接
     */
    record ToolInputDelta(String toolUseId, String name, String fragment) implements DecodedEvent {
    }

    /**
     * 區塊結束標記；index 0 為文字，1 為工具
     */
    record StopMarker(int index) implements DecodedEvent {
    }
}
