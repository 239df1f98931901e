package io.github.samzhu.relay.transform;

import io.github.samzhu.relay.model.ToolDefinition;

/**
 * 工具形狀判斷結果
 *
 * @param tool   判斷成功時的工具定義
 * @param reason 判斷失敗時的原因
 */
public record ToolShapeResult(ToolDefinition tool, String reason) {

    public static ToolShapeResult of(ToolDefinition tool) {
        return new ToolShapeResult(tool, null);
    }

    public static ToolShapeResult unrecognized(String reason) {
        return new ToolShapeResult(null, reason);
    }

    public boolean recognized() {
        return tool != null;
    }
}
