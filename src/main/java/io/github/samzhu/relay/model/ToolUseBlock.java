package io.github.samzhu.relay.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

/**
 * 工具呼叫區塊
 *
 * <p>{@code id} 在第一次指派後即固定，後續的 {@code tool_result} 必須引用同一個 id。
 *
 * @param id    工具呼叫識別碼（provider 提供或由 normalizer 決定性產生）
 * @param name  工具名稱
 * @param input 工具參數（JSON 物件）
 */
public record ToolUseBlock(
    String id,
    String name,
    JsonNode input
) implements ContentBlock {

    public ToolUseBlock {
        if (input == null || input.isNull()) {
            input = JsonNodeFactory.instance.objectNode();
        }
    }
}
