package io.github.samzhu.relay.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Canonical 內容區塊（tagged union）
 *
 * <p>三種區塊型別：
 * <ul>
 *   <li>{@link TextBlock} - {@code {"type":"text","text":"..."}}</li>
 *   <li>{@link ToolUseBlock} - {@code {"type":"tool_use","id":"...","name":"...","input":{...}}}</li>
 *   <li>{@link ToolResultBlock} - {@code {"type":"tool_result","tool_use_id":"...","content":...}}</li>
 * </ul>
 *
 * <p>區塊在陣列中的順序即為產生順序，下游任何階段都不得重新排序。
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = TextBlock.class, name = "text"),
    @JsonSubTypes.Type(value = ToolUseBlock.class, name = "tool_use"),
    @JsonSubTypes.Type(value = ToolResultBlock.class, name = "tool_result")
})
public sealed interface ContentBlock permits TextBlock, ToolUseBlock, ToolResultBlock {
}
