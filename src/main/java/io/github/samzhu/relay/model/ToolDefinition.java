package io.github.samzhu.relay.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * 工具定義（tagged union）
 *
 * <p>入站請求中的工具可能為兩種形狀之一：
 * <ul>
 *   <li>{@link Flattened} - Anthropic 形狀 {@code {name, description, input_schema}}</li>
 *   <li>{@link NestedFunction} - OpenAI 形狀 {@code {type:"function", function:{name, description, parameters}}}</li>
 * </ul>
 *
 * <p>形狀判斷由 {@link io.github.samzhu.relay.transform.ToolShapes#detect} 完成，
 * 下游轉換器只依賴 {@link #name()}、{@link #description()}、{@link #schema()}。
 */
public sealed interface ToolDefinition permits ToolDefinition.Flattened, ToolDefinition.NestedFunction {

    String name();

    String description();

    /**
     * 工具參數的 JSON Schema
     */
    JsonNode schema();

    record Flattened(String name, String description, JsonNode inputSchema, String type) implements ToolDefinition {
        @Override
        public JsonNode schema() {
            return inputSchema;
        }
    }

    record NestedFunction(String name, String description, JsonNode parameters) implements ToolDefinition {
        @Override
        public JsonNode schema() {
            return parameters;
        }
    }

    /**
     * 是否為 Anthropic server tool 形式的網頁搜尋工具
     */
    default boolean isWebSearch() {
        if (this instanceof Flattened flattened && flattened.type() != null
                && flattened.type().startsWith("web_search")) {
            return true;
        }
        return name() != null && name().startsWith("web_search");
    }
}
