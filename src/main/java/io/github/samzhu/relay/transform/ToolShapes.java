package io.github.samzhu.relay.transform;

import com.fasterxml.jackson.databind.JsonNode;

import io.github.samzhu.relay.model.ToolDefinition;

/**
 * 工具定義形狀判斷
 *
 * <p>支援兩種形狀：
 * <ul>
 *   <li>Anthropic：{@code {name, description, input_schema}}，server tool 另帶 {@code type}</li>
 *   <li>OpenAI：{@code {type: "function", function: {name, description, parameters}}}</li>
 * </ul>
 *
 * <p>純函式，不拋例外；呼叫端依 {@link ToolShapeResult#recognized()} 決定如何處理。
 */
public final class ToolShapes {

    private ToolShapes() {
    }

    public static ToolShapeResult detect(JsonNode node) {
        if (node == null || !node.isObject()) {
            return ToolShapeResult.unrecognized("tool definition must be an object");
        }

        JsonNode function = node.get("function");
        if (function != null) {
            String type = text(node, "type");
            if (type != null && !"function".equals(type)) {
                return ToolShapeResult.unrecognized("nested tool type must be 'function' but was '" + type + "'");
            }
            if (!function.isObject()) {
                return ToolShapeResult.unrecognized("'function' must be an object");
            }
            String name = text(function, "name");
            if (name == null || name.isBlank()) {
                return ToolShapeResult.unrecognized("nested function tool is missing 'function.name'");
            }
            return ToolShapeResult.of(new ToolDefinition.NestedFunction(
                name, text(function, "description"), function.get("parameters")));
        }

        String name = text(node, "name");
        if (name != null && !name.isBlank()) {
            return ToolShapeResult.of(new ToolDefinition.Flattened(
                name, text(node, "description"), node.get("input_schema"), text(node, "type")));
        }

        return ToolShapeResult.unrecognized("tool definition has neither 'name' nor 'function'");
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }
}
