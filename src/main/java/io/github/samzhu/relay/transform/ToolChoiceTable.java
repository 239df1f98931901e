package io.github.samzhu.relay.transform;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import io.github.samzhu.relay.model.ToolChoice;

/**
 * tool_choice 對照表
 *
 * <pre>
 * canonical    openai                              gemini mode
 * auto         "auto"                              AUTO
 * any          "required"                          ANY
 * tool(name)   {type:function,function:{name}}     ANY + allowedFunctionNames
 * none         "none"                              NONE
 * </pre>
 *
 * CodeWhisperer 沒有對應欄位，一律忽略。
 */
final class ToolChoiceTable {

    private static final JsonNodeFactory JSON = JsonNodeFactory.instance;

    private ToolChoiceTable() {
    }

    static JsonNode openAi(ToolChoice choice) {
        switch (choice.mode()) {
            case ANY:
                return JSON.textNode("required");
            case NONE:
                return JSON.textNode("none");
            case TOOL: {
                ObjectNode node = JSON.objectNode();
                node.put("type", "function");
                node.putObject("function").put("name", choice.name());
                return node;
            }
            case AUTO:
            default:
                return JSON.textNode("auto");
        }
    }

    static ObjectNode geminiFunctionCallingConfig(ToolChoice choice) {
        ObjectNode config = JSON.objectNode();
        switch (choice.mode()) {
            case ANY:
                config.put("mode", "ANY");
                break;
            case NONE:
                config.put("mode", "NONE");
                break;
            case TOOL:
                config.put("mode", "ANY");
                config.putArray("allowedFunctionNames").add(choice.name());
                break;
            case AUTO:
            default:
                config.put("mode", "AUTO");
                break;
        }
        return config;
    }
}
