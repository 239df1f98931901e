package io.github.samzhu.relay.transform;

import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import io.github.samzhu.relay.model.CanonicalRequest;
import io.github.samzhu.relay.model.ContentBlock;
import io.github.samzhu.relay.model.Message;
import io.github.samzhu.relay.model.TextBlock;
import io.github.samzhu.relay.model.ToolDefinition;
import io.github.samzhu.relay.model.ToolResultBlock;
import io.github.samzhu.relay.model.ToolUseBlock;
import io.github.samzhu.relay.routing.Protocol;
import io.github.samzhu.relay.routing.ProviderProfile;

/**
 * Canonical → Gemini {@code generateContent}
 *
 * <p>對應規則：
 * <ul>
 *   <li>system → {@code systemInstruction.parts[].text}</li>
 *   <li>角色 {@code assistant} → {@code model}</li>
 *   <li>tool_use → {@code functionCall{name, args}}</li>
 *   <li>tool_result → {@code functionResponse{name, response}}，name 由先前同 id 的 tool_use 取得</li>
 *   <li>工具 → {@code tools[0].functionDeclarations[]}，參數 schema 移除 Gemini 不接受的
 *       {@code $schema} 與 {@code additionalProperties}</li>
 *   <li>網頁搜尋工具 → {@code googleSearch}</li>
 *   <li>取樣參數 → {@code generationConfig}，{@code stop_sequences} → {@code stopSequences}</li>
 * </ul>
 */
@Component
public class GeminiRequestTransformer implements RequestTransformer {

    private static final Logger log = LoggerFactory.getLogger(GeminiRequestTransformer.class);

    private static final JsonNodeFactory JSON = JsonNodeFactory.instance;

    private final ParameterClamp clamp;

    public GeminiRequestTransformer(ParameterClamp clamp) {
        this.clamp = clamp;
    }

    @Override
    public Protocol protocol() {
        return Protocol.GEMINI;
    }

    @Override
    public NativeRequest transform(CanonicalRequest request, ProviderProfile provider, String model) {
        ObjectNode body = JSON.objectNode();

        if (request.hasSystem()) {
            body.putObject("systemInstruction").putArray("parts").addObject().put("text", request.system());
        }

        Map<String, String> toolNamesById = new HashMap<>();
        ArrayNode contents = body.putArray("contents");
        for (Message message : request.messages()) {
            ArrayNode parts = JSON.arrayNode();
            for (ContentBlock block : message.content()) {
                if (block instanceof TextBlock text) {
                    if (!text.text().isEmpty()) {
                        parts.addObject().put("text", text.text());
                    }
                } else if (block instanceof ToolUseBlock toolUse) {
                    toolNamesById.put(toolUse.id(), toolUse.name());
                    ObjectNode call = parts.addObject().putObject("functionCall");
                    call.put("name", toolUse.name());
                    call.set("args", toolUse.input().deepCopy());
                } else if (block instanceof ToolResultBlock result) {
                    String name = toolNamesById.get(result.toolUseId());
                    if (name == null) {
                        log.warn("tool_result references unknown tool_use id {}, using id as function name",
                            result.toolUseId());
                        name = result.toolUseId();
                    }
                    ObjectNode response = parts.addObject().putObject("functionResponse");
                    response.put("name", name);
                    response.putObject("response")
                        .put(Boolean.TRUE.equals(result.isError()) ? "error" : "content", result.content());
                }
            }
            if (parts.isEmpty()) {
                log.debug("Skipping {} message without Gemini parts", message.role());
                continue;
            }
            ObjectNode content = contents.addObject();
            content.put("role", message.isAssistant() ? "model" : "user");
            content.set("parts", parts);
        }

        if (request.hasTools()) {
            ArrayNode tools = body.putArray("tools");
            ArrayNode declarations = JSON.arrayNode();
            boolean webSearch = false;
            for (ToolDefinition tool : request.tools()) {
                if (tool.isWebSearch()) {
                    webSearch = true;
                    continue;
                }
                ObjectNode declaration = declarations.addObject();
                declaration.put("name", tool.name());
                if (tool.description() != null) {
                    declaration.put("description", tool.description());
                }
                if (tool.schema() != null && tool.schema().isObject()) {
                    declaration.set("parameters", cleanSchema(tool.schema().deepCopy()));
                }
            }
            if (!declarations.isEmpty()) {
                tools.addObject().set("functionDeclarations", declarations);
            }
            if (webSearch) {
                tools.addObject().putObject("googleSearch");
            }
            if (request.toolChoice() != null && !declarations.isEmpty()) {
                body.putObject("toolConfig")
                    .set("functionCallingConfig", ToolChoiceTable.geminiFunctionCallingConfig(request.toolChoice()));
            }
        }

        ObjectNode generationConfig = JSON.objectNode();
        Double temperature = clamp.temperature(provider, request.temperature());
        if (temperature != null) {
            generationConfig.put("temperature", temperature);
        }
        Double topP = clamp.topP(provider, request.topP());
        if (topP != null) {
            generationConfig.put("topP", topP);
        }
        Integer maxTokens = clamp.maxTokens(provider, request.maxTokens());
        if (maxTokens != null) {
            generationConfig.put("maxOutputTokens", maxTokens);
        }
        if (!request.stopSequences().isEmpty()) {
            ArrayNode stop = generationConfig.putArray("stopSequences");
            request.stopSequences().forEach(stop::add);
        }
        if (!generationConfig.isEmpty()) {
            body.set("generationConfig", generationConfig);
        }

        return new NativeRequest(Protocol.GEMINI, model, body, request.stream());
    }

    /**
     * 遞迴移除 Gemini 不接受的 schema 關鍵字
     */
    static JsonNode cleanSchema(JsonNode schema) {
        if (schema.isObject()) {
            ObjectNode object = (ObjectNode) schema;
            object.remove("$schema");
            object.remove("additionalProperties");
            Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
            while (fields.hasNext()) {
                cleanSchema(fields.next().getValue());
            }
        } else if (schema.isArray()) {
            for (JsonNode item : schema) {
                cleanSchema(item);
            }
        }
        return schema;
    }
}
