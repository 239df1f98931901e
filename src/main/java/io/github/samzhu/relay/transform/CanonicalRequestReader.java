package io.github.samzhu.relay.transform;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.github.samzhu.relay.model.CanonicalRequest;
import io.github.samzhu.relay.model.ContentBlock;
import io.github.samzhu.relay.model.Message;
import io.github.samzhu.relay.model.TextBlock;
import io.github.samzhu.relay.model.ToolChoice;
import io.github.samzhu.relay.model.ToolDefinition;
import io.github.samzhu.relay.model.ToolResultBlock;
import io.github.samzhu.relay.model.ToolUseBlock;

/**
 * 入站 Anthropic Messages 請求解析
 *
 * <p>把原始 JSON 轉成不可變的 {@link CanonicalRequest}，形狀不符時拋出
 * {@link TransformValidationException}（回應 400 {@code invalid_request_error}）。
 *
 * <p>寬鬆處理：
 * <ul>
 *   <li>字串形式的 {@code content} 轉為單一 text 區塊</li>
 *   <li>陣列形式的 {@code system} 以空行串接</li>
 *   <li>{@code thinking} / {@code redacted_thinking} 歷史區塊略過（後端無對應欄位）</li>
 *   <li>{@code metadata} 忽略</li>
 * </ul>
 */
@Component
public class CanonicalRequestReader {

    private static final Logger log = LoggerFactory.getLogger(CanonicalRequestReader.class);

    private final ObjectMapper objectMapper;

    public CanonicalRequestReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public CanonicalRequest read(byte[] body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (IOException e) {
            throw new TransformValidationException("Request body is not valid JSON");
        }
        if (root == null || !root.isObject()) {
            throw new TransformValidationException("Request body must be a JSON object");
        }
        return read(root);
    }

    public CanonicalRequest read(JsonNode root) {
        String model = root.path("model").asText(null);
        if (model == null || model.isBlank()) {
            throw new TransformValidationException("model: field required");
        }

        JsonNode messagesNode = root.get("messages");
        if (messagesNode == null || !messagesNode.isArray() || messagesNode.isEmpty()) {
            throw new TransformValidationException("messages: at least one message is required");
        }
        List<Message> messages = new ArrayList<>();
        for (int i = 0; i < messagesNode.size(); i++) {
            messages.add(readMessage(messagesNode.get(i), i));
        }

        List<ToolDefinition> tools = new ArrayList<>();
        JsonNode toolsNode = root.get("tools");
        if (toolsNode != null && !toolsNode.isNull()) {
            if (!toolsNode.isArray()) {
                throw new TransformValidationException("tools: must be an array");
            }
            for (int i = 0; i < toolsNode.size(); i++) {
                ToolShapeResult result = ToolShapes.detect(toolsNode.get(i));
                if (!result.recognized()) {
                    throw new TransformValidationException("tools." + i + ": " + result.reason());
                }
                tools.add(result.tool());
            }
        }

        return new CanonicalRequest(
            model,
            messages,
            readSystem(root.get("system")),
            tools,
            readToolChoice(root.get("tool_choice")),
            readMaxTokens(root.get("max_tokens")),
            readDouble(root, "temperature"),
            readDouble(root, "top_p"),
            readStopSequences(root.get("stop_sequences")),
            root.path("stream").asBoolean(false),
            "enabled".equals(root.path("thinking").path("type").asText(null)));
    }

    private Message readMessage(JsonNode node, int index) {
        if (node == null || !node.isObject()) {
            throw new TransformValidationException("messages." + index + ": must be an object");
        }
        String role = node.path("role").asText(null);
        if (!Message.USER.equals(role) && !Message.ASSISTANT.equals(role)) {
            throw new TransformValidationException("messages." + index + ".role: unexpected role '" + role + "'");
        }
        JsonNode content = node.get("content");
        if (content == null || content.isNull()) {
            throw new TransformValidationException("messages." + index + ".content: field required");
        }
        if (content.isTextual()) {
            return new Message(role, List.of(new TextBlock(content.asText())));
        }
        if (!content.isArray()) {
            throw new TransformValidationException("messages." + index + ".content: must be a string or an array");
        }

        List<ContentBlock> blocks = new ArrayList<>();
        for (int j = 0; j < content.size(); j++) {
            ContentBlock block = readBlock(content.get(j), "messages." + index + ".content." + j);
            if (block != null) {
                blocks.add(block);
            }
        }
        return new Message(role, blocks);
    }

    private ContentBlock readBlock(JsonNode node, String path) {
        String type = node.path("type").asText("");
        switch (type) {
            case "text":
                return new TextBlock(node.path("text").asText(""));
            case "tool_use": {
                String id = node.path("id").asText(null);
                String name = node.path("name").asText(null);
                if (id == null || name == null) {
                    throw new TransformValidationException(path + ": tool_use requires 'id' and 'name'");
                }
                JsonNode input = node.get("input");
                if (input != null && !input.isNull() && !input.isObject()) {
                    throw new TransformValidationException(path + ".input: must be an object");
                }
                return new ToolUseBlock(id, name, input);
            }
            case "tool_result": {
                String toolUseId = node.path("tool_use_id").asText(null);
                if (toolUseId == null) {
                    throw new TransformValidationException(path + ": tool_result requires 'tool_use_id'");
                }
                JsonNode isError = node.get("is_error");
                return new ToolResultBlock(toolUseId, flattenText(node.get("content"), "\n"),
                    isError != null && isError.isBoolean() ? isError.asBoolean() : null);
            }
            case "thinking":
            case "redacted_thinking":
                log.debug("Skipping {} block at {}", type, path);
                return null;
            default:
                throw new TransformValidationException(path + ": unsupported content block type '" + type + "'");
        }
    }

    private String readSystem(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isTextual() && !node.isArray()) {
            throw new TransformValidationException("system: must be a string or an array of text blocks");
        }
        return flattenText(node, "\n\n");
    }

    /**
     * 字串原樣返回；text 區塊陣列以 separator 串接
     */
    private static String flattenText(JsonNode node, String separator) {
        if (node == null || node.isNull()) {
            return "";
        }
        if (node.isTextual()) {
            return node.asText();
        }
        if (node.isArray()) {
            List<String> parts = new ArrayList<>();
            for (JsonNode part : node) {
                if (part.isTextual()) {
                    parts.add(part.asText());
                } else if ("text".equals(part.path("type").asText())) {
                    parts.add(part.path("text").asText(""));
                }
            }
            return String.join(separator, parts);
        }
        return node.toString();
    }

    private ToolChoice readToolChoice(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        String type = node.isTextual() ? node.asText() : node.path("type").asText("");
        switch (type) {
            case "auto":
                return ToolChoice.AUTO;
            case "any":
                return new ToolChoice(ToolChoice.Mode.ANY, null);
            case "none":
                return new ToolChoice(ToolChoice.Mode.NONE, null);
            case "tool": {
                String name = node.path("name").asText(null);
                if (name == null || name.isBlank()) {
                    throw new TransformValidationException("tool_choice.name: required when type is 'tool'");
                }
                return ToolChoice.tool(name);
            }
            default:
                throw new TransformValidationException("tool_choice.type: unexpected value '" + type + "'");
        }
    }

    private Integer readMaxTokens(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isIntegralNumber() || node.asLong() < 1 || node.asLong() > Integer.MAX_VALUE) {
            throw new TransformValidationException("max_tokens: must be a positive integer");
        }
        return node.asInt();
    }

    private Double readDouble(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isNumber()) {
            throw new TransformValidationException(field + ": must be a number");
        }
        return node.asDouble();
    }

    private List<String> readStopSequences(JsonNode node) {
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw new TransformValidationException("stop_sequences: must be an array of strings");
        }
        List<String> result = new ArrayList<>();
        for (JsonNode item : node) {
            result.add(item.asText());
        }
        return result;
    }
}
