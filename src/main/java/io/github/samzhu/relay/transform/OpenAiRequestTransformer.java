package io.github.samzhu.relay.transform;

import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Component;

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
 * Canonical → OpenAI {@code /chat/completions}
 *
 * <p>對應規則：
 * <ul>
 *   <li>system → 第一則 {@code role: system} 訊息</li>
 *   <li>tool_result → {@code role: tool} 訊息（{@code tool_call_id}），排在同一輪 user 文字之前</li>
 *   <li>assistant tool_use → {@code tool_calls[].function.arguments}（JSON 字串）</li>
 *   <li>{@code stop_sequences} → {@code stop}</li>
 *   <li>串流時加上 {@code stream_options.include_usage}，讓最後一個 chunk 帶 usage</li>
 * </ul>
 */
@Component
public class OpenAiRequestTransformer implements RequestTransformer {

    private static final JsonNodeFactory JSON = JsonNodeFactory.instance;

    private final ParameterClamp clamp;

    public OpenAiRequestTransformer(ParameterClamp clamp) {
        this.clamp = clamp;
    }

    @Override
    public Protocol protocol() {
        return Protocol.OPENAI;
    }

    @Override
    public NativeRequest transform(CanonicalRequest request, ProviderProfile provider, String model) {
        ObjectNode body = JSON.objectNode();
        body.put("model", model);

        ArrayNode messages = body.putArray("messages");
        if (request.hasSystem()) {
            ObjectNode system = messages.addObject();
            system.put("role", "system");
            system.put("content", request.system());
        }
        for (Message message : request.messages()) {
            if (message.isAssistant()) {
                appendAssistant(messages, message);
            } else {
                appendUser(messages, message);
            }
        }

        if (request.hasTools()) {
            ArrayNode tools = body.putArray("tools");
            for (ToolDefinition tool : request.tools()) {
                ObjectNode entry = tools.addObject();
                entry.put("type", "function");
                ObjectNode function = entry.putObject("function");
                function.put("name", tool.name());
                if (tool.description() != null) {
                    function.put("description", tool.description());
                }
                function.set("parameters", tool.schema() != null ? tool.schema().deepCopy() : emptySchema());
            }
            if (request.toolChoice() != null) {
                body.set("tool_choice", ToolChoiceTable.openAi(request.toolChoice()));
            }
        }

        Integer maxTokens = clamp.maxTokens(provider, request.maxTokens());
        if (maxTokens != null) {
            body.put("max_tokens", maxTokens);
        }
        Double temperature = clamp.temperature(provider, request.temperature());
        if (temperature != null) {
            body.put("temperature", temperature);
        }
        Double topP = clamp.topP(provider, request.topP());
        if (topP != null) {
            body.put("top_p", topP);
        }
        if (!request.stopSequences().isEmpty()) {
            ArrayNode stop = body.putArray("stop");
            request.stopSequences().forEach(stop::add);
        }

        body.put("stream", request.stream());
        if (request.stream()) {
            body.putObject("stream_options").put("include_usage", true);
        }
        return new NativeRequest(Protocol.OPENAI, model, body, request.stream());
    }

    private void appendUser(ArrayNode messages, Message message) {
        List<String> texts = new ArrayList<>();
        for (ContentBlock block : message.content()) {
            if (block instanceof ToolResultBlock result) {
                ObjectNode tool = messages.addObject();
                tool.put("role", "tool");
                tool.put("tool_call_id", result.toolUseId());
                tool.put("content", result.content());
            } else if (block instanceof TextBlock text) {
                texts.add(text.text());
            }
        }
        if (!texts.isEmpty()) {
            ObjectNode user = messages.addObject();
            user.put("role", "user");
            user.put("content", String.join("\n", texts));
        }
    }

    private void appendAssistant(ArrayNode messages, Message message) {
        ObjectNode assistant = JSON.objectNode();
        assistant.put("role", "assistant");
        String text = message.joinedText();
        ArrayNode toolCalls = JSON.arrayNode();
        for (ContentBlock block : message.content()) {
            if (block instanceof ToolUseBlock toolUse) {
                ObjectNode call = toolCalls.addObject();
                call.put("id", toolUse.id());
                call.put("type", "function");
                ObjectNode function = call.putObject("function");
                function.put("name", toolUse.name());
                function.put("arguments", toolUse.input().toString());
            }
        }
        if (text.isEmpty() && !toolCalls.isEmpty()) {
            assistant.putNull("content");
        } else {
            assistant.put("content", text);
        }
        if (!toolCalls.isEmpty()) {
            assistant.set("tool_calls", toolCalls);
        }
        messages.add(assistant);
    }

    static ObjectNode emptySchema() {
        ObjectNode schema = JSON.objectNode();
        schema.put("type", "object");
        schema.putObject("properties");
        return schema;
    }
}
