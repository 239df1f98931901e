package io.github.samzhu.relay.transform;

import java.util.List;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
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
 * Canonical → CodeWhisperer {@code generateAssistantResponse}
 *
 * <p>請求結構：
 * <pre>{@code
 * {
 *   "conversationState": {
 *     "chatTriggerType": "MANUAL",
 *     "conversationId": "<uuid>",
 *     "currentMessage": { "userInputMessage": { "content", "modelId", "origin": "AI_EDITOR",
 *                         "userInputMessageContext": { "tools": [...], "toolResults": [...] } } },
 *     "history": [ { "userInputMessage": {...} }, { "assistantResponseMessage": {...} } ]
 *   },
 *   "profileArn": "arn:aws:codewhisperer:..."
 * }
 * }</pre>
 *
 * <p>最後一則訊息成為 {@code currentMessage}，其餘依序放入 {@code history}。
 * 系統提示串接在第一則 user 訊息之前。取樣參數與停止序列沒有對應欄位，直接略過。
 */
@Component
public class CodeWhispererRequestTransformer implements RequestTransformer {

    private static final Logger log = LoggerFactory.getLogger(CodeWhispererRequestTransformer.class);

    private static final JsonNodeFactory JSON = JsonNodeFactory.instance;

    static final String ORIGIN = "AI_EDITOR";
    static final String EMPTY_TURN_CONTENT = "Continue";

    @Override
    public Protocol protocol() {
        return Protocol.CODEWHISPERER;
    }

    @Override
    public NativeRequest transform(CanonicalRequest request, ProviderProfile provider, String model) {
        if (request.temperature() != null || request.topP() != null || !request.stopSequences().isEmpty()) {
            log.debug("Dropping sampling parameters not supported by CodeWhisperer provider {}", provider.id());
        }

        ObjectNode body = JSON.objectNode();
        ObjectNode state = body.putObject("conversationState");
        state.put("chatTriggerType", "MANUAL");
        state.put("conversationId", UUID.randomUUID().toString());
        ObjectNode current = state.putObject("currentMessage");
        ArrayNode history = state.putArray("history");

        List<Message> messages = request.messages();
        String systemPrefix = request.hasSystem() ? request.system() : null;
        Message last = messages.get(messages.size() - 1);
        boolean lastIsUser = !last.isAssistant();
        int historyEnd = lastIsUser ? messages.size() - 1 : messages.size();

        for (int i = 0; i < historyEnd; i++) {
            Message message = messages.get(i);
            if (message.isAssistant()) {
                history.addObject().set("assistantResponseMessage", assistantMessage(message));
            } else {
                history.addObject().set("userInputMessage", userMessage(message, model, systemPrefix));
                systemPrefix = null;
            }
        }

        ObjectNode userInput = lastIsUser
            ? userMessage(last, model, systemPrefix)
            : userMessage(Message.user(EMPTY_TURN_CONTENT), model, systemPrefix);
        if (request.hasTools()) {
            ArrayNode tools = context(userInput).putArray("tools");
            for (ToolDefinition tool : request.tools()) {
                ObjectNode toolSpec = tools.addObject().putObject("toolSpecification");
                toolSpec.put("name", tool.name());
                toolSpec.put("description", tool.description() != null ? tool.description() : "");
                toolSpec.putObject("inputSchema").set("json",
                    tool.schema() != null ? tool.schema().deepCopy() : OpenAiRequestTransformer.emptySchema());
            }
        }
        current.set("userInputMessage", userInput);

        if (provider.profileArn() != null) {
            body.put("profileArn", provider.profileArn());
        }
        return new NativeRequest(Protocol.CODEWHISPERER, model, body, request.stream());
    }

    private ObjectNode userMessage(Message message, String model, String systemPrefix) {
        ObjectNode user = JSON.objectNode();
        StringBuilder content = new StringBuilder();
        ArrayNode toolResults = JSON.arrayNode();
        for (ContentBlock block : message.content()) {
            if (block instanceof TextBlock text) {
                content.append(text.text());
            } else if (block instanceof ToolResultBlock result) {
                ObjectNode entry = toolResults.addObject();
                entry.putArray("content").addObject().put("text", result.content());
                entry.put("status", Boolean.TRUE.equals(result.isError()) ? "error" : "success");
                entry.put("toolUseId", result.toolUseId());
            }
        }
        if (systemPrefix != null) {
            content.insert(0, content.length() > 0 ? systemPrefix + "\n\n" : systemPrefix);
        }
        if (content.length() == 0 && toolResults.isEmpty()) {
            content.append(EMPTY_TURN_CONTENT);
        }
        user.put("content", content.toString());
        user.put("modelId", model);
        user.put("origin", ORIGIN);
        if (!toolResults.isEmpty()) {
            context(user).set("toolResults", toolResults);
        }
        return user;
    }

    private ObjectNode assistantMessage(Message message) {
        ObjectNode assistant = JSON.objectNode();
        assistant.put("content", message.joinedText());
        ArrayNode toolUses = JSON.arrayNode();
        for (ContentBlock block : message.content()) {
            if (block instanceof ToolUseBlock toolUse) {
                ObjectNode entry = toolUses.addObject();
                entry.set("input", toolUse.input().deepCopy());
                entry.put("name", toolUse.name());
                entry.put("toolUseId", toolUse.id());
            }
        }
        if (!toolUses.isEmpty()) {
            assistant.set("toolUses", toolUses);
        }
        return assistant;
    }

    private static ObjectNode context(ObjectNode userInput) {
        ObjectNode context = (ObjectNode) userInput.get("userInputMessageContext");
        if (context == null) {
            context = userInput.putObject("userInputMessageContext");
        }
        return context;
    }
}
