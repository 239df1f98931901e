package io.github.samzhu.relay.routing;

import io.github.samzhu.relay.model.CanonicalRequest;
import io.github.samzhu.relay.model.ContentBlock;
import io.github.samzhu.relay.model.Message;
import io.github.samzhu.relay.model.TextBlock;
import io.github.samzhu.relay.model.ToolDefinition;
import io.github.samzhu.relay.model.ToolResultBlock;
import io.github.samzhu.relay.model.ToolUseBlock;

/**
 * Token 數估算
 *
 * <p>以 {@code ceil(字元數 / 4)} 近似，計入訊息文字、tool_use 輸入 JSON、tool_result 內容、
 * 系統提示與序列化後的工具定義。這不是任何 provider 的精確 tokenizer，
 * 長上下文門檻附近的分類結果只能視為近似值。
 */
public final class TokenEstimator {

    private TokenEstimator() {
    }

    public static int estimate(CanonicalRequest request) {
        long chars = 0;
        if (request.system() != null) {
            chars += request.system().length();
        }
        for (Message message : request.messages()) {
            for (ContentBlock block : message.content()) {
                chars += countChars(block);
            }
        }
        for (ToolDefinition tool : request.tools()) {
            chars += length(tool.name()) + length(tool.description());
            if (tool.schema() != null) {
                chars += tool.schema().toString().length();
            }
        }
        return toTokens(chars);
    }

    public static int estimate(String text) {
        return text == null ? 0 : toTokens(text.length());
    }

    public static int toTokens(long chars) {
        return (int) Math.min(Integer.MAX_VALUE, (chars + 3) / 4);
    }

    static long countChars(ContentBlock block) {
        if (block instanceof TextBlock text) {
            return length(text.text());
        }
        if (block instanceof ToolUseBlock toolUse) {
            return length(toolUse.name()) + toolUse.input().toString().length();
        }
        if (block instanceof ToolResultBlock toolResult) {
            return length(toolResult.content());
        }
        return 0;
    }

    private static int length(String value) {
        return value == null ? 0 : value.length();
    }
}
