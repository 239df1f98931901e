package io.github.samzhu.relay.normalize;

import java.util.Locale;
import java.util.Map;

import io.github.samzhu.relay.model.StopReason;
import io.github.samzhu.relay.routing.Protocol;

/**
 * Provider 結束原因對照表
 *
 * <pre>
 * OpenAI   stop → end_turn, length → max_tokens, tool_calls | function_call → tool_use,
 *          content_filter → stop_sequence
 * Gemini   STOP → end_turn, MAX_TOKENS → max_tokens,
 *          SAFETY | RECITATION | BLOCKLIST | PROHIBITED_CONTENT | SPII → stop_sequence
 * </pre>
 *
 * CodeWhisperer 沒有結束原因；未知值一律視為 {@code end_turn}。
 */
public final class StopReasonMapper {

    private static final Map<String, StopReason> OPENAI = Map.of(
        "stop", StopReason.END_TURN,
        "length", StopReason.MAX_TOKENS,
        "tool_calls", StopReason.TOOL_USE,
        "function_call", StopReason.TOOL_USE,
        "content_filter", StopReason.STOP_SEQUENCE);

    private static final Map<String, StopReason> GEMINI = Map.of(
        "STOP", StopReason.END_TURN,
        "MAX_TOKENS", StopReason.MAX_TOKENS,
        "SAFETY", StopReason.STOP_SEQUENCE,
        "RECITATION", StopReason.STOP_SEQUENCE,
        "BLOCKLIST", StopReason.STOP_SEQUENCE,
        "PROHIBITED_CONTENT", StopReason.STOP_SEQUENCE,
        "SPII", StopReason.STOP_SEQUENCE);

    private StopReasonMapper() {
    }

    public static StopReason map(Protocol protocol, String rawReason) {
        if (rawReason == null) {
            return StopReason.END_TURN;
        }
        switch (protocol) {
            case OPENAI:
                return OPENAI.getOrDefault(rawReason.toLowerCase(Locale.ROOT), StopReason.END_TURN);
            case GEMINI:
                return GEMINI.getOrDefault(rawReason.toUpperCase(Locale.ROOT), StopReason.END_TURN);
            case CODEWHISPERER:
            default:
                return StopReason.END_TURN;
        }
    }

    /**
     * 套用工具呼叫規則：有工具呼叫一律 {@code tool_use}；沒有工具呼叫時不得為 {@code tool_use}
     */
    public static StopReason resolve(StopReason declared, boolean hasToolUse) {
        if (hasToolUse) {
            return StopReason.TOOL_USE;
        }
        if (declared == null || declared == StopReason.TOOL_USE) {
            return StopReason.END_TURN;
        }
        return declared;
    }
}
