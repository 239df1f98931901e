package io.github.samzhu.relay.provider;

import com.fasterxml.jackson.databind.JsonNode;

import io.github.samzhu.relay.model.StopReason;

/**
 * Provider 輸出的語意片段
 *
 * <p>各協定的回應（unary JSON、SSE、二進位 event stream）都先轉成這個序列，
 * 之後的 tool call 還原與正規化只依賴這個型別，不需要知道來源協定。
 */
public sealed interface ProviderChunk {

    /**
     * 文字增量
     */
    record TextDelta(String text) implements ProviderChunk {
    }

    /**
     * 工具呼叫開始；輸入以 {@link ToolInputDelta} 分段送達
     *
     * @param key  同一回應內識別此工具呼叫的鍵
     * @param id   provider 指定的 id（可能為 null）
     * @param name 工具名稱
     */
    record ToolUseStart(String key, String id, String name) implements ProviderChunk {
    }

    /**
     * 工具輸入 JSON 片段，依序串接後才是完整 JSON
     */
    record ToolInputDelta(String key, String partialJson) implements ProviderChunk {
    }

    /**
     * 一次到齊的工具呼叫（Gemini functionCall、還原出來的文字工具呼叫）
     *
     * @param id    provider 指定的 id（可能為 null）
     * @param name  工具名稱
     * @param input 已解析的輸入物件
     */
    record ToolUseComplete(String id, String name, JsonNode input) implements ProviderChunk {
    }

    /**
     * 用量；後到的值覆蓋先到的值，null 表示該欄位未提供
     */
    record UsageUpdate(Integer inputTokens, Integer outputTokens) implements ProviderChunk {
    }

    /**
     * 結束訊號
     *
     * @param rawReason provider 原始的結束原因
     * @param inferred  推斷出的結束原因（provider 未送出結束訊號時由還原步驟補上）
     */
    record Finish(String rawReason, StopReason inferred) implements ProviderChunk {

        public static Finish raw(String rawReason) {
            return new Finish(rawReason, null);
        }

        public static Finish inferred(StopReason reason) {
            return new Finish(null, reason);
        }
    }
}
