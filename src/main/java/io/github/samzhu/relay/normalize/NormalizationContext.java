package io.github.samzhu.relay.normalize;

import io.github.samzhu.relay.routing.Protocol;

/**
 * 單一回應的正規化參數
 *
 * @param protocol             來源協定（決定結束原因對照表）
 * @param providerId           provider id（計數用）
 * @param messageId            回應的 message id（{@code msg_<key>}）
 * @param model                回給客戶端的模型名稱
 * @param estimatedInputTokens provider 未回報時使用的輸入 token 估算值
 */
public record NormalizationContext(
    Protocol protocol,
    String providerId,
    String messageId,
    String model,
    int estimatedInputTokens
) {

    /**
     * 產生工具 id 用的訊息鍵（去掉 {@code msg_} 前綴）
     */
    public String messageKey() {
        return messageId.startsWith("msg_") ? messageId.substring(4) : messageId;
    }

    public String toolUseId(int blockIndex) {
        return "toolu_" + messageKey() + "_" + blockIndex;
    }
}
