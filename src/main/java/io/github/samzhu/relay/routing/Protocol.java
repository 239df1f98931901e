package io.github.samzhu.relay.routing;

/**
 * 後端 provider 的原生協定
 */
public enum Protocol {

    /**
     * OpenAI 相容 {@code /chat/completions}（含 LM Studio、Ollama 等本地推論伺服器）
     */
    OPENAI,

    /**
     * Google Gemini {@code generateContent}
     */
    GEMINI,

    /**
     * AWS CodeWhisperer {@code generateAssistantResponse}（二進位 event stream 回應）
     */
    CODEWHISPERER
}
