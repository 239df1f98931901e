package io.github.samzhu.relay.provider;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * 上游 SSE（Server-Sent Events）行解析工具
 *
 * <p>OpenAI 相容與 Gemini（{@code alt=sse}）的串流回應都是 {@code data:} 行，
 * OpenAI 以 {@code data: [DONE]} 結束，Gemini 直接關閉連線。
 *
 * <p>SSE 格式範例：
 * <pre>{@code
 * data: {"choices":[{"delta":{"content":"Hello"}}]}
 *
 * data: [DONE]
 * }</pre>
 *
 * @see <a href="https://html.spec.whatwg.org/multipage/server-sent-events.html">SSE Specification</a>
 */
public class SseParser {

    private static final Logger log = LoggerFactory.getLogger(SseParser.class);

    public static final String DONE = "[DONE]";

    private final ObjectMapper objectMapper;

    public SseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * 解析 SSE data 內容為 JSON
     *
     * @param data SSE data 內容（不含 "data:" 前綴）
     * @return JSON 物件，空白、{@code [DONE]} 或解析失敗返回 null
     */
    public JsonNode parse(String data) {
        if (data == null || data.isBlank() || isDone(data)) {
            return null;
        }
        try {
            return objectMapper.readTree(data);
        } catch (Exception e) {
            log.debug("Failed to parse SSE data: {}", data, e);
            return null;
        }
    }

    /**
     * 從 SSE 行提取 data 內容
     *
     * @param line SSE 行
     * @return data 內容，非 data 行返回 null
     */
    public String extractData(String line) {
        if (line == null || !line.startsWith("data:")) {
            return null;
        }
        String data = line.substring(5);
        return data.startsWith(" ") ? data.substring(1) : data;
    }

    public boolean isDone(String data) {
        return DONE.equals(data.trim());
    }
}
