package io.github.samzhu.relay.stream;

import java.io.IOException;

import io.github.samzhu.relay.model.StreamEvent;

/**
 * 面向客戶端的 SSE 寫入端
 *
 * <p>{@link #send} 回傳即代表寫入完成，下一個 provider 片段才會被拉取。
 */
public interface SseEventSink {

    void send(StreamEvent event) throws IOException;

    /**
     * 正常結束回應
     */
    void complete();
}
