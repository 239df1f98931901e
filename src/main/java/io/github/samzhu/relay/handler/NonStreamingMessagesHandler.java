package io.github.samzhu.relay.handler;

import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.function.ServerResponse;

import io.github.samzhu.relay.model.CanonicalRequest;
import io.github.samzhu.relay.model.CanonicalResponse;
import io.github.samzhu.relay.service.MessagePipeline;

/**
 * 非串流訊息處理器
 *
 * <p>等待 provider 完整回應，正規化後以單一 JSON 回傳。錯誤由路由的 {@code onError} 轉為錯誤信封。
 *
 * @see StreamingMessagesHandler
 */
@Component
public class NonStreamingMessagesHandler {

    private final MessagePipeline pipeline;

    public NonStreamingMessagesHandler(MessagePipeline pipeline) {
        this.pipeline = pipeline;
    }

    public ServerResponse handleNonStreaming(CanonicalRequest request) {
        CanonicalResponse response = pipeline.complete(request);
        return ServerResponse.ok()
            .contentType(MediaType.APPLICATION_JSON)
            .body(response);
    }
}
