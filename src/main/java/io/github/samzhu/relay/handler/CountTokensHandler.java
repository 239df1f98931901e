package io.github.samzhu.relay.handler;

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.function.ServerResponse;

import io.github.samzhu.relay.model.CanonicalRequest;
import io.github.samzhu.relay.service.MessagePipeline;

/**
 * Token 計算處理器
 *
 * <p>以 chars/4 的估算值回應 {@code /v1/messages/count_tokens}，不呼叫任何 provider。
 * 回應格式：{@code {"input_tokens": 123}}
 */
@Component
public class CountTokensHandler {

    private static final Logger log = LoggerFactory.getLogger(CountTokensHandler.class);

    private final MessagePipeline pipeline;

    public CountTokensHandler(MessagePipeline pipeline) {
        this.pipeline = pipeline;
    }

    public ServerResponse handleCountTokens(CanonicalRequest request) {
        int inputTokens = pipeline.countTokens(request);
        log.debug("Estimated input tokens: model={}, inputTokens={}", request.model(), inputTokens);
        return ServerResponse.ok()
            .contentType(MediaType.APPLICATION_JSON)
            .body(Map.of("input_tokens", inputTokens));
    }
}
