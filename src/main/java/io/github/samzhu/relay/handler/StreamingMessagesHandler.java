package io.github.samzhu.relay.handler;

import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.function.ServerResponse;

import io.github.samzhu.relay.config.RelayProperties;
import io.github.samzhu.relay.model.CanonicalRequest;
import io.github.samzhu.relay.service.MessagePipeline;
import io.github.samzhu.relay.service.StreamingExchange;
import io.github.samzhu.relay.stream.CancellationToken;
import io.github.samzhu.relay.stream.ServerSseEventSink;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;

/**
 * 串流訊息處理器
 *
 * <p>處理流程：
 * <ol>
 *   <li>在回應開始前完成路由、failover 並取得上游回應標頭；此階段的錯誤仍以 JSON 錯誤信封回應</li>
 *   <li>以 {@link ServerResponse#sse} 開始 SSE 回應，重新輸出 canonical 事件</li>
 *   <li>客戶端斷線或逾時時取消 {@link CancellationToken}，關閉上游連線並送出終止事件</li>
 * </ol>
 *
 * <p>SSE 逾時由 {@code relay.streaming.sse-timeout} 控制（預設 10 分鐘）。
 *
 * @see NonStreamingMessagesHandler
 * @see <a href="https://docs.anthropic.com/en/api/messages-streaming">Claude Streaming</a>
 */
@Component
public class StreamingMessagesHandler {

    private static final Logger log = LoggerFactory.getLogger(StreamingMessagesHandler.class);

    private final MessagePipeline pipeline;
    private final Tracer tracer;
    private final Duration sseTimeout;

    public StreamingMessagesHandler(MessagePipeline pipeline, ObjectProvider<Tracer> tracer,
                                    RelayProperties properties) {
        this.pipeline = pipeline;
        this.tracer = tracer.getIfAvailable(() -> Tracer.NOOP);
        this.sseTimeout = properties.streaming().sseTimeout();
    }

    public ServerResponse handleStreaming(CanonicalRequest request) {
        StreamingExchange exchange = pipeline.openStream(request);

        // SSE callback 可能在不同 thread 執行，需手動傳播 trace context
        Span currentSpan = tracer.currentSpan();

        return ServerResponse.sse(sseBuilder -> {
            CancellationToken token = new CancellationToken();
            sseBuilder.onTimeout(() -> {
                log.warn("SSE timeout after {}", sseTimeout);
                token.cancel(CancellationToken.CAUSE_TIMEOUT);
            });
            sseBuilder.onError(e -> {
                log.debug("SSE connection error: {}", e.getMessage());
                token.cancel(CancellationToken.CAUSE_CLIENT_DISCONNECTED);
            });
            ServerSseEventSink sink = new ServerSseEventSink(sseBuilder);
            if (currentSpan != null) {
                try (Tracer.SpanInScope ignored = tracer.withSpan(currentSpan)) {
                    pipeline.relay(exchange, sink, token);
                }
            } else {
                pipeline.relay(exchange, sink, token);
            }
        }, sseTimeout);
    }
}
