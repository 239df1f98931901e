package io.github.samzhu.relay.service;

import java.io.IOException;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;
import java.util.function.BiFunction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.github.samzhu.relay.config.RelayProperties;
import io.github.samzhu.relay.exception.RelayException;
import io.github.samzhu.relay.model.CanonicalRequest;
import io.github.samzhu.relay.model.CanonicalResponse;
import io.github.samzhu.relay.normalize.NormalizationContext;
import io.github.samzhu.relay.normalize.NormalizedDelta;
import io.github.samzhu.relay.normalize.ResponseNormalizer;
import io.github.samzhu.relay.normalize.StreamNormalizer;
import io.github.samzhu.relay.provider.ProviderClients;
import io.github.samzhu.relay.provider.ProviderHttpException;
import io.github.samzhu.relay.provider.ProviderStream;
import io.github.samzhu.relay.provider.eventstream.StreamDecodeException;
import io.github.samzhu.relay.recovery.ToolCallRecovery;
import io.github.samzhu.relay.routing.Classification;
import io.github.samzhu.relay.routing.RequestClassifier;
import io.github.samzhu.relay.routing.Router;
import io.github.samzhu.relay.routing.RoutingDecision;
import io.github.samzhu.relay.routing.RoutingExhaustedException;
import io.github.samzhu.relay.routing.TokenEstimator;
import io.github.samzhu.relay.stream.CancellationToken;
import io.github.samzhu.relay.stream.SseEventSink;
import io.github.samzhu.relay.stream.StreamCancelledException;
import io.github.samzhu.relay.stream.StreamReemitter;
import io.github.samzhu.relay.transform.NativeRequest;
import io.github.samzhu.relay.transform.RequestTransformers;

/**
 * 請求管線
 *
 * <p>流程：分類 → 選擇路由目標 → 轉換請求 → 呼叫 provider → tool call 還原 → 正規化 →（串流）重新輸出 SSE。
 *
 * <p>Failover：provider 回應錯誤或逾時時，排除該 provider 後重新選擇，
 * 最多嘗試 {@code relay.routing.max-failover-attempts} 個目標；用盡後回報最後一個 provider 錯誤。
 * 串流一旦開始轉送就不再 failover，之後的錯誤走取消流程。
 */
@Service
public class MessagePipeline {

    private static final Logger log = LoggerFactory.getLogger(MessagePipeline.class);

    private final RequestClassifier classifier;
    private final Router router;
    private final RequestTransformers transformers;
    private final ProviderClients providerClients;
    private final ToolCallRecovery recovery;
    private final ResponseNormalizer normalizer;
    private final RelayMetrics metrics;
    private final int maxFailoverAttempts;

    public MessagePipeline(RequestClassifier classifier, Router router, RequestTransformers transformers,
                           ProviderClients providerClients, ToolCallRecovery recovery,
                           ResponseNormalizer normalizer, RelayMetrics metrics, RelayProperties properties) {
        this.classifier = classifier;
        this.router = router;
        this.transformers = transformers;
        this.providerClients = providerClients;
        this.recovery = recovery;
        this.normalizer = normalizer;
        this.metrics = metrics;
        this.maxFailoverAttempts = properties.routing().maxFailoverAttempts();
    }

    /**
     * 非串流請求
     */
    public CanonicalResponse complete(CanonicalRequest request) {
        Classification classification = classifier.classify(request);
        return withFailover(request, classification, (decision, nativeRequest) -> {
            NormalizationContext context = context(request, decision, classification);
            try (ProviderStream stream = recovery.wrap(providerClients.open(decision.provider(), nativeRequest))) {
                CanonicalResponse response = normalizer.normalize(() -> stream, context);
                log.info("Completed message: provider={}, model={}, stopReason={}, inputTokens={}, outputTokens={}",
                    decision.providerId(), decision.model(), response.stopReason().wireValue(),
                    response.usage().inputTokens(), response.usage().outputTokens());
                return response;
            }
        });
    }

    /**
     * 串流請求：取得上游回應標頭後即返回，錯誤仍可以一般錯誤回應回報
     */
    public StreamingExchange openStream(CanonicalRequest request) {
        Classification classification = classifier.classify(request);
        return withFailover(request, classification, (decision, nativeRequest) -> {
            NormalizationContext context = context(request, decision, classification);
            ProviderStream stream = recovery.wrap(providerClients.open(decision.provider(), nativeRequest));
            StreamNormalizer streamNormalizer = normalizer.streaming(context);
            return new StreamingExchange(decision, stream, streamNormalizer, context);
        });
    }

    /**
     * 把上游串流轉為 canonical SSE；拉取下一個片段前與每次寫入後檢查取消
     */
    public void relay(StreamingExchange exchange, SseEventSink sink, CancellationToken token) {
        ProviderStream stream = exchange.stream();
        StreamNormalizer streamNormalizer = exchange.normalizer();
        NormalizationContext context = exchange.context();
        RoutingDecision decision = exchange.decision();
        token.onCancel(stream::close);
        StreamReemitter reemitter = new StreamReemitter(sink, token);

        try {
            reemitter.start(context.messageId(), context.model(), context.estimatedInputTokens());
            while (true) {
                token.throwIfCancelled();
                if (!stream.hasNext()) {
                    break;
                }
                for (NormalizedDelta delta : streamNormalizer.accept(stream.next())) {
                    reemitter.accept(delta);
                }
            }
            reemitter.finish(streamNormalizer.stopReason(), streamNormalizer.outputTokens());
            metrics.request(decision.providerId(), decision.category().value(), "success");
            log.info("Stream completed: provider={}, model={}, stopReason={}, outputTokens={}",
                decision.providerId(), decision.model(), streamNormalizer.stopReason().wireValue(),
                streamNormalizer.outputTokens());
        } catch (StreamCancelledException e) {
            cancelled(reemitter, streamNormalizer, decision, token, e.cancelCause(), e);
        } catch (IOException e) {
            cancelled(reemitter, streamNormalizer, decision, token, CancellationToken.CAUSE_CLIENT_DISCONNECTED, e);
        } catch (StreamDecodeException e) {
            cancelled(reemitter, streamNormalizer, decision, token, CancellationToken.CAUSE_DECODE_ERROR, e);
        } catch (RelayException e) {
            cancelled(reemitter, streamNormalizer, decision, token, CancellationToken.CAUSE_UPSTREAM_ABORTED, e);
        } catch (RuntimeException e) {
            log.error("Unexpected error while relaying stream from provider {}", decision.providerId(), e);
            cancelled(reemitter, streamNormalizer, decision, token, CancellationToken.CAUSE_INTERNAL_ERROR, e);
        } finally {
            stream.close();
        }
    }

    public int countTokens(CanonicalRequest request) {
        return TokenEstimator.estimate(request);
    }

    private void cancelled(StreamReemitter reemitter, StreamNormalizer streamNormalizer, RoutingDecision decision,
                           CancellationToken token, String cause, Exception e) {
        token.cancel(cause);
        String effectiveCause = token.cause();
        log.warn("Stream cancelled: provider={}, cause={}, state={}, error={}",
            decision.providerId(), effectiveCause, reemitter.state(), e.getMessage());
        reemitter.cancel(streamNormalizer.outputTokens());
        metrics.streamCancelled(effectiveCause);
        metrics.request(decision.providerId(), decision.category().value(), "cancelled");
    }

    private <T> T withFailover(CanonicalRequest request, Classification classification,
                               BiFunction<RoutingDecision, NativeRequest, T> call) {
        Set<String> excluded = new LinkedHashSet<>();
        RelayException lastError = null;
        RelayException lastNonRateLimited = null;
        for (int attempt = 1; attempt <= maxFailoverAttempts; attempt++) {
            RoutingDecision decision;
            try {
                decision = router.select(classification, excluded);
            } catch (RoutingExhaustedException e) {
                metrics.routingExhausted(classification.category().value());
                if (lastError != null) {
                    throw surfaced(lastError, lastNonRateLimited);
                }
                throw e;
            }
            log.info("Routing: category={}, rule={}, provider={}, model={}, method={}, attempt={}, selectionNanos={}",
                decision.category().value(), decision.ruleId(), decision.providerId(), decision.model(),
                decision.selectionMethod().value(), attempt, decision.selectionNanos());

            NativeRequest nativeRequest = transformers.transform(request, decision.provider(), decision.model());
            try {
                T result = call.apply(decision, nativeRequest);
                if (!request.stream()) {
                    metrics.request(decision.providerId(), decision.category().value(), "success");
                }
                return result;
            } catch (RelayException e) {
                if (!e.isFailoverEligible()) {
                    metrics.request(decision.providerId(), decision.category().value(), "error");
                    throw e;
                }
                lastError = e;
                if (!isRateLimited(e)) {
                    lastNonRateLimited = e;
                }
                excluded.add(decision.providerId());
                metrics.failover(decision.category().value(), decision.providerId(), e.getClass().getSimpleName());
                log.warn("Provider {} failed ({}), attempt {}/{}", decision.providerId(), e.getMessage(),
                    attempt, maxFailoverAttempts);
            }
        }
        throw surfaced(lastError, lastNonRateLimited);
    }

    /**
     * 全部目標都回應 429 時回報 rate limit，否則回報最後一個非 429 的錯誤
     */
    private static RelayException surfaced(RelayException lastError, RelayException lastNonRateLimited) {
        return lastNonRateLimited != null ? lastNonRateLimited : lastError;
    }

    private static boolean isRateLimited(RelayException e) {
        return e instanceof ProviderHttpException http && http.isRateLimited();
    }

    private static NormalizationContext context(CanonicalRequest request, RoutingDecision decision,
                                                Classification classification) {
        return new NormalizationContext(
            decision.provider().protocol(),
            decision.providerId(),
            newMessageId(),
            request.model(),
            classification.estimatedTokens());
    }

    static String newMessageId() {
        return "msg_" + UUID.randomUUID().toString().replace("-", "").substring(0, 24);
    }
}
