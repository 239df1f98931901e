package io.github.samzhu.relay.provider;

import java.io.IOException;
import java.io.InputStream;
import java.net.SocketTimeoutException;
import java.net.http.HttpClient;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.ClientHttpRequestFactory;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import io.github.samzhu.relay.config.ProviderAuthConfig;
import io.github.samzhu.relay.exception.RelayException;
import io.github.samzhu.relay.routing.ProviderProfile;
import io.github.samzhu.relay.service.RelayMetrics;
import io.github.samzhu.relay.transform.NativeRequest;

/**
 * HTTP provider 呼叫的共用流程
 *
 * <p>負責：
 * <ul>
 *   <li>每個 provider 一個 {@link RestClient}（由 Spring 自動配置的 Builder 複製，保留 Tracing）</li>
 *   <li>unary 呼叫：JDK HttpClient，timeout 是整個呼叫（含回應本體）的期限</li>
 *   <li>串流呼叫：timeout 是每次讀取的閒置上限，涵蓋等待回應標頭與 chunk 之間的間隔，不限制串流總長度</li>
 *   <li>多組 key 時由 {@link KeyRotationService} 輪換；429 的 key 進入冷卻，立即改用下一個 key</li>
 *   <li>Resilience4j Retry：暫時性錯誤（連線失敗、逾時、408、429、5xx）以指數退避重試</li>
 *   <li>非 2xx 轉為 {@link ProviderHttpException}；上游錯誤內容只寫入 log</li>
 * </ul>
 *
 * <p>重試只涵蓋收到回應標頭之前；串流開始後的中斷由呼叫端的取消流程處理。
 */
public abstract class AbstractProviderClient implements ProviderClient {

    private static final Logger log = LoggerFactory.getLogger(AbstractProviderClient.class);

    private static final int MAX_LOGGED_ERROR_BODY = 2048;

    protected final ObjectMapper objectMapper;
    protected final SseParser sseParser;

    private final RestClient.Builder restClientBuilder;
    private final RetryRegistry retryRegistry;
    private final KeyRotationService keyRotation;
    private final RelayMetrics metrics;
    private final Map<String, RestClient> unaryClients = new ConcurrentHashMap<>();
    private final Map<String, RestClient> streamingClients = new ConcurrentHashMap<>();
    private final Map<String, Retry> retries = new ConcurrentHashMap<>();

    /**
     * @param restClientBuilder Spring 自動配置的 RestClient.Builder（已包含 Tracing instrumentation）
     */
    protected AbstractProviderClient(RestClient.Builder restClientBuilder, RetryRegistry retryRegistry,
                                     KeyRotationService keyRotation, RelayMetrics metrics,
                                     ObjectMapper objectMapper) {
        this.restClientBuilder = restClientBuilder;
        this.retryRegistry = retryRegistry;
        this.keyRotation = keyRotation;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
        this.sseParser = new SseParser(objectMapper);
    }

    @Override
    public ProviderStream open(ProviderProfile provider, NativeRequest request) {
        Retry retry = retries.computeIfAbsent(provider.id(), this::createRetry);
        return retry.executeSupplier(() -> exchangeWithKeys(provider, request));
    }

    /**
     * 上游路徑（相對於 provider endpoint）
     */
    protected abstract String path(NativeRequest request);

    /**
     * 解析完整的 unary 回應
     */
    protected abstract List<ProviderChunk> parseUnary(ProviderProfile provider, byte[] body) throws IOException;

    /**
     * 包裝串流回應；回傳的串流負責關閉 response
     */
    protected abstract ProviderStream openStream(ProviderProfile provider, ClientHttpResponse response)
        throws IOException;

    /**
     * {@code api-key} 認證使用的 header 名稱
     */
    protected String apiKeyHeader() {
        return "x-api-key";
    }

    protected MediaType streamAccept() {
        return MediaType.TEXT_EVENT_STREAM;
    }

    /**
     * 429 時讓目前的 key 冷卻並換下一個未冷卻的 key；沒有可換的 key 才把 429 交給重試與 failover
     */
    private ProviderStream exchangeWithKeys(ProviderProfile provider, NativeRequest request) {
        KeySelection key = keyRotation.select(provider);
        int keyCount = keyRotation.getKeyCount(provider);
        for (int attempt = 1; ; attempt++) {
            try {
                return exchange(provider, request, key);
            } catch (ProviderHttpException e) {
                if (key == null || !e.isRateLimited()) {
                    throw e;
                }
                keyRotation.markRateLimited(provider, key);
                metrics.keyCooldown(provider.id(), key.alias());
                if (attempt >= keyCount || !keyRotation.hasAvailableKey(provider)) {
                    throw e;
                }
                KeySelection next = keyRotation.select(provider);
                log.info("Rotating provider {} from key {} to {}", provider.id(), key.alias(), next.alias());
                key = next;
            }
        }
    }

    private ProviderStream exchange(ProviderProfile provider, NativeRequest request, KeySelection key) {
        RestClient client = request.stream()
            ? streamingClients.computeIfAbsent(provider.id(), id -> createStreamingClient(provider))
            : unaryClients.computeIfAbsent(provider.id(), id -> createUnaryClient(provider));
        try {
            return client.post()
                .uri(path(request))
                .contentType(MediaType.APPLICATION_JSON)
                .accept(request.stream() ? streamAccept() : MediaType.APPLICATION_JSON)
                .headers(headers -> applyAuth(headers, provider.auth(), key))
                .body(request.body())
                .exchange((clientRequest, response) -> {
                    if (!response.getStatusCode().is2xxSuccessful()) {
                        int status = response.getStatusCode().value();
                        String errorBody = readErrorBody(response);
                        response.close();
                        log.error("Upstream error: provider={}, status={}, body={}", provider.id(), status, errorBody);
                        throw new ProviderHttpException(provider.id(), status,
                            "Provider '" + provider.id() + "' returned HTTP " + status);
                    }
                    if (request.stream()) {
                        return openStream(provider, response);
                    }
                    try (response; InputStream body = response.getBody()) {
                        return ProviderStream.of(parseUnary(provider, body.readAllBytes()));
                    }
                }, false);
        } catch (ResourceAccessException e) {
            if (isTimeout(e)) {
                log.warn("Provider {} timed out after {}", provider.id(), provider.timeout());
                throw new ProviderTimeoutException(provider.id(), provider.timeout(), e);
            }
            log.warn("Provider {} unreachable: {}", provider.id(), e.getMessage());
            throw new ProviderHttpException(provider.id(), ProviderHttpException.NETWORK_FAILURE,
                "Provider '" + provider.id() + "' is unreachable", e);
        }
    }

    private void applyAuth(HttpHeaders headers, ProviderAuthConfig auth, KeySelection key) {
        if (key == null) {
            return;
        }
        switch (auth.type()) {
            case BEARER:
                headers.setBearerAuth(key.value());
                break;
            case API_KEY:
                headers.set(apiKeyHeader(), key.value());
                break;
            case NONE:
            default:
                break;
        }
    }

    private RestClient createUnaryClient(ProviderProfile provider) {
        HttpClient httpClient = HttpClient.newBuilder()
            .connectTimeout(provider.timeout())
            .build();
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        // JDK factory 的 read timeout 會在期限到時關閉回應本體，只適合一次讀完的回應
        requestFactory.setReadTimeout(provider.timeout());
        log.info("Created unary RestClient for provider {} ({}), endpoint={}, timeout={}",
            provider.id(), provider.protocol(), provider.endpoint(), provider.timeout());
        return buildClient(provider, requestFactory);
    }

    private RestClient createStreamingClient(ProviderProfile provider) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(provider.timeout());
        // socket read timeout：每次讀取各自計時
        requestFactory.setReadTimeout(provider.timeout());
        log.info("Created streaming RestClient for provider {} ({}), endpoint={}, idleTimeout={}",
            provider.id(), provider.protocol(), provider.endpoint(), provider.timeout());
        return buildClient(provider, requestFactory);
    }

    private RestClient buildClient(ProviderProfile provider, ClientHttpRequestFactory requestFactory) {
        // clone() 保留自動配置的 observation registry，Tracing 才會傳播
        return restClientBuilder.clone()
            .baseUrl(provider.endpoint())
            .requestFactory(requestFactory)
            .build();
    }

    /**
     * 串流讀取失敗：閒置逾時轉為 {@link ProviderTimeoutException}，其他視為連線中斷
     */
    static RelayException streamReadFailure(ProviderProfile provider, IOException e) {
        if (isTimeout(e)) {
            log.warn("Stream from provider {} idle for more than {}", provider.id(), provider.timeout());
            return new ProviderTimeoutException(provider.id(), provider.timeout(), e);
        }
        return new ProviderHttpException(provider.id(), ProviderHttpException.NETWORK_FAILURE,
            "Stream from provider '" + provider.id() + "' aborted", e);
    }

    private Retry createRetry(String providerId) {
        Retry retry = retryRegistry.retry(providerId);
        retry.getEventPublisher().onRetry(event -> {
            log.warn("Retrying provider {} (attempt {}): {}", providerId, event.getNumberOfRetryAttempts(),
                event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown");
            metrics.retry(providerId);
        });
        return retry;
    }

    private static String readErrorBody(ClientHttpResponse response) {
        try (InputStream body = response.getBody()) {
            byte[] bytes = body.readNBytes(MAX_LOGGED_ERROR_BODY);
            return new String(bytes, StandardCharsets.UTF_8);
        } catch (IOException e) {
            return "<unreadable: " + e.getMessage() + ">";
        }
    }

    private static boolean isTimeout(Throwable e) {
        Throwable current = e;
        while (current != null) {
            if (current instanceof HttpTimeoutException || current instanceof SocketTimeoutException) {
                return true;
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return false;
    }

    protected static Integer intOrNull(JsonNode node) {
        return node != null && node.isNumber() ? node.asInt() : null;
    }
}
