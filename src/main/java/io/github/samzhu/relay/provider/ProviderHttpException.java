package io.github.samzhu.relay.provider;

import org.springframework.http.HttpStatus;

import io.github.samzhu.relay.exception.RelayException;
import io.github.samzhu.relay.model.GatewayError;

/**
 * Provider 回應非 2xx，或連線層失敗（{@code statusCode == 0}）
 *
 * <p>408、429、5xx 與連線失敗視為暫時性錯誤，會先在同一 provider 重試，
 * 之後交由 Router failover。其他 4xx 同樣觸發 failover，但不重試。
 */
public class ProviderHttpException extends RelayException {

    public static final int NETWORK_FAILURE = 0;

    private final String providerId;
    private final int statusCode;

    public ProviderHttpException(String providerId, int statusCode, String message) {
        super(message);
        this.providerId = providerId;
        this.statusCode = statusCode;
    }

    public ProviderHttpException(String providerId, int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.providerId = providerId;
        this.statusCode = statusCode;
    }

    public String providerId() {
        return providerId;
    }

    public int statusCode() {
        return statusCode;
    }

    public boolean isTransient() {
        return statusCode == NETWORK_FAILURE
            || statusCode == 408
            || statusCode == 429
            || statusCode >= 500;
    }

    public boolean isRateLimited() {
        return statusCode == 429;
    }

    @Override
    public boolean isFailoverEligible() {
        return true;
    }

    @Override
    public HttpStatus httpStatus() {
        return isRateLimited() ? HttpStatus.TOO_MANY_REQUESTS : HttpStatus.BAD_GATEWAY;
    }

    @Override
    public GatewayError toGatewayError() {
        if (isRateLimited()) {
            return GatewayError.rateLimitError("Upstream provider '" + providerId + "' is rate limited");
        }
        if (statusCode == NETWORK_FAILURE) {
            return GatewayError.apiError("Upstream provider '" + providerId + "' is unreachable");
        }
        return GatewayError.apiError("Upstream provider '" + providerId + "' returned HTTP " + statusCode);
    }
}
