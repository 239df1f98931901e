package io.github.samzhu.relay.provider;

import java.time.Duration;

import org.springframework.http.HttpStatus;

import io.github.samzhu.relay.exception.RelayException;
import io.github.samzhu.relay.model.GatewayError;

/**
 * Provider 呼叫超過設定的逾時時間
 */
public class ProviderTimeoutException extends RelayException {

    private final String providerId;
    private final Duration timeout;

    public ProviderTimeoutException(String providerId, Duration timeout, Throwable cause) {
        super("Provider '" + providerId + "' did not respond within " + timeout, cause);
        this.providerId = providerId;
        this.timeout = timeout;
    }

    public String providerId() {
        return providerId;
    }

    public Duration timeout() {
        return timeout;
    }

    @Override
    public boolean isFailoverEligible() {
        return true;
    }

    @Override
    public HttpStatus httpStatus() {
        return HttpStatus.GATEWAY_TIMEOUT;
    }

    @Override
    public GatewayError toGatewayError() {
        return GatewayError.apiError("Upstream provider '" + providerId + "' timed out");
    }
}
