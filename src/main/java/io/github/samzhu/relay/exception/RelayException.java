package io.github.samzhu.relay.exception;

import org.springframework.http.HttpStatus;

import io.github.samzhu.relay.model.GatewayError;

/**
 * 閘道分類錯誤的基底類別
 *
 * <p>每個子類別決定回給客戶端的 HTTP 狀態與 {@link GatewayError} 型別，
 * 以及是否觸發 Router 的 failover。
 *
 * @see GlobalExceptionHandler
 */
public abstract class RelayException extends RuntimeException {

    protected RelayException(String message) {
        super(message);
    }

    protected RelayException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * 回給客戶端的 HTTP 狀態碼
     */
    public abstract HttpStatus httpStatus();

    /**
     * 轉為 Anthropic 相容的錯誤信封；訊息不得包含 provider 原始回應內容
     */
    public abstract GatewayError toGatewayError();

    /**
     * 是否應該換下一個 provider 重試
     */
    public boolean isFailoverEligible() {
        return false;
    }
}
