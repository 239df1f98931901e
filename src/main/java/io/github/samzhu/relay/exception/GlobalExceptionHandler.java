package io.github.samzhu.relay.exception;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.function.ServerRequest;
import org.springframework.web.servlet.function.ServerResponse;

import io.github.samzhu.relay.model.GatewayError;

/**
 * 全域異常處理器
 *
 * <p>統一把閘道異常轉成 Anthropic API 相容的錯誤格式，客戶端不會看到 provider 的原始錯誤內容。
 *
 * <p>處理的異常類型：
 * <ul>
 *   <li>{@link RelayException} - 依各自的狀態碼與錯誤類型（400/429/502/503/504）</li>
 *   <li>{@code Exception} - 500 Internal Server Error（未預期錯誤）</li>
 * </ul>
 *
 * <p>由 {@link io.github.samzhu.relay.config.GatewayConfig} 的路由 {@code onError} 呼叫。
 * 認證與授權錯誤在 Security filter 階段處理，見 {@link io.github.samzhu.relay.config.SecurityConfig}。
 *
 * @see GatewayError
 */
@Component
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    public ServerResponse handle(Throwable e, ServerRequest request) {
        if (e instanceof RelayException relay) {
            return handleRelayException(relay, request);
        }
        return handleGenericException(e, request);
    }

    /**
     * 處理閘道已知異常
     */
    private ServerResponse handleRelayException(RelayException e, ServerRequest request) {
        HttpStatus status = e.httpStatus();
        if (status.is5xxServerError()) {
            log.error("Request {} {} failed: status={}, error={}", request.method(), request.path(),
                status.value(), e.getMessage());
        } else {
            log.warn("Request {} {} rejected: status={}, error={}", request.method(), request.path(),
                status.value(), e.getMessage());
        }
        return ServerResponse.status(status)
            .contentType(MediaType.APPLICATION_JSON)
            .body(e.toGatewayError());
    }

    /**
     * 處理其他未預期異常
     */
    private ServerResponse handleGenericException(Throwable e, ServerRequest request) {
        log.error("Unexpected error on {} {}: {}", request.method(), request.path(), e.getMessage(), e);
        return ServerResponse.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .contentType(MediaType.APPLICATION_JSON)
            .body(GatewayError.apiError("Internal server error"));
    }
}
