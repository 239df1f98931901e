package io.github.samzhu.relay.transform;

import org.springframework.http.HttpStatus;

import io.github.samzhu.relay.exception.RelayException;
import io.github.samzhu.relay.model.GatewayError;

/**
 * 請求形狀錯誤或不支援；立即回報，不重試
 */
public class TransformValidationException extends RelayException {

    public TransformValidationException(String message) {
        super(message);
    }

    @Override
    public HttpStatus httpStatus() {
        return HttpStatus.BAD_REQUEST;
    }

    @Override
    public GatewayError toGatewayError() {
        return GatewayError.invalidRequestError(getMessage());
    }
}
