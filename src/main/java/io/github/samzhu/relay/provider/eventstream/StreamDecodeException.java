package io.github.samzhu.relay.provider.eventstream;

import org.springframework.http.HttpStatus;

import io.github.samzhu.relay.exception.RelayException;
import io.github.samzhu.relay.model.GatewayError;

/**
 * 串流中段出現損毀的 frame（CRC 不符或長度不合法），只終止該串流
 *
 * <p>尾端不完整的 frame 不會拋出此例外，而是視為正常結束。
 */
public class StreamDecodeException extends RelayException {

    private final long offset;

    public StreamDecodeException(String message, long offset) {
        super(message + " at offset " + offset);
        this.offset = offset;
    }

    public long offset() {
        return offset;
    }

    @Override
    public HttpStatus httpStatus() {
        return HttpStatus.BAD_GATEWAY;
    }

    @Override
    public GatewayError toGatewayError() {
        return GatewayError.apiError("Upstream event stream is corrupt");
    }
}
