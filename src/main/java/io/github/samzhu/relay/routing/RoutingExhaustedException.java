package io.github.samzhu.relay.routing;

import org.springframework.http.HttpStatus;

import io.github.samzhu.relay.exception.RelayException;
import io.github.samzhu.relay.model.GatewayError;

/**
 * 該類別沒有任何健康且未排除的路由目標；立即回報，不重試
 */
public class RoutingExhaustedException extends RelayException {

    private final RoutingCategory category;

    public RoutingExhaustedException(RoutingCategory category, String message) {
        super(message);
        this.category = category;
    }

    public RoutingCategory category() {
        return category;
    }

    @Override
    public HttpStatus httpStatus() {
        return HttpStatus.SERVICE_UNAVAILABLE;
    }

    @Override
    public GatewayError toGatewayError() {
        return GatewayError.overloadedError(
            "No healthy provider available for category '" + category.value() + "'");
    }
}
