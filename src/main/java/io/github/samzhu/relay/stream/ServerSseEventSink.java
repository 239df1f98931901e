package io.github.samzhu.relay.stream;

import java.io.IOException;

import org.springframework.web.servlet.function.ServerResponse;

import io.github.samzhu.relay.model.StreamEvent;

/**
 * 以 Spring MVC {@link ServerResponse.SseBuilder} 寫出的 SSE
 *
 * <pre>{@code
 * event: content_block_delta
 * data: {"type":"content_block_delta","index":0,"delta":{"type":"text_delta","text":"Hi"}}
 * }</pre>
 */
public class ServerSseEventSink implements SseEventSink {

    private final ServerResponse.SseBuilder sseBuilder;

    public ServerSseEventSink(ServerResponse.SseBuilder sseBuilder) {
        this.sseBuilder = sseBuilder;
    }

    @Override
    public void send(StreamEvent event) throws IOException {
        sseBuilder.event(event.eventName());
        sseBuilder.data(event.payload().toString());
    }

    @Override
    public void complete() {
        sseBuilder.complete();
    }
}
