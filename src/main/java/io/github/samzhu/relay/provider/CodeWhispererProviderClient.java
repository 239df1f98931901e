package io.github.samzhu.relay.provider;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.NoSuchElementException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import com.fasterxml.jackson.databind.ObjectMapper;

import io.github.resilience4j.retry.RetryRegistry;
import io.github.samzhu.relay.provider.eventstream.DecodedEvent;
import io.github.samzhu.relay.provider.eventstream.EventStreamDecoder;
import io.github.samzhu.relay.provider.eventstream.StreamDecodeException;
import io.github.samzhu.relay.routing.Protocol;
import io.github.samzhu.relay.routing.ProviderProfile;
import io.github.samzhu.relay.service.RelayMetrics;
import io.github.samzhu.relay.transform.NativeRequest;

/**
 * CodeWhisperer {@code generateAssistantResponse} 呼叫
 *
 * <p>回應一律是二進位 event stream：unary 一次解碼整個本體，串流則邊讀邊解碼。
 * 協定沒有結束原因欄位，結束原因由 tool call 還原步驟推斷。
 */
@Component
public class CodeWhispererProviderClient extends AbstractProviderClient {

    private static final Logger log = LoggerFactory.getLogger(CodeWhispererProviderClient.class);

    private static final int READ_BUFFER_SIZE = 8192;

    public CodeWhispererProviderClient(RestClient.Builder restClientBuilder, RetryRegistry retryRegistry,
                                       KeyRotationService keyRotation, RelayMetrics metrics, ObjectMapper objectMapper) {
        super(restClientBuilder, retryRegistry, keyRotation, metrics, objectMapper);
    }

    @Override
    public Protocol protocol() {
        return Protocol.CODEWHISPERER;
    }

    @Override
    protected String path(NativeRequest request) {
        return "/generateAssistantResponse";
    }

    @Override
    protected MediaType streamAccept() {
        return MediaType.ALL;
    }

    @Override
    protected List<ProviderChunk> parseUnary(ProviderProfile provider, byte[] body) {
        EventStreamDecoder decoder = new EventStreamDecoder(objectMapper);
        List<ProviderChunk> chunks = new ArrayList<>();
        for (DecodedEvent event : decoder.decode(body).events()) {
            toChunk(event, chunks);
        }
        return chunks;
    }

    @Override
    protected ProviderStream openStream(ProviderProfile provider, ClientHttpResponse response) throws IOException {
        return new FrameChunkStream(provider, response, new EventStreamDecoder(objectMapper));
    }

    static void toChunk(DecodedEvent event, List<ProviderChunk> out) {
        if (event instanceof DecodedEvent.TextDelta text) {
            out.add(new ProviderChunk.TextDelta(text.text()));
        } else if (event instanceof DecodedEvent.ToolUseStart start) {
            out.add(new ProviderChunk.ToolUseStart(start.toolUseId(), start.toolUseId(), start.name()));
        } else if (event instanceof DecodedEvent.ToolInputDelta delta) {
            out.add(new ProviderChunk.ToolInputDelta(delta.toolUseId(), delta.fragment()));
        } else if (event instanceof DecodedEvent.StopMarker stop) {
            // 區塊在類型切換或結束時關閉，標記本身不需要轉送
            log.trace("Stop marker for index {}", stop.index());
        }
    }

    /**
     * 從 socket 增量解碼的拉取式串流；單次讀取超過 provider timeout 視為閒置逾時
     *
     * <p>讀取進行中由其他執行緒呼叫 close 時延後到讀取端處理，與 {@link LineChunkStream} 相同。
     */
    private static final class FrameChunkStream implements ProviderStream {

        private final ProviderProfile provider;
        private final ClientHttpResponse response;
        private final InputStream body;
        private final EventStreamDecoder decoder;
        private final Deque<ProviderChunk> queue = new ArrayDeque<>();
        private final byte[] buffer = new byte[READ_BUFFER_SIZE];

        private boolean finished;
        private volatile boolean reading;
        private volatile boolean closed;

        FrameChunkStream(ProviderProfile provider, ClientHttpResponse response, EventStreamDecoder decoder)
                throws IOException {
            this.provider = provider;
            this.response = response;
            this.body = response.getBody();
            this.decoder = decoder;
        }

        @Override
        public boolean hasNext() {
            while (queue.isEmpty() && !finished) {
                read();
            }
            return !queue.isEmpty();
        }

        @Override
        public ProviderChunk next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return queue.poll();
        }

        private void read() {
            int n;
            reading = true;
            try {
                n = body.read(buffer);
            } catch (IOException e) {
                finished = true;
                throw streamReadFailure(provider, e);
            } finally {
                reading = false;
            }
            if (n < 0) {
                if (decoder.hasPartialFrame()) {
                    log.debug("Provider {} stream ended with an incomplete frame", provider.id());
                }
                finished = true;
                close();
                return;
            }
            List<DecodedEvent> events;
            try {
                events = decoder.feed(buffer, n);
            } catch (StreamDecodeException e) {
                finished = true;
                log.error("Corrupt event stream from provider {}: {}", provider.id(), e.getMessage());
                throw e;
            }
            List<ProviderChunk> chunks = new ArrayList<>();
            for (DecodedEvent event : events) {
                toChunk(event, chunks);
            }
            queue.addAll(chunks);
        }

        @Override
        public void close() {
            if (closed) {
                return;
            }
            if (reading) {
                log.debug("Read from provider {} in progress, close deferred", provider.id());
                return;
            }
            closed = true;
            finished = true;
            try {
                body.close();
            } catch (IOException e) {
                log.debug("Error closing stream from provider {}: {}", provider.id(), e.getMessage());
            } finally {
                response.close();
            }
        }
    }
}
