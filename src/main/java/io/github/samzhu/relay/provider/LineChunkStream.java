package io.github.samzhu.relay.provider;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.NoSuchElementException;
import java.util.function.BiConsumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.client.ClientHttpResponse;

import com.fasterxml.jackson.databind.JsonNode;

import io.github.samzhu.relay.routing.ProviderProfile;

/**
 * 以 SSE {@code data:} 行為單位的拉取式串流
 *
 * <p>每次只讀取足以產生下一個片段的行數；一行 JSON 可能產生多個片段，暫存在小佇列中。
 * 結束訊號（{@link ProviderChunk.Finish}）延後到串流結尾才送出，
 * 讓結束前最後一個 usage chunk 也能被處理。
 *
 * <p>串流沒有總時長限制；單次讀取超過 provider timeout 沒有資料才視為逾時。
 * 讀取進行中由其他執行緒呼叫 {@link #close()} 時不會等待讀取返回，改由讀取端的下一次 close 釋放連線。
 */
class LineChunkStream implements ProviderStream {

    private static final Logger log = LoggerFactory.getLogger(LineChunkStream.class);

    private final ProviderProfile provider;
    private final ClientHttpResponse response;
    private final BufferedReader reader;
    private final SseParser sseParser;
    private final BiConsumer<JsonNode, LineChunkStream> handler;
    private final Deque<ProviderChunk> queue = new ArrayDeque<>();

    private String pendingFinish;
    private boolean finished;
    private volatile boolean reading;
    private volatile boolean closed;

    LineChunkStream(ProviderProfile provider, ClientHttpResponse response, SseParser sseParser,
                    BiConsumer<JsonNode, LineChunkStream> handler) throws IOException {
        this.provider = provider;
        this.response = response;
        this.reader = new BufferedReader(new InputStreamReader(response.getBody(), StandardCharsets.UTF_8));
        this.sseParser = sseParser;
        this.handler = handler;
    }

    void emit(ProviderChunk chunk) {
        queue.add(chunk);
    }

    void finishWith(String rawReason) {
        pendingFinish = rawReason;
    }

    @Override
    public boolean hasNext() {
        while (queue.isEmpty() && !finished) {
            readNextLine();
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

    private void readNextLine() {
        String line;
        reading = true;
        try {
            line = reader.readLine();
        } catch (IOException e) {
            finished = true;
            throw AbstractProviderClient.streamReadFailure(provider, e);
        } finally {
            reading = false;
        }
        if (line == null) {
            end();
            return;
        }
        String data = sseParser.extractData(line);
        if (data == null) {
            return;
        }
        if (sseParser.isDone(data)) {
            end();
            return;
        }
        JsonNode json = sseParser.parse(data);
        if (json != null) {
            handler.accept(json, this);
        }
    }

    private void end() {
        finished = true;
        if (pendingFinish != null) {
            queue.add(ProviderChunk.Finish.raw(pendingFinish));
        }
        close();
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
            reader.close();
        } catch (IOException e) {
            log.debug("Error closing stream from provider {}: {}", provider.id(), e.getMessage());
        } finally {
            response.close();
        }
    }
}
