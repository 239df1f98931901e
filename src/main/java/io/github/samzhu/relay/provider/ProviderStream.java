package io.github.samzhu.relay.provider;

import java.util.Iterator;
import java.util.List;

/**
 * Provider 輸出的拉取式序列
 *
 * <p>只有在呼叫端要求下一個片段時才會從上游讀取資料；{@link #close()} 釋放上游連線，
 * 可重複呼叫。讀取失敗以 {@link io.github.samzhu.relay.exception.RelayException} 子類別拋出。
 */
public interface ProviderStream extends Iterator<ProviderChunk>, AutoCloseable {

    @Override
    void close();

    /**
     * 已完整讀取的 unary 回應
     */
    static ProviderStream of(List<ProviderChunk> chunks) {
        Iterator<ProviderChunk> iterator = List.copyOf(chunks).iterator();
        return new ProviderStream() {
            @Override
            public boolean hasNext() {
                return iterator.hasNext();
            }

            @Override
            public ProviderChunk next() {
                return iterator.next();
            }

            @Override
            public void close() {
            }
        };
    }
}
