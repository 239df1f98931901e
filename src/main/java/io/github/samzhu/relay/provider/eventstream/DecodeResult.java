package io.github.samzhu.relay.provider.eventstream;

import java.util.List;

/**
 * @param events   完整 frame 解出的事件
 * @param consumed 已消耗的位元組數；其後是不完整的 frame（或無資料）
 */
public record DecodeResult(List<DecodedEvent> events, int consumed) {
}
