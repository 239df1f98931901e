package io.github.samzhu.relay.provider.eventstream;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.zip.CRC32;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * CodeWhisperer 二進位 event stream 解碼器
 *
 * <p>解碼規則：
 * <ul>
 *   <li>逐 frame 解析，驗證 CRC32（涵蓋 CRC 之前的所有位元組）</li>
 *   <li>尾端不完整的 frame 視為正常結束，回傳之前所有完整 frame 的事件</li>
 *   <li>長度欄位不合法或 CRC 不符拋出 {@link StreamDecodeException}</li>
 *   <li>payload 前 4 個位元組若是 {@code vent}（或緊接著 JSON 物件），先移除再解析</li>
 * </ul>
 *
 * <p>payload 對應：
 * <ul>
 *   <li>{@code {"content": "..."}} → 文字增量</li>
 *   <li>{@code {"toolUseId", "name"}} → 工具呼叫開始</li>
 *   <li>{@code {"toolUseId", "name", "input"}} → 工具輸入片段（未見過開始事件時先補一個）</li>
 *   <li>{@code {"stop": true}} → 結束標記（帶 toolUseId 為 index 1，否則 index 0）</li>
 * </ul>
 *
 * <p>每個串流使用獨立實例，非執行緒安全。
 */
public class EventStreamDecoder {

    private static final Logger log = LoggerFactory.getLogger(EventStreamDecoder.class);

    public static final int MAX_FRAME_LENGTH = 16 * 1024 * 1024;

    private static final int PRELUDE_LENGTH = 8;
    private static final int PREFIX_LENGTH = 4;
    private static final byte[] VENT_PREFIX = "vent".getBytes(StandardCharsets.US_ASCII);

    private final ObjectMapper objectMapper;
    private final Set<String> startedTools = new HashSet<>();

    private byte[] pending = new byte[0];
    private long streamOffset;

    public EventStreamDecoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * 解碼一段完整緩衝區
     */
    public DecodeResult decode(byte[] buffer) {
        return decode(buffer, 0, buffer.length);
    }

    /**
     * 增量解碼：與前次剩下的不完整 frame 串接後解碼
     *
     * @param data   新讀到的資料
     * @param length 有效長度
     * @return 這次完整解出的事件
     */
    public List<DecodedEvent> feed(byte[] data, int length) {
        byte[] combined = Arrays.copyOf(pending, pending.length + length);
        System.arraycopy(data, 0, combined, pending.length, length);
        DecodeResult result = decode(combined, 0, combined.length);
        pending = Arrays.copyOfRange(combined, result.consumed(), combined.length);
        streamOffset += result.consumed();
        return result.events();
    }

    /**
     * 是否還有未完成的 frame 資料
     */
    public boolean hasPartialFrame() {
        return pending.length > 0;
    }

    private DecodeResult decode(byte[] buffer, int start, int end) {
        List<DecodedEvent> events = new ArrayList<>();
        int offset = start;
        while (true) {
            EventStreamFrame frame = readFrame(buffer, offset, end);
            if (frame == null) {
                if (offset < end) {
                    log.debug("Incomplete trailing frame: {} byte(s) at offset {}", end - offset,
                        streamOffset + offset);
                }
                break;
            }
            offset += frame.totalLength();
            toEvents(frame, events);
        }
        return new DecodeResult(events, offset - start);
    }

    /**
     * 讀取 offset 起的一個 frame；資料不足時回傳 null
     */
    EventStreamFrame readFrame(byte[] buffer, int offset, int end) {
        int available = end - offset;
        if (available < PRELUDE_LENGTH) {
            return null;
        }
        ByteBuffer view = ByteBuffer.wrap(buffer, offset, available);
        int totalLength = view.getInt();
        int headerLength = view.getInt();
        if (totalLength < EventStreamFrame.OVERHEAD || totalLength > MAX_FRAME_LENGTH) {
            throw new StreamDecodeException("Invalid frame length " + totalLength, streamOffset + offset);
        }
        if (headerLength < 0 || headerLength > totalLength - EventStreamFrame.OVERHEAD) {
            throw new StreamDecodeException(
                "Invalid header length " + headerLength + " for frame length " + totalLength, streamOffset + offset);
        }
        if (available < totalLength) {
            return null;
        }

        int crcOffset = offset + totalLength - 4;
        long expected = ByteBuffer.wrap(buffer, crcOffset, 4).getInt() & 0xFFFFFFFFL;
        CRC32 crc = new CRC32();
        crc.update(buffer, offset, totalLength - 4);
        if (crc.getValue() != expected) {
            throw new StreamDecodeException(
                String.format("CRC mismatch (expected %08x, actual %08x)", expected, crc.getValue()),
                streamOffset + offset);
        }

        int payloadStart = offset + PRELUDE_LENGTH + headerLength;
        byte[] payload = Arrays.copyOfRange(buffer, payloadStart, crcOffset);
        return new EventStreamFrame(totalLength, headerLength, payload, expected);
    }

    private void toEvents(EventStreamFrame frame, List<DecodedEvent> events) {
        byte[] payload = stripPrefix(frame.payload());
        if (payload.length == 0) {
            return;
        }
        JsonNode json;
        try {
            json = objectMapper.readTree(payload);
        } catch (IOException e) {
            log.warn("Skipping frame with non-JSON payload ({} bytes)", payload.length);
            return;
        }
        if (json == null || !json.isObject()) {
            return;
        }

        String toolUseId = json.path("toolUseId").asText(null);
        String name = json.path("name").asText(null);
        if (toolUseId != null && name != null) {
            JsonNode input = json.get("input");
            if (input == null || input.isNull()) {
                if (startedTools.add(toolUseId)) {
                    events.add(new DecodedEvent.ToolUseStart(toolUseId, name));
                }
            } else {
                if (startedTools.add(toolUseId)) {
                    events.add(new DecodedEvent.ToolUseStart(toolUseId, name));
                }
                String fragment = input.isTextual() ? input.asText() : input.toString();
                if (!fragment.isEmpty()) {
                    events.add(new DecodedEvent.ToolInputDelta(toolUseId, name, fragment));
                }
            }
        } else if (json.hasNonNull("content")) {
            events.add(new DecodedEvent.TextDelta(json.get("content").asText()));
        }

        if (json.path("stop").asBoolean(false)) {
            events.add(new DecodedEvent.StopMarker(toolUseId != null ? 1 : 0));
        }
    }

    static byte[] stripPrefix(byte[] payload) {
        if (payload.length >= PREFIX_LENGTH
                && Arrays.equals(payload, 0, PREFIX_LENGTH, VENT_PREFIX, 0, PREFIX_LENGTH)) {
            return Arrays.copyOfRange(payload, PREFIX_LENGTH, payload.length);
        }
        if (payload.length > PREFIX_LENGTH && payload[0] != '{' && payload[PREFIX_LENGTH] == '{') {
            return Arrays.copyOfRange(payload, PREFIX_LENGTH, payload.length);
        }
        return payload;
    }
}
