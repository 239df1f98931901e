package io.github.samzhu.relay.provider.eventstream;

/**
 * 單一二進位 frame
 *
 * <pre>
 * [4B total length][4B header length][header bytes][payload bytes][4B CRC32]
 * </pre>
 *
 * 所有整數皆為 big-endian。解碼後立即轉為 {@link DecodedEvent}，不會保留。
 *
 * @param totalLength  frame 總長度（含長度欄位與 CRC）
 * @param headerLength header 區段長度
 * @param payload      payload 區段（尚未去除前綴）
 * @param crc32        frame 尾端的 CRC32
 */
public record EventStreamFrame(int totalLength, int headerLength, byte[] payload, long crc32) {

    /**
     * 長度欄位與 CRC 的固定開銷
     */
    public static final int OVERHEAD = 12;
}
