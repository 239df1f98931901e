package io.github.samzhu.relay.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Canonical 結束原因
 *
 * <p>所有後端的 finish/stop 詞彙都會被正規化為這四個值之一。
 *
 * @see io.github.samzhu.relay.normalize.StopReasonMapper
 */
public enum StopReason {

    END_TURN("end_turn"),
    MAX_TOKENS("max_tokens"),
    TOOL_USE("tool_use"),
    STOP_SEQUENCE("stop_sequence");

    private final String wireValue;

    StopReason(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }
}
