package io.github.samzhu.relay.stream;

import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.github.samzhu.relay.model.StopReason;
import io.github.samzhu.relay.model.StreamEvent;
import io.github.samzhu.relay.normalize.NormalizedDelta;

/**
 * Canonical SSE 事件序列的狀態機
 *
 * <pre>
 * IDLE → MESSAGE_STARTED → (TEXT_BLOCK_OPEN | TOOL_BLOCK_OPEN)* → MESSAGE_DELTA_SENT → MESSAGE_STOPPED
 * </pre>
 *
 * <p>事件順序：
 * <ul>
 *   <li>{@code message_start}、{@code ping}</li>
 *   <li>同類型的連續增量 → {@code content_block_delta}</li>
 *   <li>類型切換或新的工具呼叫 → 關閉目前區塊，以下一個 index 開新區塊</li>
 *   <li>結束 → {@code content_block_stop}（若有開啟中的區塊）、{@code message_delta}、{@code message_stop}</li>
 * </ul>
 *
 * <p>{@code message_stop} 無論結束原因為何（包含 {@code tool_use}）都會送出且只送一次；
 * 不同情況只差在 {@code message_delta.stop_reason} 的值。取消時以 {@code end_turn} 走同樣的結束序列。
 */
public class StreamReemitter {

    private static final Logger log = LoggerFactory.getLogger(StreamReemitter.class);

    public enum State {
        IDLE,
        MESSAGE_STARTED,
        TEXT_BLOCK_OPEN,
        TOOL_BLOCK_OPEN,
        MESSAGE_DELTA_SENT,
        MESSAGE_STOPPED
    }

    private final SseEventSink sink;
    private final CancellationToken token;

    private State state = State.IDLE;
    private int nextIndex;

    public StreamReemitter(SseEventSink sink, CancellationToken token) {
        this.sink = sink;
        this.token = token;
    }

    public State state() {
        return state;
    }

    public void start(String messageId, String model, int inputTokens) throws IOException {
        requireState(State.IDLE, "start");
        state = State.MESSAGE_STARTED;
        write(StreamEvent.messageStart(messageId, model, inputTokens), true);
        write(StreamEvent.ping(), true);
    }

    public void accept(NormalizedDelta delta) throws IOException {
        if (state == State.IDLE || isTerminal()) {
            throw new IllegalStateException("Cannot accept content in state " + state);
        }
        if (delta instanceof NormalizedDelta.Text text) {
            if (state != State.TEXT_BLOCK_OPEN) {
                closeOpenBlock(true);
                state = State.TEXT_BLOCK_OPEN;
                write(StreamEvent.textBlockStart(nextIndex), true);
            }
            write(StreamEvent.textDelta(nextIndex, text.text()), true);
        } else if (delta instanceof NormalizedDelta.ToolStart start) {
            closeOpenBlock(true);
            state = State.TOOL_BLOCK_OPEN;
            write(StreamEvent.toolUseBlockStart(nextIndex, start.id(), start.name()), true);
        } else if (delta instanceof NormalizedDelta.ToolInput input) {
            if (state != State.TOOL_BLOCK_OPEN) {
                throw new IllegalStateException("Tool input without an open tool block");
            }
            write(StreamEvent.inputJsonDelta(nextIndex, input.partialJson()), true);
        }
    }

    /**
     * 正常結束
     */
    public void finish(StopReason stopReason, int outputTokens) throws IOException {
        if (isTerminal()) {
            return;
        }
        if (state == State.IDLE) {
            throw new IllegalStateException("Cannot finish a stream that was never started");
        }
        closeOpenBlock(true);
        terminate(stopReason, outputTokens);
    }

    /**
     * 取消：以 {@code end_turn} 盡力送出結束序列，客戶端已斷線時寫入失敗會被忽略
     */
    public void cancel(int outputTokens) {
        if (state == State.IDLE || state == State.MESSAGE_STOPPED) {
            return;
        }
        try {
            if (state != State.MESSAGE_DELTA_SENT) {
                closeOpenBlock(false);
                terminate(StopReason.END_TURN, outputTokens);
            } else {
                state = State.MESSAGE_STOPPED;
                write(StreamEvent.messageStop(), false);
                sink.complete();
            }
        } catch (IOException | RuntimeException e) {
            log.debug("Could not deliver terminal events after cancellation: {}", e.getMessage());
        } finally {
            state = State.MESSAGE_STOPPED;
        }
    }

    // 狀態先於寫入更新，寫入失敗或取消後不會重送同一個結束事件
    private void terminate(StopReason stopReason, int outputTokens) throws IOException {
        state = State.MESSAGE_DELTA_SENT;
        write(StreamEvent.messageDelta(stopReason, outputTokens), false);
        state = State.MESSAGE_STOPPED;
        write(StreamEvent.messageStop(), false);
        sink.complete();
    }

    private boolean isTerminal() {
        return state == State.MESSAGE_DELTA_SENT || state == State.MESSAGE_STOPPED;
    }

    private void closeOpenBlock(boolean checkCancellation) throws IOException {
        if (state == State.TEXT_BLOCK_OPEN || state == State.TOOL_BLOCK_OPEN) {
            int index = nextIndex++;
            state = State.MESSAGE_STARTED;
            write(StreamEvent.blockStop(index), checkCancellation);
        }
    }

    private void write(StreamEvent event, boolean checkCancellation) throws IOException {
        sink.send(event);
        if (checkCancellation) {
            token.throwIfCancelled();
        }
    }

    private void requireState(State expected, String operation) {
        if (state != expected) {
            throw new IllegalStateException("Cannot " + operation + " in state " + state);
        }
    }
}
