package io.github.samzhu.relay.recovery;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.NoSuchElementException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;

import io.github.samzhu.relay.model.StopReason;
import io.github.samzhu.relay.provider.ProviderChunk;
import io.github.samzhu.relay.provider.ProviderStream;

/**
 * 套用 tool call 還原的片段序列
 *
 * <p>文字增量先累積在緩衝區：沒有標記、也不可能是標記開頭的部分立即放行；
 * 可能屬於尚未完成之呼叫的部分保留到呼叫完成、遇到非文字片段、串流結束或超出視窗為止。
 * 其他片段依原順序通過。
 */
class RecoveringProviderStream implements ProviderStream {

    private static final Logger log = LoggerFactory.getLogger(RecoveringProviderStream.class);

    private final ProviderStream upstream;
    private final ToolCallRecovery recovery;
    private final int window;
    private final Deque<ProviderChunk> ready = new ArrayDeque<>();
    private final StringBuilder held = new StringBuilder();

    private boolean dropLeadingWhitespace;
    private boolean toolSeen;
    private boolean finishSeen;
    private boolean upstreamDone;

    RecoveringProviderStream(ProviderStream upstream, ToolCallRecovery recovery, int window) {
        this.upstream = upstream;
        this.recovery = recovery;
        this.window = window;
    }

    @Override
    public boolean hasNext() {
        while (ready.isEmpty() && !upstreamDone) {
            pull();
        }
        return !ready.isEmpty();
    }

    @Override
    public ProviderChunk next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        return ready.poll();
    }

    @Override
    public void close() {
        upstream.close();
    }

    private void pull() {
        if (!upstream.hasNext()) {
            upstreamDone = true;
            drain(true);
            if (!finishSeen) {
                StopReason inferred = toolSeen ? StopReason.TOOL_USE : StopReason.END_TURN;
                log.debug("Provider sent no finish reason, inferred {}", inferred.wireValue());
                recovery.count(ToolCallRecovery.OUTCOME_FINISH_INFERRED);
                ready.add(ProviderChunk.Finish.inferred(inferred));
            }
            return;
        }

        ProviderChunk chunk = upstream.next();
        if (chunk instanceof ProviderChunk.TextDelta text) {
            append(text.text());
            drain(false);
            return;
        }

        drain(true);
        if (chunk instanceof ProviderChunk.ToolUseStart || chunk instanceof ProviderChunk.ToolUseComplete) {
            toolSeen = true;
        } else if (chunk instanceof ProviderChunk.Finish) {
            finishSeen = true;
        }
        ready.add(chunk);
    }

    private void append(String text) {
        if (dropLeadingWhitespace) {
            int i = ToolCallScanner.skipWhitespace(text, 0);
            if (i == text.length()) {
                return;
            }
            text = text.substring(i);
            dropLeadingWhitespace = false;
        }
        held.append(text);
    }

    /**
     * 處理緩衝區；{@code endOfText} 表示之後不會再有接續的文字
     */
    private void drain(boolean endOfText) {
        int from = 0;
        while (from < held.length()) {
            ToolCallScanner.Result result = ToolCallScanner.scan(held, from, endOfText);

            if (result instanceof ToolCallScanner.None none) {
                release(from, none.safeEnd());
                from = none.safeEnd();
                break;
            }
            if (result instanceof ToolCallScanner.Pending pending) {
                release(from, pending.start());
                from = pending.start();
                if (held.length() - from > window) {
                    log.warn("Tool call text exceeded recovery window of {} chars, releasing unchanged", window);
                    recovery.count(ToolCallRecovery.OUTCOME_WINDOW_RELEASED);
                    release(from, held.length());
                    from = held.length();
                }
                break;
            }
            if (result instanceof ToolCallScanner.Malformed malformed) {
                release(from, malformed.resumeAt());
                from = malformed.resumeAt();
                continue;
            }

            ToolCallScanner.Match match = (ToolCallScanner.Match) result;
            release(from, match.start());
            try {
                JsonNode input = recovery.parseArguments(match.name(), match.json());
                ready.add(new ProviderChunk.ToolUseComplete(null, match.name(), input));
                toolSeen = true;
                recovery.count(ToolCallRecovery.OUTCOME_EXTRACTED);
                log.info("Recovered tool call {} from text output", match.name());
                from = ToolCallScanner.skipWhitespace(held, match.end());
                if (from == held.length()) {
                    dropLeadingWhitespace = !endOfText;
                }
            } catch (ToolCallRecoveryException e) {
                log.warn("Leaving tool call text unchanged: {}", e.getMessage());
                recovery.count(ToolCallRecovery.OUTCOME_FAILED);
                release(match.start(), match.end());
                from = match.end();
            }
        }
        held.delete(0, Math.min(from, held.length()));
        if (endOfText) {
            dropLeadingWhitespace = false;
        }
    }

    private void release(int start, int end) {
        if (end > start) {
            ready.add(new ProviderChunk.TextDelta(held.substring(start, end)));
        }
    }
}
