package io.github.samzhu.relay.recovery;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;

import io.github.samzhu.relay.model.StopReason;
import io.github.samzhu.relay.provider.ProviderChunk;
import io.github.samzhu.relay.provider.ProviderStream;
import io.github.samzhu.relay.service.RelayMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

class ToolCallRecoveryTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private SimpleMeterRegistry meterRegistry;
    private ToolCallRecovery recovery;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        recovery = new ToolCallRecovery(objectMapper, new RelayMetrics(meterRegistry), 64 * 1024);
    }

    @Test
    void shouldExtractToolCallFromSingleDelta() throws Exception {
        List<ProviderChunk> out = run(
            new ProviderChunk.TextDelta("Sure. Tool call: Read({\"path\":\"a.txt\"})"));

        assertThat(out).containsExactly(
            new ProviderChunk.TextDelta("Sure. "),
            new ProviderChunk.ToolUseComplete(null, "Read", objectMapper.readTree("{\"path\":\"a.txt\"}")),
            ProviderChunk.Finish.inferred(StopReason.TOOL_USE));
        assertThat(counter(ToolCallRecovery.OUTCOME_EXTRACTED)).isEqualTo(1.0);
        assertThat(counter(ToolCallRecovery.OUTCOME_FINISH_INFERRED)).isEqualTo(1.0);
    }

    @Test
    void shouldExtractToolCallSplitAcrossDeltas() {
        List<ProviderChunk> out = run(
            new ProviderChunk.TextDelta("Let me check. Tool ca"),
            new ProviderChunk.TextDelta("ll: Read({\"pa"),
            new ProviderChunk.TextDelta("th\": \"a.txt\"})"),
            new ProviderChunk.TextDelta("  \n"),
            new ProviderChunk.TextDelta(" done"));

        assertThat(text(out)).isEqualTo("Let me check. done");
        List<ProviderChunk.ToolUseComplete> tools = out.stream()
            .filter(ProviderChunk.ToolUseComplete.class::isInstance)
            .map(ProviderChunk.ToolUseComplete.class::cast)
            .toList();
        assertThat(tools).hasSize(1);
        assertThat(tools.get(0).name()).isEqualTo("Read");
        assertThat(tools.get(0).input().path("path").asText()).isEqualTo("a.txt");
    }

    @Test
    void shouldLeaveInvalidJsonUnchanged() {
        String original = "Tool call: Read({\"path\": })";

        List<ProviderChunk> out = run(new ProviderChunk.TextDelta(original));

        assertThat(text(out)).isEqualTo(original);
        assertThat(out).noneMatch(ProviderChunk.ToolUseComplete.class::isInstance);
        assertThat(out.get(out.size() - 1)).isEqualTo(ProviderChunk.Finish.inferred(StopReason.END_TURN));
        assertThat(counter(ToolCallRecovery.OUTCOME_FAILED)).isEqualTo(1.0);
    }

    @Test
    void shouldBeIdempotentOnRecoveredOutput() {
        List<ProviderChunk> first = run(
            new ProviderChunk.TextDelta("Tool call: Grep({\"q\":\"x\"})"),
            ProviderChunk.Finish.raw("stop"));

        List<ProviderChunk> second = run(first.toArray(new ProviderChunk[0]));

        assertThat(second).isEqualTo(first);
    }

    @Test
    void shouldKeepProviderFinishReason() {
        List<ProviderChunk> out = run(
            new ProviderChunk.TextDelta("hello"),
            new ProviderChunk.UsageUpdate(10, 2),
            ProviderChunk.Finish.raw("length"));

        assertThat(out).containsExactly(
            new ProviderChunk.TextDelta("hello"),
            new ProviderChunk.UsageUpdate(10, 2),
            ProviderChunk.Finish.raw("length"));
    }

    @Test
    void shouldReleaseTextWhenWindowExceeded() {
        recovery = new ToolCallRecovery(objectMapper, new RelayMetrics(meterRegistry), 32);
        String partial = "Tool call: Read({\"path\": \"" + "a".repeat(40);

        List<ProviderChunk> out = run(
            new ProviderChunk.TextDelta(partial),
            new ProviderChunk.TextDelta("b"));

        assertThat(text(out)).isEqualTo(partial + "b");
        assertThat(counter(ToolCallRecovery.OUTCOME_WINDOW_RELEASED)).isGreaterThanOrEqualTo(1.0);
    }

    private List<ProviderChunk> run(ProviderChunk... chunks) {
        List<ProviderChunk> out = new ArrayList<>();
        try (ProviderStream stream = recovery.wrap(ProviderStream.of(List.of(chunks)))) {
            stream.forEachRemaining(out::add);
        }
        return out;
    }

    private static String text(List<ProviderChunk> chunks) {
        StringBuilder sb = new StringBuilder();
        for (ProviderChunk chunk : chunks) {
            if (chunk instanceof ProviderChunk.TextDelta delta) {
                sb.append(delta.text());
            }
        }
        return sb.toString();
    }

    private double counter(String outcome) {
        return meterRegistry.counter("relay.recovery", "outcome", outcome).count();
    }
}
