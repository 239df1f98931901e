package io.github.samzhu.relay.stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;

import org.junit.jupiter.api.Test;

import io.github.samzhu.relay.model.StopReason;
import io.github.samzhu.relay.model.StreamEvent;
import io.github.samzhu.relay.normalize.NormalizedDelta;

class StreamReemitterTest {

    @Test
    void shouldEmitTextThenToolUseWithSingleMessageStop() throws Exception {
        RecordingSink sink = new RecordingSink();
        StreamReemitter reemitter = new StreamReemitter(sink, new CancellationToken());

        reemitter.start("msg_1", "claude-sonnet-4", 20);
        reemitter.accept(new NormalizedDelta.Text("Let me "));
        reemitter.accept(new NormalizedDelta.Text("check."));
        reemitter.accept(new NormalizedDelta.ToolStart("toolu_1", "read"));
        reemitter.accept(new NormalizedDelta.ToolInput("{\"path\":"));
        reemitter.accept(new NormalizedDelta.ToolInput("\"a\"}"));
        reemitter.finish(StopReason.TOOL_USE, 9);

        assertThat(sink.names()).containsExactly(
            "message_start", "ping",
            "content_block_start", "content_block_delta", "content_block_delta", "content_block_stop",
            "content_block_start", "content_block_delta", "content_block_delta", "content_block_stop",
            "message_delta", "message_stop");
        assertThat(sink.events().get(2).index()).isZero();
        assertThat(sink.events().get(6).index()).isEqualTo(1);
        assertThat(sink.events().get(6).payload().path("content_block").path("id").asText()).isEqualTo("toolu_1");
        assertThat(sink.events().get(10).stopReason()).isEqualTo("tool_use");
        assertThat(sink.events().get(10).payload().path("usage").path("output_tokens").asInt()).isEqualTo(9);
        assertThat(sink.completed()).isTrue();
        assertThat(reemitter.state()).isEqualTo(StreamReemitter.State.MESSAGE_STOPPED);
    }

    @Test
    void shouldOpenNewBlockForEachToolCall() throws Exception {
        RecordingSink sink = new RecordingSink();
        StreamReemitter reemitter = new StreamReemitter(sink, new CancellationToken());

        reemitter.start("msg_1", "m", 1);
        reemitter.accept(new NormalizedDelta.ToolStart("a", "one"));
        reemitter.accept(new NormalizedDelta.ToolStart("b", "two"));
        reemitter.finish(StopReason.TOOL_USE, 1);

        assertThat(sink.events())
            .filteredOn(e -> e.type() == StreamEvent.Type.CONTENT_BLOCK_START)
            .extracting(StreamEvent::index)
            .containsExactly(0, 1);
        assertThat(sink.names()).filteredOn("message_stop"::equals).hasSize(1);
    }

    @Test
    void shouldIgnoreSecondFinish() throws Exception {
        RecordingSink sink = new RecordingSink();
        StreamReemitter reemitter = new StreamReemitter(sink, new CancellationToken());

        reemitter.start("msg_1", "m", 1);
        reemitter.finish(StopReason.END_TURN, 0);
        reemitter.finish(StopReason.END_TURN, 0);
        reemitter.cancel(0);

        assertThat(sink.names()).containsExactly("message_start", "ping", "message_delta", "message_stop");
    }

    @Test
    void shouldTerminateWithEndTurnWhenCancelled() throws Exception {
        RecordingSink sink = new RecordingSink();
        CancellationToken token = new CancellationToken();
        StreamReemitter reemitter = new StreamReemitter(sink, token);

        reemitter.start("msg_1", "m", 1);
        reemitter.accept(new NormalizedDelta.Text("partial"));
        token.cancel(CancellationToken.CAUSE_TIMEOUT);

        assertThatThrownBy(() -> reemitter.accept(new NormalizedDelta.Text(" more")))
            .isInstanceOf(StreamCancelledException.class);
        reemitter.cancel(3);

        assertThat(sink.names()).endsWith("content_block_stop", "message_delta", "message_stop");
        assertThat(sink.events().get(sink.events().size() - 2).stopReason()).isEqualTo("end_turn");
        assertThat(sink.names()).filteredOn("message_stop"::equals).hasSize(1);
    }

    @Test
    void shouldSwallowWriteFailuresOnCancel() throws Exception {
        RecordingSink sink = new RecordingSink(4);
        StreamReemitter reemitter = new StreamReemitter(sink, new CancellationToken());

        reemitter.start("msg_1", "m", 1);
        reemitter.accept(new NormalizedDelta.Text("x"));
        assertThatThrownBy(() -> reemitter.accept(new NormalizedDelta.Text("y")))
            .isInstanceOf(IOException.class);

        reemitter.cancel(0);

        assertThat(reemitter.state()).isEqualTo(StreamReemitter.State.MESSAGE_STOPPED);
        assertThat(sink.events()).hasSize(4);
    }

    @Test
    void shouldRejectToolInputWithoutToolBlock() throws Exception {
        StreamReemitter reemitter = new StreamReemitter(new RecordingSink(), new CancellationToken());
        reemitter.start("msg_1", "m", 1);

        assertThatThrownBy(() -> reemitter.accept(new NormalizedDelta.ToolInput("{}")))
            .isInstanceOf(IllegalStateException.class);
    }
}
