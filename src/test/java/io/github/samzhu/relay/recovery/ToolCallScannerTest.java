package io.github.samzhu.relay.recovery;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ToolCallScannerTest {

    @Test
    void shouldMatchCompleteCall() {
        String text = "ok TOOL  CALL : Read( {\"path\": \"a)b{\"} )";

        ToolCallScanner.Result result = ToolCallScanner.scan(text, 0, false);

        assertThat(result).isInstanceOf(ToolCallScanner.Match.class);
        ToolCallScanner.Match match = (ToolCallScanner.Match) result;
        assertThat(match.start()).isEqualTo(3);
        assertThat(match.end()).isEqualTo(text.length());
        assertThat(match.name()).isEqualTo("Read");
        assertThat(match.json()).isEqualTo("{\"path\": \"a)b{\"}");
    }

    @Test
    void shouldHoldPossibleMarkerPrefix() {
        ToolCallScanner.Result result = ToolCallScanner.scan("Looking at it. Tool ca", 0, false);

        assertThat(result).isEqualTo(new ToolCallScanner.None(15));
    }

    @Test
    void shouldReleaseEverythingAtEndOfInput() {
        ToolCallScanner.Result result = ToolCallScanner.scan("Looking at it. Tool ca", 0, true);

        assertThat(result).isEqualTo(new ToolCallScanner.None(22));
    }

    @Test
    void shouldReportPendingForUnclosedObject() {
        ToolCallScanner.Result result = ToolCallScanner.scan("Tool call: Bash({\"cmd\": \"ls", 0, false);

        assertThat(result).isEqualTo(new ToolCallScanner.Pending(0));
    }

    @Test
    void shouldTreatMarkerWithoutObjectAsMalformed() {
        String text = "Tool call: Bash(ls -la)";

        ToolCallScanner.Result result = ToolCallScanner.scan(text, 0, false);

        assertThat(result).isEqualTo(new ToolCallScanner.Malformed(0, "Tool call: Bash(".length()));
    }

    @Test
    void shouldIgnoreBracesInsideEscapedStrings() {
        String json = "{\"a\": \"\\\"}\", \"b\": {\"c\": 1}}";

        assertThat(ToolCallScanner.matchBraces(json, 0)).isEqualTo(json.length());
        assertThat(ToolCallScanner.matchBraces("{\"a\": {", 0)).isEqualTo(-1);
    }
}
