package io.github.samzhu.relay.transform;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;

import com.fasterxml.jackson.databind.ObjectMapper;

import io.github.samzhu.relay.config.ProviderAuthConfig;
import io.github.samzhu.relay.model.CanonicalRequest;
import io.github.samzhu.relay.routing.Protocol;
import io.github.samzhu.relay.routing.ProviderProfile;

final class TransformFixtures {

    static final ObjectMapper MAPPER = new ObjectMapper();

    private TransformFixtures() {
    }

    static CanonicalRequest request(String json) {
        return new CanonicalRequestReader(MAPPER).read(json.getBytes(StandardCharsets.UTF_8));
    }

    static ProviderProfile provider(Protocol protocol) {
        return new ProviderProfile("p-" + protocol.name().toLowerCase(), protocol, "http://localhost",
            ProviderAuthConfig.NONE, 1, List.of(), Duration.ofSeconds(30), 4096, "arn:aws:profile/test", true);
    }

    /**
     * 含系統提示、工具往返與工具定義的對話
     */
    static final String TOOL_CONVERSATION = """
        {
          "model": "claude-sonnet-4",
          "max_tokens": 1024,
          "system": [{"type": "text", "text": "You are terse."}],
          "tool_choice": {"type": "tool", "name": "read_file"},
          "tools": [
            {"name": "read_file", "description": "Read a file",
             "input_schema": {"$schema": "http://json-schema.org/draft-07/schema#", "type": "object",
               "additionalProperties": false,
               "properties": {"path": {"type": "string", "additionalProperties": false}}}}
          ],
          "messages": [
            {"role": "user", "content": "Open a.txt"},
            {"role": "assistant", "content": [
              {"type": "text", "text": "Reading."},
              {"type": "tool_use", "id": "toolu_1", "name": "read_file", "input": {"path": "a.txt"}}
            ]},
            {"role": "user", "content": [
              {"type": "tool_result", "tool_use_id": "toolu_1", "content": "hello"},
              {"type": "text", "text": "Summarize it."}
            ]}
          ]
        }
        """;
}
