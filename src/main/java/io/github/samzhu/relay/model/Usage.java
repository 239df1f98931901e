package io.github.samzhu.relay.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Token 用量
 */
public record Usage(
    @JsonProperty("input_tokens")
    int inputTokens,
    @JsonProperty("output_tokens")
    int outputTokens
) {}
