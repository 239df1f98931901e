package io.github.samzhu.relay.provider;

import static io.github.samzhu.relay.provider.ProviderFixtures.drain;
import static io.github.samzhu.relay.provider.ProviderFixtures.profile;
import static io.github.samzhu.relay.provider.ProviderFixtures.retryRegistry;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.RestClient;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import io.github.samzhu.relay.config.ProviderAuthConfig;
import io.github.samzhu.relay.config.ProviderKeyConfig;
import io.github.samzhu.relay.routing.Protocol;
import io.github.samzhu.relay.routing.ProviderProfile;
import io.github.samzhu.relay.service.RelayMetrics;
import io.github.samzhu.relay.transform.NativeRequest;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;

class OpenAiProviderClientTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final KeyRotationService keyRotation = new KeyRotationService();

    private MockWebServer server;
    private OpenAiProviderClient client;
    private ProviderProfile provider;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        client = new OpenAiProviderClient(RestClient.builder(), retryRegistry(2), keyRotation,
            new RelayMetrics(registry), mapper);
        provider = profile("openai-test", Protocol.OPENAI, server.url("/v1").toString(),
            ProviderAuthConfig.single(ProviderAuthConfig.Type.BEARER, "sk-test"));
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void shouldParseUnaryCompletionWithToolCalls() throws Exception {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("""
                {
                  "choices": [{
                    "message": {
                      "content": "Checking.",
                      "tool_calls": [{"id": "call_1", "type": "function",
                                      "function": {"name": "read_file", "arguments": "{\\"path\\":\\"a.txt\\"}"}}]
                    },
                    "finish_reason": "tool_calls"
                  }],
                  "usage": {"prompt_tokens": 12, "completion_tokens": 7}
                }
                """));

        List<ProviderChunk> chunks = drain(client.open(provider, request(false)));

        assertThat(chunks).containsExactly(
            new ProviderChunk.TextDelta("Checking."),
            new ProviderChunk.ToolUseStart("call:0", "call_1", "read_file"),
            new ProviderChunk.ToolInputDelta("call:0", "{\"path\":\"a.txt\"}"),
            new ProviderChunk.UsageUpdate(12, 7),
            ProviderChunk.Finish.raw("tool_calls"));

        RecordedRequest recorded = server.takeRequest();
        assertThat(recorded.getPath()).isEqualTo("/v1/chat/completions");
        assertThat(recorded.getHeader("Authorization")).isEqualTo("Bearer sk-test");
        assertThat(recorded.getBody().readUtf8()).contains("\"model\":\"gpt-4o\"");
    }

    @Test
    void shouldStreamDeltasAndDeferFinishUntilUsageArrives() {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "text/event-stream")
            .setBody("""
                data: {"choices":[{"delta":{"content":"Hel"}}]}

                data: {"choices":[{"delta":{"content":"lo"}}]}

                data: {"choices":[{"delta":{"tool_calls":[{"index":0,"id":"call_1","function":{"name":"read","arguments":""}}]}}]}

                data: {"choices":[{"delta":{"tool_calls":[{"index":0,"function":{"arguments":"{\\"p\\":1}"}}]}}]}

                data: {"choices":[{"delta":{},"finish_reason":"tool_calls"}]}

                data: {"choices":[],"usage":{"prompt_tokens":10,"completion_tokens":5}}

                data: [DONE]

                """));

        List<ProviderChunk> chunks = drain(client.open(provider, request(true)));

        assertThat(chunks).containsExactly(
            new ProviderChunk.TextDelta("Hel"),
            new ProviderChunk.TextDelta("lo"),
            new ProviderChunk.ToolUseStart("call:0", "call_1", "read"),
            new ProviderChunk.ToolInputDelta("call:0", "{\"p\":1}"),
            new ProviderChunk.UsageUpdate(10, 5),
            ProviderChunk.Finish.raw("tool_calls"));
    }

    @Test
    void shouldRetryTransientErrorOnSameProvider() {
        server.enqueue(new MockResponse().setResponseCode(503).setBody("overloaded"));
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("{\"choices\":[{\"message\":{\"content\":\"ok\"},\"finish_reason\":\"stop\"}]}"));

        List<ProviderChunk> chunks = drain(client.open(provider, request(false)));

        assertThat(chunks).contains(new ProviderChunk.TextDelta("ok"));
        assertThat(server.getRequestCount()).isEqualTo(2);
        assertThat(registry.counter(RelayMetrics.RETRY, "provider", "openai-test").count()).isEqualTo(1.0);
    }

    @Test
    void shouldSurfaceRateLimitAfterRetriesAreExhausted() {
        server.enqueue(new MockResponse().setResponseCode(429).setBody("slow down"));
        server.enqueue(new MockResponse().setResponseCode(429).setBody("slow down"));

        assertThatThrownBy(() -> client.open(provider, request(false)))
            .isInstanceOfSatisfying(ProviderHttpException.class, e -> {
                assertThat(e.isRateLimited()).isTrue();
                assertThat(e.providerId()).isEqualTo("openai-test");
                assertThat(e.toGatewayError().error().type()).isEqualTo("rate_limit_error");
            });
        assertThat(server.getRequestCount()).isEqualTo(2);
    }

    @Test
    void shouldNotRetryClientErrors() {
        server.enqueue(new MockResponse().setResponseCode(400).setBody("{\"error\":\"secret upstream detail\"}"));

        assertThatThrownBy(() -> client.open(provider, request(false)))
            .isInstanceOfSatisfying(ProviderHttpException.class, e -> {
                assertThat(e.statusCode()).isEqualTo(400);
                assertThat(e.isTransient()).isFalse();
                assertThat(e.getMessage()).doesNotContain("secret upstream detail");
            });
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void shouldRotateToNextKeyWhenKeyIsRateLimited() throws Exception {
        ProviderProfile pooled = new ProviderProfile("openai-pool", Protocol.OPENAI, server.url("/v1").toString(),
            new ProviderAuthConfig(ProviderAuthConfig.Type.BEARER, null, List.of(
                new ProviderKeyConfig("primary", "sk-a"),
                new ProviderKeyConfig("backup", "sk-b")), Duration.ofMinutes(1)),
            1, List.of(), Duration.ofSeconds(5), 4096, null, true);
        server.enqueue(new MockResponse().setResponseCode(429).setBody("quota"));
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("{\"choices\":[{\"message\":{\"content\":\"one\"},\"finish_reason\":\"stop\"}]}"));
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("{\"choices\":[{\"message\":{\"content\":\"two\"},\"finish_reason\":\"stop\"}]}"));

        assertThat(drain(client.open(pooled, request(false)))).contains(new ProviderChunk.TextDelta("one"));
        assertThat(drain(client.open(pooled, request(false)))).contains(new ProviderChunk.TextDelta("two"));

        assertThat(server.takeRequest().getHeader("Authorization")).isEqualTo("Bearer sk-a");
        assertThat(server.takeRequest().getHeader("Authorization")).isEqualTo("Bearer sk-b");
        assertThat(server.takeRequest().getHeader("Authorization")).isEqualTo("Bearer sk-b");
        assertThat(registry.find(RelayMetrics.RETRY).counter()).isNull();
        assertThat(registry.counter(RelayMetrics.KEY_COOLDOWN, "provider", "openai-pool", "key", "primary").count())
            .isEqualTo(1.0);
        assertThat(keyRotation.keyStatus(pooled))
            .containsEntry("primary", KeyRotationService.STATUS_COOLING_DOWN)
            .containsEntry("backup", KeyRotationService.STATUS_AVAILABLE);
    }

    @Test
    void shouldKeepStreamingPastProviderTimeoutWhileChunksKeepArriving() {
        StringBuilder body = new StringBuilder();
        for (int i = 0; i < 10; i++) {
            body.append("data: {\"choices\":[{\"delta\":{\"content\":\"c").append(i).append("\"}}]}\n\n");
        }
        body.append("data: {\"choices\":[{\"delta\":{},\"finish_reason\":\"stop\"}]}\n\n");
        body.append("data: [DONE]\n\n");
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "text/event-stream")
            .setBody(body.toString())
            .throttleBody(body.length() / 10, 300, TimeUnit.MILLISECONDS));

        List<ProviderChunk> chunks = drain(client.open(withTimeout(Duration.ofSeconds(1)), request(true)));

        assertThat(chunks).hasSize(11);
        assertThat(chunks.get(9)).isEqualTo(new ProviderChunk.TextDelta("c9"));
        assertThat(chunks.get(10)).isEqualTo(ProviderChunk.Finish.raw("stop"));
    }

    @Test
    void shouldTimeOutStreamThatGoesIdle() {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "text/event-stream")
            .setBody("data: {\"choices\":[{\"delta\":{\"content\":\"late\"}}]}\n\n")
            .setBodyDelay(3, TimeUnit.SECONDS));

        ProviderStream stream = client.open(withTimeout(Duration.ofMillis(500)), request(true));

        try (stream) {
            assertThatThrownBy(stream::hasNext)
                .isInstanceOfSatisfying(ProviderTimeoutException.class,
                    e -> assertThat(e.providerId()).isEqualTo("openai-slow"));
        }
    }

    private ProviderProfile withTimeout(Duration timeout) {
        return new ProviderProfile("openai-slow", Protocol.OPENAI, server.url("/v1").toString(),
            ProviderAuthConfig.single(ProviderAuthConfig.Type.BEARER, "sk-test"), 1, List.of(), timeout, 4096,
            null, true);
    }

    private NativeRequest request(boolean stream) {
        ObjectNode body = mapper.createObjectNode();
        body.put("model", "gpt-4o");
        body.putArray("messages").addObject().put("role", "user").put("content", "hi");
        body.put("stream", stream);
        return new NativeRequest(Protocol.OPENAI, "gpt-4o", body, stream);
    }
}
