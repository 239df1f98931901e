package io.github.samzhu.relay.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.web.servlet.function.RouterFunction;
import org.springframework.web.servlet.function.RouterFunctions;
import org.springframework.web.servlet.function.ServerRequest;
import org.springframework.web.servlet.function.ServerResponse;

import io.github.samzhu.relay.exception.GlobalExceptionHandler;
import io.github.samzhu.relay.handler.CountTokensHandler;
import io.github.samzhu.relay.handler.NonStreamingMessagesHandler;
import io.github.samzhu.relay.handler.StreamingMessagesHandler;
import io.github.samzhu.relay.model.CanonicalRequest;
import io.github.samzhu.relay.transform.CanonicalRequestReader;

/**
 * 閘道路由配置
 *
 * <p>對外只提供 Anthropic Messages 相容的端點：
 * <ul>
 *   <li>{@code POST /v1/messages} - 訊息 API（支援串流/非串流）</li>
 *   <li>{@code POST /v1/messages/count_tokens} - Token 估算</li>
 * </ul>
 *
 * <p>{@code /v1/messages} 處理流程：
 * <ol>
 *   <li>解析並驗證請求為 canonical 形式</li>
 *   <li>根據請求中的 {@code stream} 參數分流：
 *       <ul>
 *         <li>{@code stream: true} → 串流處理（SSE）</li>
 *         <li>{@code stream: false} → 非串流處理（JSON）</li>
 *       </ul>
 *   </li>
 *   <li>任何階段的異常交由 {@link GlobalExceptionHandler} 轉為錯誤信封</li>
 * </ol>
 *
 * @see StreamingMessagesHandler
 * @see NonStreamingMessagesHandler
 * @see CountTokensHandler
 */
@Configuration
public class GatewayConfig {

    private static final Logger log = LoggerFactory.getLogger(GatewayConfig.class);

    private final CanonicalRequestReader requestReader;
    private final StreamingMessagesHandler streamingHandler;
    private final NonStreamingMessagesHandler nonStreamingHandler;
    private final CountTokensHandler countTokensHandler;
    private final GlobalExceptionHandler exceptionHandler;

    public GatewayConfig(
            CanonicalRequestReader requestReader,
            StreamingMessagesHandler streamingHandler,
            NonStreamingMessagesHandler nonStreamingHandler,
            CountTokensHandler countTokensHandler,
            GlobalExceptionHandler exceptionHandler) {
        this.requestReader = requestReader;
        this.streamingHandler = streamingHandler;
        this.nonStreamingHandler = nonStreamingHandler;
        this.countTokensHandler = countTokensHandler;
        this.exceptionHandler = exceptionHandler;
    }

    @Bean
    public RouterFunction<ServerResponse> messagesRoute() {
        return RouterFunctions.route()
            .POST("/v1/messages", this::handleMessages)
            .POST("/v1/messages/count_tokens", this::handleCountTokens)
            .onError(Exception.class, exceptionHandler::handle)
            .build();
    }

    private ServerResponse handleMessages(ServerRequest request) throws Exception {
        CanonicalRequest canonical = requestReader.read(request.body(byte[].class));
        log.debug("Received message request: subject={}, model={}, streaming={}, tools={}",
            getSubjectFromRequest(request), canonical.model(), canonical.stream(), canonical.tools().size());

        if (canonical.stream()) {
            return streamingHandler.handleStreaming(canonical);
        }
        return nonStreamingHandler.handleNonStreaming(canonical);
    }

    private ServerResponse handleCountTokens(ServerRequest request) throws Exception {
        CanonicalRequest canonical = requestReader.read(request.body(byte[].class));
        return countTokensHandler.handleCountTokens(canonical);
    }

    /**
     * 從請求中取得 JWT subject（未啟用 JWT 時為 anonymous）
     */
    private String getSubjectFromRequest(ServerRequest request) {
        return request.principal()
            .filter(JwtAuthenticationToken.class::isInstance)
            .map(JwtAuthenticationToken.class::cast)
            .map(jwt -> jwt.getToken().getSubject())
            .orElse("anonymous");
    }
}
