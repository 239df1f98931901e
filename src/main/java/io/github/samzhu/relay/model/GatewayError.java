package io.github.samzhu.relay.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 閘道錯誤回應格式
 *
 * <p>採用與 Anthropic API 相容的錯誤格式，無論請求最後由哪個 provider 處理，
 * 客戶端都只會看到這個信封，不會看到 provider 的原始錯誤內容。
 *
 * <p>錯誤結構：
 * <pre>{@code
 * {
 *   "type": "error",
 *   "error": {
 *     "type": "invalid_request_error|overloaded_error|rate_limit_error|api_error|...",
 *     "message": "錯誤描述"
 *   }
 * }
 * }</pre>
 *
 * <p>支援的錯誤類型：
 * <ul>
 *   <li>{@code authentication_error} - JWT 驗證失敗或 Token 過期</li>
 *   <li>{@code permission_error} - 權限不足或存取被拒絕</li>
 *   <li>{@code invalid_request_error} - 請求格式錯誤或不支援的形狀</li>
 *   <li>{@code overloaded_error} - 沒有可用的 provider</li>
 *   <li>{@code rate_limit_error} - 所有嘗試的 provider 都回應 429</li>
 *   <li>{@code api_error} - 上游錯誤或逾時</li>
 * </ul>
 *
 * @see io.github.samzhu.relay.exception.GlobalExceptionHandler
 * @see <a href="https://docs.anthropic.com/en/api/errors">Claude API Errors</a>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GatewayError(
    String type,
    Error error
) {
    public record Error(
        String type,
        String message
    ) {}

    public static GatewayError of(String errorType, String message) {
        return new GatewayError("error", new Error(errorType, message));
    }

    public static GatewayError authenticationError(String message) {
        return of("authentication_error", message);
    }

    public static GatewayError permissionError(String message) {
        return of("permission_error", message);
    }

    public static GatewayError overloadedError(String message) {
        return of("overloaded_error", message);
    }

    public static GatewayError rateLimitError(String message) {
        return of("rate_limit_error", message);
    }

    public static GatewayError apiError(String message) {
        return of("api_error", message);
    }

    public static GatewayError invalidRequestError(String message) {
        return of("invalid_request_error", message);
    }
}
