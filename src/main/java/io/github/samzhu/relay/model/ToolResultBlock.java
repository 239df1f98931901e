package io.github.samzhu.relay.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 工具執行結果區塊
 *
 * <p>{@code content} 可能是字串或文字區塊陣列，讀取時已攤平為單一字串。
 *
 * @param toolUseId 對應的 {@link ToolUseBlock#id()}
 * @param content   結果文字
 * @param isError   是否為錯誤結果
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ToolResultBlock(
    @JsonProperty("tool_use_id")
    String toolUseId,
    String content,
    @JsonProperty("is_error")
    Boolean isError
) implements ContentBlock {

    public ToolResultBlock {
        if (content == null) {
            content = "";
        }
    }
}
