package io.github.samzhu.relay.model;

import java.util.List;

/**
 * 對話訊息
 *
 * <p>字串形式的 {@code content} 在讀取時已轉為單一 {@link TextBlock}。
 *
 * @param role    {@code user} 或 {@code assistant}
 * @param content 內容區塊（依原始順序）
 */
public record Message(
    String role,
    List<ContentBlock> content
) {
    public static final String USER = "user";
    public static final String ASSISTANT = "assistant";

    public Message {
        content = content == null ? List.of() : List.copyOf(content);
    }

    public static Message user(String text) {
        return new Message(USER, List.of(new TextBlock(text)));
    }

    public boolean isAssistant() {
        return ASSISTANT.equals(role);
    }

    /**
     * 串接所有文字區塊
     */
    public String joinedText() {
        StringBuilder sb = new StringBuilder();
        for (ContentBlock block : content) {
            if (block instanceof TextBlock text) {
                if (sb.length() > 0) {
                    sb.append('\n');
                }
                sb.append(text.text());
            }
        }
        return sb.toString();
    }
}
