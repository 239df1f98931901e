package io.github.samzhu.relay.recovery;

/**
 * 文字中的工具呼叫無法解析
 *
 * <p>只在還原步驟內部使用：捕捉後保留原文並計數，不會中止請求。
 */
public class ToolCallRecoveryException extends Exception {

    private final String toolName;

    public ToolCallRecoveryException(String toolName, String message, Throwable cause) {
        super(message, cause);
        this.toolName = toolName;
    }

    public String toolName() {
        return toolName;
    }
}
