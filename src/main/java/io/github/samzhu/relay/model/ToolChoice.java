package io.github.samzhu.relay.model;

/**
 * 工具選擇模式
 *
 * @param mode 選擇模式
 * @param name 指定工具名稱（僅 {@link Mode#TOOL} 使用）
 */
public record ToolChoice(Mode mode, String name) {

    public enum Mode {
        AUTO,
        ANY,
        TOOL,
        NONE
    }

    public static final ToolChoice AUTO = new ToolChoice(Mode.AUTO, null);

    public static ToolChoice tool(String name) {
        return new ToolChoice(Mode.TOOL, name);
    }
}
