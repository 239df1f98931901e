package io.github.samzhu.relay.provider;

/**
 * Key 選擇結果
 * 包含選中的 key、在輪換列表中的位置與其別名
 */
public record KeySelection(
    int index,
    String alias,
    String value
) {
    @Override
    public String toString() {
        return "KeySelection[index=" + index + ", alias=" + alias + "]";
    }
}
