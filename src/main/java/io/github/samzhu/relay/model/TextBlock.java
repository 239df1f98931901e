package io.github.samzhu.relay.model;

/**
 * 文字內容區塊
 */
public record TextBlock(String text) implements ContentBlock {

    public TextBlock {
        if (text == null) {
            text = "";
        }
    }
}
