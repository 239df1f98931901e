package io.github.samzhu.relay.recovery;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 文字中 {@code Tool call: Name({...})} 的單次掃描
 *
 * <p>標記不分大小寫、允許彈性空白；JSON 物件以可辨識字串與跳脫字元的括號計數界定，
 * 每個字元最多看一次。
 */
final class ToolCallScanner {

    static final Pattern MARKER = Pattern.compile("tool\\s+call\\s*:\\s*([A-Za-z_][\\w.-]*)\\s*\\(",
        Pattern.CASE_INSENSITIVE);

    /**
     * 可能是標記開頭的尾端最多檢查的字元數
     */
    static final int MAX_MARKER_PREFIX = 96;

    private ToolCallScanner() {
    }

    sealed interface Result permits None, Pending, Match, Malformed {
    }

    /**
     * 沒有標記；{@code [from, safeEnd)} 可以放行，其後可能是標記的開頭
     */
    record None(int safeEnd) implements Result {
    }

    /**
     * 找到標記但呼叫尚未結束
     */
    record Pending(int start) implements Result {
    }

    /**
     * 完整的呼叫；{@code [start, end)} 是整段文字，json 是括號內的物件
     */
    record Match(int start, int end, String name, String json) implements Result {
    }

    /**
     * 標記後面不是合法的呼叫形狀；{@code [start, resumeAt)} 原樣放行
     */
    record Malformed(int start, int resumeAt) implements Result {
    }

    static Result scan(CharSequence text, int from, boolean endOfInput) {
        int length = text.length();
        Matcher matcher = MARKER.matcher(text);
        matcher.region(from, length);
        if (!matcher.find()) {
            return new None(endOfInput ? length : partialMarkerStart(text, from));
        }

        int start = matcher.start();
        String name = matcher.group(1);
        int cursor = skipWhitespace(text, matcher.end());
        if (cursor >= length) {
            return endOfInput ? new Malformed(start, length) : new Pending(start);
        }
        if (text.charAt(cursor) != '{') {
            return new Malformed(start, matcher.end());
        }

        int jsonEnd = matchBraces(text, cursor);
        if (jsonEnd < 0) {
            return endOfInput ? new Malformed(start, length) : new Pending(start);
        }
        int close = skipWhitespace(text, jsonEnd);
        if (close >= length) {
            return endOfInput ? new Malformed(start, length) : new Pending(start);
        }
        if (text.charAt(close) != ')') {
            return new Malformed(start, jsonEnd);
        }
        return new Match(start, close + 1, name, text.subSequence(cursor, jsonEnd).toString());
    }

    /**
     * 回傳可能成為標記開頭的最早位置；沒有則回傳文字長度
     */
    static int partialMarkerStart(CharSequence text, int from) {
        int length = text.length();
        int begin = Math.max(from, length - MAX_MARKER_PREFIX);
        Matcher matcher = MARKER.matcher(text);
        for (int i = begin; i < length; i++) {
            char c = text.charAt(i);
            if (c != 't' && c != 'T') {
                continue;
            }
            matcher.region(i, length);
            if (!matcher.lookingAt() && matcher.hitEnd()) {
                return i;
            }
        }
        return length;
    }

    /**
     * @param open '{' 的位置
     * @return 對應 '}' 之後的位置；尚未結束回傳 -1
     */
    static int matchBraces(CharSequence text, int open) {
        int depth = 0;
        boolean inString = false;
        boolean escaped = false;
        for (int i = open; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return i + 1;
                }
            }
        }
        return -1;
    }

    static int skipWhitespace(CharSequence text, int index) {
        int i = index;
        while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
            i++;
        }
        return i;
    }
}
