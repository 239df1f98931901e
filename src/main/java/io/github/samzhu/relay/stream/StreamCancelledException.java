package io.github.samzhu.relay.stream;

/**
 * 串流在兩個暫停點之一被取消（等待 provider 片段、等待客戶端寫入完成）
 */
public class StreamCancelledException extends RuntimeException {

    private final String cancelCause;

    public StreamCancelledException(String cancelCause) {
        super("Stream cancelled: " + cancelCause);
        this.cancelCause = cancelCause;
    }

    public String cancelCause() {
        return cancelCause;
    }
}
