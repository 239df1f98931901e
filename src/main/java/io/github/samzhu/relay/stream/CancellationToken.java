package io.github.samzhu.relay.stream;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 串流取消訊號
 *
 * <p>客戶端斷線、SSE 逾時或上游中斷時呼叫 {@link #cancel}；已註冊的 closer（例如關閉上游連線）
 * 只執行一次，讓阻塞中的讀取立即返回。管線在拉取下一個片段前與每次寫入後檢查。
 */
public class CancellationToken {

    private static final Logger log = LoggerFactory.getLogger(CancellationToken.class);

    public static final String CAUSE_CLIENT_DISCONNECTED = "client_disconnected";
    public static final String CAUSE_TIMEOUT = "timeout";
    public static final String CAUSE_UPSTREAM_ABORTED = "upstream_aborted";
    public static final String CAUSE_DECODE_ERROR = "decode_error";
    public static final String CAUSE_INTERNAL_ERROR = "internal_error";

    private final AtomicReference<String> cause = new AtomicReference<>();
    private final List<Runnable> closers = new CopyOnWriteArrayList<>();

    public boolean cancel(String reason) {
        if (!cause.compareAndSet(null, reason)) {
            return false;
        }
        log.debug("Cancellation requested: {}", reason);
        for (Runnable closer : closers) {
            try {
                closer.run();
            } catch (RuntimeException e) {
                log.debug("Cancellation closer failed: {}", e.getMessage());
            }
        }
        return true;
    }

    /**
     * 註冊取消時要執行的動作；已取消時立即執行
     */
    public void onCancel(Runnable closer) {
        closers.add(closer);
        if (isCancelled()) {
            closer.run();
        }
    }

    public boolean isCancelled() {
        return cause.get() != null;
    }

    public String cause() {
        return cause.get();
    }

    public void throwIfCancelled() {
        String reason = cause.get();
        if (reason != null) {
            throw new StreamCancelledException(reason);
        }
    }
}
