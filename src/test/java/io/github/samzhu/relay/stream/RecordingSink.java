package io.github.samzhu.relay.stream;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import io.github.samzhu.relay.model.StreamEvent;

/**
 * 記錄送出事件的測試用 sink，可設定在第 N 個事件時模擬客戶端斷線
 */
public class RecordingSink implements SseEventSink {

    private final List<StreamEvent> events = new ArrayList<>();
    private final int failAt;
    private boolean completed;

    public RecordingSink() {
        this(-1);
    }

    public RecordingSink(int failAt) {
        this.failAt = failAt;
    }

    @Override
    public void send(StreamEvent event) throws IOException {
        if (failAt >= 0 && events.size() >= failAt) {
            throw new IOException("Broken pipe");
        }
        events.add(event);
    }

    @Override
    public void complete() {
        completed = true;
    }

    public List<StreamEvent> events() {
        return events;
    }

    public List<String> names() {
        return events.stream().map(StreamEvent::eventName).toList();
    }

    public boolean completed() {
        return completed;
    }
}
