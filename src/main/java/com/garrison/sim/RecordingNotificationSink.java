package com.garrison.sim;

import com.garrison.core.world.NotificationSink;

import java.util.ArrayList;
import java.util.List;

public class RecordingNotificationSink implements NotificationSink {

    public record Notification(String title, String subtitle, float displaySeconds) {}

    private final List<Notification> sent = new ArrayList<>();

    @Override
    public void broadcast(String title, String subtitle, float displayDurationSeconds) {
        sent.add(new Notification(title, subtitle, displayDurationSeconds));
    }

    public List<Notification> sent() {
        return List.copyOf(sent);
    }
}
