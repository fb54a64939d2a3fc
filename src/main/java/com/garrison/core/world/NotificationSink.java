package com.garrison.core.world;

/**
 * Fire-and-forget broadcast to connected players.
 */
@FunctionalInterface
public interface NotificationSink {

    void broadcast(String title, String subtitle, float displayDurationSeconds);
}
