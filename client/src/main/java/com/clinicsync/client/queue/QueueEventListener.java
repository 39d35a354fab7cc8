package com.clinicsync.client.queue;

@FunctionalInterface
public interface QueueEventListener {
    void onEvent(QueueEvent event);
}
