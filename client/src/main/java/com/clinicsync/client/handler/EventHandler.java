package com.clinicsync.client.handler;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Callback for one inbound realtime event.
 */
@FunctionalInterface
public interface EventHandler {
    void handle(JsonNode payload) throws Exception;
}
