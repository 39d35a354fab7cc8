package com.clinicsync.core.msg;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.*;

/**
 * Wire frame exchanged over the realtime connection, in both directions.
 * <p>
 * JSON shape: {@code {"event": "<name>", "data": <any JSON>}}. The channel routes
 * inbound frames by {@code event} only; {@code data} is handed to handlers untouched.
 * </p>
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class EventFrame {
    /**
     * Event name, e.g. {@code "message:new"}.
     */
    String event;

    /**
     * Application-specific payload.
     */
    JsonNode data;
}
