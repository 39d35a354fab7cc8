package com.clinicsync.core.msg;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Value;

/**
 * Outbound event held back while the realtime channel is not connected.
 */
@Value
public class BufferedEvent {
    @JsonProperty("event")
    String event;

    @JsonProperty("payload")
    JsonNode payload;

    /**
     * Submission time (epoch millis).
     */
    @JsonProperty("enqueuedAt")
    long enqueuedAt;

    @JsonCreator
    public BufferedEvent(
        @JsonProperty("event") String event,
        @JsonProperty("payload") JsonNode payload,
        @JsonProperty("enqueuedAt") long enqueuedAt
    ) {
        this.event = event;
        this.payload = payload;
        this.enqueuedAt = enqueuedAt;
    }

    public EventFrame toFrame() {
        return new EventFrame(event, payload);
    }
}
