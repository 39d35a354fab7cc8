package com.clinicsync.client.queue;

import com.clinicsync.core.model.Priority;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class QueueStats {
    int pending;
    Map<Priority, Integer> pendingByPriority;
    boolean draining;
    boolean retryScheduled;
    boolean persistenceDegraded;
}
