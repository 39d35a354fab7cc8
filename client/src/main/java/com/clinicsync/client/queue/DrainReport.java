package com.clinicsync.client.queue;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of one drain pass.
 */
@Value
@Builder
public class DrainReport {

    public enum StopReason {
        /**
         * Queue is empty.
         */
        EMPTY,
        /**
         * Connectivity snapshot went offline.
         */
        OFFLINE,
        /**
         * Head failed with retries left; drain stopped to keep ordering.
         */
        RETRY_PENDING,
        /**
         * Another drain was already running.
         */
        ALREADY_RUNNING
    }

    int executed;
    int failed;
    int dropped;
    StopReason stopReason;

    static DrainReport alreadyRunning() {
        return DrainReport.builder().stopReason(StopReason.ALREADY_RUNNING).build();
    }
}
