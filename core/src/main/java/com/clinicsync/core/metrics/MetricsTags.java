package com.clinicsync.core.metrics;

/**
 * Standard tag keys for Micrometer metrics.
 */
public final class MetricsTags {
    private MetricsTags() {
    }

    /**
     * Tag key for the client installation identifier.
     */
    public static final String CLIENT_ID = "client_id";

    /**
     * Tag key for a sub-type (manual/automatic, read/write, event name).
     */
    public static final String TYPE = "type";

    /**
     * Tag key for an outcome or failure reason.
     */
    public static final String REASON = "reason";

    /**
     * Tag key for execution outcome (success/failure).
     */
    public static final String OUTCOME = "outcome";

}
