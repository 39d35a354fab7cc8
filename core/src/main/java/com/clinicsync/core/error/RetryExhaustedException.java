package com.clinicsync.core.error;

/**
 * A mutation failed more often than its retry budget and was dropped.
 */
public class RetryExhaustedException extends SyncException {
    private final String mutationId;
    private final int attempts;

    public RetryExhaustedException(String mutationId, int attempts, Throwable lastError) {
        super("Mutation " + mutationId + " dropped after " + attempts + " attempts", lastError);
        this.mutationId = mutationId;
        this.attempts = attempts;
    }

    public String getMutationId() {
        return mutationId;
    }

    public int getAttempts() {
        return attempts;
    }
}
