package com.clinicsync.core.store;

/**
 * Durable store keyspace.
 * <p>
 * <b>Key design principles:</b>
 * <ul>
 *   <li>Namespace prefix per signed-in installation so two profiles never share a queue</li>
 *   <li>One key per snapshot; each snapshot is rewritten as a whole on every change</li>
 * </ul>
 * </p>
 */
public final class Keys {
    private Keys() {
    }

    /**
     * Mutation queue snapshot: {@code sync:{namespace}:mutation-queue}
     * <p>
     * <b>Content:</b> JSON array of MutationRecord, in drain order.
     * </p>
     *
     * @param namespace installation or profile identifier
     * @return store key
     */
    public static String mutationQueue(String namespace) {
        return "sync:" + namespace + ":mutation-queue";
    }

    /**
     * Outbound buffer snapshot: {@code sync:{namespace}:outbound-buffer}
     * <p>
     * <b>Content:</b> JSON array of BufferedEvent, in submission order.
     * </p>
     *
     * @param namespace installation or profile identifier
     * @return store key
     */
    public static String outboundBuffer(String namespace) {
        return "sync:" + namespace + ":outbound-buffer";
    }

}
