package com.clinicsync.core.msg;

/**
 * Event names used on the realtime channel.
 * <p>
 * The channel itself only routes by name; these constants exist so that producers and
 * handlers agree on spelling.
 * </p>
 */
public final class RealtimeEvents {
    private RealtimeEvents() {
    }

    public static final String MESSAGE_NEW = "message:new";
    public static final String APPOINTMENT_REMINDER = "appointment:reminder";
    public static final String APPOINTMENT_UPDATED = "appointment:updated";
    public static final String MEDICATION_REMINDER = "medication:reminder";
    public static final String LAB_RESULT_READY = "lab:result";
    public static final String ENTITY_UPDATED = "entity:updated";

    /**
     * Client -> server: subscribe to a room. Payload {@code {"room": "<name>"}}.
     */
    public static final String ROOM_JOIN = "room:join";

    /**
     * Client -> server: unsubscribe from a room. Payload {@code {"room": "<name>"}}.
     */
    public static final String ROOM_LEAVE = "room:leave";
}
