package com.p14n.eventbus.broker;

/**
 * Outcome of a publish. Both rejection kinds report zero recipients but keep
 * their own status, so "nobody listening" and "listeners overloaded" can be
 * told apart.
 *
 * @param status     what happened to the message
 * @param recipients number of subscribers that will receive the message
 */
public record PublishResult(Status status, int recipients) {

    public enum Status {
        /** Enqueued for every subscriber of the channel. */
        ACCEPTED,
        /** The channel has no subscriber; nothing was enqueued. */
        NO_SUBSCRIBERS,
        /** The channel queue was full; the message was dropped. */
        QUEUE_FULL
    }

    private static final PublishResult NO_SUBSCRIBERS = new PublishResult(Status.NO_SUBSCRIBERS, 0);
    private static final PublishResult QUEUE_FULL = new PublishResult(Status.QUEUE_FULL, 0);

    public static PublishResult accepted(int recipients) {
        return new PublishResult(Status.ACCEPTED, recipients);
    }

    public static PublishResult noSubscribers() {
        return NO_SUBSCRIBERS;
    }

    public static PublishResult queueFull() {
        return QUEUE_FULL;
    }

    public boolean isAccepted() {
        return status == Status.ACCEPTED;
    }
}
