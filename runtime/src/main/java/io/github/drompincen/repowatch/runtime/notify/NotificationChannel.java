package io.github.drompincen.repowatch.runtime.notify;

/**
 * One independent notification outlet. Implementations are invoked in {@code @Order}
 * sequence by {@link NotificationDispatcher}, which isolates their failures.
 */
public interface NotificationChannel {

    String name();

    /** Channels without the settings they need are skipped. */
    boolean isConfigured();

    /**
     * Delivers the batch. A delivery the remote side refuses is reported as
     * {@link ChannelResult.Outcome#FAILED}; transport errors may be thrown.
     */
    ChannelResult send(NotificationBatch batch) throws Exception;
}
