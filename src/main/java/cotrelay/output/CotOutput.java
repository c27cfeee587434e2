package cotrelay.output;

/**
 * Destination for serialized CoT events.
 */
public interface CotOutput {

    /**
     * Prepare the output and start any background connection handling.
     * Called once before the first {@link #send(byte[])}.
     *
     * @throws TlsConfigurationException if configured credentials cannot be loaded
     */
    void initialize();

    /**
     * Hand one newline-terminated event to the output. Never throws; a refused event is
     * reported through the result and is not retried by the output.
     *
     * <p>Delivery is at most once. {@link SendResult#ACCEPTED} means the event was queued,
     * not that it reached the server: an event taken from the queue is lost if the
     * connection fails while it is being written, and is then counted only in the send
     * errors of {@link #getStatistics()}.</p>
     *
     * @param payload the serialized event
     * @return whether the event was accepted for delivery
     */
    SendResult send(byte[] payload);

    boolean isConnected();

    LinkStatistics getStatistics();

    /**
     * Close and cleanup resources. Events still queued are discarded.
     * Should be idempotent.
     */
    void close();
}
