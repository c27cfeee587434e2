package cotrelay.output;

/**
 * Snapshot of the outbound link counters.
 *
 * @param sendErrors enqueue timeouts, enqueue failures and socket write failures
 */
public record LinkStatistics(
        ConnectionState state,
        long messagesSent,
        long sendErrors,
        int queueSize,
        int queueCapacity
) {
    public boolean connected() {
        return state == ConnectionState.CONNECTED;
    }

    public double errorRate() {
        return (double) sendErrors / Math.max(1L, messagesSent + sendErrors);
    }

    @Override
    public String toString() {
        return String.format("LinkStatistics{state=%s, sent=%d, errors=%d, errorRate=%.3f, queue=%d/%d}",
                state, messagesSent, sendErrors, errorRate(), queueSize, queueCapacity);
    }
}
