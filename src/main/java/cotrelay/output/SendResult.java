package cotrelay.output;

/**
 * Outcome of handing one serialized event to an output.
 */
public enum SendResult {
    /** Queued for writing in FIFO order once connected; lost if the write itself fails. */
    ACCEPTED,
    /** The queue stayed full for the whole send timeout. */
    TIMEOUT,
    /** The output has been closed. */
    CLOSED,
    /** Enqueue failed for another reason (interrupted, bad payload). */
    ERROR;

    public boolean isAccepted() {
        return this == ACCEPTED;
    }
}
