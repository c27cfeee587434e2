package cotrelay.input;

/**
 * Snapshot of the ingest counters.
 *
 * @param parseErrors datagrams rejected by the parser
 * @param decodeErrors datagrams that were not valid UTF-8
 */
public record InputStatistics(long messagesReceived, long parseErrors, long decodeErrors) {

    public double errorRate() {
        return (double) (parseErrors + decodeErrors) / Math.max(1L, messagesReceived);
    }

    @Override
    public String toString() {
        return String.format("InputStatistics{received=%d, parseErrors=%d, decodeErrors=%d, errorRate=%.3f}",
                messagesReceived, parseErrors, decodeErrors, errorRate());
    }
}
