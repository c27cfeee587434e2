package cotrelay.output;

/**
 * Lifecycle of the single outbound TAK connection. The supervising loop is the only writer;
 * transitions always run DISCONNECTED -> CONNECTING -> CONNECTED -> DISCONNECTED.
 */
public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED
}
