package cotrelay.input;

import cotrelay.domain.PositionRecord;

import java.net.InetSocketAddress;

/**
 * Interface for position report sources.
 * Implementations handle the transport, decoding and parsing.
 */
public interface PositionInput {
    /**
     * Start receiving reports.
     * @throws UdpBindException if the listening socket cannot be bound
     */
    void start();

    /**
     * Stop receiving reports and close the socket.
     */
    void stop();

    /**
     * Check if the input is currently active.
     * @return true if receiving data, false otherwise
     */
    boolean isRunning();

    /**
     * Set the handler for parsed reports. Must be called before {@link #start()}.
     * @param handler the report handler
     */
    void setPositionHandler(PositionHandler handler);

    InputStatistics getStatistics();

    /**
     * Callback for successfully parsed reports. Invoked off the receive thread, possibly
     * concurrently for different datagrams.
     */
    @FunctionalInterface
    interface PositionHandler {
        void onPosition(PositionRecord record, InetSocketAddress sender);
    }
}
