package cotrelay.observability;

import cotrelay.domain.ParseError;
import cotrelay.domain.PositionRecord;
import cotrelay.output.ConnectionState;
import cotrelay.output.SendResult;

import java.net.InetSocketAddress;
import java.time.Duration;

/**
 * Receives the relay's observability events. Implementations can provide logging,
 * metrics or test recording; callbacks may arrive concurrently from several threads
 * and must not block.
 */
public interface RelayObserver {

    /**
     * Called for every datagram read from the ingest socket, before decoding.
     */
    void onDatagramReceived(InetSocketAddress sender, int bytes);

    /**
     * Called when a datagram is not valid UTF-8 and is discarded.
     */
    void onDecodeError(InetSocketAddress sender, Throwable cause);

    /**
     * Called when a decoded sentence is rejected by the parser.
     */
    void onParseError(InetSocketAddress sender, ParseError error, String sentence);

    void onPositionParsed(PositionRecord record, InetSocketAddress sender);

    /**
     * Called once per device id the first time an identifier is derived for it.
     */
    void onNewDevice(String deviceId, String uid);

    void onConversionError(String deviceId, Throwable cause);

    void onEventQueued(String deviceId);

    /**
     * Called when the outbound link refuses an event (queue full, closed link, ...).
     */
    void onEventDropped(String deviceId, SendResult result);

    void onConnectionStateChanged(ConnectionState from, ConnectionState to);

    /**
     * Time from handler dispatch to the event being queued or dropped.
     */
    void onMessageProcessed(Duration processingTime);
}
