package cotrelay.observability;

import cotrelay.domain.ParseError;
import cotrelay.domain.PositionRecord;
import cotrelay.output.ConnectionState;
import cotrelay.output.SendResult;

import java.net.InetSocketAddress;
import java.time.Duration;

/**
 * No-op implementation of RelayObserver.
 */
public final class NullRelayObserver implements RelayObserver {
    public static final NullRelayObserver INSTANCE = new NullRelayObserver();

    private NullRelayObserver() {}

    @Override
    public void onDatagramReceived(InetSocketAddress sender, int bytes) {}

    @Override
    public void onDecodeError(InetSocketAddress sender, Throwable cause) {}

    @Override
    public void onParseError(InetSocketAddress sender, ParseError error, String sentence) {}

    @Override
    public void onPositionParsed(PositionRecord record, InetSocketAddress sender) {}

    @Override
    public void onNewDevice(String deviceId, String uid) {}

    @Override
    public void onConversionError(String deviceId, Throwable cause) {}

    @Override
    public void onEventQueued(String deviceId) {}

    @Override
    public void onEventDropped(String deviceId, SendResult result) {}

    @Override
    public void onConnectionStateChanged(ConnectionState from, ConnectionState to) {}

    @Override
    public void onMessageProcessed(Duration processingTime) {}
}
