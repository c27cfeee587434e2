package cotrelay.observability;

import cotrelay.domain.ParseError;
import cotrelay.domain.PositionRecord;
import cotrelay.output.ConnectionState;
import cotrelay.output.SendResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.time.Duration;

/**
 * Production implementation of RelayObserver that emits logs via SLF4J.
 */
public final class Slf4jRelayObserver implements RelayObserver {
    private static final Logger log = LoggerFactory.getLogger(Slf4jRelayObserver.class);

    @Override
    public void onDatagramReceived(InetSocketAddress sender, int bytes) {
        log.trace("Received {} bytes from {}", bytes, sender);
    }

    @Override
    public void onDecodeError(InetSocketAddress sender, Throwable cause) {
        log.error("Failed to decode UDP message from {}: {}", sender, cause.toString());
    }

    @Override
    public void onParseError(InetSocketAddress sender, ParseError error, String sentence) {
        log.warn("Failed to parse GPGGA message from {} ({}): {}", sender, error, sentence);
    }

    @Override
    public void onPositionParsed(PositionRecord record, InetSocketAddress sender) {
        log.info("Processing GPGGA message: device={} lat={} lon={} alt={} fix={} sats={} sender={}",
                record.deviceId(), record.latitude(), record.longitude(), record.altitude(),
                record.fixQualityDescription(), record.numSatellites(), sender);
    }

    @Override
    public void onNewDevice(String deviceId, String uid) {
        log.info("Created new UID for device {}: {}", deviceId, uid);
    }

    @Override
    public void onConversionError(String deviceId, Throwable cause) {
        log.error("CoT conversion error for device {}", deviceId, cause);
    }

    @Override
    public void onEventQueued(String deviceId) {
        log.debug("CoT queued for device {}", deviceId);
    }

    @Override
    public void onEventDropped(String deviceId, SendResult result) {
        log.warn("CoT for device {} dropped: {}", deviceId, result);
    }

    @Override
    public void onConnectionStateChanged(ConnectionState from, ConnectionState to) {
        log.info("TAK link state: {} -> {}", from, to);
    }

    @Override
    public void onMessageProcessed(Duration processingTime) {
        log.trace("Message processed in {} us", processingTime.toNanos() / 1_000L);
    }
}
