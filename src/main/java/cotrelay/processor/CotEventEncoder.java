package cotrelay.processor;

import cotrelay.domain.FixQuality;
import cotrelay.domain.PositionRecord;
import cotrelay.domain.TrackingEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * Transforms parsed GPGGA positions into Cursor-on-Target events.
 * Pure computation apart from the uid cache, and safe for concurrent use.
 */
public class CotEventEncoder {
    private static final Logger logger = LoggerFactory.getLogger(CotEventEncoder.class);

    public static final double MAX_CIRCULAR_ERROR = 9999.0;
    public static final double UNKNOWN_FIX_BASE_ERROR = 10.0;
    public static final String DEVICE_INFO_TYPE = "GPS Tracker";
    public static final String LOCATION_SOURCE = "GPS";

    private static final DateTimeFormatter WHOLE_SECONDS = DateTimeFormatter.ofPattern("HH:mm:ss");
    private static final DateTimeFormatter MICRO_SECONDS = DateTimeFormatter.ofPattern("HH:mm:ss.SSSSSS");

    private final String eventType;
    private final Duration staleTime;
    private final DeviceUidRegistry uidRegistry;

    /**
     * @param eventType   CoT type stamped on every event, e.g. {@code a-f-G-U-C}
     * @param staleTime   how long after {@code time} the event goes stale
     * @param uidRegistry device id to uid cache, owned by this encoder
     */
    public CotEventEncoder(String eventType, Duration staleTime, DeviceUidRegistry uidRegistry) {
        this.eventType = Objects.requireNonNull(eventType, "eventType cannot be null");
        this.staleTime = Objects.requireNonNull(staleTime, "staleTime cannot be null");
        this.uidRegistry = Objects.requireNonNull(uidRegistry, "uidRegistry cannot be null");
        if (staleTime.isNegative() || staleTime.isZero()) {
            throw new IllegalArgumentException("staleTime must be positive");
        }
    }

    /**
     * Build the CoT event for a position observed at {@code now}.
     */
    public TrackingEvent encode(PositionRecord record, Instant now) {
        String uid = uidRegistry.uidFor(record.deviceId());
        double ce = circularError(record.fixQuality(), record.hdop());

        TrackingEvent.Detail detail = new TrackingEvent.Detail(
                new TrackingEvent.Contact(record.deviceId()),
                new TrackingEvent.PrecisionLocation(LOCATION_SOURCE, LOCATION_SOURCE),
                record.hasValidFix() ? new TrackingEvent.Track(0.0, 0.0) : null,
                new TrackingEvent.GpsStatus(
                        record.numSatellites(),
                        record.hdop(),
                        record.fixQuality(),
                        record.fixQualityDescription()),
                new TrackingEvent.DeviceInfo(record.deviceId(), DEVICE_INFO_TYPE),
                new TrackingEvent.Remarks(remarks(record))
        );

        return new TrackingEvent(
                TrackingEvent.COT_VERSION,
                uid,
                eventType,
                now,
                now,
                now.plus(staleTime),
                howFor(record.fixQuality()),
                new TrackingEvent.Point(record.latitude(), record.longitude(), record.altitude(), ce, ce),
                detail
        );
    }

    /**
     * Encode and serialize in one step, producing the newline-terminated bytes sent to TAK.
     *
     * @throws CotConversionException if the event cannot be built or serialized
     */
    public byte[] encodeToWire(PositionRecord record, Instant now) {
        try {
            byte[] wire = encode(record, now).toWireBytes();
            logger.debug("Converted GPGGA to CoT for device {} ({} bytes)", record.deviceId(), wire.length);
            return wire;
        } catch (RuntimeException e) {
            throw new CotConversionException("Failed to convert GPGGA to CoT for device " + record.deviceId(), e);
        }
    }

    public DeviceUidRegistry uidRegistry() {
        return uidRegistry;
    }

    static String howFor(int fixQuality) {
        FixQuality quality = FixQuality.fromCode(fixQuality);
        return quality != null ? quality.how() : FixQuality.GPS.how();
    }

    /**
     * Base error for the fix type, scaled by HDOP when one was reported, capped at 9999 m.
     */
    static double circularError(int fixQuality, double hdop) {
        FixQuality quality = FixQuality.fromCode(fixQuality);
        double base = quality != null ? quality.baseError() : UNKNOWN_FIX_BASE_ERROR;
        if (hdop > 0) {
            return Math.min(base * hdop, MAX_CIRCULAR_ERROR);
        }
        return base;
    }

    private static String remarks(PositionRecord record) {
        StringBuilder sb = new StringBuilder("GPGGA Device: ").append(record.deviceId());
        LocalTime time = record.timeOfFix();
        if (time != null) {
            sb.append(", GPS Time: ")
                    .append(time.getNano() == 0 ? WHOLE_SECONDS.format(time) : MICRO_SECONDS.format(time));
        }
        return sb.toString();
    }
}
