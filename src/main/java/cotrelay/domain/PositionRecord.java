package cotrelay.domain;

import java.time.LocalTime;
import java.util.Objects;

/**
 * A validated position report decoded from one GPGGA sentence.
 * Optional fields ({@code timeOfFix}, {@code geoidSeparation}, {@code dgpsAge},
 * {@code dgpsStationId}) are {@code null} when the sentence left them empty.
 */
public record PositionRecord(
        LocalTime timeOfFix,
        double latitude,
        double longitude,
        int fixQuality,
        int numSatellites,
        double hdop,
        double altitude,
        Double geoidSeparation,
        Double dgpsAge,
        String dgpsStationId,
        String deviceId
) {
    public PositionRecord {
        Objects.requireNonNull(deviceId, "deviceId cannot be null");
        if (deviceId.isBlank()) {
            throw new IllegalArgumentException("deviceId cannot be blank");
        }
        if (fixQuality < FixQuality.MIN_CODE || fixQuality > FixQuality.MAX_CODE) {
            throw new IllegalArgumentException(
                    "Fix quality must be between 0 and 8, got " + fixQuality);
        }
        if (numSatellites < 0) {
            throw new IllegalArgumentException(
                    "Number of satellites cannot be negative, got " + numSatellites);
        }
        if (!(hdop >= 0.0)) {
            throw new IllegalArgumentException("HDOP cannot be negative, got " + hdop);
        }
        if (!(latitude >= -90.0 && latitude <= 90.0)) {
            throw new IllegalArgumentException("Latitude out of range: " + latitude);
        }
        if (!(longitude >= -180.0 && longitude <= 180.0)) {
            throw new IllegalArgumentException("Longitude out of range: " + longitude);
        }
    }

    /**
     * A fix quality of zero means the receiver had no position solution.
     */
    public boolean hasValidFix() {
        return fixQuality > 0;
    }

    public String fixQualityDescription() {
        FixQuality quality = FixQuality.fromCode(fixQuality);
        return quality != null ? quality.description() : "Unknown";
    }
}
