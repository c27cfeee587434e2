package cotrelay.domain;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlText;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Cursor-on-Target position event, serialized as a single {@code <event>} XML document.
 * Built once by the encoder and never modified afterwards.
 */
@JacksonXmlRootElement(localName = "event")
@JsonPropertyOrder({"version", "uid", "type", "time", "start", "stale", "how", "point", "detail"})
public record TrackingEvent(
        @JacksonXmlProperty(isAttribute = true) String version,
        @JacksonXmlProperty(isAttribute = true) String uid,
        @JacksonXmlProperty(isAttribute = true) String type,
        @JacksonXmlProperty(isAttribute = true)
        @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = TrackingEvent.TIME_PATTERN, timezone = "UTC")
        Instant time,
        @JacksonXmlProperty(isAttribute = true)
        @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = TrackingEvent.TIME_PATTERN, timezone = "UTC")
        Instant start,
        @JacksonXmlProperty(isAttribute = true)
        @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = TrackingEvent.TIME_PATTERN, timezone = "UTC")
        Instant stale,
        @JacksonXmlProperty(isAttribute = true) String how,
        Point point,
        Detail detail
) {
    public static final String COT_VERSION = "2.0";

    /** ISO-8601 UTC with microseconds and a literal Z, as TAK servers expect. */
    public static final String TIME_PATTERN = "yyyy-MM-dd'T'HH:mm:ss.SSSSSS'Z'";

    private static final ObjectMapper MAPPER = new XmlMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    /**
     * Render this event as CoT XML (no XML declaration).
     *
     * @throws IllegalStateException if serialization fails
     */
    public String toXml() {
        try {
            return MAPPER.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("CoT XML serialization failed", e);
        }
    }

    /**
     * Newline-terminated UTF-8 bytes, the framing used on the TAK stream.
     */
    public byte[] toWireBytes() {
        return (toXml() + "\n").getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Location with circular ({@code ce}) and linear ({@code le}) error in meters.
     */
    @JsonPropertyOrder({"lat", "lon", "hae", "ce", "le"})
    public record Point(
            @JacksonXmlProperty(isAttribute = true) double lat,
            @JacksonXmlProperty(isAttribute = true) double lon,
            @JacksonXmlProperty(isAttribute = true) double hae,
            @JacksonXmlProperty(isAttribute = true) double ce,
            @JacksonXmlProperty(isAttribute = true) double le
    ) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonPropertyOrder({"contact", "precisionlocation", "track", "__gps", "__device", "remarks"})
    public record Detail(
            Contact contact,
            @JsonProperty("precisionlocation") PrecisionLocation precisionLocation,
            Track track,
            @JsonProperty("__gps") GpsStatus gpsStatus,
            @JsonProperty("__device") DeviceInfo deviceInfo,
            Remarks remarks
    ) {}

    public record Contact(@JacksonXmlProperty(isAttribute = true) String callsign) {}

    @JsonPropertyOrder({"altsrc", "geopointsrc"})
    public record PrecisionLocation(
            @JacksonXmlProperty(isAttribute = true) String altsrc,
            @JacksonXmlProperty(isAttribute = true) String geopointsrc
    ) {}

    /**
     * GPGGA has no course or speed, so a track is always stationary.
     */
    @JsonPropertyOrder({"course", "speed"})
    public record Track(
            @JacksonXmlProperty(isAttribute = true) double course,
            @JacksonXmlProperty(isAttribute = true) double speed
    ) {}

    @JsonPropertyOrder({"numSats", "hdop", "fixQuality", "fixQualityDesc"})
    public record GpsStatus(
            @JacksonXmlProperty(isAttribute = true) int numSats,
            @JacksonXmlProperty(isAttribute = true) double hdop,
            @JacksonXmlProperty(isAttribute = true) int fixQuality,
            @JacksonXmlProperty(isAttribute = true) String fixQualityDesc
    ) {}

    @JsonPropertyOrder({"uid", "type"})
    public record DeviceInfo(
            @JacksonXmlProperty(isAttribute = true) String uid,
            @JacksonXmlProperty(isAttribute = true) String type
    ) {}

    public record Remarks(@JacksonXmlText String text) {}
}
