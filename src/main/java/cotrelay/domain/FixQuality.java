package cotrelay.domain;

/**
 * GPS fix quality codes reported in field 6 of a GPGGA sentence.
 * Each code carries the CoT {@code how} marker and the base horizontal error
 * (meters) used when estimating the circular error of a report.
 */
public enum FixQuality {
    INVALID(0, "Invalid", "h-g-i-g-o", 9999.0),
    GPS(1, "GPS fix", "h-gps", 5.0),
    DGPS(2, "DGPS fix", "h-dgps", 2.0),
    PPS(3, "PPS fix", "h-pps", 1.0),
    RTK(4, "Real Time Kinematic", "h-rtk", 0.1),
    FLOAT_RTK(5, "Float RTK", "h-rtk", 0.5),
    ESTIMATED(6, "Estimated", "h-e", 10.0),
    MANUAL(7, "Manual input", "h-m", 50.0),
    SIMULATION(8, "Simulation", "h-s", 100.0);

    public static final int MIN_CODE = 0;
    public static final int MAX_CODE = 8;

    private final int code;
    private final String description;
    private final String how;
    private final double baseError;

    FixQuality(int code, String description, String how, double baseError) {
        this.code = code;
        this.description = description;
        this.how = how;
        this.baseError = baseError;
    }

    public int code() {
        return code;
    }

    public String description() {
        return description;
    }

    public String how() {
        return how;
    }

    public double baseError() {
        return baseError;
    }

    /**
     * Look up a fix quality by its numeric code.
     *
     * @param code the GPGGA fix quality digit
     * @return the matching constant, or {@code null} if the code is outside 0-8
     */
    public static FixQuality fromCode(int code) {
        for (FixQuality quality : values()) {
            if (quality.code == code) {
                return quality;
            }
        }
        return null;
    }
}
