package cotrelay.parser;

import cotrelay.domain.ParseError;
import cotrelay.domain.ParseResult;
import cotrelay.domain.PositionRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.time.LocalTime;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses NMEA GPGGA sentences extended with a trailing device identifier field.
 *
 * <pre>
 * $GPGGA,hhmmss.ss,ddmm.mmmm,N,dddmm.mmmm,W,q,nn,h.h,a.a,M,g.g,M,age,station,DEVICE*CS
 * </pre>
 *
 * The checksum is verified before the sentence structure is looked at, so a corrupted
 * sentence is always reported as {@link ParseError#CHECKSUM_MISMATCH}. Instances are
 * stateless and safe to share between threads.
 */
public class GpggaSentenceParser {
    private static final Logger logger = LoggerFactory.getLogger(GpggaSentenceParser.class);

    public static final char SENTENCE_START = '$';
    public static final char CHECKSUM_DELIMITER = '*';

    // The DGPS station id and its comma may be omitted entirely, so both
    // "...,M,,DEV1*CS" and "...,M,,,DEV1*CS" carry device id DEV1.
    private static final Pattern GPGGA_PATTERN = Pattern.compile(
            "^\\$GPGGA,"
                    + "(\\d{6}(?:\\.\\d+)?)?,"      // 1 time hhmmss.sss
                    + "(\\d+\\.\\d+),"              // 2 latitude ddmm.mmmm
                    + "([NS]),"                     // 3
                    + "(\\d+\\.\\d+),"              // 4 longitude dddmm.mmmm
                    + "([EW]),"                     // 5
                    + "([0-8]),"                    // 6 fix quality
                    + "(\\d+),"                     // 7 satellites
                    + "(\\d+(?:\\.\\d+)?)?,"        // 8 hdop
                    + "(-?\\d+\\.?\\d*),"           // 9 altitude
                    + "M,"
                    + "(-?\\d+\\.?\\d*)?,"          // 10 geoid separation
                    + "M?,"
                    + "(\\d+\\.?\\d*)?,"            // 11 dgps age
                    + "(?:(\\d+)?,)?"               // 12 dgps station id
                    + "([^*]+)"                     // 13 device id
                    + "\\*([0-9A-Fa-f]{2})$");      // 14 checksum

    /**
     * Parse one sentence.
     *
     * @param sentence raw sentence text, surrounding whitespace allowed
     * @return the decoded record, or the reason it was rejected
     */
    public ParseResult parse(String sentence) {
        if (sentence == null) {
            return ParseResult.failure(ParseError.MALFORMED_SENTENCE, "sentence is null");
        }
        String trimmed = sentence.strip();

        int delimiter = trimmed.indexOf(CHECKSUM_DELIMITER);
        if (delimiter < 0) {
            return ParseResult.failure(ParseError.CHECKSUM_MISSING, "no '*' delimiter");
        }
        String payload = trimmed.substring(0, delimiter);
        String transmitted = trimmed.substring(delimiter + 1);
        if (!payload.isEmpty() && payload.charAt(0) == SENTENCE_START) {
            payload = payload.substring(1);
        }
        String computed = checksum(payload);
        if (!computed.equalsIgnoreCase(transmitted)) {
            return ParseResult.failure(ParseError.CHECKSUM_MISMATCH,
                    "expected " + computed + " but sentence carries " + transmitted);
        }

        Matcher m = GPGGA_PATTERN.matcher(trimmed);
        if (!m.matches()) {
            return ParseResult.failure(ParseError.MALFORMED_SENTENCE, "not an extended GPGGA sentence");
        }

        try {
            PositionRecord record = new PositionRecord(
                    parseTime(m.group(1)),
                    decodeCoordinate(m.group(2), "S".equals(m.group(3))),
                    decodeCoordinate(m.group(4), "W".equals(m.group(5))),
                    Integer.parseInt(m.group(6)),
                    Integer.parseInt(m.group(7)),
                    m.group(8) != null ? Double.parseDouble(m.group(8)) : 0.0,
                    Double.parseDouble(m.group(9)),
                    m.group(10) != null ? Double.valueOf(m.group(10)) : null,
                    m.group(11) != null ? Double.valueOf(m.group(11)) : null,
                    m.group(12),
                    m.group(13).strip()
            );
            return ParseResult.success(record);
        } catch (IllegalArgumentException e) {
            // NumberFormatException is an IllegalArgumentException too
            return ParseResult.failure(ParseError.INVALID_FIELD, e.getMessage());
        }
    }

    /**
     * XOR of every code point in {@code payload}, as at least two uppercase hex digits.
     * A payload with characters above U+00FF can yield more than two digits and then
     * never matches a transmitted checksum.
     */
    public static String checksum(String payload) {
        int sum = payload.codePoints().reduce(0, (acc, cp) -> acc ^ cp);
        return String.format("%02X", sum);
    }

    /**
     * Convert an NMEA {@code [d]ddmm.mmmm} field to signed decimal degrees. The two digits
     * left of the decimal point are whole minutes; anything before them is whole degrees.
     *
     * @param field    the packed degrees/minutes field
     * @param negative true for the southern or western hemisphere
     */
    public static double decodeCoordinate(String field, boolean negative) {
        int dot = field.indexOf('.');
        String integerPart = dot >= 0 ? field.substring(0, dot) : field;
        String fraction = dot >= 0 ? field.substring(dot + 1) : "0";

        double degrees;
        double minutes;
        if (integerPart.length() >= 2) {
            degrees = integerPart.length() > 2
                    ? Integer.parseInt(integerPart.substring(0, integerPart.length() - 2))
                    : 0;
            minutes = Double.parseDouble(
                    integerPart.substring(integerPart.length() - 2) + "." + fraction);
        } else {
            degrees = 0;
            minutes = Double.parseDouble(field);
        }

        double decimal = degrees + minutes / 60.0;
        return negative ? -decimal : decimal;
    }

    /**
     * Decode {@code hhmmss[.fff]}. A bad time only loses the field, it never rejects the sentence.
     */
    static LocalTime parseTime(String field) {
        if (field == null) {
            return null;
        }
        try {
            int hour = Integer.parseInt(field.substring(0, 2));
            int minute = Integer.parseInt(field.substring(2, 4));
            int second = Integer.parseInt(field.substring(4, 6));
            int nanos = 0;
            int dot = field.indexOf('.');
            if (dot >= 0) {
                String fraction = (field.substring(dot + 1) + "000000000").substring(0, 9);
                nanos = Integer.parseInt(fraction);
            }
            return LocalTime.of(hour, minute, second, nanos);
        } catch (DateTimeException | NumberFormatException e) {
            logger.warn("Invalid time format '{}', omitting time of fix", field);
            return null;
        }
    }
}
