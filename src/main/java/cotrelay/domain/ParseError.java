package cotrelay.domain;

/**
 * Reasons a sentence is rejected by the parser.
 */
public enum ParseError {
    /** No {@code *} delimiter, so there is nothing to verify. */
    CHECKSUM_MISSING,
    /** The XOR checksum over the payload does not match the transmitted one. */
    CHECKSUM_MISMATCH,
    /** The checksum is fine but the sentence does not follow the extended GPGGA grammar. */
    MALFORMED_SENTENCE,
    /** The sentence is well formed but a field value is out of range. */
    INVALID_FIELD
}
