package cotrelay.domain;

import java.util.Objects;

/**
 * Outcome of parsing one sentence: either a {@link PositionRecord} or a
 * {@link ParseError} with a short detail message. Exactly one side is set.
 */
public record ParseResult(PositionRecord position, ParseError error, String detail) {

    public ParseResult {
        if ((position == null) == (error == null)) {
            throw new IllegalArgumentException("Exactly one of position or error must be set");
        }
    }

    public static ParseResult success(PositionRecord position) {
        return new ParseResult(Objects.requireNonNull(position, "position cannot be null"), null, null);
    }

    public static ParseResult failure(ParseError error, String detail) {
        return new ParseResult(null, Objects.requireNonNull(error, "error cannot be null"), detail);
    }

    public boolean isSuccess() {
        return position != null;
    }
}
