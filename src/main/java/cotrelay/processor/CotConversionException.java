package cotrelay.processor;

/**
 * A position record could not be turned into CoT. Retrying the same record fails the same way.
 */
public class CotConversionException extends RuntimeException {

    public CotConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
