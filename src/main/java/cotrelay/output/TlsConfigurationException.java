package cotrelay.output;

/**
 * TLS credentials were configured but could not be loaded. Fatal at startup.
 */
public class TlsConfigurationException extends RuntimeException {

    public TlsConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
