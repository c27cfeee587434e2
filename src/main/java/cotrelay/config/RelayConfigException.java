package cotrelay.config;

/**
 * A configuration variable is missing, malformed or out of range.
 */
public class RelayConfigException extends RuntimeException {

    private final String variable;

    public RelayConfigException(String variable, String message) {
        this(variable, message, null);
    }

    public RelayConfigException(String variable, String message, Throwable cause) {
        super(variable + ": " + message, cause);
        this.variable = variable;
    }

    /**
     * @return the environment variable that failed validation
     */
    public String getVariable() {
        return variable;
    }
}
