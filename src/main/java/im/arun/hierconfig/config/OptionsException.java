package im.arun.hierconfig.config;

/**
 * Options or rule files that are missing, unreadable or malformed.
 */
public class OptionsException extends RuntimeException {

    public OptionsException(String message) {
        super(message);
    }

    public OptionsException(String message, Throwable cause) {
        super(message, cause);
    }
}
