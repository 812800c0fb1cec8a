package basix;

/**
 * Base class of all errors thrown by the formula transformations
 */
public class BasixException extends RuntimeException {

    public BasixException(String message) {
        super(message);
    }

    public BasixException(String message, Throwable cause) {
        super(message, cause);
    }
}
