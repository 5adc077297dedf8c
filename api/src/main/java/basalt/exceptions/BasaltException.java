package basalt.exceptions;

/**
 * Base class of every error reported to users of the client.
 */
public class BasaltException extends RuntimeException {
    public BasaltException(String message) {
        super(message);
    }
    
    public BasaltException(String message, Throwable cause) {
        super(message, cause);
    }
}
