package basalt.protocol;

/**
 * Thrown when a payload received from a node can't be decoded. The payload is
 * dropped; the connection it came from is kept.
 */
public class CodecException extends Exception {
    public CodecException(String message) {
        super(message);
    }
    
    public CodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
