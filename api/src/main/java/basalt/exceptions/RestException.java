package basalt.exceptions;

import javax.annotation.Nonnull;

/**
 * Failure of a REST call to a node.
 */
public class RestException extends BasaltException {
    public enum Kind {
        /**
         * The node could not be reached, or the connection broke before a response
         * was read. Retried internally before being reported.
         */
        NETWORK,
        /**
         * The node answered with a non successful status. Never retried.
         */
        SERVER_REJECTED
    }
    
    private final Kind kind;
    private final int status;
    
    public RestException(@Nonnull Kind kind, int status, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.status = status;
    }
    
    public RestException(@Nonnull Kind kind, int status, String message) {
        this(kind, status, message, null);
    }
    
    @Nonnull
    public Kind kind() {
        return kind;
    }
    
    /**
     * Returns the HTTP status the node answered with, or -1 for network failures.
     *
     * @return The HTTP status.
     */
    public int status() {
        return status;
    }
    
    public boolean isRetryable() {
        return kind == Kind.NETWORK;
    }
}
