package basalt.exceptions;

/**
 * Thrown when a node declines a player command, for example one for a guild it
 * does not know about.
 */
public class CommandRejectedException extends RestException {
    public CommandRejectedException(int status, String message) {
        super(Kind.SERVER_REJECTED, status, message);
    }
}
