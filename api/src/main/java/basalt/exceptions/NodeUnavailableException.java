package basalt.exceptions;

/**
 * Thrown when no healthy, ready node can take a player.
 */
public class NodeUnavailableException extends BasaltException {
    public NodeUnavailableException(String message) {
        super(message);
    }
}
