package basalt.node.transport;

import basalt.exceptions.BasaltException;

/**
 * Connection level failure. Handled by reconnecting, never reported for a single command.
 */
public class TransportException extends BasaltException {
    public TransportException(String message) {
        super(message);
    }
}
