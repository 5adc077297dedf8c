package basalt.exceptions;

/**
 * Thrown when moving backwards from the first track of a queue.
 */
public class AtBoundaryException extends BasaltException {
    public AtBoundaryException() {
        super("Already at the start of the queue");
    }
}
