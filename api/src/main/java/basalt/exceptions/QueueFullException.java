package basalt.exceptions;

import javax.annotation.Nonnegative;

public class QueueFullException extends BasaltException {
    private final int limit;
    
    public QueueFullException(@Nonnegative int limit) {
        super("Queue is full (limit " + limit + ")");
        this.limit = limit;
    }
    
    @Nonnegative
    public int limit() {
        return limit;
    }
}
