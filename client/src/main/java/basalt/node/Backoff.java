package basalt.node;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nonnegative;

/**
 * Geometric delay schedule: {@code base * 2^attempt}, capped at {@code max}.
 */
public class Backoff {
    private final long baseDelay;
    private final long maxDelay;
    
    public Backoff(@Nonnegative long baseDelay, @Nonnegative long maxDelay) {
        if(baseDelay < 1) {
            throw new IllegalArgumentException("Base delay must be positive");
        }
        if(maxDelay < baseDelay) {
            throw new IllegalArgumentException("Max delay must not be smaller than base delay");
        }
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
    }
    
    /**
     * Returns the delay before a retry, in milliseconds.
     *
     * @param attempt Number of failed attempts before this retry, starting at 0.
     *
     * @return The delay.
     */
    @CheckReturnValue
    public long delay(@Nonnegative int attempt) {
        if(attempt <= 0) {
            return baseDelay;
        }
        //past this shift the multiplication overflows
        if(attempt >= Long.numberOfLeadingZeros(baseDelay) - 1) {
            return maxDelay;
        }
        return Math.min(maxDelay, baseDelay << attempt);
    }
    
    public long baseDelay() {
        return baseDelay;
    }
    
    public long maxDelay() {
        return maxDelay;
    }
}
