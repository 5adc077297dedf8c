package basalt.track;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nonnegative;
import javax.annotation.Nonnull;
import java.util.List;

/**
 * Describes what an enqueue operation did to a player's queue.
 */
public class EnqueueResult {
    private static final EnqueueResult EMPTY = new EnqueueResult(List.of(), -1, false);
    
    private final List<Track> added;
    private final int position;
    private final boolean started;
    
    public EnqueueResult(@Nonnull List<Track> added, int position, boolean started) {
        this.added = List.copyOf(added);
        this.position = position;
        this.started = started;
    }
    
    @Nonnull
    @CheckReturnValue
    public static EnqueueResult empty() {
        return EMPTY;
    }
    
    /**
     * Returns the tracks appended to the queue, in queue order.
     *
     * @return The added tracks.
     */
    @Nonnull
    @CheckReturnValue
    public List<Track> added() {
        return added;
    }
    
    /**
     * Returns the queue index of the first added track, or -1 if nothing was added.
     *
     * @return Queue index of the first added track.
     */
    @CheckReturnValue
    public int position() {
        return position;
    }
    
    /**
     * Returns whether this operation started playback on an idle player.
     *
     * @return True if playback was started.
     */
    @CheckReturnValue
    public boolean startedPlaying() {
        return started;
    }
    
    @Nonnegative
    @CheckReturnValue
    public int count() {
        return added.size();
    }
}
