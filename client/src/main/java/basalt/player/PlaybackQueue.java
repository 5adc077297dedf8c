package basalt.player;

import basalt.exceptions.AtBoundaryException;
import basalt.exceptions.QueueFullException;
import basalt.track.Track;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nonnegative;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Bounded, ordered track list with a cursor. The cursor is -1 exactly when
 * the queue is empty.
 */
public class PlaybackQueue {
    private final List<Track> tracks = new ArrayList<>();
    private final int limit;
    private final Random random;
    private int index = -1;
    
    public PlaybackQueue(@Nonnegative int limit, @Nonnull Random random) {
        if(limit < 1) {
            throw new IllegalArgumentException("Queue limit must be positive");
        }
        this.limit = limit;
        this.random = random;
    }
    
    /**
     * Appends a track. The cursor is moved to it if the queue was empty.
     *
     * @param track Track to append.
     *
     * @return The index of the appended track.
     *
     * @throws QueueFullException If the queue is full. The queue is not modified.
     */
    public synchronized int add(@Nonnull Track track) {
        if(tracks.size() >= limit) {
            throw new QueueFullException(limit);
        }
        tracks.add(track);
        if(index < 0) {
            index = tracks.size() - 1;
        }
        return tracks.size() - 1;
    }
    
    /**
     * Appends all tracks, or none if they don't fit.
     *
     * @param toAdd Tracks to append.
     *
     * @return The index of the first appended track.
     *
     * @throws QueueFullException If the tracks don't fit. The queue is not modified.
     */
    public synchronized int addAll(@Nonnull List<Track> toAdd) {
        if(tracks.size() + toAdd.size() > limit) {
            throw new QueueFullException(limit);
        }
        var first = tracks.size();
        tracks.addAll(toAdd);
        if(index < 0 && !toAdd.isEmpty()) {
            index = first;
        }
        return first;
    }
    
    /**
     * Moves the cursor to the given index.
     *
     * @param newIndex Index to move to.
     *
     * @return The track at that index.
     */
    @Nonnull
    public synchronized Track select(int newIndex) {
        if(newIndex < 0 || newIndex >= tracks.size()) {
            throw new IndexOutOfBoundsException("Index " + newIndex + " out of bounds for queue of " + tracks.size());
        }
        index = newIndex;
        return tracks.get(index);
    }
    
    /**
     * Moves the cursor forward according to a loop mode. Manual advances (skips)
     * move past the current track even in {@link LoopMode#TRACK}.
     *
     * @param mode   Loop mode to apply.
     * @param manual Whether this advance was requested by a user.
     *
     * @return The new current track, or null if the end was reached, in which
     * case the queue is cleared.
     */
    @Nullable
    public synchronized Track advance(@Nonnull LoopMode mode, boolean manual) {
        if(index < 0) {
            return null;
        }
        var size = tracks.size();
        int next;
        switch(mode) {
            case TRACK:
                next = manual ? index + 1 : index;
                break;
            case QUEUE:
                next = (index + 1) % size;
                break;
            case RANDOM:
                next = size == 1 ? index : randomOther(size);
                break;
            default:
                next = index + 1;
                break;
        }
        if(next >= size) {
            clear();
            return null;
        }
        index = next;
        return tracks.get(index);
    }
    
    /**
     * Moves the cursor one track back.
     *
     * @return The new current track.
     *
     * @throws AtBoundaryException If the cursor is on the first track.
     */
    @Nonnull
    public synchronized Track back() {
        if(index <= 0) {
            throw new AtBoundaryException();
        }
        index--;
        return tracks.get(index);
    }
    
    /**
     * Replaces the track under the cursor, if it is still the expected one.
     *
     * @param expected    Track expected to be current.
     * @param replacement Track to put in its place.
     *
     * @return True if the track was replaced.
     */
    public synchronized boolean replaceCurrent(@Nonnull Track expected, @Nonnull Track replacement) {
        if(index < 0 || !tracks.get(index).equals(expected)) {
            return false;
        }
        tracks.set(index, replacement);
        return true;
    }
    
    public synchronized void clear() {
        tracks.clear();
        index = -1;
    }
    
    @Nullable
    @CheckReturnValue
    public synchronized Track current() {
        return index < 0 ? null : tracks.get(index);
    }
    
    @CheckReturnValue
    public synchronized int index() {
        return index;
    }
    
    @CheckReturnValue
    public synchronized int size() {
        return tracks.size();
    }
    
    @CheckReturnValue
    public int limit() {
        return limit;
    }
    
    @Nonnull
    @CheckReturnValue
    public synchronized List<Track> snapshot() {
        return List.copyOf(tracks);
    }
    
    private int randomOther(int size) {
        var pick = random.nextInt(size - 1);
        return pick >= index ? pick + 1 : pick;
    }
}
