package basalt.player;

/**
 * Policy applied when a track ends naturally.
 */
public enum LoopMode {
    /**
     * Move to the next track, going idle after the last one.
     */
    NONE,
    /**
     * Replay the current track.
     */
    TRACK,
    /**
     * Move to the next track, wrapping to the first one after the last.
     */
    QUEUE,
    /**
     * Pick a random track other than the current one. Behaves like {@link #TRACK}
     * when the queue has a single track.
     */
    RANDOM
}
