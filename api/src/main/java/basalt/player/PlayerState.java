package basalt.player;

public enum PlayerState {
    /**
     * Nothing queued, or the queue was exhausted.
     */
    IDLE,
    PLAYING,
    PAUSED,
    /**
     * The node holding this player restarted without resuming its session. The
     * player keeps its queue but sends nothing until it is bound to a node again.
     */
    STALLED,
    /**
     * Terminal state. Destroyed players reject every operation.
     */
    DESTROYED
}
