package basalt.player;

public enum DestroyReason {
    /**
     * Released by the command layer, for example with a stop command.
     */
    REQUESTED,
    /**
     * No listener remained in the voice channel for the configured idle timeout.
     */
    IDLE_TIMEOUT,
    /**
     * The node holding the player was lost and no other node could take it.
     */
    NODE_UNAVAILABLE,
    /**
     * The bot was disconnected from the voice channel.
     */
    DISCONNECTED
}
