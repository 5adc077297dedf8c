package basalt.exceptions;

import basalt.player.PlayerState;

import javax.annotation.Nonnull;

/**
 * Thrown when an operation is not valid for the current state of a player.
 */
public class PlayerStateException extends BasaltException {
    private final PlayerState state;
    
    public PlayerStateException(@Nonnull PlayerState state, @Nonnull String message) {
        super(message + " (state " + state + ")");
        this.state = state;
    }
    
    @Nonnull
    public PlayerState state() {
        return state;
    }
}
