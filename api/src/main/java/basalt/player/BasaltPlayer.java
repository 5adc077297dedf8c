package basalt.player;

import basalt.node.Node;
import basalt.track.Track;
import basalt.voice.VoiceSession;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nonnegative;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;

/**
 * Read only view of a guild's player. Values may change concurrently as commands
 * and node events are applied; mutations go through {@link PlayerController}.
 */
public interface BasaltPlayer {
    /**
     * Returns the guild id of this player.
     *
     * @return The guild id for this player.
     */
    @Nonnull
    @CheckReturnValue
    String guildId();
    
    /**
     * Returns the node this player is currently bound to. Stalled and destroyed
     * players may still report their last node.
     *
     * @return The node this player is bound to.
     */
    @Nullable
    @CheckReturnValue
    Node node();
    
    /**
     * Returns the current state of this player.
     *
     * @return The state of this player.
     */
    @Nonnull
    @CheckReturnValue
    PlayerState state();
    
    /**
     * Returns the voice session used by this player.
     *
     * @return The voice session of this player.
     */
    @Nonnull
    @CheckReturnValue
    VoiceSession voiceSession();
    
    /**
     * Returns a snapshot of the queue, in play order.
     *
     * @return The queued tracks.
     */
    @Nonnull
    @CheckReturnValue
    List<Track> queue();
    
    /**
     * Returns the index of the current track in the queue, or -1 when idle.
     *
     * @return The current index.
     */
    @CheckReturnValue
    int currentIndex();
    
    /**
     * Returns the current track, or null when idle.
     *
     * @return The current track.
     */
    @Nullable
    @CheckReturnValue
    Track currentTrack();
    
    @Nonnull
    @CheckReturnValue
    LoopMode loopMode();
    
    @CheckReturnValue
    boolean paused();
    
    @Nonnegative
    @CheckReturnValue
    int volume();
    
    /**
     * Returns the estimated playback position of the current track, in milliseconds.
     * The estimate is the last position reported by the node plus the time elapsed
     * since, while playing.
     *
     * @return The estimated position.
     */
    @Nonnegative
    @CheckReturnValue
    long position();
    
    /**
     * Returns the time of the last command or event applied to this player, as
     * milliseconds since the epoch.
     *
     * @return The last activity timestamp.
     */
    @CheckReturnValue
    long lastActivity();
}
