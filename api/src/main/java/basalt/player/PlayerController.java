package basalt.player;

import basalt.node.NodeHealth;
import basalt.track.EnqueueResult;
import basalt.track.LoadResult;
import basalt.track.Track;
import basalt.voice.VoiceSession;
import io.vertx.core.Future;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nonnegative;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;

/**
 * Entry point for the command layer. Every operation on a guild is applied in
 * call order, after the operations previously issued for the same guild; the
 * returned futures complete once the player state was updated.
 *
 * Player operations on a guild without a player fail with
 * {@link basalt.exceptions.PlayerNotFoundException}.
 */
public interface PlayerController {
    /**
     * Returns the player of a guild, if it exists.
     *
     * @param guildId Guild id of the player.
     *
     * @return The player, or null if the guild has none.
     */
    @Nullable
    @CheckReturnValue
    BasaltPlayer player(@Nonnull String guildId);
    
    /**
     * Returns a snapshot of all live players.
     *
     * @return The live players.
     */
    @Nonnull
    @CheckReturnValue
    List<BasaltPlayer> players();
    
    /**
     * Creates the player of a guild on the least loaded healthy node, or replaces
     * the voice session of the existing one.
     *
     * @param guildId Guild id of the player.
     * @param session Voice session to use.
     *
     * @return The player. Fails with {@link basalt.exceptions.NodeUnavailableException}
     * when no node can take a new player.
     */
    @Nonnull
    Future<BasaltPlayer> assign(@Nonnull String guildId, @Nonnull VoiceSession session);
    
    /**
     * Replaces the voice session of an existing player. Does nothing if the
     * guild has no player.
     *
     * @param guildId Guild id of the player.
     * @param session New voice session.
     *
     * @return A future completed once the session was replaced.
     */
    @Nonnull
    Future<Void> updateVoiceSession(@Nonnull String guildId, @Nonnull VoiceSession session);
    
    /**
     * Moves a player to another healthy node, destroying it if none is available.
     *
     * @param guildId Guild id of the player.
     *
     * @return The player after being rebound.
     */
    @Nonnull
    Future<BasaltPlayer> rebind(@Nonnull String guildId);
    
    /**
     * Destroys the player of a guild, telling its node to drop it. Succeeds if the
     * guild has no player.
     *
     * @param guildId Guild id of the player.
     *
     * @return A future completed once the player was destroyed.
     */
    @Nonnull
    Future<Void> release(@Nonnull String guildId);
    
    /**
     * Resolves a query using the node of the player.
     *
     * @param guildId Guild id of the player.
     * @param query   Url, search query or identifier.
     *
     * @return The load result.
     */
    @Nonnull
    Future<LoadResult> resolve(@Nonnull String guildId, @Nonnull String query);
    
    /**
     * Resolves a query and enqueues the result. Playlists are added as a whole,
     * search results add their first track.
     *
     * @param guildId Guild id of the player.
     * @param query   Url, search query or identifier.
     *
     * @return What was enqueued. Fails with {@link basalt.exceptions.TrackLoadFailedException}
     * if the node failed to load the query.
     */
    @Nonnull
    Future<EnqueueResult> play(@Nonnull String guildId, @Nonnull String query);
    
    @Nonnull
    Future<EnqueueResult> enqueue(@Nonnull String guildId, @Nonnull Track track);
    
    @Nonnull
    Future<EnqueueResult> enqueueAll(@Nonnull String guildId, @Nonnull List<Track> tracks, int selectedIndex);
    
    /**
     * Skips the current track.
     *
     * @param guildId Guild id of the player.
     *
     * @return The new current track, or null if the player went idle.
     */
    @Nonnull
    Future<Track> skip(@Nonnull String guildId);
    
    /**
     * Goes back to the previous track. Fails with {@link basalt.exceptions.AtBoundaryException}
     * on the first track.
     *
     * @param guildId Guild id of the player.
     *
     * @return The new current track.
     */
    @Nonnull
    Future<Track> previous(@Nonnull String guildId);
    
    @Nonnull
    Future<Boolean> pause(@Nonnull String guildId);
    
    @Nonnull
    Future<Boolean> resume(@Nonnull String guildId);
    
    /**
     * Seeks the current track. Positions outside the track are clamped.
     *
     * @param guildId  Guild id of the player.
     * @param position Target position, in milliseconds.
     *
     * @return The position actually sought to.
     */
    @Nonnull
    Future<Long> seek(@Nonnull String guildId, long position);
    
    @Nonnull
    Future<Integer> setVolume(@Nonnull String guildId, int volume);
    
    @Nonnull
    Future<Void> setLoopMode(@Nonnull String guildId, @Nonnull LoopMode mode);
    
    /**
     * Reports how many members other than the bot are in the player's voice channel.
     * Starts the idle timer when it reaches zero and cancels it otherwise.
     *
     * @param guildId  Guild id of the player.
     * @param nonBotMembers Number of listeners in the channel.
     */
    void onOccupancyChange(@Nonnull String guildId, @Nonnegative int nonBotMembers);
    
    /**
     * Reports that the bot left the voice channel of a guild.
     *
     * @param guildId Guild id of the player.
     *
     * @return A future completed once the player was destroyed.
     */
    @Nonnull
    Future<Void> onVoiceDisconnected(@Nonnull String guildId);
    
    /**
     * Returns a health snapshot of every configured node.
     *
     * @return The node health snapshot.
     */
    @Nonnull
    @CheckReturnValue
    List<NodeHealth> nodeHealth();
}
