package basalt.event;

import basalt.node.Node;
import basalt.player.BasaltPlayer;
import basalt.player.DestroyReason;
import basalt.track.Track;

import javax.annotation.Nonnegative;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Receives playback and node notifications. Methods are called from the thread
 * owning the player or node the notification is about, and must not block.
 */
public interface BasaltEventListener {
    default void onPlayerCreated(@Nonnull BasaltPlayer player) {
    }
    
    default void onPlayerDestroyed(@Nonnull BasaltPlayer player, @Nonnull DestroyReason reason) {
    }
    
    /**
     * Called when the node starts playing a track.
     *
     * @param player Player playing the track.
     * @param track  Track that started.
     */
    default void onTrackStart(@Nonnull BasaltPlayer player, @Nonnull Track track) {
    }
    
    /**
     * Called when the last track of the queue ended and the player went idle.
     *
     * @param player Player whose queue ended.
     */
    default void onQueueEnd(@Nonnull BasaltPlayer player) {
    }
    
    /**
     * Called once when a player skipped too many failing tracks in a row and gave up.
     * The player is idle when this is called.
     *
     * @param player              Player that gave up.
     * @param consecutiveFailures Number of tracks that failed in a row.
     * @param lastError           Error of the last failed track, if the node reported one.
     */
    default void onPlaybackFailed(@Nonnull BasaltPlayer player, @Nonnegative int consecutiveFailures,
                                  @Nullable String lastError) {
    }
    
    default void onPlayerStalled(@Nonnull BasaltPlayer player) {
    }
    
    default void onVoiceConnectionClosed(@Nonnull BasaltPlayer player, int closeCode,
                                         @Nullable String reason, boolean byRemote) {
    }
    
    default void onNodeReady(@Nonnull Node node, boolean resumed) {
    }
    
    /**
     * Called once when a node crosses the consecutive failure threshold. The node
     * keeps reconnecting, and takes no new players until it does.
     *
     * @param node Node that became unhealthy.
     */
    default void onNodeUnhealthy(@Nonnull Node node) {
    }
}
