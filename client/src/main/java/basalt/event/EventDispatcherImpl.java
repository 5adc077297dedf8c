package basalt.event;

import basalt.node.Node;
import basalt.player.BasaltPlayer;
import basalt.player.DestroyReason;
import basalt.track.Track;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnegative;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

public class EventDispatcherImpl implements EventDispatcher {
    private static final Logger log = LoggerFactory.getLogger(EventDispatcher.class);
    
    private final Set<BasaltEventListener> listeners = ConcurrentHashMap.newKeySet();
    
    @Override
    public void register(@Nonnull BasaltEventListener listener) {
        listeners.add(listener);
    }
    
    @Override
    public void unregister(@Nonnull BasaltEventListener listener) {
        listeners.remove(listener);
    }
    
    public void onPlayerCreated(@Nonnull BasaltPlayer player) {
        forEach(l -> l.onPlayerCreated(player));
    }
    
    public void onPlayerDestroyed(@Nonnull BasaltPlayer player, @Nonnull DestroyReason reason) {
        forEach(l -> l.onPlayerDestroyed(player, reason));
    }
    
    public void onTrackStart(@Nonnull BasaltPlayer player, @Nonnull Track track) {
        forEach(l -> l.onTrackStart(player, track));
    }
    
    public void onQueueEnd(@Nonnull BasaltPlayer player) {
        forEach(l -> l.onQueueEnd(player));
    }
    
    public void onPlaybackFailed(@Nonnull BasaltPlayer player, @Nonnegative int consecutiveFailures,
                                 @Nullable String lastError) {
        forEach(l -> l.onPlaybackFailed(player, consecutiveFailures, lastError));
    }
    
    public void onPlayerStalled(@Nonnull BasaltPlayer player) {
        forEach(l -> l.onPlayerStalled(player));
    }
    
    public void onVoiceConnectionClosed(@Nonnull BasaltPlayer player, int closeCode,
                                        @Nullable String reason, boolean byRemote) {
        forEach(l -> l.onVoiceConnectionClosed(player, closeCode, reason, byRemote));
    }
    
    public void onNodeReady(@Nonnull Node node, boolean resumed) {
        forEach(l -> l.onNodeReady(node, resumed));
    }
    
    public void onNodeUnhealthy(@Nonnull Node node) {
        forEach(l -> l.onNodeUnhealthy(node));
    }
    
    private void forEach(Consumer<BasaltEventListener> action) {
        for(var v : listeners) {
            try {
                action.accept(v);
            } catch(Throwable t) {
                log.error("Error dispatching event to {}: ", v, t);
            }
        }
    }
}
