package basalt.player;

import basalt.event.EventDispatcherImpl;
import basalt.exceptions.NodeUnavailableException;
import basalt.exceptions.PlayerNotFoundException;
import basalt.exceptions.TrackLoadFailedException;
import basalt.node.NodeHealth;
import basalt.node.NodeLink;
import basalt.node.NodeListener;
import basalt.protocol.InboundMessage;
import basalt.protocol.OutboundCommand;
import basalt.protocol.PlayerEvent;
import basalt.track.EnqueueResult;
import basalt.track.LoadResult;
import basalt.track.Track;
import basalt.voice.VoiceSession;
import com.typesafe.config.Config;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.net.MalformedURLException;
import java.net.URL;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Registry of players and the nodes they are bound to. Every operation on a
 * player runs on that player's context, in submission order.
 */
public class PlayerManager implements PlayerController, NodeListener {
    private static final Logger log = LoggerFactory.getLogger(PlayerManager.class);
    private static final Pattern SEARCH_PREFIX = Pattern.compile("^[a-z]{2,}search:");
    
    private final Map<String, Player> players = new ConcurrentHashMap<>();
    private final Map<String, Long> idleTimers = new ConcurrentHashMap<>();
    private final Map<String, Long> stallTimers = new ConcurrentHashMap<>();
    private final List<NodeLink> nodes = new CopyOnWriteArrayList<>();
    private final Vertx vertx;
    private final Config config;
    private final EventDispatcherImpl dispatcher;
    private final Random random;
    private final long idleTimeout;
    private final long stallTimeout;
    private final String searchPrefix;
    
    public PlayerManager(@Nonnull Vertx vertx, @Nonnull Config config, @Nonnull EventDispatcherImpl dispatcher,
                         @Nonnull Random random) {
        this.vertx = vertx;
        this.config = config;
        this.dispatcher = dispatcher;
        this.random = random;
        this.idleTimeout = config.getDuration("player.idle-timeout", TimeUnit.MILLISECONDS);
        this.stallTimeout = config.getDuration("player.stall-timeout", TimeUnit.MILLISECONDS);
        this.searchPrefix = config.getString("player.search-prefix");
    }
    
    public void addNode(@Nonnull NodeLink node) {
        nodes.add(node);
    }
    
    @Nullable
    @Override
    public BasaltPlayer player(@Nonnull String guildId) {
        return players.get(guildId);
    }
    
    @Nonnull
    @Override
    public List<BasaltPlayer> players() {
        return List.copyOf(players.values());
    }
    
    @Nonnull
    @Override
    public Future<BasaltPlayer> assign(@Nonnull String guildId, @Nonnull VoiceSession session) {
        if(!guildId.equals(session.guildId())) {
            return Future.failedFuture(new IllegalArgumentException("Voice session is for guild " + session.guildId()));
        }
        var existing = players.get(guildId);
        if(existing != null) {
            return submit(existing, p -> {
                p.updateVoiceSession(session);
                return p;
            });
        }
        var node = selectNode(null);
        if(node == null) {
            return Future.failedFuture(new NodeUnavailableException("No healthy node available for guild " + guildId));
        }
        var created = new AtomicBoolean();
        var player = players.computeIfAbsent(guildId, id -> {
            created.set(true);
            return new Player(dispatcher, config, id, session, vertx.getOrCreateContext(), random);
        });
        if(!created.get()) {
            return submit(player, p -> {
                p.updateVoiceSession(session);
                return p;
            });
        }
        return submit(player, p -> {
            node.playerBound();
            p.bind(node);
            log.info("Created player for guild {} on node {}", guildId, node.name());
            dispatcher.onPlayerCreated(p);
            return p;
        });
    }
    
    @Nonnull
    @Override
    public Future<Void> updateVoiceSession(@Nonnull String guildId, @Nonnull VoiceSession session) {
        var player = players.get(guildId);
        if(player == null) {
            log.debug("Ignoring voice session for guild {} without player", guildId);
            return Future.succeededFuture();
        }
        return submit(player, p -> {
            p.updateVoiceSession(session);
            return null;
        });
    }
    
    @Nonnull
    @Override
    public Future<BasaltPlayer> rebind(@Nonnull String guildId) {
        var player = players.get(guildId);
        if(player == null) {
            return Future.failedFuture(new PlayerNotFoundException(guildId));
        }
        var target = selectNode(player.node());
        if(target == null) {
            log.warn("No node available to rebind player of guild {}", guildId);
            return release(guildId, DestroyReason.NODE_UNAVAILABLE)
                    .compose(v -> Future.failedFuture(new NodeUnavailableException("No healthy node available for guild " + guildId)));
        }
        var current = player.currentTrack();
        Future<Track> refreshed = current == null ? Future.succeededFuture() : reresolve(target, current);
        return refreshed.compose(track -> submit(player, p -> {
            var previous = p.node();
            if(previous == target && p.state() != PlayerState.STALLED) {
                return p;
            }
            cancel(stallTimers.remove(guildId));
            if(previous != null) {
                //stalled players were already taken off the lost node's load
                if(p.state() != PlayerState.STALLED) {
                    previous.playerUnbound();
                }
                if(previous != target && previous.available()) {
                    previous.discard(guildId);
                    previous.send(new OutboundCommand.Destroy(guildId))
                            .onFailure(e -> log.warn("Failed to destroy player of guild {} on node {}", guildId, previous.name(), e));
                }
            }
            if(track != null) {
                p.replaceCurrent(current, track);
            }
            target.playerBound();
            p.bind(target);
            log.info("Rebound player of guild {} from node {} to node {}", guildId,
                    previous == null ? null : previous.name(), target.name());
            return p;
        }));
    }
    
    @Nonnull
    @Override
    public Future<Void> release(@Nonnull String guildId) {
        return release(guildId, DestroyReason.REQUESTED);
    }
    
    @Nonnull
    public Future<Void> release(@Nonnull String guildId, @Nonnull DestroyReason reason) {
        var player = players.remove(guildId);
        cancel(idleTimers.remove(guildId));
        cancel(stallTimers.remove(guildId));
        if(player == null) {
            return Future.succeededFuture();
        }
        return submit(player, p -> {
            var node = p.node();
            var counted = p.state() != PlayerState.STALLED;
            if(p.destroy(reason) && counted && node != null) {
                node.playerUnbound();
            }
            return null;
        });
    }
    
    @Nonnull
    @Override
    public Future<LoadResult> resolve(@Nonnull String guildId, @Nonnull String query) {
        var player = players.get(guildId);
        if(player == null) {
            return Future.failedFuture(new PlayerNotFoundException(guildId));
        }
        var node = player.node();
        if(node == null || !node.available()) {
            node = selectNode(null);
        }
        if(node == null) {
            return Future.failedFuture(new NodeUnavailableException("No node available to resolve tracks"));
        }
        return node.rest().resolveTracks(identifier(query));
    }
    
    @Nonnull
    @Override
    public Future<EnqueueResult> play(@Nonnull String guildId, @Nonnull String query) {
        var player = players.get(guildId);
        if(player == null) {
            return Future.failedFuture(new PlayerNotFoundException(guildId));
        }
        return resolve(guildId, query).compose(result -> {
            switch(result.type()) {
                case TRACK_LOADED:
                    return submit(player, p -> p.enqueue(result.tracks().get(0)));
                case SEARCH_RESULT:
                    if(result.tracks().isEmpty()) {
                        return Future.succeededFuture(EnqueueResult.empty());
                    }
                    return submit(player, p -> p.enqueue(result.tracks().get(0)));
                case PLAYLIST_LOADED:
                    return submit(player, p -> p.enqueueAll(result.tracks(), result.selectedIndex()));
                case LOAD_FAILED:
                    return Future.failedFuture(new TrackLoadFailedException(
                            result.failureMessage() == null ? "Unknown error" : result.failureMessage(),
                            result.severity() == null ? LoadResult.Severity.FAULT : result.severity()
                    ));
                default:
                    return Future.succeededFuture(EnqueueResult.empty());
            }
        });
    }
    
    @Nonnull
    @Override
    public Future<EnqueueResult> enqueue(@Nonnull String guildId, @Nonnull Track track) {
        return withPlayer(guildId, p -> p.enqueue(track));
    }
    
    @Nonnull
    @Override
    public Future<EnqueueResult> enqueueAll(@Nonnull String guildId, @Nonnull List<Track> tracks, int selectedIndex) {
        return withPlayer(guildId, p -> p.enqueueAll(tracks, selectedIndex));
    }
    
    @Nonnull
    @Override
    public Future<Track> skip(@Nonnull String guildId) {
        return withPlayer(guildId, Player::skip);
    }
    
    @Nonnull
    @Override
    public Future<Track> previous(@Nonnull String guildId) {
        return withPlayer(guildId, Player::previous);
    }
    
    @Nonnull
    @Override
    public Future<Boolean> pause(@Nonnull String guildId) {
        return withPlayer(guildId, Player::pause);
    }
    
    @Nonnull
    @Override
    public Future<Boolean> resume(@Nonnull String guildId) {
        return withPlayer(guildId, Player::resume);
    }
    
    @Nonnull
    @Override
    public Future<Long> seek(@Nonnull String guildId, long position) {
        return withPlayer(guildId, p -> p.seek(position));
    }
    
    @Nonnull
    @Override
    public Future<Integer> setVolume(@Nonnull String guildId, int volume) {
        return withPlayer(guildId, p -> p.setVolume(volume));
    }
    
    @Nonnull
    @Override
    public Future<Void> setLoopMode(@Nonnull String guildId, @Nonnull LoopMode mode) {
        return withPlayer(guildId, p -> {
            p.setLoopMode(mode);
            return null;
        });
    }
    
    @Override
    public void onOccupancyChange(@Nonnull String guildId, int nonBotMembers) {
        var player = players.get(guildId);
        if(player == null) {
            return;
        }
        cancel(idleTimers.remove(guildId));
        if(nonBotMembers > 0) {
            return;
        }
        log.debug("Voice channel of guild {} is empty, destroying player in {}ms", guildId, idleTimeout);
        idleTimers.compute(guildId, (k, old) -> {
            cancel(old);
            return vertx.setTimer(idleTimeout, id -> {
                if(!idleTimers.remove(guildId, id)) {
                    return;
                }
                log.info("Voice channel of guild {} stayed empty for {}ms", guildId, idleTimeout);
                release(guildId, DestroyReason.IDLE_TIMEOUT);
            });
        });
    }
    
    @Nonnull
    @Override
    public Future<Void> onVoiceDisconnected(@Nonnull String guildId) {
        return release(guildId, DestroyReason.DISCONNECTED);
    }
    
    @Nonnull
    @Override
    public List<NodeHealth> nodeHealth() {
        return nodes.stream().map(NodeHealth::new).collect(Collectors.toList());
    }
    
    @Override
    public void onReady(@Nonnull NodeLink node, boolean resumed) {
        dispatcher.onNodeReady(node, resumed);
        if(resumed) {
            //runs before the node flushes buffered commands
            for(var player : playersOn(node)) {
                var state = player.state();
                if(state == PlayerState.STALLED || state == PlayerState.DESTROYED) {
                    continue;
                }
                node.send(new OutboundCommand.VoiceUpdate(player.voiceSession()))
                        .onFailure(e -> log.warn("Failed to resend voice update for guild {}", player.guildId(), e));
            }
        }
        rebindStalled();
    }
    
    @Override
    public void onSessionLost(@Nonnull NodeLink node) {
        var affected = playersOn(node);
        if(affected.isEmpty()) {
            return;
        }
        log.warn("Node {} lost its session, stalling {} players", node.name(), affected.size());
        for(var player : affected) {
            submit(player, p -> {
                if(p.markStalled()) {
                    node.playerUnbound();
                }
                return null;
            }).onSuccess(v -> {
                scheduleStallTimeout(player);
                if(selectNode(null) != null) {
                    rebind(player.guildId()).onFailure(e -> log.warn("Failed to rebind player of guild {}", player.guildId(), e));
                }
            });
        }
    }
    
    @Override
    public void onUnhealthy(@Nonnull NodeLink node) {
        dispatcher.onNodeUnhealthy(node);
    }
    
    @Override
    public void onPlayerUpdate(@Nonnull NodeLink node, @Nonnull InboundMessage.PlayerUpdate update) {
        var player = routed(node, update.guildId());
        if(player != null) {
            player.context().runOnContext(__ -> player.handlePlayerUpdate(update));
        }
    }
    
    @Override
    public void onPlayerEvent(@Nonnull NodeLink node, @Nonnull PlayerEvent event) {
        var player = routed(node, event.guildId());
        if(player != null) {
            submit(player, p -> {
                p.handleEvent(event);
                return null;
            });
        }
    }
    
    /**
     * Picks the least loaded healthy ready node, preferring nodes other than the given one.
     *
     * @param avoid Node to avoid, if another one is available.
     *
     * @return The selected node, or null if no node is available.
     */
    @Nullable
    @CheckReturnValue
    public NodeLink selectNode(@Nullable NodeLink avoid) {
        var candidates = nodes.stream()
                .filter(NodeLink::available)
                .sorted(Comparator.comparingInt(NodeLink::load))
                .collect(Collectors.toList());
        for(var candidate : candidates) {
            if(candidate != avoid) {
                return candidate;
            }
        }
        return candidates.isEmpty() ? null : candidates.get(0);
    }
    
    /**
     * Applies a search prefix to queries that are neither urls nor prefixed already.
     * A {@code raw:} prefix sends the rest of the query verbatim.
     *
     * @param query Query to convert.
     *
     * @return The identifier to send to the node.
     */
    @Nonnull
    @CheckReturnValue
    public String identifier(@Nonnull String query) {
        if(isUrl(query) || SEARCH_PREFIX.matcher(query).find()) {
            return query;
        }
        if(query.startsWith("raw:")) {
            return query.substring(4);
        }
        return searchPrefix + query;
    }
    
    @Nonnull
    private Future<Track> reresolve(@Nonnull NodeLink target, @Nonnull Track track) {
        var uri = track.info().uri();
        if(uri == null) {
            return Future.succeededFuture(track);
        }
        return target.rest().resolveTracks(uri).map(result -> {
            if(result.type() == LoadResult.Type.TRACK_LOADED) {
                return result.tracks().get(0);
            }
            log.debug("Could not re-resolve {} on node {} ({}), keeping old encoding", track, target.name(), result.type());
            return track;
        }).otherwise(e -> {
            log.warn("Could not re-resolve {} on node {}, keeping old encoding", track, target.name(), e);
            return track;
        });
    }
    
    private void rebindStalled() {
        for(var player : players.values()) {
            if(player.state() == PlayerState.STALLED && selectNode(null) != null) {
                rebind(player.guildId()).onFailure(e -> log.warn("Failed to rebind player of guild {}", player.guildId(), e));
            }
        }
    }
    
    private void scheduleStallTimeout(@Nonnull Player player) {
        var guildId = player.guildId();
        stallTimers.compute(guildId, (k, old) -> {
            cancel(old);
            return vertx.setTimer(stallTimeout, id -> {
                if(!stallTimers.remove(guildId, id)) {
                    return;
                }
                if(player.state() == PlayerState.STALLED && players.get(guildId) == player) {
                    log.warn("Player of guild {} stayed stalled for {}ms", guildId, stallTimeout);
                    release(guildId, DestroyReason.NODE_UNAVAILABLE);
                }
            });
        });
    }
    
    @Nullable
    private Player routed(@Nonnull NodeLink node, @Nonnull String guildId) {
        var player = players.get(guildId);
        if(player == null) {
            log.debug("Dropping message from node {} for unknown guild {}", node.name(), guildId);
            return null;
        }
        if(player.node() != node) {
            log.debug("Dropping message from node {} for guild {}, bound to another node", node.name(), guildId);
            return null;
        }
        return player;
    }
    
    @Nonnull
    private List<Player> playersOn(@Nonnull NodeLink node) {
        var list = new ArrayList<Player>();
        for(var player : players.values()) {
            if(player.node() == node) {
                list.add(player);
            }
        }
        return list;
    }
    
    @Nonnull
    private <T> Future<T> withPlayer(@Nonnull String guildId, @Nonnull Function<Player, T> action) {
        var player = players.get(guildId);
        if(player == null) {
            return Future.failedFuture(new PlayerNotFoundException(guildId));
        }
        return submit(player, action);
    }
    
    /**
     * Runs an action on the context of a player. The future completes after the
     * commands the action sent were handed to the node.
     */
    @Nonnull
    private <T> Future<T> submit(@Nonnull Player player, @Nonnull Function<Player, T> action) {
        var promise = Promise.<T>promise();
        player.context().runOnContext(__ -> {
            if(player.destroyed()) {
                promise.fail(new PlayerNotFoundException(player.guildId()));
                return;
            }
            T result;
            try {
                result = action.apply(player);
            } catch(RuntimeException e) {
                player.drainSent();
                promise.fail(e);
                return;
            }
            Future<Void> delivered = Future.succeededFuture();
            for(var future : player.drainSent()) {
                delivered = delivered.compose(v -> future);
            }
            delivered.map(result).onComplete(promise);
        });
        return promise.future();
    }
    
    private void cancel(@Nullable Long timer) {
        if(timer != null) {
            vertx.cancelTimer(timer);
        }
    }
    
    private static boolean isUrl(@Nonnull String query) {
        try {
            new URL(query);
            return true;
        } catch(MalformedURLException e) {
            return false;
        }
    }
}
