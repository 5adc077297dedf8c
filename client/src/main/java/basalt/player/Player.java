package basalt.player;

import basalt.event.EventDispatcherImpl;
import basalt.exceptions.PlayerStateException;
import basalt.node.NodeLink;
import basalt.protocol.InboundMessage;
import basalt.protocol.OutboundCommand;
import basalt.protocol.PlayerEvent;
import basalt.track.EnqueueResult;
import basalt.track.Track;
import basalt.voice.VoiceSession;
import com.typesafe.config.Config;
import io.prometheus.client.Counter;
import io.vertx.core.Context;
import io.vertx.core.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Playback state of a guild. Not thread safe: every mutating method must be
 * called on {@link #context()}, which {@link PlayerManager} takes care of.
 * Getters may be called from any thread.
 */
public class Player implements BasaltPlayer {
    private static final Logger log = LoggerFactory.getLogger(Player.class);
    
    public static final int MAX_VOLUME = 1000;
    
    private static final Counter failedTracks = Counter.build()
            .namespace("basalt")
            .name("failed_tracks")
            .help("Tracks skipped because they failed or got stuck")
            .labelNames("cause")
            .register();
    
    private final List<Future<Void>> sent = new ArrayList<>();
    private final EventDispatcherImpl dispatcher;
    private final String guildId;
    private final Context context;
    private final PlaybackQueue queue;
    private final int maxAutoSkips;
    
    private volatile NodeLink node;
    private volatile VoiceSession voiceSession;
    private volatile LoopMode loopMode = LoopMode.NONE;
    private volatile boolean paused;
    private volatile int volume;
    private volatile boolean stalled;
    private volatile boolean destroyed;
    private volatile long position;
    private volatile long positionUpdated;
    private volatile long lastActivity = System.currentTimeMillis();
    private int consecutiveFailures;
    private String ignoredEnd;
    
    public Player(@Nonnull EventDispatcherImpl dispatcher, @Nonnull Config config, @Nonnull String guildId,
                  @Nonnull VoiceSession voiceSession, @Nonnull Context context, @Nonnull Random random) {
        this.dispatcher = dispatcher;
        this.guildId = guildId;
        this.voiceSession = voiceSession;
        this.context = context;
        this.queue = new PlaybackQueue(config.getInt("player.queue-limit"), random);
        this.maxAutoSkips = config.getInt("player.max-auto-skips");
        this.volume = clampVolume(config.getInt("player.default-volume"));
    }
    
    @Nonnull
    @CheckReturnValue
    public Context context() {
        return context;
    }
    
    @Nonnull
    @Override
    public String guildId() {
        return guildId;
    }
    
    @Nullable
    @Override
    public NodeLink node() {
        return node;
    }
    
    @Nonnull
    @Override
    public PlayerState state() {
        if(destroyed) {
            return PlayerState.DESTROYED;
        }
        if(stalled) {
            return PlayerState.STALLED;
        }
        if(queue.current() == null) {
            return PlayerState.IDLE;
        }
        return paused ? PlayerState.PAUSED : PlayerState.PLAYING;
    }
    
    @Nonnull
    @Override
    public VoiceSession voiceSession() {
        return voiceSession;
    }
    
    @Nonnull
    @Override
    public List<Track> queue() {
        return queue.snapshot();
    }
    
    @Override
    public int currentIndex() {
        return queue.index();
    }
    
    @Nullable
    @Override
    public Track currentTrack() {
        return queue.current();
    }
    
    @Nonnull
    @Override
    public LoopMode loopMode() {
        return loopMode;
    }
    
    @Override
    public boolean paused() {
        return paused;
    }
    
    @Override
    public int volume() {
        return volume;
    }
    
    @Override
    public long position() {
        var current = queue.current();
        if(current == null) {
            return 0;
        }
        var estimate = position;
        if(state() == PlayerState.PLAYING) {
            estimate += System.currentTimeMillis() - positionUpdated;
        }
        return Math.max(0, Math.min(estimate, current.info().length()));
    }
    
    @Override
    public long lastActivity() {
        return lastActivity;
    }
    
    public boolean destroyed() {
        return destroyed;
    }
    
    /**
     * Binds this player to a node: sends the voice session and, if a track is
     * current, plays it again from the last known position.
     *
     * @param node Node to bind to.
     */
    public void bind(@Nonnull NodeLink node) {
        ensureAlive();
        var resumeAt = position();
        this.node = node;
        this.stalled = false;
        touch();
        send(new OutboundCommand.VoiceUpdate(voiceSession));
        var current = queue.current();
        if(current != null) {
            play(current, resumeAt);
        }
    }
    
    /**
     * Marks this player as stalled. It keeps its queue and position, and sends
     * nothing until {@link #bind(NodeLink) bound} again.
     *
     * @return {@code true} if the player was not stalled or destroyed before.
     */
    public boolean markStalled() {
        if(destroyed || stalled) {
            return false;
        }
        var at = position();
        stalled = true;
        position = at;
        positionUpdated = System.currentTimeMillis();
        log.info("Player for guild {} stalled, node {} lost its session", guildId, node == null ? null : node.name());
        dispatcher.onPlayerStalled(this);
        return true;
    }
    
    /**
     * Swaps the current track for an encoding produced by another node. Does
     * nothing if the track changed in the meantime.
     */
    public void replaceCurrent(@Nonnull Track expected, @Nonnull Track replacement) {
        ensureAlive();
        if(queue.replaceCurrent(expected, replacement)) {
            log.debug("Replaced current track of guild {} with {}", guildId, replacement);
        }
    }
    
    /**
     * Replaces the voice session and forwards it to the node.
     *
     * @param session New voice session.
     */
    public void updateVoiceSession(@Nonnull VoiceSession session) {
        ensureAlive();
        if(!guildId.equals(session.guildId())) {
            throw new IllegalArgumentException("Voice session for guild " + session.guildId() +
                    " given to player of guild " + guildId);
        }
        touch();
        voiceSession = session;
        send(new OutboundCommand.VoiceUpdate(session));
    }
    
    @Nonnull
    public EnqueueResult enqueue(@Nonnull Track track) {
        ensureAlive();
        touch();
        var wasIdle = queue.index() < 0;
        var index = queue.add(track);
        if(wasIdle) {
            play(track, 0);
        }
        return new EnqueueResult(List.of(track), index, wasIdle);
    }
    
    /**
     * Appends tracks as a whole. If the player was idle, playback starts with the
     * selected track, or the first one if none was selected.
     *
     * @param tracks        Tracks to append.
     * @param selectedIndex Index, in {@code tracks}, of the track to start with.
     *
     * @return What was enqueued.
     */
    @Nonnull
    public EnqueueResult enqueueAll(@Nonnull List<Track> tracks, int selectedIndex) {
        ensureAlive();
        if(tracks.isEmpty()) {
            return EnqueueResult.empty();
        }
        touch();
        var wasIdle = queue.index() < 0;
        var first = queue.addAll(tracks);
        if(wasIdle) {
            var start = selectedIndex >= 0 && selectedIndex < tracks.size() ? selectedIndex : 0;
            play(queue.select(first + start), 0);
        }
        return new EnqueueResult(tracks, first, wasIdle);
    }
    
    @Nullable
    public Track skip() {
        requireActive("skip");
        touch();
        var next = queue.advance(loopMode, true);
        if(next == null) {
            goIdle(true);
            dispatcher.onQueueEnd(this);
            return null;
        }
        play(next, 0);
        return next;
    }
    
    @Nonnull
    public Track previous() {
        requireActive("go back");
        touch();
        var track = queue.back();
        play(track, 0);
        return track;
    }
    
    /**
     * Pauses playback.
     *
     * @return False if the player was already paused.
     */
    public boolean pause() {
        var state = state();
        if(state == PlayerState.PAUSED) {
            return false;
        }
        if(state != PlayerState.PLAYING) {
            throw new PlayerStateException(state, "Nothing to pause");
        }
        touch();
        position = position();
        positionUpdated = System.currentTimeMillis();
        paused = true;
        send(new OutboundCommand.Pause(guildId, true));
        return true;
    }
    
    /**
     * Resumes playback.
     *
     * @return False if the player was already playing.
     */
    public boolean resume() {
        var state = state();
        if(state == PlayerState.PLAYING) {
            return false;
        }
        if(state != PlayerState.PAUSED) {
            throw new PlayerStateException(state, "Nothing to resume");
        }
        touch();
        positionUpdated = System.currentTimeMillis();
        paused = false;
        send(new OutboundCommand.Pause(guildId, false));
        return true;
    }
    
    /**
     * Seeks the current track, clamping the target to the track bounds.
     *
     * @param target Target position, in milliseconds.
     *
     * @return The position sought to.
     */
    public long seek(long target) {
        requireActive("seek");
        var track = queue.current();
        if(!track.info().isSeekable()) {
            throw new PlayerStateException(state(), "Track " + track.info().title() + " is not seekable");
        }
        touch();
        var clamped = Math.max(0, Math.min(target, track.info().length()));
        position = clamped;
        positionUpdated = System.currentTimeMillis();
        send(new OutboundCommand.Seek(guildId, clamped));
        return clamped;
    }
    
    public int setVolume(int requested) {
        ensureAlive();
        touch();
        volume = clampVolume(requested);
        send(new OutboundCommand.Volume(guildId, volume));
        return volume;
    }
    
    public void setLoopMode(@Nonnull LoopMode mode) {
        ensureAlive();
        touch();
        loopMode = mode;
    }
    
    /**
     * Destroys this player, telling the node to drop it.
     *
     * @param reason Why the player is destroyed.
     *
     * @return False if the player was already destroyed.
     */
    public boolean destroy(@Nonnull DestroyReason reason) {
        if(destroyed) {
            return false;
        }
        var link = node;
        if(link != null) {
            link.discard(guildId);
        }
        send(new OutboundCommand.Stop(guildId));
        send(new OutboundCommand.Destroy(guildId));
        destroyed = true;
        log.info("Destroyed player for guild {} ({})", guildId, reason);
        dispatcher.onPlayerDestroyed(this, reason);
        queue.clear();
        return true;
    }
    
    public void handlePlayerUpdate(@Nonnull InboundMessage.PlayerUpdate update) {
        if(destroyed || stalled) {
            return;
        }
        position = update.position();
        positionUpdated = System.currentTimeMillis();
    }
    
    public void handleEvent(@Nonnull PlayerEvent event) {
        if(destroyed || stalled) {
            log.debug("Dropping {} for {} player of guild {}", event.type(), state(), guildId);
            return;
        }
        touch();
        switch(event.type()) {
            case TRACK_START:
                onTrackStart(event);
                break;
            case TRACK_END:
                onTrackEnd((PlayerEvent.TrackEnd) event);
                break;
            case TRACK_EXCEPTION: {
                var exception = (PlayerEvent.TrackException) event;
                var message = exception.message() == null ? "Unknown error" : exception.message();
                onTrackFailed(event.track(), message, "exception", false);
                break;
            }
            case TRACK_STUCK:
                onTrackFailed(event.track(), "Stuck for " + ((PlayerEvent.TrackStuck) event).thresholdMs() + "ms",
                        "stuck", false);
                break;
            case WEBSOCKET_CLOSED: {
                var closed = (PlayerEvent.WebSocketClosed) event;
                log.info("Voice connection of guild {} closed with code {}: {} (by remote: {})",
                        guildId, closed.code(), closed.reason(), closed.byRemote());
                dispatcher.onVoiceConnectionClosed(this, closed.code(), closed.reason(), closed.byRemote());
                break;
            }
            default:
                log.debug("Ignoring unknown event {} for guild {}", ((PlayerEvent.Unknown) event).name(), guildId);
                break;
        }
    }
    
    /**
     * Returns the futures of the commands sent since the last call, and forgets them.
     *
     * @return The futures of the sent commands.
     */
    @Nonnull
    public List<Future<Void>> drainSent() {
        var copy = List.copyOf(sent);
        sent.clear();
        return copy;
    }
    
    private void onTrackStart(@Nonnull PlayerEvent event) {
        if(!isCurrent(event.track())) {
            log.debug("Ignoring start of stale track in guild {}", guildId);
            return;
        }
        ignoredEnd = null;
        consecutiveFailures = 0;
        position = 0;
        positionUpdated = System.currentTimeMillis();
        dispatcher.onTrackStart(this, queue.current());
    }
    
    private void onTrackEnd(@Nonnull PlayerEvent.TrackEnd event) {
        if(!isCurrent(event.track())) {
            log.debug("Ignoring end of stale track in guild {} ({})", guildId, event.reason());
            return;
        }
        if(ignoredEnd != null && event.reason() != PlayerEvent.EndReason.FINISHED &&
                (event.track() == null || ignoredEnd.equals(event.track()))) {
            //already advanced past it when the failure was reported
            ignoredEnd = null;
            return;
        }
        ignoredEnd = null;
        switch(event.reason()) {
            case FINISHED:
                consecutiveFailures = 0;
                advance();
                break;
            case LOAD_FAILED:
                onTrackFailed(event.track(), "Track failed to load", "load_failed", true);
                break;
            default:
                log.debug("Track ended with reason {} in guild {}, not advancing", event.reason(), guildId);
                break;
        }
    }
    
    private void onTrackFailed(@Nullable String encoded, @Nonnull String message, @Nonnull String cause,
                               boolean ended) {
        if(!isCurrent(encoded)) {
            log.debug("Ignoring failure of stale track in guild {}: {}", guildId, message);
            return;
        }
        var track = queue.current();
        failedTracks.labels(cause).inc();
        log.warn("Track {} failed in guild {}: {}", track, guildId, message);
        if(consecutiveFailures >= maxAutoSkips) {
            var failures = consecutiveFailures + 1;
            consecutiveFailures = 0;
            log.error("Giving up on guild {} after {} failed tracks in a row", guildId, failures);
            goIdle(true);
            dispatcher.onPlaybackFailed(this, failures, message);
            return;
        }
        consecutiveFailures++;
        if(!ended) {
            ignoredEnd = track.encoded();
        }
        advance();
    }
    
    private void advance() {
        var next = queue.advance(loopMode, false);
        if(next == null) {
            goIdle(false);
            dispatcher.onQueueEnd(this);
            return;
        }
        play(next, 0);
    }
    
    private void goIdle(boolean stop) {
        queue.clear();
        ignoredEnd = null;
        paused = false;
        position = 0;
        if(stop) {
            send(new OutboundCommand.Stop(guildId));
        }
    }
    
    private void play(@Nonnull Track track, long startTime) {
        position = startTime;
        positionUpdated = System.currentTimeMillis();
        send(new OutboundCommand.Play(guildId, track.encoded(), startTime, 0, paused, volume));
    }
    
    private void send(@Nonnull OutboundCommand command) {
        var link = node;
        if(destroyed || stalled || link == null) {
            log.debug("Not sending {} for player of guild {} ({})", command, guildId, state());
            return;
        }
        sent.add(link.send(command));
    }
    
    private boolean isCurrent(@Nullable String encoded) {
        var current = queue.current();
        return current != null && (encoded == null || current.encoded().equals(encoded));
    }
    
    private void touch() {
        lastActivity = System.currentTimeMillis();
    }
    
    private void ensureAlive() {
        if(destroyed) {
            throw new PlayerStateException(PlayerState.DESTROYED, "Player of guild " + guildId + " was destroyed");
        }
    }
    
    private void requireActive(@Nonnull String action) {
        var state = state();
        if(state != PlayerState.PLAYING && state != PlayerState.PAUSED) {
            throw new PlayerStateException(state, "Cannot " + action);
        }
    }
    
    private static int clampVolume(int volume) {
        return Math.max(0, Math.min(volume, MAX_VOLUME));
    }
    
    @Override
    public String toString() {
        return "Player{guild=" + guildId + ", state=" + state() + ", queue=" + queue.size() + "}";
    }
}
