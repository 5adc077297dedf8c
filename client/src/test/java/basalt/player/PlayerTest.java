package basalt.player;

import basalt.event.EventDispatcherImpl;
import basalt.exceptions.PlayerStateException;
import basalt.exceptions.QueueFullException;
import basalt.protocol.InboundMessage;
import basalt.protocol.OutboundCommand;
import basalt.protocol.PlayerEvent;
import basalt.track.LoadResult;
import io.vertx.core.Vertx;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;

import static basalt.TestSupport.config;
import static basalt.TestSupport.track;
import static basalt.TestSupport.voice;
import static org.junit.jupiter.api.Assertions.*;

class PlayerTest {
    private static final String GUILD = "100";
    
    private Vertx vertx;
    private RecordingLink link;
    private RecordingListener listener;
    private Player player;
    
    @BeforeEach
    void setUp() {
        vertx = Vertx.vertx();
        link = new RecordingLink("node-a");
        listener = new RecordingListener();
        var dispatcher = new EventDispatcherImpl();
        dispatcher.register(listener);
        player = new Player(dispatcher, config("basalt.player.queue-limit = 10"), GUILD, voice(GUILD),
                vertx.getOrCreateContext(), new Random(7));
        player.bind(link);
        player.drainSent();
        link.clear();
    }
    
    @AfterEach
    void tearDown() {
        vertx.close();
    }
    
    @Test
    void bindSendsVoiceSession() {
        var other = new RecordingLink("node-b");
        player.bind(other);
        var updates = other.sent(OutboundCommand.Op.VOICE_UPDATE);
        assertEquals(1, updates.size());
        var session = ((OutboundCommand.VoiceUpdate) updates.get(0)).session();
        assertEquals(GUILD, session.guildId());
        assertEquals("session-" + GUILD, session.sessionId());
    }
    
    @Test
    void playsQueueInOrderThenGoesIdle() {
        var result = player.enqueue(track("a"));
        assertTrue(result.startedPlaying());
        assertEquals(0, result.position());
        assertFalse(player.enqueue(track("b")).startedPlaying());
        player.enqueue(track("c"));
        assertEquals(PlayerState.PLAYING, player.state());
        
        finish("a");
        finish("b");
        finish("c");
        
        assertEquals(List.of("enc-a", "enc-b", "enc-c"), playedTracks());
        assertEquals(List.of(track("a"), track("b"), track("c")), listener.started);
        assertEquals(1, listener.count("queueEnd"));
        assertEquals(PlayerState.IDLE, player.state());
        assertTrue(player.queue().isEmpty());
        assertEquals(-1, player.currentIndex());
    }
    
    @Test
    void randomLoopReplaysSingleTrack() {
        player.enqueue(track("a"));
        player.setLoopMode(LoopMode.RANDOM);
        finish("a");
        finish("a");
        assertEquals(List.of("enc-a", "enc-a", "enc-a"), playedTracks());
        assertEquals(0, listener.count("queueEnd"));
    }
    
    @Test
    void trackLoopRepeatsUntilSkipped() {
        player.enqueue(track("a"));
        player.enqueue(track("b"));
        player.setLoopMode(LoopMode.TRACK);
        finish("a");
        assertEquals(track("a"), player.currentTrack());
        assertEquals(track("b"), player.skip());
        assertEquals(List.of("enc-a", "enc-a", "enc-b"), playedTracks());
    }
    
    @Test
    void failureCeilingNotifiesOnce() {
        for(var name : List.of("a", "b", "c", "d", "e")) {
            player.enqueue(track(name));
        }
        for(var name : List.of("a", "b", "c", "d", "e")) {
            player.handleEvent(new PlayerEvent.TrackException(GUILD, "enc-" + name, "broken " + name, LoadResult.Severity.COMMON));
        }
        assertEquals(1, listener.count("failed"));
        assertEquals(List.of(4), listener.failures);
        assertEquals(PlayerState.IDLE, player.state());
        assertTrue(player.queue().isEmpty());
        assertEquals(List.of("enc-a", "enc-b", "enc-c", "enc-d"), playedTracks());
        assertFalse(link.sent(OutboundCommand.Op.STOP).isEmpty());
    }
    
    @Test
    void successResetsFailureCount() {
        for(var name : List.of("a", "b", "c", "d", "e", "f")) {
            player.enqueue(track(name));
        }
        player.handleEvent(new PlayerEvent.TrackException(GUILD, "enc-a", "x", LoadResult.Severity.COMMON));
        player.handleEvent(new PlayerEvent.TrackException(GUILD, "enc-b", "x", LoadResult.Severity.COMMON));
        finish("c");
        player.handleEvent(new PlayerEvent.TrackStuck(GUILD, "enc-d", 10_000));
        player.handleEvent(new PlayerEvent.TrackException(GUILD, "enc-e", "x", LoadResult.Severity.COMMON));
        assertEquals(0, listener.count("failed"));
        assertEquals(track("f"), player.currentTrack());
    }
    
    @Test
    void failuresBetweenPlayedTracksAreNotConsecutive() {
        for(var name : List.of("a", "b", "c", "d", "e", "f", "g", "h")) {
            player.enqueue(track(name));
        }
        for(var pair : List.of(List.of("a", "b"), List.of("c", "d"), List.of("e", "f"))) {
            player.handleEvent(new PlayerEvent.TrackException(GUILD, "enc-" + pair.get(0), "x", LoadResult.Severity.COMMON));
            player.handleEvent(new PlayerEvent.TrackStart(GUILD, "enc-" + pair.get(1)));
            player.skip();
        }
        player.handleEvent(new PlayerEvent.TrackException(GUILD, "enc-g", "x", LoadResult.Severity.COMMON));
        assertEquals(0, listener.count("failed"));
        assertEquals(PlayerState.PLAYING, player.state());
        assertEquals(track("h"), player.currentTrack());
    }
    
    @Test
    void endAfterExceptionDoesNotSkipTwice() {
        player.enqueue(track("a"));
        player.enqueue(track("b"));
        player.enqueue(track("c"));
        player.handleEvent(new PlayerEvent.TrackException(GUILD, null, "x", LoadResult.Severity.COMMON));
        player.handleEvent(new PlayerEvent.TrackEnd(GUILD, null, PlayerEvent.EndReason.LOAD_FAILED));
        assertEquals(track("b"), player.currentTrack());
    }
    
    @Test
    void loadFailedEndAdvances() {
        player.enqueue(track("a"));
        player.enqueue(track("b"));
        player.handleEvent(new PlayerEvent.TrackEnd(GUILD, "enc-a", PlayerEvent.EndReason.LOAD_FAILED));
        assertEquals(track("b"), player.currentTrack());
    }
    
    @Test
    void ignoresStaleAndNonAdvancingEnds() {
        player.enqueue(track("a"));
        player.enqueue(track("b"));
        finish("z");
        player.handleEvent(new PlayerEvent.TrackEnd(GUILD, "enc-a", PlayerEvent.EndReason.REPLACED));
        player.handleEvent(new PlayerEvent.TrackEnd(GUILD, "enc-a", PlayerEvent.EndReason.STOPPED));
        player.handleEvent(new PlayerEvent.TrackEnd(GUILD, "enc-a", PlayerEvent.EndReason.UNKNOWN));
        assertEquals(track("a"), player.currentTrack());
        assertEquals(List.of("enc-a"), playedTracks());
    }
    
    @Test
    void pauseAndResumeAreIdempotent() {
        assertThrows(PlayerStateException.class, player::pause);
        player.enqueue(track("a"));
        player.enqueue(track("b"));
        player.skip();
        assertTrue(player.pause());
        assertFalse(player.pause());
        assertEquals(PlayerState.PAUSED, player.state());
        assertTrue(player.resume());
        assertFalse(player.resume());
        assertEquals(1, player.currentIndex());
        assertEquals(track("b"), player.currentTrack());
        assertEquals(2, player.queue().size());
        var pauses = link.sent(OutboundCommand.Op.PAUSE);
        assertEquals(2, pauses.size());
        assertTrue(((OutboundCommand.Pause) pauses.get(0)).state());
        assertFalse(((OutboundCommand.Pause) pauses.get(1)).state());
    }
    
    @Test
    void pausedFlagCarriesToNextTrack() {
        player.enqueue(track("a"));
        player.enqueue(track("b"));
        player.pause();
        player.skip();
        var plays = link.sent(OutboundCommand.Op.PLAY);
        assertTrue(((OutboundCommand.Play) plays.get(plays.size() - 1)).pause());
        assertEquals(PlayerState.PAUSED, player.state());
    }
    
    @Test
    void skipPastEndGoesIdle() {
        player.enqueue(track("a"));
        assertNull(player.skip());
        assertEquals(PlayerState.IDLE, player.state());
        assertEquals(1, listener.count("queueEnd"));
        assertEquals(1, link.sent(OutboundCommand.Op.STOP).size());
        assertThrows(PlayerStateException.class, player::skip);
    }
    
    @Test
    void previousReplaysEarlierTrack() {
        player.enqueue(track("a"));
        player.enqueue(track("b"));
        player.skip();
        assertEquals(track("a"), player.previous());
        assertEquals(0, player.currentIndex());
    }
    
    @Test
    void seekClampsAndRejectsUnseekable() {
        player.enqueue(track("a", 60_000, true));
        assertEquals(60_000, player.seek(90_000));
        assertEquals(0, player.seek(-5));
        var seeks = link.sent(OutboundCommand.Op.SEEK);
        assertEquals(60_000, ((OutboundCommand.Seek) seeks.get(0)).position());
        
        player.enqueue(track("live", 0, false));
        player.skip();
        assertThrows(PlayerStateException.class, () -> player.seek(1000));
    }
    
    @Test
    void volumeIsClamped() {
        assertEquals(1000, player.setVolume(5000));
        assertEquals(0, player.setVolume(-1));
        assertEquals(0, player.volume());
        player.enqueue(track("a"));
        assertEquals(0, ((OutboundCommand.Play) link.sent(OutboundCommand.Op.PLAY).get(0)).volume());
    }
    
    @Test
    void fullQueueLeavesPlayerUnchanged() {
        for(var i = 0; i < 10; i++) {
            player.enqueue(track("t" + i));
        }
        assertThrows(QueueFullException.class, () -> player.enqueue(track("overflow")));
        assertEquals(10, player.queue().size());
        assertThrows(QueueFullException.class, () -> player.enqueueAll(List.of(track("x")), -1));
        assertEquals(track("t0"), player.currentTrack());
    }
    
    @Test
    void enqueueAllStartsAtSelectedTrack() {
        var result = player.enqueueAll(List.of(track("a"), track("b"), track("c")), 2);
        assertTrue(result.startedPlaying());
        assertEquals(3, result.count());
        assertEquals(track("c"), player.currentTrack());
        assertEquals(List.of("enc-c"), playedTracks());
    }
    
    @Test
    void stalledPlayerSendsNothingAndReplaysOnBind() {
        player.enqueue(track("a"));
        player.pause();
        player.handlePlayerUpdate(new InboundMessage.PlayerUpdate(GUILD, 30_000, System.currentTimeMillis(), true));
        player.markStalled();
        assertEquals(PlayerState.STALLED, player.state());
        assertEquals(1, listener.count("stalled"));
        link.clear();
        
        player.enqueue(track("b"));
        player.setVolume(20);
        assertThrows(PlayerStateException.class, player::skip);
        assertTrue(link.sent().isEmpty());
        
        var other = new RecordingLink("node-b");
        player.bind(other);
        assertEquals(PlayerState.PAUSED, player.state());
        var sent = other.sent();
        assertEquals(OutboundCommand.Op.VOICE_UPDATE, sent.get(0).op());
        var play = (OutboundCommand.Play) sent.get(1);
        assertEquals("enc-a", play.track());
        assertEquals(30_000, play.startTime());
        assertTrue(play.pause());
        assertEquals(20, play.volume());
    }
    
    @Test
    void voiceCloseIsForwarded() {
        player.handleEvent(new PlayerEvent.WebSocketClosed(GUILD, 4006, "Session invalid", true));
        assertEquals(1, listener.count("voiceClosed"));
    }
    
    @Test
    void destroySendsTeardownOnce() {
        player.enqueue(track("a"));
        link.clear();
        assertTrue(player.destroy(DestroyReason.REQUESTED));
        assertFalse(player.destroy(DestroyReason.REQUESTED));
        assertEquals(List.of(OutboundCommand.Op.STOP, OutboundCommand.Op.DESTROY),
                link.sent().stream().map(OutboundCommand::op).collect(Collectors.toList()));
        assertEquals(PlayerState.DESTROYED, player.state());
        assertEquals(List.of(DestroyReason.REQUESTED), listener.destroyed);
        assertThrows(PlayerStateException.class, () -> player.enqueue(track("b")));
    }
    
    @Test
    void sentFuturesAreDrained() {
        player.enqueue(track("a"));
        assertEquals(1, player.drainSent().size());
        assertTrue(player.drainSent().isEmpty());
    }
    
    private void finish(String name) {
        player.handleEvent(new PlayerEvent.TrackStart(GUILD, "enc-" + name));
        player.handleEvent(new PlayerEvent.TrackEnd(GUILD, "enc-" + name, PlayerEvent.EndReason.FINISHED));
    }
    
    private List<String> playedTracks() {
        return link.sent(OutboundCommand.Op.PLAY).stream()
                .map(c -> ((OutboundCommand.Play) c).track())
                .collect(Collectors.toList());
    }
}
