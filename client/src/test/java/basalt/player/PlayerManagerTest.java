package basalt.player;

import basalt.event.EventDispatcherImpl;
import basalt.exceptions.NodeUnavailableException;
import basalt.exceptions.PlayerNotFoundException;
import basalt.exceptions.TrackLoadFailedException;
import basalt.node.Backoff;
import basalt.node.NodeInfo;
import basalt.protocol.OutboundCommand;
import basalt.protocol.PlayerEvent;
import basalt.rest.RestClient;
import basalt.track.EnqueueResult;
import basalt.voice.VoiceSession;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpServer;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CopyOnWriteArrayList;

import static basalt.TestSupport.await;
import static basalt.TestSupport.awaitFailure;
import static basalt.TestSupport.config;
import static basalt.TestSupport.sleepQuietly;
import static basalt.TestSupport.track;
import static basalt.TestSupport.voice;
import static basalt.TestSupport.waitFor;
import static org.junit.jupiter.api.Assertions.*;

class PlayerManagerTest {
    private static final String GUILD = "200";
    
    private final List<String> resolved = new CopyOnWriteArrayList<>();
    private Vertx vertx;
    private HttpServer server;
    private RecordingListener listener;
    private RecordingLink nodeA;
    private RecordingLink nodeB;
    private PlayerManager manager;
    
    @BeforeEach
    void setUp() throws Exception {
        vertx = Vertx.vertx();
        server = await(vertx.createHttpServer().requestHandler(fakeNode()).listen(0, "127.0.0.1"));
        listener = new RecordingListener();
        var dispatcher = new EventDispatcherImpl();
        dispatcher.register(listener);
        manager = new PlayerManager(vertx, config("basalt.player { idle-timeout = 100ms, stall-timeout = 300ms }"),
                dispatcher, new Random(1));
        nodeA = new RecordingLink("a", rest("a"));
        nodeB = new RecordingLink("b", rest("b"));
        manager.addNode(nodeA);
        manager.addNode(nodeB);
    }
    
    @AfterEach
    void tearDown() throws Exception {
        await(vertx.close());
    }
    
    @Test
    void assignsToLeastLoadedNode() throws Exception {
        nodeA.reportedPlayers = 5;
        var player = await(manager.assign(GUILD, voice(GUILD)));
        assertSame(nodeB, player.node());
        assertEquals(1, nodeB.bound());
        assertEquals(0, nodeA.bound());
        assertEquals(1, nodeB.sent(OutboundCommand.Op.VOICE_UPDATE).size());
        assertEquals(List.of("created"), listener.events);
        
        var second = await(manager.assign("201", voice("201")));
        assertSame(nodeB, second.node());
        var third = await(manager.assign("202", voice("202")));
        assertSame(nodeB, third.node());
        nodeB.reportedPlayers = 9;
        assertSame(nodeA, await(manager.assign("203", voice("203"))).node());
    }
    
    @Test
    void tiesKeepConfigurationOrder() throws Exception {
        assertSame(nodeA, await(manager.assign(GUILD, voice(GUILD))).node());
    }
    
    @Test
    void assignFailsWithoutAvailableNode() throws Exception {
        nodeA.available = false;
        nodeB.available = false;
        var e = awaitFailure(manager.assign(GUILD, voice(GUILD)));
        assertTrue(e instanceof NodeUnavailableException);
        assertNull(manager.player(GUILD));
        assertTrue(listener.events.isEmpty());
    }
    
    @Test
    void assigningAgainUpdatesVoiceSession() throws Exception {
        var first = await(manager.assign(GUILD, voice(GUILD)));
        var updated = new VoiceSession(GUILD, "other-channel", "session-2", "token-2", "voice2.example.com");
        var second = await(manager.assign(GUILD, updated));
        assertSame(first, second);
        assertEquals("other-channel", second.voiceSession().channelId());
        assertEquals(2, nodeA.sent(OutboundCommand.Op.VOICE_UPDATE).size());
        assertEquals(1, listener.count("created"));
    }
    
    @Test
    void rejectsVoiceSessionOfOtherGuild() throws Exception {
        var e = awaitFailure(manager.assign(GUILD, voice("999")));
        assertTrue(e instanceof IllegalArgumentException);
    }
    
    @Test
    void commandsForUnknownGuildFail() throws Exception {
        assertTrue(awaitFailure(manager.skip("404")) instanceof PlayerNotFoundException);
        assertTrue(awaitFailure(manager.enqueue("404", track("a"))) instanceof PlayerNotFoundException);
        assertTrue(awaitFailure(manager.play("404", "song")) instanceof PlayerNotFoundException);
    }
    
    @Test
    void commandsApplyInSubmissionOrder() throws Exception {
        await(manager.assign(GUILD, voice(GUILD)));
        var futures = new ArrayList<Future<EnqueueResult>>();
        for(var i = 0; i < 50; i++) {
            futures.add(manager.enqueue(GUILD, track("t" + i)));
        }
        for(var i = 0; i < 50; i++) {
            assertEquals(i, await(futures.get(i)).position());
        }
        assertEquals(50, manager.player(GUILD).queue().size());
    }
    
    @Test
    void releaseIsIdempotent() throws Exception {
        await(manager.assign(GUILD, voice(GUILD)));
        await(manager.enqueue(GUILD, track("a")));
        await(manager.release(GUILD));
        await(manager.release(GUILD));
        assertNull(manager.player(GUILD));
        assertEquals(0, nodeA.bound());
        assertEquals(List.of(DestroyReason.REQUESTED), listener.destroyed);
        assertEquals(1, nodeA.sent(OutboundCommand.Op.DESTROY).size());
        assertTrue(awaitFailure(manager.skip(GUILD)) instanceof PlayerNotFoundException);
    }
    
    @Test
    void voiceDisconnectReleasesPlayer() throws Exception {
        await(manager.assign(GUILD, voice(GUILD)));
        await(manager.onVoiceDisconnected(GUILD));
        assertNull(manager.player(GUILD));
        assertEquals(List.of(DestroyReason.DISCONNECTED), listener.destroyed);
    }
    
    @Test
    void emptyChannelReleasesAfterIdleTimeout() throws Exception {
        await(manager.assign(GUILD, voice(GUILD)));
        manager.onOccupancyChange(GUILD, 0);
        waitFor("idle release", () -> manager.player(GUILD) == null);
        assertEquals(List.of(DestroyReason.IDLE_TIMEOUT), listener.destroyed);
    }
    
    @Test
    void rejoiningCancelsIdleTimeout() throws Exception {
        await(manager.assign(GUILD, voice(GUILD)));
        manager.onOccupancyChange(GUILD, 0);
        manager.onOccupancyChange(GUILD, 2);
        sleepQuietly(250);
        assertNotNull(manager.player(GUILD));
        assertTrue(listener.destroyed.isEmpty());
    }
    
    @Test
    void playsSearchResults() throws Exception {
        await(manager.assign(GUILD, voice(GUILD)));
        var result = await(manager.play(GUILD, "never gonna"));
        assertEquals("ytsearch:never gonna", resolved.get(0));
        assertEquals(1, result.count());
        assertTrue(result.startedPlaying());
        assertEquals("enc-never gonna-1", manager.player(GUILD).currentTrack().encoded());
    }
    
    @Test
    void playsPlaylistsFromSelectedTrack() throws Exception {
        await(manager.assign(GUILD, voice(GUILD)));
        var result = await(manager.play(GUILD, "raw:list"));
        assertEquals("list", resolved.get(0));
        assertEquals(3, result.count());
        var player = manager.player(GUILD);
        assertEquals(3, player.queue().size());
        assertEquals(1, player.currentIndex());
    }
    
    @Test
    void noMatchesEnqueuesNothing() throws Exception {
        await(manager.assign(GUILD, voice(GUILD)));
        var result = await(manager.play(GUILD, "ytsearch:nothing"));
        assertEquals(0, result.count());
        assertEquals(PlayerState.IDLE, manager.player(GUILD).state());
    }
    
    @Test
    void loadFailuresAreSurfaced() throws Exception {
        await(manager.assign(GUILD, voice(GUILD)));
        var e = awaitFailure(manager.play(GUILD, "ytsearch:broken"));
        assertTrue(e instanceof TrackLoadFailedException);
        assertTrue(manager.player(GUILD).queue().isEmpty());
    }
    
    @Test
    void appliesSearchPrefix() {
        assertEquals("https://example.com/a", manager.identifier("https://example.com/a"));
        assertEquals("scsearch:song", manager.identifier("scsearch:song"));
        assertEquals("ytsearch:song", manager.identifier("song"));
        assertEquals("ytsearch:raw", manager.identifier("raw"));
        assertEquals("song", manager.identifier("raw:song"));
    }
    
    @Test
    void routesEventsFromBoundNodeOnly() throws Exception {
        await(manager.assign(GUILD, voice(GUILD)));
        await(manager.enqueue(GUILD, track("a")));
        await(manager.enqueue(GUILD, track("b")));
        manager.onPlayerEvent(nodeB, new PlayerEvent.TrackEnd(GUILD, "enc-a", PlayerEvent.EndReason.FINISHED));
        manager.onPlayerEvent(nodeA, new PlayerEvent.TrackEnd("unknown", "enc-a", PlayerEvent.EndReason.FINISHED));
        manager.onPlayerEvent(nodeA, new PlayerEvent.TrackEnd(GUILD, "enc-a", PlayerEvent.EndReason.FINISHED));
        waitFor("advance", () -> manager.player(GUILD).currentIndex() == 1);
        assertEquals("enc-b", manager.player(GUILD).currentTrack().encoded());
        assertEquals(2, nodeA.sent(OutboundCommand.Op.PLAY).size());
    }
    
    @Test
    void resumedNodeGetsVoiceUpdatesImmediately() throws Exception {
        await(manager.assign(GUILD, voice(GUILD)));
        nodeA.clear();
        manager.onReady(nodeA, true);
        assertEquals(1, nodeA.sent(OutboundCommand.Op.VOICE_UPDATE).size());
        assertEquals(1, listener.count("nodeResumed"));
    }
    
    @Test
    void lostSessionMovesPlayersToAnotherNode() throws Exception {
        await(manager.assign(GUILD, voice(GUILD)));
        await(manager.enqueue(GUILD, track("a")));
        nodeA.available = false;
        manager.onSessionLost(nodeA);
        waitFor("rebind", () -> !nodeB.sent(OutboundCommand.Op.PLAY).isEmpty());
        var play = (OutboundCommand.Play) nodeB.sent(OutboundCommand.Op.PLAY).get(0);
        assertEquals("node-b-https://example.com/a", play.track());
        assertEquals(OutboundCommand.Op.VOICE_UPDATE, nodeB.sent().get(0).op());
        var player = manager.player(GUILD);
        assertSame(nodeB, player.node());
        assertEquals(0, nodeA.bound());
        assertEquals(1, nodeB.bound());
        assertEquals(1, listener.count("stalled"));
        sleepQuietly(400);
        assertNotNull(manager.player(GUILD));
    }
    
    @Test
    void stalledPlayerIsDestroyedWhenNoNodeComesBack() throws Exception {
        await(manager.assign(GUILD, voice(GUILD)));
        nodeA.available = false;
        nodeB.available = false;
        manager.onSessionLost(nodeA);
        waitFor("stalled", () -> manager.player(GUILD) == null || manager.player(GUILD).state() == PlayerState.STALLED);
        waitFor("destroyed", () -> manager.player(GUILD) == null);
        assertEquals(List.of(DestroyReason.NODE_UNAVAILABLE), listener.destroyed);
    }
    
    @Test
    void stalledPlayersDoNotCountTowardsLostNode() throws Exception {
        nodeB.available = false;
        await(manager.assign(GUILD, voice(GUILD)));
        assertEquals(1, nodeA.bound());
        nodeA.available = false;
        manager.onSessionLost(nodeA);
        waitFor("unbound", () -> nodeA.bound() == 0);
        assertEquals(PlayerState.STALLED, manager.player(GUILD).state());
        manager.onSessionLost(nodeA);
        sleepQuietly(50);
        assertEquals(0, nodeA.bound());
        nodeB.available = true;
        var player = await(manager.rebind(GUILD));
        assertSame(nodeB, player.node());
        assertEquals(0, nodeA.bound());
        assertEquals(1, nodeB.bound());
        await(manager.release(GUILD));
        assertEquals(0, nodeB.bound());
    }
    
    @Test
    void readyNodeRebindsStalledPlayers() throws Exception {
        nodeB.available = false;
        await(manager.assign(GUILD, voice(GUILD)));
        await(manager.enqueue(GUILD, track("a")));
        nodeA.available = false;
        manager.onSessionLost(nodeA);
        waitFor("stalled", () -> manager.player(GUILD).state() == PlayerState.STALLED);
        nodeA.clear();
        nodeA.available = true;
        manager.onReady(nodeA, false);
        waitFor("replay", () -> manager.player(GUILD).state() == PlayerState.PLAYING);
        assertEquals(1, nodeA.sent(OutboundCommand.Op.PLAY).size());
        assertEquals(1, nodeA.bound());
        sleepQuietly(400);
        assertNotNull(manager.player(GUILD));
    }
    
    @Test
    void manualRebindMovesPlayer() throws Exception {
        await(manager.assign(GUILD, voice(GUILD)));
        await(manager.enqueue(GUILD, track("a")));
        var player = await(manager.rebind(GUILD));
        assertSame(nodeB, player.node());
        assertEquals(1, nodeA.sent(OutboundCommand.Op.DESTROY).size());
        assertEquals(1, nodeB.sent(OutboundCommand.Op.PLAY).size());
        assertEquals(0, nodeA.bound());
        assertEquals(1, nodeB.bound());
    }
    
    @Test
    void reportsNodeHealth() {
        nodeB.available = false;
        var health = manager.nodeHealth();
        assertEquals(2, health.size());
        assertEquals("a", health.get(0).name());
        assertTrue(health.get(0).healthy());
        assertFalse(health.get(1).healthy());
    }
    
    private RestClient rest(String name) {
        var info = new NodeInfo(name, "127.0.0.1", server.actualPort(), "secret-" + name, false, false);
        return new RestClient(vertx, vertx.createHttpClient(), info, "42", 1, new Backoff(10, 10), 2000);
    }
    
    private Router fakeNode() {
        var router = Router.router(vertx);
        router.get("/loadtracks").handler(context -> {
            var identifier = context.queryParam("identifier").get(0);
            var node = context.request().getHeader("Authorization").substring("secret-".length());
            resolved.add(identifier);
            JsonObject body;
            if(identifier.equals("ytsearch:nothing")) {
                body = new JsonObject().put("loadType", "NO_MATCHES");
            } else if(identifier.equals("ytsearch:broken")) {
                body = new JsonObject().put("loadType", "LOAD_FAILED")
                        .put("exception", new JsonObject().put("message", "broken").put("severity", "COMMON"));
            } else if(identifier.startsWith("ytsearch:")) {
                var query = identifier.substring("ytsearch:".length());
                body = new JsonObject().put("loadType", "SEARCH_RESULT")
                        .put("tracks", new JsonArray().add(trackJson(query + "-1")).add(trackJson(query + "-2")));
            } else if(identifier.equals("list")) {
                body = new JsonObject().put("loadType", "PLAYLIST_LOADED")
                        .put("playlistInfo", new JsonObject().put("name", "list").put("selectedTrack", 1))
                        .put("tracks", new JsonArray().add(trackJson("p1")).add(trackJson("p2")).add(trackJson("p3")));
            } else {
                body = new JsonObject().put("loadType", "TRACK_LOADED")
                        .put("tracks", new JsonArray().add(trackJson(identifier)
                                .put("track", "node-" + node + "-" + identifier)));
            }
            context.response().end(body.encode());
        });
        return router;
    }
    
    private static JsonObject trackJson(String name) {
        return new JsonObject()
                .put("track", "enc-" + name)
                .put("info", new JsonObject()
                        .put("identifier", name)
                        .put("title", name)
                        .put("author", "someone")
                        .put("length", 100_000)
                        .put("uri", "https://example.com/" + name));
    }
}
