package basalt.handler;

import basalt.ClientState;
import basalt.event.EventDispatcher;
import basalt.event.EventDispatcherImpl;
import basalt.node.Node;
import basalt.player.PlayerController;
import basalt.player.PlayerManager;
import basalt.player.RecordingLink;
import com.typesafe.config.Config;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.http.HttpClient;
import io.vertx.core.http.HttpClientResponse;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.http.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Collection;
import java.util.List;
import java.util.Random;

import static basalt.TestSupport.await;
import static basalt.TestSupport.config;
import static basalt.TestSupport.track;
import static basalt.TestSupport.voice;
import static org.junit.jupiter.api.Assertions.*;

class DiagnosticsHandlerTest {
    private Vertx vertx;
    private HttpServer server;
    private HttpClient client;
    private PlayerManager manager;
    
    @BeforeEach
    void setUp() throws Exception {
        vertx = Vertx.vertx();
        var config = config();
        var dispatcher = new EventDispatcherImpl();
        manager = new PlayerManager(vertx, config, dispatcher, new Random(1));
        var node = new RecordingLink("a");
        manager.addNode(node);
        var state = new ClientState() {
            @Override
            public Config config() {
                return config;
            }
            
            @Override
            public Vertx vertx() {
                return vertx;
            }
            
            @Override
            public EventDispatcher dispatcher() {
                return dispatcher;
            }
            
            @Override
            public Collection<? extends Node> nodes() {
                return List.of(node);
            }
            
            @Override
            public PlayerController players() {
                return manager;
            }
        };
        server = await(vertx.createHttpServer().requestHandler(DiagnosticsHandler.router(state)).listen(0, "127.0.0.1"));
        client = vertx.createHttpClient();
    }
    
    @AfterEach
    void tearDown() throws Exception {
        await(vertx.close());
    }
    
    @Test
    void listsNodes() throws Exception {
        var response = get("/nodes");
        assertEquals(200, response.status);
        assertEquals("application/json", response.contentType);
        var nodes = response.body.toJsonArray();
        assertEquals(1, nodes.size());
        assertEquals("a", nodes.getJsonObject(0).getString("name"));
        assertTrue(nodes.getJsonObject(0).getBoolean("healthy"));
    }
    
    @Test
    void showsPlayer() throws Exception {
        await(manager.assign("1", voice("1")));
        await(manager.enqueue("1", track("a")));
        await(manager.enqueue("1", track("b")));
        var response = get("/players/1");
        assertEquals(200, response.status);
        var json = response.body.toJsonObject();
        assertEquals("1", json.getString("guildId"));
        assertEquals("a", json.getString("node"));
        assertEquals("PLAYING", json.getString("state"));
        assertEquals("channel-1", json.getString("channelId"));
        assertEquals(0, json.getInteger("currentIndex"));
        assertEquals("enc-a", json.getJsonObject("current").getString("track"));
        assertEquals(2, json.getJsonArray("queue").size());
    }
    
    @Test
    void missingPlayerIsNotFound() throws Exception {
        var response = get("/players/2");
        assertEquals(404, response.status);
        var json = response.body.toJsonObject();
        assertEquals(404, json.getInteger("code"));
        assertEquals("Player not found", json.getString("message"));
    }
    
    @Test
    void metricsAreOffByDefault() throws Exception {
        assertEquals(404, get("/metrics").status);
    }
    
    @Test
    void unknownRoutesAreNotFound() throws Exception {
        var response = get("/nope");
        assertEquals(404, response.status);
        assertNotNull(response.version);
    }
    
    private Response get(String uri) throws Exception {
        return await(client.request(HttpMethod.GET, server.actualPort(), "127.0.0.1", uri)
                .compose(request -> request.send())
                .compose(response -> response.body().map(body -> new Response(response, body))));
    }
    
    private static class Response {
        final int status;
        final String contentType;
        final String version;
        final Buffer body;
        
        Response(HttpClientResponse response, Buffer body) {
            this.status = response.statusCode();
            this.contentType = response.getHeader("Content-Type");
            this.version = response.getHeader("Basalt-Version");
            this.body = body;
        }
    }
}
