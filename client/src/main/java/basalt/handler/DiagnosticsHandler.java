package basalt.handler;

import basalt.ClientState;
import basalt.Version;
import basalt.player.BasaltPlayer;
import basalt.track.Track;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import io.vertx.core.Future;
import io.vertx.core.http.HttpServer;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nonnegative;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.io.StringWriter;
import java.util.Set;

/**
 * Read only HTTP view of the client: node health, player state and metrics.
 */
public class DiagnosticsHandler {
    private static final Logger log = LoggerFactory.getLogger(DiagnosticsHandler.class);
    
    @Nonnull
    @CheckReturnValue
    public static Router router(@Nonnull ClientState state) {
        var config = state.config();
        var router = Router.router(state.vertx());
        
        //handle failures for all routes
        router.route().failureHandler(context -> {
            log.error("Error handling {} {}", context.request().method(), context.normalizedPath(), context.failure());
            error(context, 500, "Internal server error");
        });
        
        router.route().handler(context -> {
            log.debug("Received request {} {} from {}",
                    context.request().method(),
                    context.normalizedPath(),
                    context.request().remoteAddress()
            );
            context.response().putHeader("Basalt-Version", Version.VERSION);
            context.response().putHeader("Content-Type", "application/json");
            context.next();
        });
        
        if(config.getBoolean("prometheus.enabled")) {
            router.get("/metrics").handler(context -> {
                var writer = new StringWriter();
                try {
                    TextFormat.write004(writer, CollectorRegistry.defaultRegistry.filteredMetricFamilySamples(
                            Set.copyOf(context.queryParam("name[]"))
                    ));
                } catch(IOException e) {
                    context.fail(e);
                    return;
                }
                context.response()
                        .putHeader("Content-Type", TextFormat.CONTENT_TYPE_004)
                        .end(writer.toString());
            });
        }
        
        router.get("/nodes").handler(context -> {
            var nodes = new JsonArray();
            for(var health : state.players().nodeHealth()) {
                nodes.add(health.toJson());
            }
            context.response().end(nodes.toBuffer());
        });
        
        router.get("/players/:guild_id").handler(context -> {
            var player = state.players().player(context.pathParam("guild_id"));
            if(player == null) {
                error(context, 404, "Player not found");
                return;
            }
            context.response().end(encodePlayer(player).toBuffer());
        });
        
        router.route().handler(context -> error(context, 404, "Not found"));
        return router;
    }
    
    /**
     * Starts the diagnostics server on the configured host and port.
     *
     * @param state Client to expose.
     *
     * @return A future completed with the listening server.
     */
    @Nonnull
    public static Future<HttpServer> setup(@Nonnull ClientState state) {
        var config = state.config();
        var host = config.getString("diagnostics.host");
        var port = config.getInt("diagnostics.port");
        log.info("Starting diagnostics server on {}:{}", host, port);
        return state.vertx().createHttpServer()
                .requestHandler(router(state))
                .listen(port, host)
                .onSuccess(server -> log.info("Diagnostics server listening on port {}", server.actualPort()))
                .onFailure(e -> log.error("Error starting diagnostics server", e));
    }
    
    @Nonnull
    @CheckReturnValue
    public static JsonObject encodePlayer(@Nonnull BasaltPlayer player) {
        var queue = new JsonArray();
        for(var track : player.queue()) {
            queue.add(encodeTrack(track));
        }
        var node = player.node();
        var session = player.voiceSession();
        return new JsonObject()
                .put("guildId", player.guildId())
                .put("node", node == null ? null : node.name())
                .put("state", player.state().name())
                .put("channelId", session.channelId())
                .put("currentIndex", player.currentIndex())
                .put("current", encodeTrack(player.currentTrack()))
                .put("position", player.position())
                .put("paused", player.paused())
                .put("volume", player.volume())
                .put("loopMode", player.loopMode().name())
                .put("lastActivity", player.lastActivity())
                .put("queue", queue);
    }
    
    @Nullable
    private static JsonObject encodeTrack(@Nullable Track track) {
        if(track == null) {
            return null;
        }
        var info = track.info();
        return new JsonObject()
                .put("track", track.encoded())
                .put("identifier", info.identifier())
                .put("title", info.title())
                .put("author", info.author())
                .put("length", info.length())
                .put("uri", info.uri())
                .put("isStream", info.isStream());
    }
    
    private static void error(@Nonnull RoutingContext context, @Nonnegative int code, @Nonnull String message) {
        context.response()
                .setStatusCode(code).setStatusMessage(message)
                .putHeader("Content-Type", "application/json")
                .end(new JsonObject()
                        .put("code", code)
                        .put("message", message)
                        .toBuffer()
                );
    }
}
