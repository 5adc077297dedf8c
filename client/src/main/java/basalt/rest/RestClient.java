package basalt.rest;

import basalt.exceptions.CommandRejectedException;
import basalt.exceptions.RestException;
import basalt.node.Backoff;
import basalt.node.NodeInfo;
import basalt.node.NodeStats;
import basalt.protocol.CodecException;
import basalt.protocol.OutboundCommand;
import basalt.protocol.WireCodec;
import basalt.track.LoadResult;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.http.HttpClient;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.http.RequestOptions;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * Request/response calls to a node's http api. Connection level failures are
 * retried with backoff; any http response is final.
 */
public class RestClient {
    private static final Logger log = LoggerFactory.getLogger(RestClient.class);
    
    private final Vertx vertx;
    private final HttpClient client;
    private final NodeInfo node;
    private final String userId;
    private final int maxAttempts;
    private final Backoff backoff;
    private final long requestTimeout;
    
    public RestClient(@Nonnull Vertx vertx, @Nonnull HttpClient client, @Nonnull NodeInfo node,
                      @Nonnull String userId, int maxAttempts, @Nonnull Backoff backoff, long requestTimeout) {
        if(maxAttempts < 1) {
            throw new IllegalArgumentException("At least one attempt is required");
        }
        this.vertx = vertx;
        this.client = client;
        this.node = node;
        this.userId = userId;
        this.maxAttempts = maxAttempts;
        this.backoff = backoff;
        this.requestTimeout = requestTimeout;
    }
    
    /**
     * Resolves an identifier into tracks. The identifier is sent as is; search
     * prefixes must already be applied.
     *
     * @param identifier Identifier to resolve.
     *
     * @return The load result.
     */
    @Nonnull
    @CheckReturnValue
    public Future<LoadResult> resolveTracks(@Nonnull String identifier) {
        log.debug("Resolving {} on node {}", identifier, node.name());
        return request(HttpMethod.GET, "/loadtracks?identifier=" + URLEncoder.encode(identifier, StandardCharsets.UTF_8), null)
                .compose(body -> {
                    if(body == null) {
                        return Future.failedFuture(new RestException(RestException.Kind.SERVER_REJECTED, 200,
                                "Empty load result from node " + node.name()));
                    }
                    try {
                        return Future.succeededFuture(WireCodec.decodeLoadResult(body));
                    } catch(CodecException e) {
                        return Future.failedFuture(new RestException(RestException.Kind.SERVER_REJECTED, 200,
                                "Invalid load result from node " + node.name() + ": " + e.getMessage(), e));
                    }
                });
    }
    
    /**
     * Returns the state the node holds for a player, or null if it has none.
     *
     * @param guildId Guild id of the player.
     *
     * @return The player state.
     */
    @Nonnull
    @CheckReturnValue
    public Future<JsonObject> player(@Nonnull String guildId) {
        return request(HttpMethod.GET, "/player/" + guildId, null)
                .recover(e -> {
                    if(e instanceof RestException && ((RestException) e).status() == 404) {
                        return Future.succeededFuture(null);
                    }
                    return Future.failedFuture(e);
                });
    }
    
    @Nonnull
    @CheckReturnValue
    public Future<NodeStats> stats() {
        return request(HttpMethod.GET, "/stats", null)
                .map(body -> WireCodec.decodeStats(body == null ? new JsonObject() : body));
    }
    
    /**
     * Runs a player command over http. The request body is the json the websocket
     * command would carry.
     *
     * @param command Command to run.
     *
     * @return A future completed once the node accepted the command. Fails with
     * {@link CommandRejectedException} if the node declined it.
     */
    @Nonnull
    public Future<Void> execute(@Nonnull OutboundCommand command) {
        var guildId = command.guildId();
        if(guildId == null) {
            return Future.failedFuture(new IllegalArgumentException("Command " + command + " can't be sent over http"));
        }
        var body = WireCodec.toJson(command);
        body.remove("op");
        body.remove("guildId");
        Future<JsonObject> result;
        switch(command.op()) {
            case PLAY:
                result = request(HttpMethod.POST, "/player/" + guildId + "/play", body);
                break;
            case STOP:
                result = request(HttpMethod.POST, "/player/" + guildId + "/stop", null);
                break;
            case PAUSE:
                result = request(HttpMethod.PATCH, "/player/" + guildId + "/pause", body);
                break;
            case SEEK:
                result = request(HttpMethod.PATCH, "/player/" + guildId + "/seek", body);
                break;
            case VOLUME:
                result = request(HttpMethod.PATCH, "/player/" + guildId + "/volume", body);
                break;
            case VOICE_UPDATE:
                result = request(HttpMethod.POST, "/player/" + guildId + "/voice-server-update", body);
                break;
            case DESTROY:
                result = request(HttpMethod.DELETE, "/player/" + guildId, null);
                break;
            default:
                return Future.failedFuture(new IllegalArgumentException("Command " + command + " can't be sent over http"));
        }
        return result.recover(e -> {
            if(e instanceof RestException && ((RestException) e).kind() == RestException.Kind.SERVER_REJECTED) {
                var rest = (RestException) e;
                return Future.failedFuture(new CommandRejectedException(rest.status(), rest.getMessage()));
            }
            return Future.failedFuture(e);
        }).mapEmpty();
    }
    
    @Nonnull
    private Future<JsonObject> request(@Nonnull HttpMethod method, @Nonnull String uri, @Nullable JsonObject body) {
        return attempt(method, uri, body, 0);
    }
    
    @Nonnull
    private Future<JsonObject> attempt(@Nonnull HttpMethod method, @Nonnull String uri,
                                       @Nullable JsonObject body, int attempt) {
        return send(method, uri, body).recover(e -> {
            if(e instanceof RestException) {
                return Future.failedFuture(e);
            }
            if(attempt + 1 >= maxAttempts) {
                log.warn("{} {} on node {} failed after {} attempts", method, uri, node.name(), maxAttempts, e);
                return Future.failedFuture(new RestException(RestException.Kind.NETWORK, -1,
                        "Node " + node.name() + " unreachable: " + e.getMessage(), e));
            }
            var delay = backoff.delay(attempt);
            log.debug("{} {} on node {} failed, retrying in {}ms", method, uri, node.name(), delay, e);
            var promise = Promise.<JsonObject>promise();
            vertx.setTimer(delay, __ -> attempt(method, uri, body, attempt + 1).onComplete(promise));
            return promise.future();
        });
    }
    
    @Nonnull
    private Future<JsonObject> send(@Nonnull HttpMethod method, @Nonnull String uri, @Nullable JsonObject body) {
        var options = new RequestOptions()
                .setMethod(method)
                .setHost(node.host())
                .setPort(node.port())
                .setURI(uri)
                .setSsl(node.secure())
                .setTimeout(requestTimeout)
                .putHeader("Authorization", node.password())
                .putHeader("User-Id", userId)
                .putHeader("Content-Type", "application/json");
        return client.request(options)
                .compose(request -> body == null ? request.send() : request.send(body.toBuffer()))
                .compose(response -> response.body().compose(buffer -> {
                    var status = response.statusCode();
                    if(status >= 200 && status < 300) {
                        return Future.succeededFuture(parse(buffer));
                    }
                    return Future.failedFuture(rejected(status, response.statusMessage(), buffer));
                }));
    }
    
    @Nullable
    private static JsonObject parse(@Nonnull Buffer buffer) {
        if(buffer.length() == 0) {
            return null;
        }
        try {
            return buffer.toJsonObject();
        } catch(DecodeException | ClassCastException e) {
            log.debug("Ignoring non json response body", e);
            return null;
        }
    }
    
    @Nonnull
    private RestException rejected(int status, @Nullable String statusMessage, @Nonnull Buffer buffer) {
        var message = statusMessage;
        var json = parse(buffer);
        if(json != null) {
            message = json.getString("message", json.getString("error", message));
        }
        log.debug("Node {} rejected request with status {}: {}", node.name(), status, message);
        return new RestException(RestException.Kind.SERVER_REJECTED, status,
                "Node " + node.name() + " answered " + status + ": " + message);
    }
}
