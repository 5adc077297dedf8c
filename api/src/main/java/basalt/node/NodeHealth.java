package basalt.node;

import io.vertx.core.json.JsonObject;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Point in time snapshot of a node, for diagnostics.
 */
public class NodeHealth {
    private final String name;
    private final ConnectionState state;
    private final boolean healthy;
    private final int consecutiveFailures;
    private final int load;
    private final String sessionId;
    private final NodeStats stats;
    
    public NodeHealth(@Nonnull Node node) {
        this.name = node.name();
        this.state = node.state();
        this.healthy = node.healthy();
        this.consecutiveFailures = node.consecutiveFailures();
        this.load = node.load();
        this.sessionId = node.sessionId();
        this.stats = node.stats();
    }
    
    @Nonnull
    @CheckReturnValue
    public String name() {
        return name;
    }
    
    @Nonnull
    @CheckReturnValue
    public ConnectionState state() {
        return state;
    }
    
    @CheckReturnValue
    public boolean healthy() {
        return healthy;
    }
    
    @CheckReturnValue
    public int consecutiveFailures() {
        return consecutiveFailures;
    }
    
    @CheckReturnValue
    public int load() {
        return load;
    }
    
    @Nullable
    @CheckReturnValue
    public String sessionId() {
        return sessionId;
    }
    
    @Nullable
    @CheckReturnValue
    public NodeStats stats() {
        return stats;
    }
    
    @Nonnull
    @CheckReturnValue
    public JsonObject toJson() {
        var json = new JsonObject()
                .put("name", name)
                .put("state", state.name())
                .put("healthy", healthy)
                .put("consecutiveFailures", consecutiveFailures)
                .put("load", load)
                .put("sessionId", sessionId);
        if(stats != null) {
            json.put("stats", new JsonObject()
                    .put("players", stats.players())
                    .put("playingPlayers", stats.playingPlayers())
                    .put("uptime", stats.uptime())
                    .put("systemLoad", stats.systemLoad())
                    .put("nodeLoad", stats.nodeLoad())
                    .put("memoryUsed", stats.memoryUsed()));
        }
        return json;
    }
}
