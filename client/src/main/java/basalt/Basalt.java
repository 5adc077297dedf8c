package basalt;

import basalt.event.EventDispatcherImpl;
import basalt.handler.DiagnosticsHandler;
import basalt.node.Backoff;
import basalt.node.NodeConnection;
import basalt.node.NodeInfo;
import basalt.node.transport.NodeTransport;
import basalt.node.transport.VertxNodeTransport;
import basalt.player.PlayerManager;
import basalt.rest.RestClient;
import basalt.util.ConfigUtil;
import basalt.util.Init;
import com.typesafe.config.Config;
import io.vertx.core.CompositeFuture;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpClient;
import io.vertx.core.http.HttpClientOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

public class Basalt implements ClientState {
    private static final Logger log = LoggerFactory.getLogger(Basalt.class);
    
    private final EventDispatcherImpl dispatcher = new EventDispatcherImpl();
    private final List<NodeConnection> nodes = new ArrayList<>();
    private final Vertx vertx;
    private final Config config;
    private final HttpClient httpClient;
    private final PlayerManager manager;
    
    /**
     * Creates the client and its node connections. Nothing connects until {@link #start()}.
     *
     * @param vertx      Vertx instance to run on.
     * @param rootConfig Configuration containing the {@code basalt} key.
     * @param transport  Transport used to open node sessions.
     */
    public Basalt(@Nonnull Vertx vertx, @Nonnull Config rootConfig, @Nonnull NodeTransport transport) {
        this.vertx = vertx;
        this.config = rootConfig.getConfig("basalt");
        this.httpClient = vertx.createHttpClient(new HttpClientOptions()
                .setConnectTimeout((int) config.getDuration("node.connect-timeout", TimeUnit.MILLISECONDS)));
        this.manager = new PlayerManager(vertx, config, dispatcher, new Random());
        var restBackoff = new Backoff(
                config.getDuration("rest.base-delay", TimeUnit.MILLISECONDS),
                config.getDuration("rest.max-delay", TimeUnit.MILLISECONDS)
        );
        for(var nodeConfig : config.getConfigList("nodes")) {
            var info = NodeInfo.fromConfig(nodeConfig);
            var rest = new RestClient(vertx, httpClient, info, config.getString("user-id"),
                    config.getInt("rest.max-attempts"), restBackoff,
                    config.getDuration("rest.request-timeout", TimeUnit.MILLISECONDS));
            var node = new NodeConnection(vertx, config, info, transport, rest, manager);
            nodes.add(node);
            manager.addNode(node);
        }
        if(nodes.isEmpty()) {
            throw new IllegalArgumentException("No nodes configured");
        }
    }
    
    @Nonnull
    @CheckReturnValue
    @Override
    public Config config() {
        return config;
    }
    
    @Nonnull
    @CheckReturnValue
    @Override
    public Vertx vertx() {
        return vertx;
    }
    
    @Nonnull
    @CheckReturnValue
    @Override
    public EventDispatcherImpl dispatcher() {
        return dispatcher;
    }
    
    @Nonnull
    @CheckReturnValue
    @Override
    public List<NodeConnection> nodes() {
        return Collections.unmodifiableList(nodes);
    }
    
    @Nonnull
    @CheckReturnValue
    @Override
    public PlayerManager players() {
        return manager;
    }
    
    /**
     * Connects every node.
     *
     * @return A future completed once any node is ready, failed if all of them were shut down first.
     */
    @Nonnull
    public Future<Void> start() {
        var ready = nodes.stream().map(NodeConnection::connect).collect(Collectors.toList());
        return CompositeFuture.any(new ArrayList<>(ready)).mapEmpty();
    }
    
    /**
     * Destroys every player and shuts every node down.
     *
     * @return A future completed once all nodes were shut down.
     */
    @Nonnull
    public Future<Void> shutdown() {
        var released = manager.players().stream()
                .map(p -> manager.release(p.guildId()))
                .collect(Collectors.toList());
        return CompositeFuture.join(new ArrayList<>(released))
                .eventually(v -> CompositeFuture.join(new ArrayList<>(nodes.stream()
                        .map(NodeConnection::shutdown)
                        .collect(Collectors.toList()))))
                .eventually(v -> httpClient.close())
                .mapEmpty();
    }
    
    public static void main(String[] args) {
        var start = System.nanoTime();
        log.info("Starting basalt version {}", Version.VERSION);
        try {
            var rootConfig = ConfigUtil.load();
            var config = rootConfig.getConfig("basalt");
            Init.preInit(config);
            var vertx = Vertx.vertx();
            var basalt = new Basalt(vertx, rootConfig, new VertxNodeTransport(
                    vertx,
                    config.getString("node.websocket-path"),
                    (int) config.getDuration("node.connect-timeout", TimeUnit.MILLISECONDS)
            ));
            Init.postInit(basalt);
            if(config.getBoolean("diagnostics.enabled")) {
                DiagnosticsHandler.setup(basalt);
            }
            basalt.start()
                    .onSuccess(v -> log.info("First node ready after {} ms", (System.nanoTime() - start) / 1_000_000))
                    .onFailure(e -> log.error("No node became ready", e));
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                log.info("Shutting down");
                var latch = new CountDownLatch(1);
                basalt.shutdown()
                        .eventually(v -> vertx.close())
                        .onComplete(__ -> latch.countDown());
                try {
                    if(!latch.await(10, TimeUnit.SECONDS)) {
                        log.warn("Timed out waiting for shutdown");
                    }
                } catch(InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }, "basalt-shutdown"));
            log.info("Started in {} ms", (System.nanoTime() - start) / 1_000_000);
        } catch(Throwable t) {
            log.error("Fatal error during initialization", t);
            System.exit(1);
        }
    }
}
