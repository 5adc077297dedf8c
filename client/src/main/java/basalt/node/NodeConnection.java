package basalt.node;

import basalt.Version;
import basalt.node.transport.NodeSession;
import basalt.node.transport.NodeTransport;
import basalt.node.transport.TransportException;
import basalt.protocol.CodecException;
import basalt.protocol.InboundMessage;
import basalt.protocol.OutboundCommand;
import basalt.protocol.PlayerEvent;
import basalt.protocol.WireCodec;
import basalt.rest.RestClient;
import com.typesafe.config.Config;
import io.prometheus.client.Counter;
import io.vertx.core.Context;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Session with a single node. Owns at most one transport session at a time and
 * keeps it alive: lost connections are resumed while the resume window lasts,
 * and retried with backoff otherwise.
 *
 * All state transitions run on the context this connection was created on.
 */
public class NodeConnection implements NodeLink {
    private static final Logger log = LoggerFactory.getLogger(NodeConnection.class);
    
    private static final Counter connectAttempts = Counter.build()
            .namespace("basalt")
            .name("node_connect_attempts")
            .help("Connection attempts made to nodes")
            .labelNames("node", "kind")
            .register();
    private static final Counter droppedFrames = Counter.build()
            .namespace("basalt")
            .name("node_dropped_frames")
            .help("Frames received from nodes that could not be decoded")
            .labelNames("node")
            .register();
    
    private final Queue<OutboundCommand> pending = new ConcurrentLinkedQueue<>();
    private final AtomicInteger boundPlayers = new AtomicInteger();
    private final Promise<Void> firstReady = Promise.promise();
    private final Vertx vertx;
    private final Context context;
    private final NodeInfo info;
    private final NodeTransport transport;
    private final RestClient rest;
    private final NodeListener listener;
    private final String userId;
    private final String clientName;
    private final Backoff backoff;
    private final long handshakeTimeout;
    private final long resumeTimeout;
    private final int unhealthyThreshold;
    private final int pendingLimit;
    
    private volatile ConnectionState state = ConnectionState.DISCONNECTED;
    private volatile NodeSession session;
    private volatile String sessionId;
    private volatile NodeStats stats;
    private volatile boolean healthy = true;
    private volatile int failures;
    
    //node context only
    private Future<Void> teardown = Future.succeededFuture();
    private boolean shutdown;
    private boolean attemptInFlight;
    private boolean resumeAttempt;
    private boolean announcingReady;
    private long reconnectTimer = -1;
    private long handshakeTimer = -1;
    private long resumeTimer = -1;
    
    public NodeConnection(@Nonnull Vertx vertx, @Nonnull Config config, @Nonnull NodeInfo info,
                          @Nonnull NodeTransport transport, @Nonnull RestClient rest,
                          @Nonnull NodeListener listener) {
        this.vertx = vertx;
        this.context = vertx.getOrCreateContext();
        this.info = info;
        this.transport = transport;
        this.rest = rest;
        this.listener = listener;
        this.userId = config.getString("user-id");
        this.clientName = config.getString("client-name");
        this.backoff = new Backoff(
                config.getDuration("node.reconnect.base-delay", TimeUnit.MILLISECONDS),
                config.getDuration("node.reconnect.max-delay", TimeUnit.MILLISECONDS)
        );
        this.handshakeTimeout = config.getDuration("node.connect-timeout", TimeUnit.MILLISECONDS);
        this.resumeTimeout = config.getDuration("node.resume-timeout", TimeUnit.MILLISECONDS);
        this.unhealthyThreshold = config.getInt("node.unhealthy-threshold");
        this.pendingLimit = config.getInt("node.pending-limit");
    }
    
    @Nonnull
    @Override
    public NodeInfo info() {
        return info;
    }
    
    @Nonnull
    @Override
    public ConnectionState state() {
        return state;
    }
    
    @Nullable
    @Override
    public String sessionId() {
        return sessionId;
    }
    
    @Override
    public boolean healthy() {
        return healthy;
    }
    
    @Override
    public int consecutiveFailures() {
        return failures;
    }
    
    @Override
    public int load() {
        var s = stats;
        return Math.max(boundPlayers.get(), s == null ? 0 : s.players());
    }
    
    @Nullable
    @Override
    public NodeStats stats() {
        return stats;
    }
    
    @Nonnull
    @Override
    public RestClient rest() {
        return rest;
    }
    
    @Override
    public boolean available() {
        return healthy && state == ConnectionState.READY;
    }
    
    @Override
    public void playerBound() {
        boundPlayers.incrementAndGet();
    }
    
    @Override
    public void playerUnbound() {
        boundPlayers.decrementAndGet();
    }
    
    /**
     * Starts connecting. Failed attempts are retried until {@link #shutdown()}.
     *
     * @return A future completed the first time this node becomes ready.
     */
    @Nonnull
    public Future<Void> connect() {
        context.runOnContext(__ -> {
            if(shutdown || attemptInFlight || state != ConnectionState.DISCONNECTED || reconnectTimer != -1) {
                return;
            }
            attempt();
        });
        return firstReady.future();
    }
    
    /**
     * Closes the session and stops reconnecting. Terminal.
     *
     * @return A future completed once the session was torn down.
     */
    @Nonnull
    public Future<Void> shutdown() {
        var promise = Promise.<Void>promise();
        context.runOnContext(__ -> {
            shutdown = true;
            reconnectTimer = cancel(reconnectTimer);
            handshakeTimer = cancel(handshakeTimer);
            resumeTimer = cancel(resumeTimer);
            state = ConnectionState.DISCONNECTED;
            pending.clear();
            var s = session;
            session = null;
            if(s != null) {
                teardown = s.close().otherwiseEmpty();
            }
            firstReady.tryFail(new TransportException("Node " + info.name() + " was shut down"));
            log.info("Node {} shut down", info.name());
            teardown.onComplete(promise);
        });
        return promise.future();
    }
    
    /**
     * Sends a command, buffering it while the node is not ready. Commands are
     * ordered on this connection's context, so a command never overtakes one
     * buffered before it.
     */
    @Nonnull
    @Override
    public Future<Void> send(@Nonnull OutboundCommand command) {
        if(info.preferRest() && command.guildId() != null) {
            return rest.execute(command);
        }
        if(Vertx.currentContext() == context) {
            return sendOnContext(command);
        }
        var promise = Promise.<Void>promise();
        context.runOnContext(__ -> sendOnContext(command).onComplete(promise));
        return promise.future();
    }
    
    @Nonnull
    private Future<Void> sendOnContext(@Nonnull OutboundCommand command) {
        var s = session;
        //the ready listener re-issues voice updates ahead of buffered commands
        if(state == ConnectionState.READY && s != null && (pending.isEmpty() || announcingReady)) {
            return write(s, command);
        }
        if(shutdown) {
            log.debug("Dropping {} for node {}, which was shut down", command, info.name());
            return Future.succeededFuture();
        }
        if(pending.size() >= pendingLimit) {
            log.warn("Dropping {}, node {} already buffers {} commands", command, info.name(), pendingLimit);
            return Future.succeededFuture();
        }
        log.debug("Buffering {} until node {} is ready", command, info.name());
        pending.add(command);
        flushPending();
        return Future.succeededFuture();
    }
    
    @Override
    public void discard(@Nonnull String guildId) {
        pending.removeIf(command -> guildId.equals(command.guildId()));
    }
    
    private void attempt() {
        if(shutdown || attemptInFlight) {
            return;
        }
        attemptInFlight = true;
        resumeAttempt = sessionId != null && resumeTimer != -1;
        if(!resumeAttempt) {
            state = ConnectionState.CONNECTING;
        }
        connectAttempts.labels(info.name(), resumeAttempt ? "resume" : "new").inc();
        if(resumeAttempt) {
            log.info("Resuming session {} on node {}", sessionId, info);
        } else {
            log.info("Connecting to node {}", info);
        }
        var headers = headers(resumeAttempt);
        teardown.compose(v -> transport.open(info, headers), e -> transport.open(info, headers))
                .onComplete(ar -> {
                    if(ar.failed()) {
                        onAttemptFailed(ar.cause());
                    } else {
                        onOpened(ar.result());
                    }
                });
    }
    
    private void onOpened(@Nonnull NodeSession s) {
        if(shutdown) {
            attemptInFlight = false;
            teardown = s.close().otherwiseEmpty();
            return;
        }
        session = s;
        state = ConnectionState.AUTHENTICATED;
        s.messageHandler(this::onFrame);
        s.closeHandler((code, reason) -> onClosed(s, code, reason));
        handshakeTimer = vertx.setTimer(handshakeTimeout, __ -> {
            handshakeTimer = -1;
            if(session == s && state == ConnectionState.AUTHENTICATED) {
                log.warn("Node {} did not announce a session within {}ms", info.name(), handshakeTimeout);
                session = null;
                teardown = s.close().otherwiseEmpty();
                onAttemptFailed(new TransportException("Timed out waiting for session"));
            }
        });
    }
    
    private void onFrame(@Nonnull String frame) {
        InboundMessage message;
        try {
            message = WireCodec.decode(frame);
        } catch(CodecException e) {
            droppedFrames.labels(info.name()).inc();
            log.warn("Dropping malformed frame from node {}: {}", info.name(), e.getMessage());
            log.debug("Malformed frame: {}", frame);
            return;
        }
        switch(message.op()) {
            case READY:
                onReady((InboundMessage.Ready) message);
                break;
            case STATS:
                stats = ((InboundMessage.Stats) message).stats();
                break;
            case PLAYER_UPDATE:
                listener.onPlayerUpdate(this, (InboundMessage.PlayerUpdate) message);
                break;
            case EVENT:
                listener.onPlayerEvent(this, (PlayerEvent) message);
                break;
            default:
                log.debug("Ignoring unknown op {} from node {}", ((InboundMessage.Unknown) message).name(), info.name());
                break;
        }
    }
    
    private void onReady(@Nonnull InboundMessage.Ready ready) {
        handshakeTimer = cancel(handshakeTimer);
        resumeTimer = cancel(resumeTimer);
        attemptInFlight = false;
        var resumed = resumeAttempt && ready.resumed() && ready.sessionId().equals(sessionId);
        if(resumeAttempt && !resumed) {
            log.warn("Node {} did not resume session {}", info.name(), sessionId);
            loseSession();
        }
        resumeAttempt = false;
        sessionId = ready.sessionId();
        state = ConnectionState.READY;
        failures = 0;
        if(!healthy) {
            healthy = true;
            log.info("Node {} is healthy again", info.name());
        }
        log.info("Node {} ready with session {} (resumed: {})", info.name(), sessionId, resumed);
        if(resumeTimeout > 0) {
            write(session, new OutboundCommand.ConfigureResuming(TimeUnit.MILLISECONDS.toSeconds(resumeTimeout + 999)));
        }
        announcingReady = true;
        try {
            listener.onReady(this, resumed);
        } finally {
            announcingReady = false;
        }
        flushPending();
        firstReady.tryComplete();
    }
    
    private void onClosed(@Nonnull NodeSession s, int code, @Nullable String reason) {
        if(session != s) {
            return;
        }
        session = null;
        handshakeTimer = cancel(handshakeTimer);
        if(shutdown) {
            return;
        }
        if(state != ConnectionState.READY) {
            onAttemptFailed(new TransportException("Connection closed during handshake (" + code + ": " + reason + ")"));
            return;
        }
        log.warn("Lost connection to node {} ({}: {})", info.name(), code, reason);
        if(resumeTimeout > 0) {
            state = ConnectionState.RECONNECTING;
            resumeTimer = vertx.setTimer(resumeTimeout, __ -> {
                resumeTimer = -1;
                if(shutdown || state == ConnectionState.READY || sessionId == null) {
                    return;
                }
                log.warn("Resume window of node {} expired", info.name());
                resumeAttempt = false;
                if(!attemptInFlight) {
                    state = ConnectionState.CONNECTING;
                }
                loseSession();
            });
        } else {
            state = ConnectionState.CONNECTING;
            loseSession();
        }
        scheduleReconnect();
    }
    
    private void onAttemptFailed(@Nonnull Throwable cause) {
        if(!attemptInFlight) {
            return;
        }
        attemptInFlight = false;
        failures++;
        log.warn("Connection attempt to node {} failed ({} in a row): {}", info.name(), failures, cause.toString());
        if(healthy && failures >= unhealthyThreshold) {
            healthy = false;
            log.error("Node {} marked unhealthy after {} consecutive failures", info.name(), failures);
            listener.onUnhealthy(this);
        }
        if(shutdown) {
            return;
        }
        state = sessionId != null && resumeTimer != -1 ? ConnectionState.RECONNECTING : ConnectionState.DISCONNECTED;
        scheduleReconnect();
    }
    
    private void loseSession() {
        sessionId = null;
        pending.clear();
        listener.onSessionLost(this);
    }
    
    private void scheduleReconnect() {
        if(shutdown || reconnectTimer != -1) {
            return;
        }
        var delay = backoff.delay(failures);
        log.debug("Reconnecting to node {} in {}ms", info.name(), delay);
        reconnectTimer = vertx.setTimer(delay, __ -> {
            reconnectTimer = -1;
            attempt();
        });
    }
    
    private void flushPending() {
        OutboundCommand command;
        while(state == ConnectionState.READY && session != null && (command = pending.poll()) != null) {
            write(session, command);
        }
    }
    
    @Nonnull
    private Future<Void> write(@Nonnull NodeSession s, @Nonnull OutboundCommand command) {
        return s.send(WireCodec.encode(command)).otherwise(e -> {
            log.warn("Failed to send {} to node {}", command, info.name(), e);
            return null;
        });
    }
    
    @Nonnull
    private Map<String, String> headers(boolean resume) {
        var headers = new LinkedHashMap<String, String>();
        headers.put("Authorization", info.password());
        headers.put("User-Id", userId);
        headers.put("Client-Name", clientName + "/" + Version.VERSION);
        if(resume) {
            headers.put("Session-Id", sessionId);
        }
        return headers;
    }
    
    private long cancel(long timer) {
        if(timer != -1) {
            vertx.cancelTimer(timer);
        }
        return -1;
    }
    
    @Override
    public String toString() {
        return "NodeConnection{" + info.name() + ", " + state + "}";
    }
}
