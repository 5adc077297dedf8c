package basalt.node.transport;

import basalt.node.NodeInfo;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpClient;
import io.vertx.core.http.HttpClientOptions;
import io.vertx.core.http.WebSocket;
import io.vertx.core.http.WebSocketConnectOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.util.Map;

/**
 * Websocket transport backed by the vertx http client.
 */
public class VertxNodeTransport implements NodeTransport {
    private static final Logger log = LoggerFactory.getLogger(VertxNodeTransport.class);
    
    private final HttpClient client;
    private final String path;
    private final int connectTimeout;
    
    public VertxNodeTransport(@Nonnull Vertx vertx, @Nonnull String path, int connectTimeout) {
        this.client = vertx.createHttpClient(new HttpClientOptions()
                .setConnectTimeout(connectTimeout)
                .setMaxWebSocketFrameSize(1 << 20)
                .setMaxWebSocketMessageSize(1 << 22));
        this.path = path;
        this.connectTimeout = connectTimeout;
    }
    
    @Nonnull
    @Override
    public Future<NodeSession> open(@Nonnull NodeInfo node, @Nonnull Map<String, String> headers) {
        var options = new WebSocketConnectOptions();
        options.setHost(node.host());
        options.setPort(node.port());
        options.setURI(path);
        options.setSsl(node.secure());
        options.setTimeout(connectTimeout);
        headers.forEach(options::addHeader);
        log.debug("Opening websocket to {}", node);
        return client.webSocket(options).map(WebSocketSession::new);
    }
    
    private static class WebSocketSession implements NodeSession {
        private final WebSocket ws;
        
        WebSocketSession(WebSocket ws) {
            this.ws = ws;
            ws.exceptionHandler(e -> log.warn("Websocket error", e));
        }
        
        @Nonnull
        @Override
        public Future<Void> send(@Nonnull String text) {
            return ws.writeTextMessage(text);
        }
        
        @Override
        public void messageHandler(@Nonnull Handler<String> handler) {
            ws.textMessageHandler(handler);
        }
        
        @Override
        public void closeHandler(@Nonnull CloseHandler handler) {
            ws.closeHandler(__ -> {
                var code = ws.closeStatusCode();
                handler.onClose(code == null ? -1 : code, ws.closeReason());
            });
        }
        
        @Nonnull
        @Override
        public Future<Void> close() {
            return ws.close();
        }
    }
}
