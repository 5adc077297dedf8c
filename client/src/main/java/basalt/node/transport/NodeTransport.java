package basalt.node.transport;

import basalt.node.NodeInfo;
import io.vertx.core.Future;

import javax.annotation.Nonnull;
import java.util.Map;

/**
 * Opens sessions to nodes.
 */
public interface NodeTransport {
    /**
     * Opens a new session. The future fails if the node refuses the connection,
     * including for bad credentials.
     *
     * @param node    Node to connect to.
     * @param headers Handshake headers.
     *
     * @return The opened session.
     */
    @Nonnull
    Future<NodeSession> open(@Nonnull NodeInfo node, @Nonnull Map<String, String> headers);
}
