package basalt.node;

import basalt.protocol.InboundMessage;
import basalt.protocol.PlayerEvent;

import javax.annotation.Nonnull;

/**
 * Receives connection lifecycle changes and player scoped messages of a node.
 * Called on the node's context.
 */
public interface NodeListener {
    /**
     * Called when the node announced a session.
     *
     * @param node    Node that became ready.
     * @param resumed Whether the previous session was resumed.
     */
    void onReady(@Nonnull NodeLink node, boolean resumed);
    
    /**
     * Called when the previous session of the node is gone, either because the
     * resume window expired or the node refused to resume it. Players bound to
     * the node must be rebound.
     *
     * @param node Node that lost its session.
     */
    void onSessionLost(@Nonnull NodeLink node);
    
    void onUnhealthy(@Nonnull NodeLink node);
    
    void onPlayerUpdate(@Nonnull NodeLink node, @Nonnull InboundMessage.PlayerUpdate update);
    
    void onPlayerEvent(@Nonnull NodeLink node, @Nonnull PlayerEvent event);
}
