package basalt.node;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nonnegative;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * A remote audio node, and the state of this client's connection to it.
 */
public interface Node {
    /**
     * Returns the static identity of this node.
     *
     * @return The info of this node.
     */
    @Nonnull
    @CheckReturnValue
    NodeInfo info();
    
    @Nonnull
    @CheckReturnValue
    default String name() {
        return info().name();
    }
    
    /**
     * Returns the current connection state.
     *
     * @return The connection state.
     */
    @Nonnull
    @CheckReturnValue
    ConnectionState state();
    
    /**
     * Returns the session id assigned by the node, or null if no session was
     * established or the previous one expired.
     *
     * @return The session id.
     */
    @Nullable
    @CheckReturnValue
    String sessionId();
    
    /**
     * Returns whether this node can take new players. A node becomes unhealthy
     * after too many consecutive connection failures and healthy again once it
     * reaches {@link ConnectionState#READY}.
     *
     * @return True if this node is healthy.
     */
    @CheckReturnValue
    boolean healthy();
    
    /**
     * Returns the number of consecutive failed connection attempts.
     *
     * @return The consecutive failure count.
     */
    @Nonnegative
    @CheckReturnValue
    int consecutiveFailures();
    
    /**
     * Returns the load used when picking a node for a new player: the larger of
     * the players this client bound to it and the player count the node reported.
     *
     * @return The load of this node.
     */
    @Nonnegative
    @CheckReturnValue
    int load();
    
    /**
     * Returns the last stats reported by this node, if any.
     *
     * @return The last stats.
     */
    @Nullable
    @CheckReturnValue
    NodeStats stats();
}
