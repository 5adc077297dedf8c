package basalt;

import basalt.event.EventDispatcher;
import basalt.node.Node;
import basalt.player.PlayerController;
import com.typesafe.config.Config;
import io.vertx.core.Vertx;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nonnull;
import java.util.Collection;

/**
 * Provides access to the client objects for the command layer.
 */
public interface ClientState {
    /**
     * Config used by the client, rooted at the {@code basalt} key.
     *
     * @return The client configuration.
     */
    @Nonnull
    @CheckReturnValue
    Config config();
    
    /**
     * Vertx instance used by the client.
     *
     * @return The vertx instance.
     */
    @Nonnull
    @CheckReturnValue
    Vertx vertx();
    
    /**
     * The event dispatcher used by the client. You can use this to dynamically register/unregister listeners.
     *
     * @return The event dispatcher.
     */
    @Nonnull
    @CheckReturnValue
    EventDispatcher dispatcher();
    
    /**
     * Returns the configured nodes, in configuration order.
     *
     * @return The configured nodes.
     */
    @Nonnull
    @CheckReturnValue
    Collection<? extends Node> nodes();
    
    /**
     * Returns the controller used to create and command players.
     *
     * @return The player controller.
     */
    @Nonnull
    @CheckReturnValue
    PlayerController players();
}
