package basalt.node;

import basalt.protocol.OutboundCommand;
import basalt.rest.RestClient;
import io.vertx.core.Future;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nonnull;

/**
 * The side of a node players talk to.
 */
public interface NodeLink extends Node {
    /**
     * Sends a command to the node. Commands sent while the node is reconnecting
     * are buffered and delivered once the session resumes.
     *
     * @param command Command to send.
     *
     * @return A future completed once the command was handed to the node. Only
     * fails for commands the node explicitly declined.
     */
    @Nonnull
    Future<Void> send(@Nonnull OutboundCommand command);
    
    /**
     * Drops buffered commands of a guild.
     *
     * @param guildId Guild whose commands should be dropped.
     */
    void discard(@Nonnull String guildId);
    
    /**
     * Returns the http client of this node.
     *
     * @return The http client.
     */
    @Nonnull
    @CheckReturnValue
    RestClient rest();
    
    /**
     * Returns whether new players may be bound to this node.
     *
     * @return True if this node is healthy and ready.
     */
    @CheckReturnValue
    boolean available();
    
    void playerBound();
    
    void playerUnbound();
}
