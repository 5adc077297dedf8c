package basalt.node.transport;

import io.vertx.core.Future;
import io.vertx.core.Handler;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * A live bidirectional connection to a node.
 */
public interface NodeSession {
    /**
     * Sends a text frame.
     *
     * @param text Frame contents.
     *
     * @return A future completed when the frame was written.
     */
    @Nonnull
    Future<Void> send(@Nonnull String text);
    
    void messageHandler(@Nonnull Handler<String> handler);
    
    /**
     * Sets the handler called once the connection is closed, by either side.
     *
     * @param handler Handler to call.
     */
    void closeHandler(@Nonnull CloseHandler handler);
    
    /**
     * Closes the connection. The returned future completes when the teardown finished.
     *
     * @return A future completed on teardown.
     */
    @Nonnull
    Future<Void> close();
    
    @FunctionalInterface
    interface CloseHandler {
        void onClose(int code, @Nullable String reason);
    }
}
