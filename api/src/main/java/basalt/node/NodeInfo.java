package basalt.node;

import com.typesafe.config.Config;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Static identity of a node, read from configuration.
 */
public class NodeInfo {
    private final String name;
    private final String host;
    private final int port;
    private final String password;
    private final boolean secure;
    private final boolean preferRest;
    
    public NodeInfo(@Nonnull String name, @Nonnull String host, int port, @Nonnull String password,
                    boolean secure, boolean preferRest) {
        if(port < 1 || port > 65535) {
            throw new IllegalArgumentException("Invalid port " + port + " for node " + name);
        }
        this.name = Objects.requireNonNull(name, "name");
        this.host = Objects.requireNonNull(host, "host");
        this.port = port;
        this.password = Objects.requireNonNull(password, "password");
        this.secure = secure;
        this.preferRest = preferRest;
    }
    
    /**
     * Reads a node entry of the {@code nodes} list.
     *
     * @param config Entry to read.
     *
     * @return The node info.
     */
    @Nonnull
    @CheckReturnValue
    public static NodeInfo fromConfig(@Nonnull Config config) {
        var host = config.getString("host");
        var port = config.getInt("port");
        return new NodeInfo(
                config.hasPath("name") ? config.getString("name") : host + ":" + port,
                host,
                port,
                config.getString("password"),
                config.hasPath("secure") && config.getBoolean("secure"),
                config.hasPath("prefer-rest") && config.getBoolean("prefer-rest")
        );
    }
    
    @Nonnull
    @CheckReturnValue
    public String name() {
        return name;
    }
    
    @Nonnull
    @CheckReturnValue
    public String host() {
        return host;
    }
    
    @CheckReturnValue
    public int port() {
        return port;
    }
    
    @Nonnull
    @CheckReturnValue
    public String password() {
        return password;
    }
    
    /**
     * Returns whether connections to this node use TLS.
     *
     * @return True for wss/https.
     */
    @CheckReturnValue
    public boolean secure() {
        return secure;
    }
    
    /**
     * Returns whether player commands should be sent over REST instead of the websocket.
     *
     * @return True if REST is preferred for player commands.
     */
    @CheckReturnValue
    public boolean preferRest() {
        return preferRest;
    }
    
    @Override
    public String toString() {
        return name + " (" + (secure ? "wss" : "ws") + "://" + host + ":" + port + ")";
    }
}
