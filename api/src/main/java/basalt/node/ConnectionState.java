package basalt.node;

public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    /**
     * The transport was accepted by the node, which has not announced the session yet.
     */
    AUTHENTICATED,
    READY,
    /**
     * The transport was lost; reconnecting with the previous session id while the
     * resume window lasts.
     */
    RECONNECTING
}
