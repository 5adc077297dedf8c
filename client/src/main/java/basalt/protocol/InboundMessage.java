package basalt.protocol;

import basalt.node.NodeStats;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Message received from a node. Player scoped messages ({@link PlayerUpdate}
 * and {@link PlayerEvent}) carry the guild they target.
 */
public abstract class InboundMessage {
    public enum Op {
        READY, PLAYER_UPDATE, STATS, EVENT,
        /**
         * An op this client doesn't know. Ignored.
         */
        UNKNOWN
    }
    
    private final Op op;
    
    InboundMessage(@Nonnull Op op) {
        this.op = op;
    }
    
    @Nonnull
    @CheckReturnValue
    public Op op() {
        return op;
    }
    
    public static class Ready extends InboundMessage {
        private final String sessionId;
        private final boolean resumed;
        
        public Ready(@Nonnull String sessionId, boolean resumed) {
            super(Op.READY);
            this.sessionId = sessionId;
            this.resumed = resumed;
        }
        
        @Nonnull
        public String sessionId() {
            return sessionId;
        }
        
        public boolean resumed() {
            return resumed;
        }
    }
    
    public static class PlayerUpdate extends InboundMessage {
        private final String guildId;
        private final long position;
        private final long timestamp;
        private final boolean connected;
        
        public PlayerUpdate(@Nonnull String guildId, long position, long timestamp, boolean connected) {
            super(Op.PLAYER_UPDATE);
            this.guildId = guildId;
            this.position = position;
            this.timestamp = timestamp;
            this.connected = connected;
        }
        
        @Nonnull
        public String guildId() {
            return guildId;
        }
        
        public long position() {
            return position;
        }
        
        public long timestamp() {
            return timestamp;
        }
        
        public boolean connected() {
            return connected;
        }
    }
    
    public static class Stats extends InboundMessage {
        private final NodeStats stats;
        
        public Stats(@Nonnull NodeStats stats) {
            super(Op.STATS);
            this.stats = stats;
        }
        
        @Nonnull
        public NodeStats stats() {
            return stats;
        }
    }
    
    public static class Unknown extends InboundMessage {
        private final String name;
        
        public Unknown(@Nullable String name) {
            super(Op.UNKNOWN);
            this.name = name;
        }
        
        @Nullable
        public String name() {
            return name;
        }
    }
}
