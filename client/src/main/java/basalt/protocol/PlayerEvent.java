package basalt.protocol;

import basalt.track.LoadResult;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Track lifecycle or voice connection event for a guild.
 */
public abstract class PlayerEvent extends InboundMessage {
    public enum Type {
        TRACK_START("TrackStartEvent"),
        TRACK_END("TrackEndEvent"),
        TRACK_EXCEPTION("TrackExceptionEvent"),
        TRACK_STUCK("TrackStuckEvent"),
        WEBSOCKET_CLOSED("WebSocketClosedEvent"),
        UNKNOWN(null);
        
        private final String wireName;
        
        Type(String wireName) {
            this.wireName = wireName;
        }
        
        @Nullable
        public String wireName() {
            return wireName;
        }
        
        @Nonnull
        @CheckReturnValue
        static Type fromWire(@Nullable String name) {
            for(var type : values()) {
                if(type.wireName != null && type.wireName.equals(name)) {
                    return type;
                }
            }
            return UNKNOWN;
        }
    }
    
    public enum EndReason {
        FINISHED(true),
        LOAD_FAILED(true),
        STOPPED(false),
        REPLACED(false),
        CLEANUP(false),
        UNKNOWN(false);
        
        private final boolean mayStartNext;
        
        EndReason(boolean mayStartNext) {
            this.mayStartNext = mayStartNext;
        }
        
        public boolean mayStartNext() {
            return mayStartNext;
        }
    }
    
    private final Type type;
    private final String guildId;
    private final String track;
    
    PlayerEvent(@Nonnull Type type, @Nonnull String guildId, @Nullable String track) {
        super(Op.EVENT);
        this.type = type;
        this.guildId = guildId;
        this.track = track;
    }
    
    @Nonnull
    @CheckReturnValue
    public Type type() {
        return type;
    }
    
    @Nonnull
    @CheckReturnValue
    public String guildId() {
        return guildId;
    }
    
    /**
     * Returns the encoded track this event is about, if the node sent one.
     *
     * @return The encoded track.
     */
    @Nullable
    @CheckReturnValue
    public String track() {
        return track;
    }
    
    public static class TrackStart extends PlayerEvent {
        public TrackStart(@Nonnull String guildId, @Nullable String track) {
            super(Type.TRACK_START, guildId, track);
        }
    }
    
    public static class TrackEnd extends PlayerEvent {
        private final EndReason reason;
        
        public TrackEnd(@Nonnull String guildId, @Nullable String track, @Nonnull EndReason reason) {
            super(Type.TRACK_END, guildId, track);
            this.reason = reason;
        }
        
        @Nonnull
        public EndReason reason() {
            return reason;
        }
    }
    
    public static class TrackException extends PlayerEvent {
        private final String message;
        private final LoadResult.Severity severity;
        
        public TrackException(@Nonnull String guildId, @Nullable String track, @Nullable String message,
                              @Nonnull LoadResult.Severity severity) {
            super(Type.TRACK_EXCEPTION, guildId, track);
            this.message = message;
            this.severity = severity;
        }
        
        @Nullable
        public String message() {
            return message;
        }
        
        @Nonnull
        public LoadResult.Severity severity() {
            return severity;
        }
    }
    
    public static class TrackStuck extends PlayerEvent {
        private final long thresholdMs;
        
        public TrackStuck(@Nonnull String guildId, @Nullable String track, long thresholdMs) {
            super(Type.TRACK_STUCK, guildId, track);
            this.thresholdMs = thresholdMs;
        }
        
        public long thresholdMs() {
            return thresholdMs;
        }
    }
    
    public static class WebSocketClosed extends PlayerEvent {
        private final int code;
        private final String reason;
        private final boolean byRemote;
        
        public WebSocketClosed(@Nonnull String guildId, int code, @Nullable String reason, boolean byRemote) {
            super(Type.WEBSOCKET_CLOSED, guildId, null);
            this.code = code;
            this.reason = reason;
            this.byRemote = byRemote;
        }
        
        public int code() {
            return code;
        }
        
        @Nullable
        public String reason() {
            return reason;
        }
        
        public boolean byRemote() {
            return byRemote;
        }
    }
    
    public static class Unknown extends PlayerEvent {
        private final String name;
        
        public Unknown(@Nonnull String guildId, @Nullable String name) {
            super(Type.UNKNOWN, guildId, null);
            this.name = name;
        }
        
        @Nullable
        public String name() {
            return name;
        }
    }
}
