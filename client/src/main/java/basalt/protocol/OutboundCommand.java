package basalt.protocol;

import basalt.voice.VoiceSession;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Control message sent to a node. Each subclass is one {@link Op}; encoding
 * lives in {@link WireCodec}.
 */
public abstract class OutboundCommand {
    public enum Op {
        PLAY("play"),
        STOP("stop"),
        PAUSE("pause"),
        SEEK("seek"),
        VOLUME("volume"),
        VOICE_UPDATE("voiceUpdate"),
        DESTROY("destroy"),
        CONFIGURE_RESUMING("configureResuming");
        
        private final String wireName;
        
        Op(String wireName) {
            this.wireName = wireName;
        }
        
        @Nonnull
        @CheckReturnValue
        public String wireName() {
            return wireName;
        }
    }
    
    private final Op op;
    private final String guildId;
    
    OutboundCommand(@Nonnull Op op, @Nullable String guildId) {
        this.op = op;
        this.guildId = guildId;
    }
    
    @Nonnull
    @CheckReturnValue
    public Op op() {
        return op;
    }
    
    /**
     * Returns the guild this command targets, or null for session scoped commands.
     *
     * @return The target guild.
     */
    @Nullable
    @CheckReturnValue
    public String guildId() {
        return guildId;
    }
    
    @Override
    public String toString() {
        return op.wireName + (guildId == null ? "" : "(" + guildId + ")");
    }
    
    public static class Play extends OutboundCommand {
        private final String track;
        private final long startTime;
        private final long endTime;
        private final boolean pause;
        private final int volume;
        
        /**
         * @param guildId   Target guild.
         * @param track     Encoded track.
         * @param startTime Start position in milliseconds, or 0.
         * @param endTime   End position in milliseconds, or 0 to play until the end.
         * @param pause     Whether the track starts paused.
         * @param volume    Volume to play at, or -1 to keep the current one.
         */
        public Play(@Nonnull String guildId, @Nonnull String track, long startTime, long endTime,
                    boolean pause, int volume) {
            super(Op.PLAY, Objects.requireNonNull(guildId));
            this.track = Objects.requireNonNull(track);
            this.startTime = startTime;
            this.endTime = endTime;
            this.pause = pause;
            this.volume = volume;
        }
        
        @Nonnull
        public String track() {
            return track;
        }
        
        public long startTime() {
            return startTime;
        }
        
        public long endTime() {
            return endTime;
        }
        
        public boolean pause() {
            return pause;
        }
        
        public int volume() {
            return volume;
        }
    }
    
    public static class Stop extends OutboundCommand {
        public Stop(@Nonnull String guildId) {
            super(Op.STOP, Objects.requireNonNull(guildId));
        }
    }
    
    public static class Pause extends OutboundCommand {
        private final boolean state;
        
        public Pause(@Nonnull String guildId, boolean state) {
            super(Op.PAUSE, Objects.requireNonNull(guildId));
            this.state = state;
        }
        
        public boolean state() {
            return state;
        }
    }
    
    public static class Seek extends OutboundCommand {
        private final long position;
        
        public Seek(@Nonnull String guildId, long position) {
            super(Op.SEEK, Objects.requireNonNull(guildId));
            this.position = position;
        }
        
        public long position() {
            return position;
        }
    }
    
    public static class Volume extends OutboundCommand {
        private final int volume;
        
        public Volume(@Nonnull String guildId, int volume) {
            super(Op.VOLUME, Objects.requireNonNull(guildId));
            this.volume = volume;
        }
        
        public int volume() {
            return volume;
        }
    }
    
    public static class VoiceUpdate extends OutboundCommand {
        private final VoiceSession session;
        
        public VoiceUpdate(@Nonnull VoiceSession session) {
            super(Op.VOICE_UPDATE, session.guildId());
            this.session = session;
        }
        
        @Nonnull
        public VoiceSession session() {
            return session;
        }
    }
    
    public static class Destroy extends OutboundCommand {
        public Destroy(@Nonnull String guildId) {
            super(Op.DESTROY, Objects.requireNonNull(guildId));
        }
    }
    
    public static class ConfigureResuming extends OutboundCommand {
        private final long timeoutSeconds;
        
        public ConfigureResuming(long timeoutSeconds) {
            super(Op.CONFIGURE_RESUMING, null);
            this.timeoutSeconds = timeoutSeconds;
        }
        
        public long timeoutSeconds() {
            return timeoutSeconds;
        }
    }
}
