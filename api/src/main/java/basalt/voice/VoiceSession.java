package basalt.voice;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Voice credentials for a guild, as provided by the gateway client. Instances
 * are immutable; a newer session for the same guild replaces the whole object.
 */
public class VoiceSession {
    private final String guildId;
    private final String channelId;
    private final String sessionId;
    private final String token;
    private final String endpoint;
    
    public VoiceSession(@Nonnull String guildId, @Nonnull String channelId, @Nonnull String sessionId,
                        @Nonnull String token, @Nonnull String endpoint) {
        this.guildId = Objects.requireNonNull(guildId, "guildId");
        this.channelId = Objects.requireNonNull(channelId, "channelId");
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.token = Objects.requireNonNull(token, "token");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
    }
    
    @Nonnull
    @CheckReturnValue
    public String guildId() {
        return guildId;
    }
    
    @Nonnull
    @CheckReturnValue
    public String channelId() {
        return channelId;
    }
    
    @Nonnull
    @CheckReturnValue
    public String sessionId() {
        return sessionId;
    }
    
    @Nonnull
    @CheckReturnValue
    public String token() {
        return token;
    }
    
    @Nonnull
    @CheckReturnValue
    public String endpoint() {
        return endpoint;
    }
    
    @Override
    public String toString() {
        //token intentionally left out
        return "VoiceSession{guild=" + guildId + ", channel=" + channelId + ", endpoint=" + endpoint + "}";
    }
}
