package basalt.exceptions;

import javax.annotation.Nonnull;

public class PlayerNotFoundException extends BasaltException {
    public PlayerNotFoundException(@Nonnull String guildId) {
        super("No player for guild " + guildId);
    }
}
