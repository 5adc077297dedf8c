package basalt.event;

import javax.annotation.Nonnull;

public interface EventDispatcher {
    void register(@Nonnull BasaltEventListener listener);
    
    void unregister(@Nonnull BasaltEventListener listener);
}
