package basalt.util;

import basalt.ClientState;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import com.typesafe.config.Config;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;

public class Init {
    /**
     * Applies the settings that must be in place before anything else runs.
     *
     * @param config Configuration rooted at the {@code basalt} key.
     */
    public static void preInit(@Nonnull Config config) {
        ((Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME)).setLevel(
                Level.valueOf(config.getString("log-level").toUpperCase())
        );
        if(config.getBoolean("prometheus.enabled")) {
            PrometheusUtils.setup();
        }
        if(config.getBoolean("sentry.enabled")) {
            SentryUtils.setup(config);
        }
    }
    
    public static void postInit(@Nonnull ClientState state) {
        if(state.config().getBoolean("prometheus.enabled")) {
            PrometheusUtils.configureMetrics(state);
        }
        if(state.config().getBoolean("sentry.enabled")) {
            SentryUtils.configureWarns(state);
        }
    }
}
