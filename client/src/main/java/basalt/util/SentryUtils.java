package basalt.util;

import basalt.ClientState;
import basalt.Version;
import basalt.event.BasaltEventListener;
import basalt.node.Node;
import basalt.player.BasaltPlayer;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.filter.ThresholdFilter;
import com.typesafe.config.Config;
import io.sentry.Sentry;
import io.sentry.SentryClient;
import io.sentry.event.Event;
import io.sentry.event.EventBuilder;
import io.sentry.logback.SentryAppender;
import io.sentry.util.Util;
import org.slf4j.LoggerFactory;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

class SentryUtils {
    private static final String SENTRY_APPENDER_NAME = "SENTRY";
    private static SentryClient client;
    
    static void setup(@Nonnull Config config) {
        var client = Sentry.init(dsn(config.getString("sentry.dsn")));
        client.setRelease(Version.VERSION);
        client.setEnvironment(config.getString("sentry.environment"));
        var tags = config.getString("sentry.tags");
        if(!tags.isEmpty()) {
            client.setTags(Util.parseTags(tags));
        }
        SentryUtils.client = client;
        var loggerContext = (LoggerContext) LoggerFactory.getILoggerFactory();
        var root = loggerContext.getLogger(Logger.ROOT_LOGGER_NAME);
        
        if(root.getAppender(SENTRY_APPENDER_NAME) == null) {
            var sentryAppender = new SentryAppender();
            sentryAppender.setName(SENTRY_APPENDER_NAME);
            
            var threshold = new ThresholdFilter();
            threshold.setLevel(config.getString("sentry.log-level").toUpperCase());
            threshold.start();
            sentryAppender.addFilter(threshold);
            
            sentryAppender.setContext(loggerContext);
            sentryAppender.start();
            root.addAppender(sentryAppender);
        }
    }
    
    static void configureWarns(@Nonnull ClientState state) {
        state.dispatcher().register(new BasaltEventListener() {
            @Override
            public void onNodeUnhealthy(@Nonnull Node node) {
                client.sendEvent(new EventBuilder()
                        .withLevel(Event.Level.WARNING)
                        .withMessage("Node marked unhealthy")
                        .withExtra("node", node.name())
                        .withExtra("failures", node.consecutiveFailures())
                );
            }
            
            @Override
            public void onPlaybackFailed(@Nonnull BasaltPlayer player, int consecutiveFailures,
                                         @Nullable String lastError) {
                client.sendEvent(new EventBuilder()
                        .withLevel(Event.Level.WARNING)
                        .withMessage("Gave up on failing tracks")
                        .withExtra("guild", player.guildId())
                        .withExtra("failures", consecutiveFailures)
                        .withExtra("error", lastError)
                );
            }
        });
    }
    
    //in-app frames are detected by package, passed as a dsn option
    @Nonnull
    @CheckReturnValue
    static String dsn(@Nonnull String dsn) {
        if(dsn.isEmpty() || dsn.contains("stacktrace.app.packages")) {
            return dsn;
        }
        return dsn + (dsn.contains("?") ? "&" : "?") + "stacktrace.app.packages=basalt";
    }
}
