package basalt.util;

import basalt.Version;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigValueFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nonnull;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class ConfigUtil {
    private static final Logger log = LoggerFactory.getLogger(ConfigUtil.class);
    
    @Nonnull
    @CheckReturnValue
    public static Config load() {
        return load(Paths.get("application.conf"));
    }
    
    /**
     * Loads the configuration. Environment variables and system properties take
     * precedence over the given file, which takes precedence over the classpath
     * {@code application.conf} and {@code reference.conf}.
     *
     * @param path Configuration file to load, if readable.
     *
     * @return The resolved configuration.
     */
    @Nonnull
    @CheckReturnValue
    public static Config load(@Nonnull Path path) {
        var defaults = ConfigFactory.defaultApplication()
                .withFallback(ConfigFactory.defaultReference());
        if(Files.isReadable(path)) {
            log.info("Loading config from {}", path.toAbsolutePath());
            defaults = ConfigFactory.parseFile(path.toFile()).withFallback(defaults);
        }
        return ConfigFactory.empty()
                .withValue("basalt.version", ConfigValueFactory.fromAnyRef(Version.VERSION))
                .withFallback(ConfigFactory.systemEnvironment())
                .withFallback(ConfigFactory.systemProperties())
                .withFallback(defaults)
                .resolve();
    }
}
