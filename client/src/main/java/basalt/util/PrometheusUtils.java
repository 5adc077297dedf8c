package basalt.util;

import basalt.ClientState;
import basalt.event.BasaltEventListener;
import basalt.player.BasaltPlayer;
import basalt.player.DestroyReason;
import basalt.player.PlayerState;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import io.prometheus.client.Collector;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Gauge;
import io.prometheus.client.hotspot.BufferPoolsExports;
import io.prometheus.client.hotspot.ClassLoadingExports;
import io.prometheus.client.hotspot.GarbageCollectorExports;
import io.prometheus.client.hotspot.MemoryAllocationExports;
import io.prometheus.client.hotspot.MemoryPoolsExports;
import io.prometheus.client.hotspot.StandardExports;
import io.prometheus.client.hotspot.VersionInfoExports;
import io.prometheus.client.logback.InstrumentedAppender;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;

class PrometheusUtils {
    static void setup() {
        var prometheusAppender = new InstrumentedAppender();
        
        var factory = (LoggerContext) LoggerFactory.getILoggerFactory();
        var root = factory.getLogger(Logger.ROOT_LOGGER_NAME);
        prometheusAppender.setContext(root.getLoggerContext());
        prometheusAppender.start();
        root.addAppender(prometheusAppender);
        
        //same as DefaultExports.initialize() but doesn't add the
        //thread exports, because that stops all java threads every time
        //it's measured
        new StandardExports().register();
        new MemoryPoolsExports().register();
        new MemoryAllocationExports().register();
        new BufferPoolsExports().register();
        new GarbageCollectorExports().register();
        new ClassLoadingExports().register();
        new VersionInfoExports().register();
    }
    
    static void configureMetrics(@Nonnull ClientState state) {
        CollectorRegistry.defaultRegistry.register(new ClientCollector(state));
        
        var players = Gauge.build()
                .namespace("basalt")
                .name("players")
                .help("Number of players alive at a given point")
                .register();
        
        state.dispatcher().register(new BasaltEventListener() {
            @Override
            public void onPlayerCreated(@Nonnull BasaltPlayer player) {
                players.inc();
            }
            
            @Override
            public void onPlayerDestroyed(@Nonnull BasaltPlayer player, @Nonnull DestroyReason reason) {
                players.dec();
            }
        });
    }
    
    private static class ClientCollector extends Collector {
        private final Gauge playersByState = Gauge.build()
                .namespace("basalt")
                .name("players_by_state")
                .help("Number of players in each state")
                .labelNames("state")
                .create();
        private final Gauge healthyNodes = Gauge.build()
                .namespace("basalt")
                .name("healthy_nodes")
                .help("Number of healthy nodes")
                .create();
        private final ClientState state;
        
        ClientCollector(@Nonnull ClientState state) {
            this.state = state;
        }
        
        @Override
        public List<MetricFamilySamples> collect() {
            var counts = new EnumMap<PlayerState, Integer>(PlayerState.class);
            for(var s : PlayerState.values()) {
                counts.put(s, 0);
            }
            for(var player : state.players().players()) {
                counts.merge(player.state(), 1, Integer::sum);
            }
            counts.forEach((s, count) -> playersByState.labels(s.name().toLowerCase()).set(count));
            healthyNodes.set(state.nodes().stream().filter(n -> n.healthy()).count());
            
            var samples = new ArrayList<MetricFamilySamples>();
            samples.addAll(playersByState.collect());
            samples.addAll(healthyNodes.collect());
            return samples;
        }
    }
}
