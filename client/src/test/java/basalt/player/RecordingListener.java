package basalt.player;

import basalt.event.BasaltEventListener;
import basalt.node.Node;
import basalt.track.Track;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

class RecordingListener implements BasaltEventListener {
    final List<String> events = new CopyOnWriteArrayList<>();
    final List<Track> started = new CopyOnWriteArrayList<>();
    final List<Integer> failures = new CopyOnWriteArrayList<>();
    final List<DestroyReason> destroyed = new CopyOnWriteArrayList<>();
    
    long count(String event) {
        return events.stream().filter(event::equals).count();
    }
    
    @Override
    public void onPlayerCreated(BasaltPlayer player) {
        events.add("created");
    }
    
    @Override
    public void onPlayerDestroyed(BasaltPlayer player, DestroyReason reason) {
        events.add("destroyed");
        destroyed.add(reason);
    }
    
    @Override
    public void onTrackStart(BasaltPlayer player, Track track) {
        events.add("start");
        started.add(track);
    }
    
    @Override
    public void onQueueEnd(BasaltPlayer player) {
        events.add("queueEnd");
    }
    
    @Override
    public void onPlaybackFailed(BasaltPlayer player, int consecutiveFailures, String lastError) {
        events.add("failed");
        failures.add(consecutiveFailures);
    }
    
    @Override
    public void onPlayerStalled(BasaltPlayer player) {
        events.add("stalled");
    }
    
    @Override
    public void onVoiceConnectionClosed(BasaltPlayer player, int closeCode, String reason, boolean byRemote) {
        events.add("voiceClosed");
    }
    
    @Override
    public void onNodeReady(Node node, boolean resumed) {
        events.add(resumed ? "nodeResumed" : "nodeReady");
    }
    
    @Override
    public void onNodeUnhealthy(Node node) {
        events.add("nodeUnhealthy");
    }
}
