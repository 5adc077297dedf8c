package basalt.node;

import basalt.protocol.InboundMessage;
import basalt.protocol.PlayerEvent;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

class RecordingNodeListener implements NodeListener {
    final List<String> events = new CopyOnWriteArrayList<>();
    final List<InboundMessage.PlayerUpdate> updates = new CopyOnWriteArrayList<>();
    final List<PlayerEvent> playerEvents = new CopyOnWriteArrayList<>();
    volatile Consumer<NodeLink> onReady = node -> {};
    
    long count(String event) {
        return events.stream().filter(event::equals).count();
    }
    
    @Override
    public void onReady(NodeLink node, boolean resumed) {
        events.add(resumed ? "resumed" : "ready");
        onReady.accept(node);
    }
    
    @Override
    public void onSessionLost(NodeLink node) {
        events.add("lost");
    }
    
    @Override
    public void onUnhealthy(NodeLink node) {
        events.add("unhealthy");
    }
    
    @Override
    public void onPlayerUpdate(NodeLink node, InboundMessage.PlayerUpdate update) {
        updates.add(update);
    }
    
    @Override
    public void onPlayerEvent(NodeLink node, PlayerEvent event) {
        playerEvents.add(event);
    }
}
