package basalt.node;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nonnegative;

/**
 * Load figures periodically pushed by a node.
 */
public class NodeStats {
    private final int players;
    private final int playingPlayers;
    private final long uptime;
    private final long memoryFree;
    private final long memoryUsed;
    private final long memoryAllocated;
    private final long memoryReservable;
    private final int cores;
    private final double systemLoad;
    private final double nodeLoad;
    private final long framesSent;
    private final long framesNulled;
    private final long framesDeficit;
    
    public NodeStats(int players, int playingPlayers, long uptime,
                     long memoryFree, long memoryUsed, long memoryAllocated, long memoryReservable,
                     int cores, double systemLoad, double nodeLoad,
                     long framesSent, long framesNulled, long framesDeficit) {
        this.players = players;
        this.playingPlayers = playingPlayers;
        this.uptime = uptime;
        this.memoryFree = memoryFree;
        this.memoryUsed = memoryUsed;
        this.memoryAllocated = memoryAllocated;
        this.memoryReservable = memoryReservable;
        this.cores = cores;
        this.systemLoad = systemLoad;
        this.nodeLoad = nodeLoad;
        this.framesSent = framesSent;
        this.framesNulled = framesNulled;
        this.framesDeficit = framesDeficit;
    }
    
    @Nonnegative
    @CheckReturnValue
    public int players() {
        return players;
    }
    
    @Nonnegative
    @CheckReturnValue
    public int playingPlayers() {
        return playingPlayers;
    }
    
    @CheckReturnValue
    public long uptime() {
        return uptime;
    }
    
    @CheckReturnValue
    public long memoryFree() {
        return memoryFree;
    }
    
    @CheckReturnValue
    public long memoryUsed() {
        return memoryUsed;
    }
    
    @CheckReturnValue
    public long memoryAllocated() {
        return memoryAllocated;
    }
    
    @CheckReturnValue
    public long memoryReservable() {
        return memoryReservable;
    }
    
    @CheckReturnValue
    public int cores() {
        return cores;
    }
    
    @CheckReturnValue
    public double systemLoad() {
        return systemLoad;
    }
    
    /**
     * Returns the share of cpu used by the node process itself.
     *
     * @return The node process load.
     */
    @CheckReturnValue
    public double nodeLoad() {
        return nodeLoad;
    }
    
    /**
     * Returns the frames sent over the last minute, or -1 if the node did not report frame stats.
     *
     * @return Frames sent.
     */
    @CheckReturnValue
    public long framesSent() {
        return framesSent;
    }
    
    @CheckReturnValue
    public long framesNulled() {
        return framesNulled;
    }
    
    @CheckReturnValue
    public long framesDeficit() {
        return framesDeficit;
    }
}
