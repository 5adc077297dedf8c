package basalt.track;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nonnegative;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;

/**
 * Outcome of a track resolution request. Exactly one of the {@link Type types}
 * applies; the accessors that make no sense for a type return empty values.
 */
public class LoadResult {
    public enum Type {
        NO_MATCHES, TRACK_LOADED, PLAYLIST_LOADED, SEARCH_RESULT, LOAD_FAILED
    }
    
    public enum Severity {
        COMMON, SUSPICIOUS, FAULT
    }
    
    private final Type type;
    private final List<Track> tracks;
    private final String playlistName;
    private final int selectedIndex;
    private final String failureMessage;
    private final Severity severity;
    
    private LoadResult(Type type, List<Track> tracks, String playlistName, int selectedIndex,
                       String failureMessage, Severity severity) {
        this.type = type;
        this.tracks = List.copyOf(tracks);
        this.playlistName = playlistName;
        this.selectedIndex = selectedIndex;
        this.failureMessage = failureMessage;
        this.severity = severity;
    }
    
    @Nonnull
    @CheckReturnValue
    public static LoadResult noMatches() {
        return new LoadResult(Type.NO_MATCHES, List.of(), null, -1, null, null);
    }
    
    @Nonnull
    @CheckReturnValue
    public static LoadResult track(@Nonnull Track track) {
        return new LoadResult(Type.TRACK_LOADED, List.of(track), null, -1, null, null);
    }
    
    @Nonnull
    @CheckReturnValue
    public static LoadResult playlist(@Nullable String name, @Nonnull List<Track> tracks, int selectedIndex) {
        if(selectedIndex >= tracks.size()) {
            selectedIndex = -1;
        }
        return new LoadResult(Type.PLAYLIST_LOADED, tracks, name, selectedIndex, null, null);
    }
    
    @Nonnull
    @CheckReturnValue
    public static LoadResult search(@Nonnull List<Track> tracks) {
        return new LoadResult(Type.SEARCH_RESULT, tracks, null, -1, null, null);
    }
    
    @Nonnull
    @CheckReturnValue
    public static LoadResult failed(@Nonnull String message, @Nonnull Severity severity) {
        return new LoadResult(Type.LOAD_FAILED, List.of(), null, -1, message, severity);
    }
    
    @Nonnull
    @CheckReturnValue
    public Type type() {
        return type;
    }
    
    @Nonnull
    @CheckReturnValue
    public List<Track> tracks() {
        return tracks;
    }
    
    @Nullable
    @CheckReturnValue
    public String playlistName() {
        return playlistName;
    }
    
    /**
     * Returns the index of the track selected in a playlist, or -1 when
     * no track was selected or this result is not a playlist.
     *
     * @return The selected index.
     */
    @CheckReturnValue
    public int selectedIndex() {
        return selectedIndex;
    }
    
    @Nullable
    @CheckReturnValue
    public String failureMessage() {
        return failureMessage;
    }
    
    @Nullable
    @CheckReturnValue
    public Severity severity() {
        return severity;
    }
    
    @Nonnegative
    @CheckReturnValue
    public int size() {
        return tracks.size();
    }
    
    @Override
    public String toString() {
        return "LoadResult{type=" + type + ", tracks=" + tracks.size() + "}";
    }
}
