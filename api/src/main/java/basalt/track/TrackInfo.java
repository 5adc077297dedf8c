package basalt.track;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nonnegative;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Metadata of a resolved track, as reported by the node that resolved it.
 */
public class TrackInfo {
    private final String identifier;
    private final String title;
    private final String author;
    private final long length;
    private final String uri;
    private final String sourceName;
    private final boolean stream;
    private final boolean seekable;
    
    public TrackInfo(@Nonnull String identifier, @Nonnull String title, @Nonnull String author,
                     @Nonnegative long length, @Nullable String uri, @Nullable String sourceName,
                     boolean stream, boolean seekable) {
        this.identifier = identifier;
        this.title = title;
        this.author = author;
        this.length = length;
        this.uri = uri;
        this.sourceName = sourceName;
        this.stream = stream;
        this.seekable = seekable;
    }
    
    @Nonnull
    @CheckReturnValue
    public String identifier() {
        return identifier;
    }
    
    @Nonnull
    @CheckReturnValue
    public String title() {
        return title;
    }
    
    @Nonnull
    @CheckReturnValue
    public String author() {
        return author;
    }
    
    /**
     * Returns the duration of the track, in milliseconds. Streams report
     * an unbounded length, which nodes usually encode as {@code Long.MAX_VALUE}.
     *
     * @return The duration of the track.
     */
    @Nonnegative
    @CheckReturnValue
    public long length() {
        return length;
    }
    
    @Nullable
    @CheckReturnValue
    public String uri() {
        return uri;
    }
    
    @Nullable
    @CheckReturnValue
    public String sourceName() {
        return sourceName;
    }
    
    @CheckReturnValue
    public boolean isStream() {
        return stream;
    }
    
    @CheckReturnValue
    public boolean isSeekable() {
        return seekable;
    }
    
    @Override
    public String toString() {
        return "TrackInfo{title=" + title + ", author=" + author + ", length=" + length + "}";
    }
}
