package basalt.track;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * A track reference, made of the node-encoded blob used to play it and
 * the metadata the node returned when resolving it.
 */
public class Track {
    private final String encoded;
    private final TrackInfo info;
    
    public Track(@Nonnull String encoded, @Nonnull TrackInfo info) {
        this.encoded = Objects.requireNonNull(encoded, "encoded");
        this.info = Objects.requireNonNull(info, "info");
    }
    
    /**
     * Returns the encoded form of this track, which is what play commands carry.
     *
     * @return The encoded track.
     */
    @Nonnull
    @CheckReturnValue
    public String encoded() {
        return encoded;
    }
    
    @Nonnull
    @CheckReturnValue
    public TrackInfo info() {
        return info;
    }
    
    @Override
    public boolean equals(Object o) {
        if(this == o) return true;
        if(!(o instanceof Track)) return false;
        return encoded.equals(((Track) o).encoded);
    }
    
    @Override
    public int hashCode() {
        return encoded.hashCode();
    }
    
    @Override
    public String toString() {
        return "Track{" + info.title() + "}";
    }
}
