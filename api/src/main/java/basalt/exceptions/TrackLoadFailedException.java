package basalt.exceptions;

import basalt.track.LoadResult;

import javax.annotation.Nonnull;

public class TrackLoadFailedException extends BasaltException {
    private final LoadResult.Severity severity;
    
    public TrackLoadFailedException(@Nonnull String message, @Nonnull LoadResult.Severity severity) {
        super(message);
        this.severity = severity;
    }
    
    @Nonnull
    public LoadResult.Severity severity() {
        return severity;
    }
}
