package basalt.protocol;

import basalt.node.NodeStats;
import basalt.track.LoadResult;
import basalt.track.Track;
import basalt.track.TrackInfo;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Encodes commands sent to nodes and decodes what nodes send back. Decoding
 * ignores fields it doesn't know, and maps unknown ops and event types to
 * their {@code Unknown} variants.
 */
public class WireCodec {
    private WireCodec() {}
    
    @Nonnull
    @CheckReturnValue
    public static String encode(@Nonnull OutboundCommand command) {
        return toJson(command).encode();
    }
    
    /**
     * Returns the json form of a command, including the {@code op} field.
     *
     * @param command Command to encode.
     *
     * @return The encoded command.
     */
    @Nonnull
    @CheckReturnValue
    public static JsonObject toJson(@Nonnull OutboundCommand command) {
        var json = new JsonObject().put("op", command.op().wireName());
        if(command.guildId() != null) {
            json.put("guildId", command.guildId());
        }
        switch(command.op()) {
            case PLAY: {
                var play = (OutboundCommand.Play) command;
                json.put("track", play.track());
                if(play.startTime() > 0) {
                    json.put("startTimeMs", play.startTime());
                }
                if(play.endTime() > 0) {
                    json.put("endTimeMs", play.endTime());
                }
                json.put("pause", play.pause());
                if(play.volume() >= 0) {
                    json.put("volume", play.volume());
                }
                break;
            }
            case PAUSE:
                json.put("state", ((OutboundCommand.Pause) command).state());
                break;
            case SEEK:
                json.put("positionMs", ((OutboundCommand.Seek) command).position());
                break;
            case VOLUME:
                json.put("volume", ((OutboundCommand.Volume) command).volume());
                break;
            case VOICE_UPDATE: {
                var session = ((OutboundCommand.VoiceUpdate) command).session();
                json.put("sessionId", session.sessionId());
                json.put("event", new JsonObject()
                        .put("guild_id", session.guildId())
                        .put("token", session.token())
                        .put("endpoint", session.endpoint())
                );
                break;
            }
            case CONFIGURE_RESUMING:
                json.put("timeout", ((OutboundCommand.ConfigureResuming) command).timeoutSeconds());
                break;
            case STOP:
            case DESTROY:
                break;
            default:
                throw new AssertionError("Unhandled op " + command.op());
        }
        return json;
    }
    
    /**
     * Decodes a text frame received from a node.
     *
     * @param frame Frame to decode.
     *
     * @return The decoded message.
     *
     * @throws CodecException If the frame is not valid json, or a known message misses
     *                        required fields or has fields of the wrong type.
     */
    @Nonnull
    @CheckReturnValue
    public static InboundMessage decode(@Nonnull String frame) throws CodecException {
        JsonObject json;
        try {
            json = new JsonObject(frame);
        } catch(DecodeException e) {
            throw new CodecException("Frame is not a json object", e);
        }
        return decode(json);
    }
    
    @Nonnull
    @CheckReturnValue
    public static InboundMessage decode(@Nonnull JsonObject json) throws CodecException {
        try {
            var op = json.getString("op");
            if(op == null) {
                throw new CodecException("Missing op field");
            }
            switch(op) {
                case "ready":
                    return new InboundMessage.Ready(
                            required(json, "sessionId"),
                            json.getBoolean("resumed", false)
                    );
                case "playerUpdate": {
                    var state = json.getJsonObject("state");
                    if(state == null) {
                        throw new CodecException("Missing state field");
                    }
                    return new InboundMessage.PlayerUpdate(
                            required(json, "guildId"),
                            longField(state, "positionMs", "position", 0),
                            longField(state, "timestamp", "time", System.currentTimeMillis()),
                            state.getBoolean("connected", true)
                    );
                }
                case "stats":
                    return new InboundMessage.Stats(decodeStats(json));
                case "event":
                    return decodeEvent(json);
                default:
                    return new InboundMessage.Unknown(op);
            }
        } catch(ClassCastException e) {
            throw new CodecException("Field of unexpected type", e);
        }
    }
    
    @Nonnull
    @CheckReturnValue
    public static NodeStats decodeStats(@Nonnull JsonObject json) {
        var memory = json.getJsonObject("memory", new JsonObject());
        var cpu = json.getJsonObject("cpu", new JsonObject());
        var frames = json.getJsonObject("frameStats");
        return new NodeStats(
                json.getInteger("players", 0),
                json.getInteger("playingPlayers", 0),
                json.getLong("uptime", 0L),
                memory.getLong("free", 0L),
                memory.getLong("used", 0L),
                memory.getLong("allocated", 0L),
                memory.getLong("reservable", 0L),
                cpu.getInteger("cores", 0),
                cpu.getDouble("systemLoad", 0.0),
                cpu.getDouble("lavalinkLoad", cpu.getDouble("nodeLoad", 0.0)),
                frames == null ? -1 : frames.getLong("sent", -1L),
                frames == null ? -1 : frames.getLong("nulled", -1L),
                frames == null ? -1 : frames.getLong("deficit", -1L)
        );
    }
    
    @Nonnull
    @CheckReturnValue
    private static PlayerEvent decodeEvent(@Nonnull JsonObject json) throws CodecException {
        var guildId = required(json, "guildId");
        var type = json.getString("type");
        var track = trackField(json);
        switch(PlayerEvent.Type.fromWire(type)) {
            case TRACK_START:
                return new PlayerEvent.TrackStart(guildId, track);
            case TRACK_END:
                return new PlayerEvent.TrackEnd(guildId, track, endReason(json.getString("reason")));
            case TRACK_EXCEPTION: {
                var exception = json.getJsonObject("exception");
                var message = json.getString("error");
                var severity = LoadResult.Severity.COMMON;
                if(exception != null) {
                    if(message == null) {
                        message = exception.getString("message");
                    }
                    severity = severity(exception.getString("severity"));
                }
                return new PlayerEvent.TrackException(guildId, track, message, severity);
            }
            case TRACK_STUCK:
                return new PlayerEvent.TrackStuck(guildId, track, json.getLong("thresholdMs", 0L));
            case WEBSOCKET_CLOSED:
                return new PlayerEvent.WebSocketClosed(
                        guildId,
                        json.getInteger("code", -1),
                        json.getString("reason"),
                        json.getBoolean("byRemote", false)
                );
            default:
                return new PlayerEvent.Unknown(guildId, type);
        }
    }
    
    /**
     * Decodes the body of a {@code /loadtracks} response.
     *
     * @param json Body to decode.
     *
     * @return The load result.
     *
     * @throws CodecException If the body is not a valid load result.
     */
    @Nonnull
    @CheckReturnValue
    public static LoadResult decodeLoadResult(@Nonnull JsonObject json) throws CodecException {
        try {
            var loadType = json.getString("loadType");
            if(loadType == null) {
                throw new CodecException("Missing loadType field");
            }
            switch(loadType) {
                case "NO_MATCHES":
                    return LoadResult.noMatches();
                case "TRACK_LOADED": {
                    var tracks = decodeTracks(json.getJsonArray("tracks"));
                    if(tracks.isEmpty()) {
                        throw new CodecException("TRACK_LOADED result without tracks");
                    }
                    return LoadResult.track(tracks.get(0));
                }
                case "PLAYLIST_LOADED": {
                    var info = json.getJsonObject("playlistInfo", new JsonObject());
                    return LoadResult.playlist(
                            info.getString("name"),
                            decodeTracks(json.getJsonArray("tracks")),
                            info.getInteger("selectedTrack", -1)
                    );
                }
                case "SEARCH_RESULT":
                    return LoadResult.search(decodeTracks(json.getJsonArray("tracks")));
                case "LOAD_FAILED": {
                    var exception = json.getJsonObject("exception", json.getJsonObject("cause", new JsonObject()));
                    var message = exception.getString("message", "Unknown error");
                    var severity = json.getString("severity", exception.getString("severity"));
                    return LoadResult.failed(message, severity(severity));
                }
                default:
                    throw new CodecException("Unknown loadType " + loadType);
            }
        } catch(ClassCastException e) {
            throw new CodecException("Field of unexpected type", e);
        }
    }
    
    @Nonnull
    @CheckReturnValue
    public static Track decodeTrack(@Nonnull JsonObject json) throws CodecException {
        var encoded = json.getString("track", json.getString("encoded"));
        if(encoded == null) {
            throw new CodecException("Missing track field");
        }
        var info = json.getJsonObject("info");
        if(info == null) {
            throw new CodecException("Missing info field");
        }
        return new Track(encoded, new TrackInfo(
                required(info, "identifier"),
                info.getString("title", "Unknown title"),
                info.getString("author", "Unknown artist"),
                info.getLong("length", 0L),
                info.getString("uri"),
                info.getString("sourceName"),
                info.getBoolean("isStream", false),
                info.getBoolean("isSeekable", true)
        ));
    }
    
    private static List<Track> decodeTracks(@Nullable JsonArray array) throws CodecException {
        var list = new ArrayList<Track>();
        if(array == null) {
            return list;
        }
        for(var i = 0; i < array.size(); i++) {
            list.add(decodeTrack(array.getJsonObject(i)));
        }
        return list;
    }
    
    @Nullable
    private static String trackField(@Nonnull JsonObject json) {
        var value = json.getValue("track");
        if(value == null) {
            value = json.getValue("encodedTrack");
        }
        if(value instanceof JsonObject) {
            return ((JsonObject) value).getString("encoded", ((JsonObject) value).getString("track"));
        }
        return value == null ? null : value.toString();
    }
    
    @Nonnull
    private static String required(@Nonnull JsonObject json, @Nonnull String key) throws CodecException {
        var value = json.getString(key);
        if(value == null) {
            throw new CodecException("Missing " + key + " field");
        }
        return value;
    }
    
    private static long longField(@Nonnull JsonObject json, @Nonnull String key, @Nonnull String alias, long def) {
        var value = json.getLong(key);
        if(value == null) {
            value = json.getLong(alias);
        }
        return value == null ? def : value;
    }
    
    @Nonnull
    private static PlayerEvent.EndReason endReason(@Nullable String reason) {
        if(reason == null) {
            return PlayerEvent.EndReason.UNKNOWN;
        }
        try {
            return PlayerEvent.EndReason.valueOf(
                    reason.replaceAll("([a-z])([A-Z])", "$1_$2").toUpperCase(Locale.ROOT)
            );
        } catch(IllegalArgumentException e) {
            return PlayerEvent.EndReason.UNKNOWN;
        }
    }
    
    @Nonnull
    private static LoadResult.Severity severity(@Nullable String severity) {
        if(severity == null) {
            return LoadResult.Severity.COMMON;
        }
        try {
            return LoadResult.Severity.valueOf(severity.toUpperCase(Locale.ROOT));
        } catch(IllegalArgumentException e) {
            return LoadResult.Severity.FAULT;
        }
    }
}
