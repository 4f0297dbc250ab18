package io.pollwatch.event;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import java.nio.file.Path;
import java.util.Objects;
import org.jetbrains.annotations.Nullable;

/**
 * A single change observed under the root directory.
 *
 * @param path absolute path of the item
 * @param type the item's type at the time it was observed (or last observed, for {@link EventKind#DELETE})
 * @param kind what happened
 * @param cause the underlying failure for {@link EventKind#ERROR} events, otherwise null
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"path", "type", "kind", "error"})
public record Event(
        @JsonSerialize(using = ToStringSerializer.class) Path path,
        PathType type,
        EventKind kind,
        @JsonIgnore @Nullable Throwable cause) {

    public Event {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(kind, "kind");
    }

    public static Event of(Path path, PathType type, EventKind kind) {
        return new Event(path, type, kind, null);
    }

    public static Event error(Path path, PathType type, Throwable cause) {
        return new Event(path, type, EventKind.ERROR, cause);
    }

    /** Wire form of {@link #cause()}: its message, or its class name when it has none. */
    @JsonProperty("error")
    public @Nullable String error() {
        if (cause == null) {
            return null;
        }
        var message = cause.getMessage();
        return message != null ? message : cause.getClass().getName();
    }

    @Override
    public String toString() {
        var base = kind + " " + type + " " + path;
        var error = error();
        return error == null ? base : base + " (" + error + ")";
    }
}
