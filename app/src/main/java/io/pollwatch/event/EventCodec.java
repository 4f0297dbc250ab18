package io.pollwatch.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.UncheckedIOException;

/** Serializes events to the JSON line format used when events leave the process. */
public final class EventCodec {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private EventCodec() {}

    public static String toJson(Event event) {
        try {
            return MAPPER.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }
}
