package io.feydor.mmlbeep.util;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.reflect.TypeToken;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;
import io.feydor.mmlbeep.mml.BeepEvent;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.util.List;

/**
 * Reads and writes beep files: a JSON array of [frequencyHz, durationMs] pairs, e.g. [[262,500],[0,250]]
 */
public class JsonIo {
    private static final Gson GSON = new GsonBuilder()
            .registerTypeAdapter(BeepEvent.class, new BeepEventAdapter().nullSafe())
            .create();

    public static String toJson(List<BeepEvent> events) {
        return GSON.toJson(events);
    }

    public static List<BeepEvent> fromJson(String json) {
        return fromJson(new StringReader(json));
    }

    /**
     * @throws JsonParseException When the document is not an array of two-number arrays
     */
    public static List<BeepEvent> fromJson(Reader reader) {
        TypeToken<List<BeepEvent>> typeToken = new TypeToken<>() {};
        List<BeepEvent> events = GSON.fromJson(reader, typeToken);
        if (events == null)
            throw new JsonParseException("Empty beep document");
        return events;
    }

    /** A BeepEvent as a two-element array instead of Gson's default object */
    static class BeepEventAdapter extends TypeAdapter<BeepEvent> {
        @Override
        public void write(JsonWriter out, BeepEvent event) throws IOException {
            out.beginArray();
            out.value(event.frequencyHz());
            out.value(event.durationMs());
            out.endArray();
        }

        @Override
        public BeepEvent read(JsonReader in) throws IOException {
            in.beginArray();
            int frequency = in.nextInt();
            int duration = in.nextInt();
            if (in.peek() != JsonToken.END_ARRAY)
                throw new JsonParseException("A beep must be exactly [frequencyHz, durationMs]: " + in.getPath());
            in.endArray();
            try {
                return new BeepEvent(frequency, duration);
            } catch (IllegalArgumentException e) {
                throw new JsonParseException(e.getMessage() + " at " + in.getPath(), e);
            }
        }
    }
}
