package io.feydor.mmlbeep.util;

import io.feydor.mmlbeep.mml.BeepEvent;

import java.util.List;
import java.util.stream.Collectors;

/**
 * The supported beep file formats
 */
public enum BeepFormat {
    /** [[frequencyHz, durationMs], ...] */
    JSON("json") {
        @Override
        public String render(List<BeepEvent> events) {
            return JsonIo.toJson(events);
        }
    },

    /**
     * A C++ source file defining <code>std::vector&lt;Note&gt; notes</code>, to be linked with a player that calls
     * Beep(frequency, duration) for tones and Sleep(duration) for rests
     */
    CPP("cpp") {
        @Override
        public String render(List<BeepEvent> events) {
            String notes = events.stream()
                    .map(event -> String.format("    {%d, %d}", event.frequencyHz(), event.durationMs()))
                    .collect(Collectors.joining(",\n"));
            return "#include <vector>\n\n"
                    + "struct Note {\n"
                    + "    unsigned int frequency;\n"
                    + "    unsigned int duration;\n"
                    + "};\n\n"
                    + "std::vector<Note> notes = {\n"
                    + (notes.isEmpty() ? "" : notes + "\n")
                    + "};\n";
        }
    };

    public final String extension;

    BeepFormat(String extension) {
        this.extension = extension;
    }

    public abstract String render(List<BeepEvent> events);

    /**
     * @param name "json" or "cpp", in any case
     * @throws IllegalArgumentException When the format is unknown
     */
    public static BeepFormat fromName(String name) {
        for (var format : values()) {
            if (format.extension.equalsIgnoreCase(name))
                return format;
        }
        throw new IllegalArgumentException("Unknown beep format: " + name + ". Expected one of: json, cpp");
    }
}
