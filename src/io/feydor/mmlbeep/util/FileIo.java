package io.feydor.mmlbeep.util;

import io.feydor.mmlbeep.mml.BeepEvent;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

public class FileIo {
    private static final Logger LOGGER = Logger.getLogger(FileIo.class.getName());

    /**
     * Writes the events to a beep file, replacing it if it exists
     * @param path where to write
     * @param events the events of a single track
     * @param format the file format
     */
    public static void writeBeepFile(Path path, List<BeepEvent> events, BeepFormat format) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null && !Files.isDirectory(parent)) {
            LOGGER.log(Level.INFO, "Creating directory: {0}", parent);
            Files.createDirectories(parent);
        }
        Files.writeString(path, format.render(events), StandardCharsets.UTF_8);
        LOGGER.log(Level.FINE, "Wrote {0} events to {1}", new Object[]{events.size(), path});
    }

    /** Reads back a JSON beep file */
    public static List<BeepEvent> readBeepFile(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return JsonIo.fromJson(reader);
        }
    }
}
