package org.Aayush.wayfinder.maze;

import lombok.experimental.UtilityClass;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reads maze text from files or the classpath.
 * <p>
 * Trailing empty lines and carriage returns are dropped; every other line is one maze row.
 * A line of spaces is a row of open cells and is kept.
 */
@UtilityClass
public class MazeLoader {

    /** Classpath location of the bundled 10x10 maze. */
    public static final String DEFAULT_MAZE_RESOURCE = "mazes/default.txt";

    private static final Logger log = LoggerFactory.getLogger(MazeLoader.class);

    public MazeGrid load(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        MazeGrid grid = MazeGrid.parse(normalize(Files.readAllLines(file, StandardCharsets.UTF_8)));
        log.info("Loaded maze {} ({}x{})", file, grid.rows(), grid.columns());
        return grid;
    }

    /**
     * Loads the bundled maze.
     *
     * @throws UncheckedIOException when the resource is missing or unreadable.
     */
    public MazeGrid loadDefault() {
        return loadResource(DEFAULT_MAZE_RESOURCE);
    }

    public MazeGrid loadResource(String resource) {
        Objects.requireNonNull(resource, "resource");
        InputStream in = MazeLoader.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            throw new UncheckedIOException(new IOException("maze resource not found: " + resource));
        }
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            List<String> lines = new ArrayList<>();
            String line;
            while ((line = reader.readLine()) != null) {
                lines.add(line);
            }
            MazeGrid grid = MazeGrid.parse(normalize(lines));
            log.info("Loaded maze resource {} ({}x{})", resource, grid.rows(), grid.columns());
            return grid;
        } catch (IOException ex) {
            throw new UncheckedIOException("failed to read maze resource " + resource, ex);
        }
    }

    List<String> normalize(List<String> raw) {
        List<String> lines = new ArrayList<>(raw.size());
        for (String line : raw) {
            lines.add(line.endsWith("\r") ? line.substring(0, line.length() - 1) : line);
        }
        int last = lines.size();
        while (last > 0 && lines.get(last - 1).isEmpty()) {
            last--;
        }
        return new ArrayList<>(lines.subList(0, last));
    }
}
