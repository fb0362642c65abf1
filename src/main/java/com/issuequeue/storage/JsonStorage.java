package com.issuequeue.storage;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

/**
 * JSON Lines helpers shared by the issue store. One record per line, snake_case keys.
 */
public class JsonStorage {

    private static final ObjectMapper mapper = new ObjectMapper()
        .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public static ObjectMapper mapper() {
        return mapper;
    }

    /**
     * Read every record of a JSON Lines file. A missing file reads as empty; a
     * malformed line fails the whole read with its line number.
     */
    public static <T> List<T> readJsonLines(Path filePath, Class<T> clazz) throws IOException {
        return readJsonLines(filePath, clazz, ignored -> null);
    }

    /**
     * Like {@link #readJsonLines(Path, Class)}, but each parsed record is also handed to
     * {@code check}, which returns a problem description or null. Any problem fails the read.
     */
    public static <T> List<T> readJsonLines(Path filePath, Class<T> clazz, Function<T, String> check)
            throws IOException {
        if (!Files.exists(filePath)) {
            return Collections.emptyList();
        }
        List<String> lines = Files.readAllLines(filePath, StandardCharsets.UTF_8);
        List<T> items = new ArrayList<>(lines.size());
        int lineNumber = 0;
        for (String line : lines) {
            lineNumber++;
            if (line == null || line.isBlank()) {
                continue;
            }
            T item;
            try {
                item = mapper.readValue(line, clazz);
            } catch (IOException e) {
                throw new IOException("Malformed record at " + filePath.getFileName() + ":" + lineNumber
                    + " (" + e.getMessage() + ")", e);
            }
            if (item == null) {
                throw new IOException("Malformed record at " + filePath.getFileName() + ":" + lineNumber + " (null)");
            }
            String problem = check.apply(item);
            if (problem != null) {
                throw new IOException("Invalid record at " + filePath.getFileName() + ":" + lineNumber
                    + " (" + problem + ")");
            }
            items.add(item);
        }
        return items;
    }

    /**
     * Replace the file with a full snapshot: write to .tmp, then rename over the target.
     */
    public static void writeJsonLinesAtomic(Path filePath, Collection<?> data) throws IOException {
        Path parent = filePath.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        StringBuilder content = new StringBuilder();
        for (Object item : data) {
            content.append(mapper.writeValueAsString(item)).append('\n');
        }
        Path tmpFile = filePath.resolveSibling(filePath.getFileName().toString() + ".tmp");
        Files.writeString(tmpFile, content.toString(), StandardCharsets.UTF_8);
        Files.move(tmpFile, filePath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    /**
     * Append one record as a single write, so concurrent appenders never interleave within a line.
     */
    public static void appendJsonLine(Path filePath, Object record) throws IOException {
        Path parent = filePath.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        byte[] line = (mapper.writeValueAsString(record) + "\n").getBytes(StandardCharsets.UTF_8);
        Files.write(filePath, line, StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
    }
}
