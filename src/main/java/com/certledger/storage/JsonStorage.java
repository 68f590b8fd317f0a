package com.certledger.storage;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * JSON file persistence for the ledger stores. Writes go to a sibling temp
 * file first and are moved into place, so a crash never leaves a torn file.
 */
public class JsonStorage {

    private static final ObjectMapper mapper = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public static <T> List<T> readJsonList(Path path, Class<T[]> clazz) throws IOException {
        if (path == null || !Files.exists(path)) {
            return Collections.emptyList();
        }
        T[] items = mapper.readValue(path.toFile(), clazz);
        if (items == null || items.length == 0) {
            return Collections.emptyList();
        }
        return Arrays.asList(items);
    }

    public static void writeJsonList(Path path, List<?> data) throws IOException {
        writeJson(path, data);
    }

    public static <T> T readJson(Path path, Class<T> clazz) throws IOException {
        if (path == null || !Files.exists(path)) {
            return null;
        }
        return mapper.readValue(path.toFile(), clazz);
    }

    public static void writeJson(Path path, Object data) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path temp = path.resolveSibling(path.getFileName() + ".tmp");
        mapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), data);
        try {
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
