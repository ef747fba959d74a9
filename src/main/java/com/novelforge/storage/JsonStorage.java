package com.novelforge.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.novelforge.AppLogger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * JSON file persistence with crash safety.
 *
 * Writes copy the current file to {@code <name>.backup}, then write {@code <name>.tmp}
 * and move it over the original. If the write fails the backup is restored and the
 * error rethrown. Reads fall back to the backup when the primary cannot be parsed.
 */
public class JsonStorage {

    private final ObjectMapper mapper;
    private final AppLogger logger = AppLogger.get();

    public JsonStorage(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public ObjectMapper getMapper() {
        return mapper;
    }

    public static Path backupPath(Path file) {
        return file.resolveSibling(file.getFileName() + ".backup");
    }

    public void writeWithBackup(Path file, Object value) throws IOException {
        Path parent = file.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path backup = backupPath(file);
        if (Files.exists(file)) {
            Files.copy(file, backup, StandardCopyOption.REPLACE_EXISTING);
        }
        try {
            writeAtomic(file, mapper.writerWithDefaultPrettyPrinter().writeValueAsString(value));
        } catch (IOException | RuntimeException e) {
            if (Files.exists(backup)) {
                try {
                    Files.copy(backup, file, StandardCopyOption.REPLACE_EXISTING);
                    logger.warn("[JsonStorage] Write failed, restored backup for " + file.getFileName());
                } catch (IOException restoreError) {
                    e.addSuppressed(restoreError);
                }
            }
            throw e;
        }
    }

    /**
     * Read a JSON file, falling back to its backup if the primary is missing or corrupt.
     * Returns null when neither is readable.
     */
    public <T> T readWithBackup(Path file, Class<T> type) throws IOException {
        IOException primaryError = null;
        if (Files.exists(file)) {
            try {
                return mapper.readValue(Files.readString(file, StandardCharsets.UTF_8), type);
            } catch (IOException e) {
                primaryError = e;
                logger.warn("[JsonStorage] Corrupt file " + file.getFileName() + ": " + e.getMessage());
            }
        }
        Path backup = backupPath(file);
        if (Files.exists(backup)) {
            T value = mapper.readValue(Files.readString(backup, StandardCharsets.UTF_8), type);
            logger.info("[JsonStorage] Recovered " + file.getFileName() + " from backup");
            return value;
        }
        if (primaryError != null) {
            throw primaryError;
        }
        return null;
    }

    public void deleteWithBackup(Path file) throws IOException {
        Files.deleteIfExists(file);
        Files.deleteIfExists(backupPath(file));
    }

    /**
     * Write text to a temp sibling and move it into place.
     */
    public static void writeAtomic(Path file, String content) throws IOException {
        Path parent = file.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        Files.writeString(tmp, content, StandardCharsets.UTF_8);
        try {
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
