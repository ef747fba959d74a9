package com.novelforge.storage;

import com.novelforge.settings.NovelConfig;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

/**
 * Persists {@link NovelConfig} as {@code .novel_config.json} inside the project folder.
 */
public class ConfigStore {

    public static final String CONFIG_FILE = ".novel_config.json";

    private final JsonStorage storage;

    public ConfigStore(JsonStorage storage) {
        this.storage = storage;
    }

    public void save(Path projectRoot, NovelConfig config) throws IOException {
        config.setUpdatedAt(Instant.now().toString());
        storage.writeWithBackup(projectRoot.resolve(CONFIG_FILE), config);
    }

    public NovelConfig load(Path projectRoot) throws IOException {
        NovelConfig config = storage.readWithBackup(projectRoot.resolve(CONFIG_FILE), NovelConfig.class);
        if (config == null) {
            throw new FileNotFoundException("No project config in " + projectRoot.getFileName());
        }
        return config;
    }

    public boolean exists(Path projectRoot) {
        return Files.exists(projectRoot.resolve(CONFIG_FILE));
    }
}
