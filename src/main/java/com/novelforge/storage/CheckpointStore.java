package com.novelforge.storage;

import com.novelforge.AppLogger;
import com.novelforge.models.CheckpointRecord;
import com.novelforge.models.Message;
import com.novelforge.models.Phase;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/**
 * Per-phase conversation checkpoints: {@code .conversation_history_{PHASE}.json}.
 * One file per (project, phase), overwritten on every save.
 */
public class CheckpointStore {

    private final JsonStorage storage;
    private final AppLogger logger = AppLogger.get();

    public CheckpointStore(JsonStorage storage) {
        this.storage = storage;
    }

    public static String fileName(Phase phase) {
        return ".conversation_history_" + phase.name() + ".json";
    }

    public Path pathFor(Path projectRoot, Phase phase) {
        return projectRoot.resolve(fileName(phase));
    }

    public void save(Path projectRoot, String projectId, Phase phase, int iteration, List<Message> history)
        throws IOException {
        CheckpointRecord record = new CheckpointRecord(projectId, phase, iteration, Instant.now().toString(), history);
        storage.writeWithBackup(pathFor(projectRoot, phase), record);
    }

    /**
     * Load the saved history for a phase, or null if none exists.
     */
    public CheckpointRecord load(Path projectRoot, Phase phase) throws IOException {
        CheckpointRecord record = storage.readWithBackup(pathFor(projectRoot, phase), CheckpointRecord.class);
        if (record != null) {
            logger.info("[Checkpoint] Loaded " + record.getMessages().size() + " messages for " + phase);
        }
        return record;
    }

    public void clear(Path projectRoot, Phase phase) throws IOException {
        Path file = pathFor(projectRoot, phase);
        if (Files.exists(file)) {
            logger.info("[Checkpoint] Cleared history for " + phase);
        }
        storage.deleteWithBackup(file);
    }

    public boolean exists(Path projectRoot, Phase phase) {
        return Files.exists(pathFor(projectRoot, phase));
    }
}
