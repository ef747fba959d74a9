package com.novelforge.storage;

import com.novelforge.models.WorkflowState;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Persists {@link WorkflowState} as {@code .novel_state.json} inside the project folder.
 */
public class StateStore {

    public static final String STATE_FILE = ".novel_state.json";

    private final JsonStorage storage;

    public StateStore(JsonStorage storage) {
        this.storage = storage;
    }

    public void save(Path projectRoot, WorkflowState state) throws IOException {
        state.touch();
        storage.writeWithBackup(projectRoot.resolve(STATE_FILE), state);
    }

    /**
     * @throws FileNotFoundException when the project has no state file
     */
    public WorkflowState load(Path projectRoot) throws IOException {
        WorkflowState state = storage.readWithBackup(projectRoot.resolve(STATE_FILE), WorkflowState.class);
        if (state == null) {
            throw new FileNotFoundException("No workflow state in " + projectRoot.getFileName());
        }
        return state;
    }

    public boolean exists(Path projectRoot) {
        Path file = projectRoot.resolve(STATE_FILE);
        return Files.exists(file) || Files.exists(JsonStorage.backupPath(file));
    }
}
