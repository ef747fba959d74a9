package com.novelforge;

import com.novelforge.models.ProjectFile;
import com.novelforge.models.ProjectSummary;
import com.novelforge.models.WorkflowState;
import com.novelforge.settings.NovelConfig;
import com.novelforge.storage.ConfigStore;
import com.novelforge.storage.JsonStorage;
import com.novelforge.storage.StateStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.FileNotFoundException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class ProjectServiceTest {

    @TempDir
    Path output;

    private ProjectService service;

    @BeforeEach
    void setUp() {
        JsonStorage storage = new JsonStorage(TestProjects.MAPPER);
        service = new ProjectService(output, new ConfigStore(storage), new StateStore(storage));
    }

    private static NovelConfig config(String name) {
        NovelConfig config = TestProjects.config(null);
        config.setProjectName(name);
        return config;
    }

    @Test
    void createWritesLayoutConfigAndState() throws Exception {
        ProjectContext project = service.create(config("The Lighthouse Keeper"));

        assertTrue(project.getProjectId().matches("The Lighthouse Keeper - \\d{8}_\\d{6}"));
        assertEquals(project.getProjectId(), project.getConfig().getProjectId());
        assertTrue(Files.isDirectory(project.planningDir()));
        assertTrue(Files.isDirectory(project.manuscriptDir()));
        assertTrue(Files.isDirectory(project.critiquesDir()));
        assertTrue(service.exists(project.getProjectId()));
        assertEquals(WorkflowState.create("x").getPhase(), service.loadState(project.getProjectId()).getPhase());
    }

    @Test
    void createRejectsInvalidConfig() {
        NovelConfig config = config("Untitled");
        config.setTheme(" ");

        assertThrows(IllegalArgumentException.class, () -> service.create(config));
        assertEquals(0, output.toFile().list().length);
    }

    @Test
    void sanitizeKeepsReadableCharacters() {
        assertEquals("Who's There, Anyway", ProjectService.sanitizeName("Who's  There, Anyway?!"));
        assertEquals("Night-Shift", ProjectService.sanitizeName(" Night-Shift/.. "));
        assertEquals("project", ProjectService.sanitizeName("???"));
        assertEquals(80, ProjectService.sanitizeName("a".repeat(200)).length());
    }

    @Test
    void listsProjectsMostRecentFirstAndSkipsBrokenFolders() throws Exception {
        ProjectContext older = service.create(config("Older"));
        ProjectContext newer = service.create(config("Newer"));
        setLastUpdated(older, "2024-01-01T00:00:00Z");
        setLastUpdated(newer, "2024-06-01T00:00:00Z");
        Files.createDirectories(output.resolve("stray"));

        List<ProjectSummary> projects = service.list();

        assertEquals(List.of(newer.getProjectId(), older.getProjectId()),
            projects.stream().map(ProjectSummary::getProjectId).collect(Collectors.toList()));
        assertEquals("Newer", projects.get(0).getProjectName());
    }

    private static void setLastUpdated(ProjectContext project, String timestamp) throws Exception {
        Path file = project.getRoot().resolve(StateStore.STATE_FILE);
        WorkflowState state = TestProjects.MAPPER.readValue(file.toFile(), WorkflowState.class);
        state.setLastUpdated(timestamp);
        TestProjects.MAPPER.writeValue(file.toFile(), state);
    }

    @Test
    void listFilesLeavesOutBookkeepingFiles() throws Exception {
        ProjectContext project = service.create(config("Files"));
        Files.writeString(project.planningDir().resolve("summary.md"), "Summary");
        Files.writeString(project.getRoot().resolve(".conversation_history_PLANNING.json"), "[]");

        List<ProjectFile> files = service.listFiles(project.getProjectId());

        assertEquals(List.of("planning/summary.md"),
            files.stream().map(ProjectFile::getPath).collect(Collectors.toList()));
        assertEquals(7, files.get(0).getSize());
        assertEquals("Summary", service.readFile(project.getProjectId(), "planning/summary.md"));
    }

    @Test
    void pathsCannotEscapeTheirFolders() throws Exception {
        ProjectContext project = service.create(config("Escape"));

        assertThrows(SecurityException.class, () -> service.readFile(project.getProjectId(), "../../secret.txt"));
        assertThrows(SecurityException.class, () -> service.projectRoot(".."));
        assertThrows(IllegalArgumentException.class, () -> service.projectRoot(""));
        assertThrows(FileNotFoundException.class, () -> service.readFile(project.getProjectId(), "planning/none.md"));
    }

    @Test
    void deleteRemovesTheProjectFolder() throws Exception {
        ProjectContext project = service.create(config("Doomed"));

        service.delete(project.getProjectId());

        assertFalse(Files.exists(project.getRoot()));
        assertThrows(FileNotFoundException.class, () -> service.open(project.getProjectId()));
        assertThrows(FileNotFoundException.class, () -> service.delete(project.getProjectId()));
    }
}
