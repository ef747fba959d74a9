package com.novelforge.pipeline;

import com.novelforge.AppLogger;
import com.novelforge.ProjectContext;
import com.novelforge.ProjectService;
import com.novelforge.models.WorkflowState;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs generation loops on background threads, at most one per project.
 */
public class GenerationManager {

    /**
     * Builds the loop for a project; lets callers choose provider and observers.
     */
    @FunctionalInterface
    public interface LoopFactory {
        AgentLoop create(ProjectContext project) throws IOException;
    }

    private static final class ActiveRun {
        private final AgentLoop loop;
        private final String startedAt = Instant.now().toString();
        private Thread thread;

        private ActiveRun(AgentLoop loop) {
            this.loop = loop;
        }
    }

    private final ProjectService projects;
    private final LoopFactory loopFactory;
    private final Map<String, ActiveRun> active = new ConcurrentHashMap<>();
    private final Map<String, String> lastOutcome = new ConcurrentHashMap<>();
    private final AppLogger logger = AppLogger.get();

    public GenerationManager(ProjectService projects, LoopFactory loopFactory) {
        this.projects = projects;
        this.loopFactory = loopFactory;
    }

    /**
     * Start the loop for a project. Clears a stored pause first.
     *
     * @return false if a loop for the project is already running
     */
    public boolean start(String projectId) throws IOException {
        if (active.containsKey(projectId)) {
            return false;
        }
        ProjectContext project = projects.open(projectId);
        AgentLoop loop = loopFactory.create(project);
        ActiveRun run = new ActiveRun(loop);
        if (active.putIfAbsent(projectId, run) != null) {
            return false;
        }
        try {
            WorkflowState state = projects.loadState(projectId);
            if (state.isPaused()) {
                state.setPaused(false);
                state.setPausedAt(null);
                projects.saveState(projectId, state);
            }
        } catch (IOException | RuntimeException e) {
            active.remove(projectId, run);
            throw e;
        }

        Thread runner = new Thread(() -> execute(projectId, run), "generation-" + projectId);
        runner.setDaemon(true);
        run.thread = runner;
        lastOutcome.remove(projectId);
        runner.start();
        logger.info("[Generation] Started " + projectId);
        return true;
    }

    /**
     * Pause a project. A running loop applies it at its next iteration boundary.
     */
    public void pause(String projectId) throws IOException {
        ActiveRun run = active.get(projectId);
        if (run != null) {
            run.loop.requestPause();
            logger.info("[Generation] Pause requested for " + projectId);
            return;
        }
        WorkflowState state = projects.loadState(projectId);
        state.setPaused(true);
        state.setPausedAt(Instant.now().toString());
        projects.saveState(projectId, state);
        logger.info("[Generation] Paused idle project " + projectId);
    }

    /**
     * Clear a pause and make sure a loop is running.
     *
     * @return true if a new loop was started
     */
    public boolean resume(String projectId) throws IOException {
        ActiveRun run = active.get(projectId);
        if (run == null) {
            return start(projectId);
        }
        run.loop.cancelPauseRequest();
        WorkflowState state = projects.loadState(projectId);
        if (state.isPaused()) {
            state.setPaused(false);
            state.setPausedAt(null);
            projects.saveState(projectId, state);
        }
        logger.info("[Generation] Resumed " + projectId);
        return false;
    }

    /**
     * Interrupt the worker thread.
     *
     * @return false if nothing was running
     */
    public boolean stop(String projectId) {
        ActiveRun run = active.get(projectId);
        if (run == null || run.thread == null) {
            return false;
        }
        run.thread.interrupt();
        logger.info("[Generation] Stop requested for " + projectId);
        return true;
    }

    public boolean isRunning(String projectId) {
        return active.containsKey(projectId);
    }

    public List<String> getActiveProjects() {
        return new ArrayList<>(active.keySet());
    }

    public Map<String, Object> status(String projectId) throws IOException {
        WorkflowState state = projects.loadState(projectId);
        ActiveRun run = active.get(projectId);
        boolean running = run != null;
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("project_id", projectId);
        status.put("is_running", running);
        status.put("is_paused", state.isPaused());
        status.put("phase", state.getPhase());
        status.put("started_at", running ? run.startedAt : null);
        status.put("last_outcome", lastOutcome.get(projectId));
        status.put("can_start", !running);
        status.put("can_pause", running && !state.isPaused());
        status.put("can_resume", state.isPaused() || !running);
        return status;
    }

    /**
     * Wait for a project's worker thread to finish.
     */
    public void await(String projectId, long timeoutMillis) throws InterruptedException {
        ActiveRun run = active.get(projectId);
        if (run != null && run.thread != null) {
            run.thread.join(timeoutMillis);
        }
    }

    public void shutdown() {
        for (Map.Entry<String, ActiveRun> entry : active.entrySet()) {
            if (entry.getValue().thread != null) {
                entry.getValue().thread.interrupt();
            }
        }
    }

    private void execute(String projectId, ActiveRun run) {
        try {
            LoopOutcome outcome = run.loop.run();
            lastOutcome.put(projectId, outcome.name());
            logger.info("[Generation] " + projectId + " finished: " + outcome);
        } catch (InterruptedException e) {
            lastOutcome.put(projectId, "STOPPED");
            logger.info("[Generation] " + projectId + " stopped");
        } catch (Exception e) {
            lastOutcome.put(projectId, "FAILED: " + e.getMessage());
            logger.error("[Generation] " + projectId + " failed: " + e.getMessage(), e);
        } finally {
            active.remove(projectId, run);
        }
    }
}
