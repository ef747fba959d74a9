package com.novelforge.pipeline;

import com.novelforge.AppLogger;
import com.novelforge.ProjectService;
import com.novelforge.models.PendingApproval;
import com.novelforge.models.Phase;
import com.novelforge.models.WorkflowState;
import com.novelforge.storage.CheckpointStore;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Human decisions on parked transitions.
 *
 * Only touches state while a request is pending. The loop persists a pending
 * request with its post-iteration save and writes nothing more until its approval
 * gate reloads the decision from disk.
 */
public class ApprovalService {

    static final String DEFAULT_REJECTION =
        "The reviewer rejected this checkpoint. Review your work, improve it and try again.";

    private final ProjectService projects;
    private final CheckpointStore checkpoints;
    private final AppLogger logger = AppLogger.get();

    public ApprovalService(ProjectService projects, CheckpointStore checkpoints) {
        this.projects = projects;
        this.checkpoints = checkpoints;
    }

    public PendingApproval pending(String projectId) throws IOException {
        return projects.loadState(projectId).getPendingApproval();
    }

    public synchronized WorkflowState decide(String projectId, boolean approved, String notes) throws IOException {
        return approved ? approve(projectId, notes) : reject(projectId, notes);
    }

    /**
     * Apply the parked transition. Checkpoints of both phases are dropped so a
     * restarted loop opens the new phase fresh.
     *
     * @throws IllegalStateException when nothing is pending
     */
    public synchronized WorkflowState approve(String projectId, String notes) throws IOException {
        WorkflowState state = projects.loadState(projectId);
        PendingApproval pending = requirePending(projectId, state);
        state.addApproval(pending.getType(), true, notes);
        state.setPendingApproval(null);
        Phase target = pending.getTargetPhase();
        if (target != null) {
            state.applyPhase(target, pending.getData());
        }
        projects.saveState(projectId, state);
        if (target != null) {
            Path root = projects.projectRoot(projectId);
            checkpoints.clear(root, pending.getFromPhase());
            checkpoints.clear(root, target);
        }
        logger.info("[Approval] " + projectId + " approved " + pending.getType()
            + (target != null ? " -> " + target : ""));
        return state;
    }

    /**
     * Drop the parked transition; the notes reach the agent as its next user message.
     *
     * @throws IllegalStateException when nothing is pending
     */
    public synchronized WorkflowState reject(String projectId, String notes) throws IOException {
        WorkflowState state = projects.loadState(projectId);
        PendingApproval pending = requirePending(projectId, state);
        state.addApproval(pending.getType(), false, notes);
        state.setPendingApproval(null);
        state.setPendingFeedback(notes != null && !notes.isBlank() ? notes : DEFAULT_REJECTION);
        projects.saveState(projectId, state);
        logger.info("[Approval] " + projectId + " rejected " + pending.getType());
        return state;
    }

    private PendingApproval requirePending(String projectId, WorkflowState state) {
        PendingApproval pending = state.getPendingApproval();
        if (pending == null) {
            throw new IllegalStateException("No pending approval for project " + projectId);
        }
        return pending;
    }
}
