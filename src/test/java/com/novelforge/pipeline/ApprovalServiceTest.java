package com.novelforge.pipeline;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.novelforge.ProjectService;
import com.novelforge.TestProjects;
import com.novelforge.models.Message;
import com.novelforge.models.PendingApproval;
import com.novelforge.models.Phase;
import com.novelforge.models.WorkflowState;
import com.novelforge.storage.CheckpointStore;
import com.novelforge.storage.ConfigStore;
import com.novelforge.storage.JsonStorage;
import com.novelforge.storage.StateStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ApprovalServiceTest {

    private static final String ID = "novel-1";

    @TempDir
    Path dir;

    private ProjectService projects;
    private CheckpointStore checkpoints;
    private ApprovalService approvals;

    @BeforeEach
    void setUp() throws Exception {
        JsonStorage storage = new JsonStorage(new ObjectMapper());
        TestProjects.create(dir);
        projects = new ProjectService(dir, new ConfigStore(storage), new StateStore(storage));
        checkpoints = new CheckpointStore(storage);
        approvals = new ApprovalService(projects, checkpoints);
    }

    private void park(Phase from, Phase to, Map<String, Object> data) throws Exception {
        WorkflowState state = projects.loadState(ID);
        state.setPhase(from);
        state.setPendingApproval(new PendingApproval(AgentLoop.approvalType(from, to), from, to, data, "t0"));
        projects.saveState(ID, state);
    }

    @Test
    void approveAppliesParkedTransition() throws Exception {
        park(Phase.WRITE_CRITIQUE, Phase.WRITING, Map.of("current_item", 3));

        WorkflowState state = approvals.approve(ID, "fine");

        assertEquals(Phase.WRITING, state.getPhase());
        assertEquals(3, state.getCurrentItem());
        assertNull(state.getPendingApproval());
        assertEquals(Phase.WRITING, projects.loadState(ID).getPhase());
        WorkflowState.ApprovalRecord record = state.getApprovalHistory().get(0);
        assertEquals("chunk_critique", record.getType());
        assertTrue(record.isApproved());
        assertEquals("fine", record.getNotes());
    }

    @Test
    void approveDropsCheckpointsSoRestartOpensTargetPhaseFresh() throws Exception {
        park(Phase.PLAN_CRITIQUE, Phase.PLANNING, Map.of());
        Path root = projects.projectRoot(ID);
        List<Message> stale = List.of(Message.system("old planning prompt"), Message.user("old revision request"));
        checkpoints.save(root, ID, Phase.PLANNING, 4, stale);
        checkpoints.save(root, ID, Phase.PLAN_CRITIQUE, 2, stale);

        approvals.approve(ID, null);

        assertFalse(checkpoints.exists(root, Phase.PLANNING));
        assertFalse(checkpoints.exists(root, Phase.PLAN_CRITIQUE));
        assertNull(checkpoints.load(root, Phase.PLANNING));
    }

    @Test
    void rejectKeepsPhaseAndStoresFeedback() throws Exception {
        park(Phase.PLANNING, Phase.PLAN_CRITIQUE, Map.of());

        WorkflowState state = approvals.decide(ID, false, "Give the antagonist a motive.");

        assertEquals(Phase.PLANNING, state.getPhase());
        assertNull(state.getPendingApproval());
        assertEquals("Give the antagonist a motive.", projects.loadState(ID).getPendingFeedback());
        assertFalse(state.getApprovalHistory().get(0).isApproved());
    }

    @Test
    void rejectWithoutNotesUsesDefaultFeedback() throws Exception {
        park(Phase.PLANNING, Phase.PLAN_CRITIQUE, Map.of());

        approvals.reject(ID, " ");

        assertEquals(ApprovalService.DEFAULT_REJECTION, projects.loadState(ID).getPendingFeedback());
    }

    @Test
    void decisionWithoutPendingApprovalFails() throws Exception {
        assertNull(approvals.pending(ID));
        assertThrows(IllegalStateException.class, () -> approvals.approve(ID, null));
        assertThrows(IllegalStateException.class, () -> approvals.reject(ID, null));
    }
}
