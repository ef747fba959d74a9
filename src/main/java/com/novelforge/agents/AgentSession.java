package com.novelforge.agents;

import com.novelforge.AppLogger;
import com.novelforge.ProjectContext;
import com.novelforge.models.CheckpointRecord;
import com.novelforge.models.Message;
import com.novelforge.models.ToolCall;
import com.novelforge.models.WorkflowState;
import com.novelforge.storage.CheckpointStore;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Conversation of one agent within one phase. Append-only, except that context
 * compression may replace the whole history.
 */
public class AgentSession {

    private final PhaseAgent agent;
    private final List<Message> history = new ArrayList<>();
    private final boolean resumed;
    private final AppLogger logger = AppLogger.get();

    private AgentSession(PhaseAgent agent, List<Message> restored) {
        this.agent = agent;
        if (restored != null) {
            history.addAll(restored);
        }
        this.resumed = !history.isEmpty();
    }

    public static AgentSession fresh(PhaseAgent agent) {
        return new AgentSession(agent, null);
    }

    /**
     * Build the session for a phase, restoring its checkpointed history when one exists.
     */
    public static AgentSession open(PhaseAgent agent, ProjectContext project, CheckpointStore checkpoints)
        throws IOException {
        CheckpointRecord record = checkpoints.load(project.getRoot(), agent.getPhase());
        AgentSession session = new AgentSession(agent, record != null ? record.getMessages() : null);
        if (session.resumed) {
            session.logger.info("[" + agent.getRole() + "] Resuming from checkpoint with "
                + session.history.size() + " messages");
        }
        return session;
    }

    public PhaseAgent getAgent() {
        return agent;
    }

    public boolean isResumed() {
        return resumed;
    }

    public boolean isEmpty() {
        return history.isEmpty();
    }

    public int size() {
        return history.size();
    }

    public List<Message> history() {
        return Collections.unmodifiableList(history);
    }

    /**
     * Start a fresh conversation: system prompt followed by the agent's opening user prompt.
     */
    public void seed(ProjectContext project, WorkflowState state) throws IOException {
        if (!history.isEmpty()) {
            throw new IllegalStateException("Session already seeded");
        }
        history.add(Message.system(agent.systemPrompt(project.getConfig(), state)));
        String initial = agent.initialPrompt(project, state);
        if (initial != null && !initial.isBlank()) {
            history.add(Message.user(initial));
        }
    }

    public void append(Message message) {
        history.add(message);
    }

    public void appendToolResult(ToolCall call, String content) {
        history.add(Message.toolResult(call.getId(), call.getFunctionName(), content));
    }

    /**
     * Swap in a compressed history.
     */
    public void replaceHistory(List<Message> replacement) {
        history.clear();
        history.addAll(replacement);
    }
}
