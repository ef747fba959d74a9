package com.novelforge.pipeline;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.novelforge.AppLogger;
import com.novelforge.ProjectContext;
import com.novelforge.agents.AgentSession;
import com.novelforge.agents.PhaseAgent;
import com.novelforge.models.Message;
import com.novelforge.models.PendingApproval;
import com.novelforge.models.Phase;
import com.novelforge.models.WorkflowState;
import com.novelforge.output.ApprovalChannel;
import com.novelforge.output.GenerationObserver;
import com.novelforge.providers.chat.ModelProvider;
import com.novelforge.providers.chat.ModelRequest;
import com.novelforge.providers.tokens.TokenEstimator;
import com.novelforge.settings.ApiSettings;
import com.novelforge.storage.CheckpointStore;
import com.novelforge.storage.StateStore;
import com.novelforge.storage.TranscriptWriter;
import com.novelforge.stream.ModelStream;
import com.novelforge.stream.StreamAssembler;
import com.novelforge.tools.ToolExecutionContext;
import com.novelforge.tools.TransitionRequest;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;

/**
 * Drives one project through its phases until it completes or hits the iteration cap.
 *
 * The loop is the only writer of the project's state while it runs. Other threads talk to
 * it through {@link #requestPause()}, or by editing persisted state while the loop sits in a
 * polling gate (paused, or waiting on an approval).
 */
public class AgentLoop {

    public static final long POLL_SECONDS = 5;
    public static final int TRANSCRIPT_EVERY = 5;

    static final String CONTINUE_PROMPT =
        "Continue with the workflow. Use the available tools to make progress on the current phase.";

    private final ProjectContext project;
    private final ModelProvider provider;
    private final StateStore stateStore;
    private final CheckpointStore checkpointStore;
    private final TranscriptWriter transcripts;
    private final GenerationObserver observer;
    private final ApprovalChannel approvals;
    private final Sleeper sleeper;
    private final ObjectMapper mapper;
    private final RetryController retry;
    private final ContextCompressor compressor;
    private final ToolDispatcher dispatcher;
    private final AppLogger logger = AppLogger.get();

    private volatile boolean pauseRequested;
    private Phase announcedPhase;

    private AgentLoop(Builder builder) {
        this.project = Objects.requireNonNull(builder.project, "project");
        this.provider = Objects.requireNonNull(builder.provider, "provider");
        this.stateStore = Objects.requireNonNull(builder.stateStore, "stateStore");
        this.checkpointStore = Objects.requireNonNull(builder.checkpointStore, "checkpointStore");
        this.transcripts = builder.transcripts != null ? builder.transcripts : new TranscriptWriter();
        this.observer = builder.observer != null ? builder.observer : GenerationObserver.NONE;
        this.approvals = builder.approvals != null ? builder.approvals : ApprovalChannel.NONE;
        this.sleeper = builder.sleeper != null ? builder.sleeper : Sleeper.SYSTEM;
        this.mapper = Objects.requireNonNull(builder.mapper, "mapper");
        this.retry = new RetryController(sleeper);
        this.compressor = new ContextCompressor(provider, Objects.requireNonNull(builder.estimator, "estimator"));
        this.dispatcher = new ToolDispatcher(mapper);
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getProjectId() {
        return project.getProjectId();
    }

    /**
     * Ask the loop to pause at its next iteration boundary.
     */
    public void requestPause() {
        pauseRequested = true;
    }

    public void cancelPauseRequest() {
        pauseRequested = false;
    }

    public LoopOutcome run() throws IOException, InterruptedException {
        String projectId = project.getProjectId();
        Path root = project.getRoot();
        int maxIterations = project.getConfig().getApi().getMaxIterations();

        WorkflowState state = stateStore.load(root);
        AgentSession session = null;
        Phase observedPhase = null;
        String surfacedApproval = null;
        announcedPhase = state.getPhase();
        logger.info("[Loop] " + projectId + " starting in " + state.getPhase()
            + " at iteration " + state.getTotalIterations());

        while (true) {
            if (pauseRequested) {
                pauseRequested = false;
                state = stateStore.load(root);
                state.setPaused(true);
                state.setPausedAt(Instant.now().toString());
                stateStore.save(root, state);
                logger.info("[Loop] " + projectId + " paused");
            }
            if (state.isComplete()) {
                logger.info("[Loop] " + projectId + " complete after " + state.getTotalIterations() + " iterations");
                observer.completed(projectId, state);
                return LoopOutcome.COMPLETED;
            }
            if (state.getTotalIterations() >= maxIterations) {
                String message = "Reached maximum iterations (" + maxIterations + ") in phase " + state.getPhase();
                logger.error("[Loop] " + projectId + ": " + message);
                observer.error(projectId, "iteration_limit", message);
                return LoopOutcome.ITERATION_LIMIT_REACHED;
            }
            if (state.isPaused()) {
                sleeper.sleepSeconds(POLL_SECONDS);
                state = stateStore.load(root);
                continue;
            }
            PendingApproval pending = state.getPendingApproval();
            if (pending != null) {
                String key = pending.getRequestedAt() + "|" + pending.getTargetPhase();
                if (!key.equals(surfacedApproval)) {
                    logger.info("[Loop] " + projectId + " waiting for approval: " + pending.getType());
                    approvals.requestApproval(projectId, pending);
                    surfacedApproval = key;
                }
                sleeper.sleepSeconds(POLL_SECONDS);
                state = stateStore.load(root);
                continue;
            }
            surfacedApproval = null;

            if (session == null || state.getPhase() != observedPhase) {
                if (session != null) {
                    checkpointStore.clear(root, observedPhase);
                    checkpointStore.clear(root, state.getPhase());
                    if (announcedPhase != state.getPhase()) {
                        observer.phaseChanged(projectId, observedPhase, state.getPhase());
                        announcedPhase = state.getPhase();
                    }
                }
                observedPhase = state.getPhase();
                session = AgentSession.open(PhaseAgent.forPhase(observedPhase), project, checkpointStore);
            }

            if (session.isEmpty()) {
                session.seed(project, state);
            }
            if (state.getPendingFeedback() != null) {
                session.append(Message.user("Reviewer feedback on the last checkpoint: " + state.getPendingFeedback()));
                state.setPendingFeedback(null);
            } else if (endsWithFinalAnswer(session)) {
                session.append(Message.user(CONTINUE_PROMPT));
            }

            Phase before = state.getPhase();
            try {
                runIteration(session, state);
            } catch (InterruptedException e) {
                logger.info("[Loop] " + projectId + " interrupted during iteration");
                saveCheckpoint(session, state);
                throw e;
            } catch (IOException | RuntimeException e) {
                recordFailure(session, state, e);
                throw e;
            }

            boolean unchanged = state.getPhase() == before;
            state.recordIteration(unchanged);
            stateStore.save(root, state);
            if (unchanged) {
                checkpointStore.save(root, projectId, before, state.getCurrentPhaseIterations(), session.history());
                if (state.getCurrentPhaseIterations() % TRANSCRIPT_EVERY == 0) {
                    writeTranscript(before, session);
                }
            } else {
                writeTranscript(before, session);
                checkpointStore.clear(root, before);
            }
            observer.progress(projectId, state);
        }
    }

    /**
     * One model turn: compress if needed, stream the reply, run its tool calls.
     */
    void runIteration(AgentSession session, WorkflowState state) throws IOException, InterruptedException {
        String projectId = project.getProjectId();
        ApiSettings api = project.getConfig().getApi();
        compressor.compressIfNeeded(session, project, state, observer);

        ModelRequest request = new ModelRequest(api.getModelId(), session.history(),
            session.getAgent().tools().toDefinitions(mapper), api.getTemperature(), api.getMaxOutputTokens());
        ModelStream stream = retry.execute("model stream", () -> provider.openStream(request));
        StreamAssembler assembler = new StreamAssembler(
            (text, reasoning) -> observer.streamChunk(projectId, text, reasoning));
        Message reply = assembler.assemble(stream);
        session.append(reply);

        if (!reply.hasToolCalls()) {
            logger.info("[Loop] " + session.getAgent().getRole() + " replied without tool calls");
            return;
        }
        ToolExecutionContext context = new ToolExecutionContext(project, state, mapper);
        TransitionRequest transition = dispatcher.dispatch(session, reply.getToolCalls(), context, observer);
        if (transition != null) {
            applyTransition(state, transition);
        }
    }

    /**
     * Validate a requested transition and either apply it or park it as a pending approval.
     */
    void applyTransition(WorkflowState state, TransitionRequest transition) throws IOException {
        Phase from = state.getPhase();
        Phase to = transition.getToPhase();
        if (!from.canTransitionTo(to)) {
            logger.warn("[Loop] Rejected transition " + from + " -> " + to + ": not an allowed edge");
            state.addError("invalid_transition", from + " -> " + to);
            return;
        }
        if (to == Phase.COMPLETE && !state.allItemsApproved()) {
            logger.warn("[Loop] Rejected transition to COMPLETE: " + state.getApprovedItems().size()
                + " of " + state.getTotalItems() + " items approved");
            state.addError("invalid_transition", "COMPLETE before all items approved");
            return;
        }
        if (project.getConfig().getCheckpoints().requiresApproval(from, to)) {
            PendingApproval pending = new PendingApproval(approvalType(from, to), from, to,
                transition.getData(), Instant.now().toString());
            // Persisted by the post-iteration save; the approval gate reads it from disk.
            state.setPendingApproval(pending);
            logger.info("[Loop] Transition " + from + " -> " + to + " waiting for approval");
            return;
        }
        state.applyPhase(to, transition.getData());
        stateStore.save(project.getRoot(), state);
        logger.info("[Loop] Phase " + from + " -> " + to);
        observer.phaseChanged(project.getProjectId(), from, to);
        announcedPhase = to;
    }

    static String approvalType(Phase from, Phase to) {
        if (to == Phase.PLAN_CRITIQUE) return "plan";
        if (from == Phase.PLAN_CRITIQUE) return "plan_critique";
        if (to == Phase.WRITE_CRITIQUE) return "chunk";
        return "chunk_critique";
    }

    private static boolean endsWithFinalAnswer(AgentSession session) {
        if (session.isEmpty()) {
            return false;
        }
        Message last = session.history().get(session.size() - 1);
        return last.isRole(Message.ASSISTANT) && !last.hasToolCalls();
    }

    private void recordFailure(AgentSession session, WorkflowState state, Exception error) {
        String projectId = project.getProjectId();
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        logger.error("[Loop] " + projectId + " iteration failed: " + message, error);
        saveCheckpoint(session, state);
        writeTranscript(state.getPhase(), session);
        state.addError(error.getClass().getSimpleName(), message);
        try {
            stateStore.save(project.getRoot(), state);
        } catch (IOException | RuntimeException saveError) {
            logger.error("[Loop] Failed to save state on iteration error: " + saveError.getMessage());
        }
        observer.error(projectId, "iteration", message);
    }

    private void saveCheckpoint(AgentSession session, WorkflowState state) {
        try {
            checkpointStore.save(project.getRoot(), project.getProjectId(), state.getPhase(),
                state.getCurrentPhaseIterations(), session.history());
            logger.info("[Loop] Saved conversation history with " + session.size() + " messages");
        } catch (IOException | RuntimeException saveError) {
            logger.error("[Loop] Failed to save conversation history: " + saveError.getMessage());
        }
    }

    private void writeTranscript(Phase phase, AgentSession session) {
        try {
            transcripts.write(project.getRoot(), project.getProjectId(), phase, session.history());
        } catch (IOException e) {
            logger.warn("[Loop] Could not write transcript: " + e.getMessage());
        }
    }

    public static class Builder {
        private ProjectContext project;
        private ModelProvider provider;
        private TokenEstimator estimator;
        private StateStore stateStore;
        private CheckpointStore checkpointStore;
        private TranscriptWriter transcripts;
        private GenerationObserver observer;
        private ApprovalChannel approvals;
        private Sleeper sleeper;
        private ObjectMapper mapper;

        public Builder project(ProjectContext project) {
            this.project = project;
            return this;
        }

        public Builder provider(ModelProvider provider) {
            this.provider = provider;
            return this;
        }

        public Builder estimator(TokenEstimator estimator) {
            this.estimator = estimator;
            return this;
        }

        public Builder stateStore(StateStore stateStore) {
            this.stateStore = stateStore;
            return this;
        }

        public Builder checkpointStore(CheckpointStore checkpointStore) {
            this.checkpointStore = checkpointStore;
            return this;
        }

        public Builder transcripts(TranscriptWriter transcripts) {
            this.transcripts = transcripts;
            return this;
        }

        public Builder observer(GenerationObserver observer) {
            this.observer = observer;
            return this;
        }

        public Builder approvals(ApprovalChannel approvals) {
            this.approvals = approvals;
            return this;
        }

        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = sleeper;
            return this;
        }

        public Builder mapper(ObjectMapper mapper) {
            this.mapper = mapper;
            return this;
        }

        public AgentLoop build() {
            return new AgentLoop(this);
        }
    }
}
