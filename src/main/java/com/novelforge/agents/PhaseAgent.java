package com.novelforge.agents;

import com.novelforge.ConfigurationException;
import com.novelforge.ProjectContext;
import com.novelforge.models.Phase;
import com.novelforge.models.WorkflowState;
import com.novelforge.settings.NovelConfig;
import com.novelforge.tools.PlanCritiqueTools;
import com.novelforge.tools.PlanningTools;
import com.novelforge.tools.ProjectFiles;
import com.novelforge.tools.ToolRegistry;
import com.novelforge.tools.WriteCritiqueTools;
import com.novelforge.tools.WritingTools;

import java.io.IOException;

/**
 * The four agents, one per working phase. Each supplies a system prompt, a fixed tool
 * set and the user prompt that opens a fresh conversation.
 */
public enum PhaseAgent {

    PLANNING(Phase.PLANNING, "Story Architect") {
        @Override
        public String systemPrompt(NovelConfig config, WorkflowState state) {
            return PromptLibrary.planning(config);
        }

        @Override
        ToolRegistry createTools() {
            return PlanningTools.registry();
        }

        @Override
        public String initialPrompt(ProjectContext project, WorkflowState state) {
            NovelConfig config = project.getConfig();
            StringBuilder sb = new StringBuilder();
            sb.append("Please create a comprehensive plan for a novel based on this theme/concept:\n\n\"")
                .append(config.getTheme()).append("\"\n\n");
            sb.append("Target length: ").append(config.lengthDescription()).append("\n");
            if (config.getGenre() != null && !config.getGenre().isBlank()) {
                sb.append("Genre: ").append(config.getGenre()).append("\n");
            }
            sb.append("\nFollow the planning workflow:\n")
                .append("1. Create the project folder\n")
                .append("2. Create a story summary (concept, themes, conflict, arc)\n")
                .append("3. Create the dramatis personae\n")
                .append("4. Create the story structure, including the number of chunks\n")
                .append("5. Create a detailed chunk-by-chunk plot outline\n")
                .append("6. Finalize the plan\n");
            return sb.toString();
        }
    },

    PLAN_CRITIQUE(Phase.PLAN_CRITIQUE, "Story Editor") {
        @Override
        public String systemPrompt(NovelConfig config, WorkflowState state) {
            return PromptLibrary.planCritique(config);
        }

        @Override
        ToolRegistry createTools() {
            return PlanCritiqueTools.registry();
        }

        @Override
        public String initialPrompt(ProjectContext project, WorkflowState state) {
            int max = project.getConfig().getAgent().getMaxPlanCritiqueIterations();
            return "Please review the completed plan for \"" + project.getConfig().getProjectName() + "\".\n\n"
                + "1. Load the plan materials\n"
                + "2. Critique them thoroughly\n"
                + "3. Revise any document that needs work\n"
                + "4. Approve the plan once it is a solid foundation for writing\n\n"
                + "You may run up to " + max + " critique iterations.";
        }
    },

    WRITING(Phase.WRITING, "Creative Writer") {
        @Override
        public String systemPrompt(NovelConfig config, WorkflowState state) {
            return PromptLibrary.writing(config, currentItem(state));
        }

        @Override
        ToolRegistry createTools() {
            return WritingTools.registry();
        }

        @Override
        public String initialPrompt(ProjectContext project, WorkflowState state) throws IOException {
            int item = currentItem(state);
            boolean revision = state.critiqueCount(item) > 0;
            StringBuilder sb = new StringBuilder();
            if (revision) {
                sb.append("REVISION: ");
            }
            sb.append("Please write Chunk ").append(item).append(" of the novel.\n");
            if (revision) {
                String feedback = latestRevisionRequest(project, item);
                if (feedback != null) {
                    sb.append("\nREVISION REQUESTED - address the following feedback:\n")
                        .append(feedback).append("\n");
                }
            }
            sb.append("\nWorkflow:\n")
                .append("1. load_approved_plan\n")
                .append("2. get_chunk_context for Chunk ").append(item).append("\n")
                .append("3. review_previous_writing if continuity needs checking\n")
                .append("4. write_chunk with the complete, polished text\n")
                .append("5. finalize_chunk to submit it for critique\n");
            return sb.toString();
        }
    },

    WRITE_CRITIQUE(Phase.WRITE_CRITIQUE, "Content Editor") {
        @Override
        public String systemPrompt(NovelConfig config, WorkflowState state) {
            return PromptLibrary.writeCritique(config, currentItem(state));
        }

        @Override
        ToolRegistry createTools() {
            return WriteCritiqueTools.registry();
        }

        @Override
        public String initialPrompt(ProjectContext project, WorkflowState state) {
            int item = currentItem(state);
            int max = project.getConfig().getAgent().getMaxWriteCritiqueIterations();
            int iteration = state.critiqueCount(item) + 1;
            String prompt = "Please review Chunk " + item + " for quality and consistency.\n"
                + "Critique iteration: " + iteration + " of " + max + "\n\n"
                + "1. load_chunk_for_review\n"
                + "2. load_context_for_critique\n"
                + "3. critique_chunk to document your assessment\n"
                + "4. approve_chunk if it meets the standard, otherwise request_revision\n";
            if (iteration >= max) {
                prompt += "\nThis is the final iteration; approve unless the chunk has serious problems.\n";
            }
            return prompt;
        }
    };

    private final Phase phase;
    private final String role;
    private volatile ToolRegistry tools;

    PhaseAgent(Phase phase, String role) {
        this.phase = phase;
        this.role = role;
    }

    public Phase getPhase() {
        return phase;
    }

    public String getRole() {
        return role;
    }

    public abstract String systemPrompt(NovelConfig config, WorkflowState state);

    public abstract String initialPrompt(ProjectContext project, WorkflowState state) throws IOException;

    abstract ToolRegistry createTools();

    public ToolRegistry tools() {
        ToolRegistry registry = tools;
        if (registry == null) {
            registry = createTools();
            tools = registry;
        }
        return registry;
    }

    /**
     * @throws ConfigurationException for a phase without an agent (COMPLETE)
     */
    public static PhaseAgent forPhase(Phase phase) {
        for (PhaseAgent agent : values()) {
            if (agent.phase == phase) {
                return agent;
            }
        }
        throw new ConfigurationException("No agent for phase " + phase);
    }

    static int currentItem(WorkflowState state) {
        return state.getCurrentItem() > 0 ? state.getCurrentItem() : 1;
    }

    static String latestRevisionRequest(ProjectContext project, int item) throws IOException {
        ProjectFiles files = new ProjectFiles(project);
        String prefix = String.format("chunk_%02d_revision_request_v", item);
        int version = files.latestVersion(prefix);
        if (version == 0 && !files.exists(ProjectContext.CRITIQUES_DIR + "/" + prefix + "0.md")) {
            return null;
        }
        return files.read(ProjectContext.CRITIQUES_DIR + "/" + prefix + version + ".md");
    }
}
