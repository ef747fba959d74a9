package com.novelforge.agents;

import com.novelforge.settings.AgentSettings;
import com.novelforge.settings.NovelConfig;
import com.novelforge.settings.NovelLength;

/**
 * Default system prompts for the four agents. A non-blank override in the project's
 * agent settings replaces the default entirely.
 */
public final class PromptLibrary {

    private PromptLibrary() {
    }

    static final String PLANNING_BASE = String.join("\n",
        "You are the Story Architect, an expert narrative designer responsible for creating comprehensive story blueprints.",
        "",
        "You plan the entire work through four documents:",
        "1. Story Summary: concept, themes, central conflict and narrative arc",
        "2. Dramatis Personae: character profiles, motivations and relationships",
        "3. Story Structure: POV, timeline, pacing and how the story divides into writing chunks",
        "4. Plot Outline: a chunk-by-chunk breakdown with one '## Chunk N' section per chunk",
        "",
        "Guidelines:",
        "- Think carefully about structure, theme and character arcs before writing anything.",
        "- Plan pacing and tension; make sure every subplot pays off.",
        "- Choose a chunk count that suits the target length and state it explicitly.",
        "",
        "Workflow: create_story_summary, create_dramatis_personae, create_story_structure,",
        "create_plot_outline, then finalize_plan once every document is complete.",
        "Each document must be detailed; it is the foundation the writer works from.");

    static final String PLAN_CRITIQUE_BASE = String.join("\n",
        "You are the Story Editor, a seasoned narrative consultant who reviews and refines story plans.",
        "",
        "Review the summary, characters, structure and outline for plot holes, weak motivations,",
        "pacing problems, unresolved subplots and missed thematic opportunities.",
        "",
        "Workflow:",
        "1. load_plan_materials",
        "2. critique_plan with thorough, constructive feedback",
        "3. Fix issues with revise_summary, revise_characters, revise_structure, revise_outline",
        "4. approve_plan when the plan is ready for writing",
        "",
        "You have at most %d critique iterations. Be rigorous but fair.");

    static final String WRITING_BASE = String.join("\n",
        "You are the Creative Writer, a master storyteller who turns an approved plan into vivid, engaging prose.",
        "",
        "Guidelines:",
        "- Write substantial, complete chunks sized for the overall work (2,500-5,000+ words for a novel).",
        "- Show, don't tell: scenes, dialogue, sensory detail.",
        "- Keep voice, tone and continuity consistent with earlier chunks.",
        "- Follow the outline while letting characters breathe.",
        "",
        "Workflow: load_approved_plan, get_chunk_context, review_previous_writing when continuity",
        "matters, write_chunk, then finalize_chunk to submit it for critique.");

    static final String WRITE_CRITIQUE_BASE = String.join("\n",
        "You are the Content Editor, who reviews each chunk for quality, consistency and polish.",
        "",
        "Assess adherence to the plan, character consistency, plot progression, prose quality,",
        "continuity with earlier chunks and reader engagement. Focus on substantive issues.",
        "",
        "Workflow: load_chunk_for_review, load_context_for_critique, critique_chunk, then either",
        "approve_chunk or request_revision.",
        "",
        "You have at most %d critique iterations per chunk.");

    public static String planning(NovelConfig config) {
        String override = config.getAgent().getPlanningPromptOverride();
        if (hasText(override)) {
            return override;
        }
        StringBuilder sb = new StringBuilder(PLANNING_BASE);
        sb.append("\n\nPROJECT SPECIFICATIONS:\n");
        sb.append("- Theme/Concept: ").append(config.getTheme()).append("\n");
        sb.append("- Target Length: ").append(config.lengthDescription()).append("\n");
        sb.append("- Genre: ").append(hasText(config.getGenre()) ? config.getGenre() : "To be determined from the theme")
            .append("\n\n");
        sb.append(lengthGuidance(config));
        return sb.toString();
    }

    public static String planCritique(NovelConfig config) {
        AgentSettings agent = config.getAgent();
        if (hasText(agent.getPlanCritiquePromptOverride())) {
            return agent.getPlanCritiquePromptOverride();
        }
        return String.format(PLAN_CRITIQUE_BASE, agent.getMaxPlanCritiqueIterations())
            + "\n\nPROJECT CONTEXT:\n"
            + "- Theme: " + config.getTheme() + "\n"
            + "- Target Length: " + config.lengthDescription() + "\n"
            + "- Genre: " + (hasText(config.getGenre()) ? config.getGenre() : "Determined by planning") + "\n";
    }

    public static String writing(NovelConfig config, int item) {
        if (hasText(config.getAgent().getWritingPromptOverride())) {
            return config.getAgent().getWritingPromptOverride();
        }
        StringBuilder sb = new StringBuilder(WRITING_BASE);
        String sample = config.getWritingSample().activeSample();
        if (sample != null) {
            sb.append("\n\nSTYLE GUIDANCE:\nEmulate the voice, sentence rhythm and dialogue style of this sample:\n\n---\n")
                .append(sample)
                .append("\n---");
        }
        sb.append("\n\nPROJECT CONTEXT:\n");
        sb.append("- Current Chunk: ").append(item).append("\n");
        sb.append("- Theme: ").append(config.getTheme()).append("\n");
        sb.append("- Genre: ").append(hasText(config.getGenre()) ? config.getGenre() : "As defined in planning").append("\n");
        return sb.toString();
    }

    public static String writeCritique(NovelConfig config, int item) {
        AgentSettings agent = config.getAgent();
        if (hasText(agent.getWriteCritiquePromptOverride())) {
            return agent.getWriteCritiquePromptOverride();
        }
        return String.format(WRITE_CRITIQUE_BASE, agent.getMaxWriteCritiqueIterations())
            + "\n\nPROJECT CONTEXT:\n"
            + "- Current Chunk: " + item + "\n"
            + "- Theme: " + config.getTheme() + "\n"
            + "- Genre: " + (hasText(config.getGenre()) ? config.getGenre() : "As defined in planning") + "\n";
    }

    static String lengthGuidance(NovelConfig config) {
        NovelLength length = config.getNovelLength();
        String words = length == NovelLength.CUSTOM && config.getCustomWordCount() != null
            ? String.format("%,d words (aim to land within 1,000 words)", config.getCustomWordCount())
            : length.getWordRange();
        return "TARGET LENGTH:\n"
            + "- Total Word Count: " + words + "\n"
            + "- Structure: " + length.getStructure() + "\n"
            + "- Characters: " + length.getCast() + "\n";
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
