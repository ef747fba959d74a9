package com.novelforge.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Durable per-project workflow state. Written after every orchestrator iteration.
 *
 * Items are the writing units (chunks) numbered from 1.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class WorkflowState {

    public static final String CURRENT_ITEM = "current_item";

    public static final String[] PLAN_FILES = {
        "planning/summary.md", "planning/characters.md", "planning/structure.md", "planning/outline.md"
    };

    private String projectId;
    private Phase phase = Phase.PLANNING;
    private PendingApproval pendingApproval;
    private boolean paused;
    private String pausedAt;
    private int totalIterations;
    private int currentPhaseIterations;

    private int totalItems;
    private int currentItem = 1;
    private Map<Integer, Integer> itemCritiqueCounts = new LinkedHashMap<>();
    private List<Integer> completedItems = new ArrayList<>();
    private List<Integer> approvedItems = new ArrayList<>();

    private boolean planApproved;
    private int planCritiqueIterations;
    private Map<String, Boolean> planFilesCreated = new LinkedHashMap<>();

    private List<ApprovalRecord> approvalHistory = new ArrayList<>();
    private List<TransitionRecord> phaseTransitions = new ArrayList<>();
    private List<ErrorRecord> errorLog = new ArrayList<>();
    private int compressions;
    private String lastCompressionAt;
    private String pendingFeedback;

    private String createdAt;
    private String lastUpdated;

    public WorkflowState() {
    }

    public static WorkflowState create(String projectId) {
        WorkflowState state = new WorkflowState();
        state.projectId = projectId;
        state.createdAt = Instant.now().toString();
        state.lastUpdated = state.createdAt;
        return state;
    }

    // --- transitions ---

    /**
     * Move to a new phase, reset the per-phase counter and append an audit record.
     * A {@code current_item} entry in the transition data selects the item the next phase works on.
     */
    public void applyPhase(Phase target, Map<String, Object> data) {
        Phase from = this.phase;
        this.phase = target;
        this.currentPhaseIterations = 0;
        if (from == Phase.PLAN_CRITIQUE && target == Phase.WRITING) {
            planApproved = true;
        }
        if (data != null && data.get(CURRENT_ITEM) instanceof Number) {
            currentItem = ((Number) data.get(CURRENT_ITEM)).intValue();
        }
        phaseTransitions.add(new TransitionRecord(from, target, Instant.now().toString()));
    }

    public void recordIteration(boolean phaseUnchanged) {
        totalIterations++;
        if (phaseUnchanged) {
            currentPhaseIterations++;
        }
    }

    // --- items ---

    public int incrementCritiqueCount(int item) {
        int next = itemCritiqueCounts.getOrDefault(item, 0) + 1;
        itemCritiqueCounts.put(item, next);
        return next;
    }

    public int critiqueCount(int item) {
        return itemCritiqueCounts.getOrDefault(item, 0);
    }

    public void markCompleted(int item) {
        if (!completedItems.contains(item)) {
            completedItems.add(item);
        }
    }

    public void markApproved(int item) {
        if (!approvedItems.contains(item)) {
            approvedItems.add(item);
        }
    }

    /**
     * True once every item from 1 to totalItems is approved.
     */
    @JsonIgnore
    public boolean allItemsApproved() {
        if (totalItems <= 0) {
            return false;
        }
        for (int i = 1; i <= totalItems; i++) {
            if (!approvedItems.contains(i)) {
                return false;
            }
        }
        return true;
    }

    @JsonIgnore
    public boolean isComplete() {
        return phase == Phase.COMPLETE;
    }

    @JsonIgnore
    public int planFileCount() {
        int count = 0;
        for (String file : PLAN_FILES) {
            if (Boolean.TRUE.equals(planFilesCreated.get(file))) {
                count++;
            }
        }
        return count;
    }

    /**
     * Overall progress, 0-100. Planning and plan critique weigh 10 each, writing and
     * its critique share the remaining 80 by approved item ratio.
     */
    @JsonIgnore
    public double progressPercentage() {
        if (phase == Phase.COMPLETE) {
            return 100.0;
        }
        switch (phase) {
            case PLANNING:
                return 10.0 * planFileCount() / PLAN_FILES.length;
            case PLAN_CRITIQUE:
                return 15.0;
            case WRITING:
            case WRITE_CRITIQUE:
            default:
                double writing = totalItems > 0 ? 80.0 * completedItems.size() / totalItems : 0.0;
                return Math.min(100.0, 20.0 + writing);
        }
    }

    public void addApproval(String type, boolean approved, String notes) {
        approvalHistory.add(new ApprovalRecord(type, approved, notes, Instant.now().toString()));
    }

    public void addError(String type, String message) {
        errorLog.add(new ErrorRecord(type, message, phase, Instant.now().toString()));
    }

    public void recordCompression() {
        compressions++;
        lastCompressionAt = Instant.now().toString();
    }

    public void touch() {
        lastUpdated = Instant.now().toString();
    }

    // --- accessors ---

    public String getProjectId() {
        return projectId;
    }

    public void setProjectId(String projectId) {
        this.projectId = projectId;
    }

    public Phase getPhase() {
        return phase;
    }

    public void setPhase(Phase phase) {
        this.phase = phase;
    }

    public PendingApproval getPendingApproval() {
        return pendingApproval;
    }

    public void setPendingApproval(PendingApproval pendingApproval) {
        this.pendingApproval = pendingApproval;
    }

    public boolean isPaused() {
        return paused;
    }

    public void setPaused(boolean paused) {
        this.paused = paused;
    }

    public String getPausedAt() {
        return pausedAt;
    }

    public void setPausedAt(String pausedAt) {
        this.pausedAt = pausedAt;
    }

    public int getTotalIterations() {
        return totalIterations;
    }

    public void setTotalIterations(int totalIterations) {
        this.totalIterations = totalIterations;
    }

    public int getCurrentPhaseIterations() {
        return currentPhaseIterations;
    }

    public void setCurrentPhaseIterations(int currentPhaseIterations) {
        this.currentPhaseIterations = currentPhaseIterations;
    }

    public int getTotalItems() {
        return totalItems;
    }

    public void setTotalItems(int totalItems) {
        this.totalItems = totalItems;
    }

    public int getCurrentItem() {
        return currentItem;
    }

    public void setCurrentItem(int currentItem) {
        this.currentItem = currentItem;
    }

    public Map<Integer, Integer> getItemCritiqueCounts() {
        return itemCritiqueCounts;
    }

    public void setItemCritiqueCounts(Map<Integer, Integer> itemCritiqueCounts) {
        this.itemCritiqueCounts = itemCritiqueCounts != null ? itemCritiqueCounts : new LinkedHashMap<>();
    }

    public List<Integer> getCompletedItems() {
        return completedItems;
    }

    public void setCompletedItems(List<Integer> completedItems) {
        this.completedItems = completedItems != null ? completedItems : new ArrayList<>();
    }

    public List<Integer> getApprovedItems() {
        return approvedItems;
    }

    public void setApprovedItems(List<Integer> approvedItems) {
        this.approvedItems = approvedItems != null ? approvedItems : new ArrayList<>();
    }

    public boolean isPlanApproved() {
        return planApproved;
    }

    public void setPlanApproved(boolean planApproved) {
        this.planApproved = planApproved;
    }

    public int getPlanCritiqueIterations() {
        return planCritiqueIterations;
    }

    public void setPlanCritiqueIterations(int planCritiqueIterations) {
        this.planCritiqueIterations = planCritiqueIterations;
    }

    public Map<String, Boolean> getPlanFilesCreated() {
        return planFilesCreated;
    }

    public void setPlanFilesCreated(Map<String, Boolean> planFilesCreated) {
        this.planFilesCreated = planFilesCreated != null ? planFilesCreated : new LinkedHashMap<>();
    }

    public List<ApprovalRecord> getApprovalHistory() {
        return approvalHistory;
    }

    public void setApprovalHistory(List<ApprovalRecord> approvalHistory) {
        this.approvalHistory = approvalHistory != null ? approvalHistory : new ArrayList<>();
    }

    public List<TransitionRecord> getPhaseTransitions() {
        return phaseTransitions;
    }

    public void setPhaseTransitions(List<TransitionRecord> phaseTransitions) {
        this.phaseTransitions = phaseTransitions != null ? phaseTransitions : new ArrayList<>();
    }

    public List<ErrorRecord> getErrorLog() {
        return errorLog;
    }

    public void setErrorLog(List<ErrorRecord> errorLog) {
        this.errorLog = errorLog != null ? errorLog : new ArrayList<>();
    }

    public int getCompressions() {
        return compressions;
    }

    public void setCompressions(int compressions) {
        this.compressions = compressions;
    }

    public String getLastCompressionAt() {
        return lastCompressionAt;
    }

    public void setLastCompressionAt(String lastCompressionAt) {
        this.lastCompressionAt = lastCompressionAt;
    }

    public String getPendingFeedback() {
        return pendingFeedback;
    }

    public void setPendingFeedback(String pendingFeedback) {
        this.pendingFeedback = pendingFeedback;
    }

    public String getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(String createdAt) {
        this.createdAt = createdAt;
    }

    public String getLastUpdated() {
        return lastUpdated;
    }

    public void setLastUpdated(String lastUpdated) {
        this.lastUpdated = lastUpdated;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TransitionRecord {
        private Phase from;
        private Phase to;
        private String timestamp;

        public TransitionRecord() {
        }

        public TransitionRecord(Phase from, Phase to, String timestamp) {
            this.from = from;
            this.to = to;
            this.timestamp = timestamp;
        }

        public Phase getFrom() { return from; }
        public void setFrom(Phase from) { this.from = from; }
        public Phase getTo() { return to; }
        public void setTo(Phase to) { this.to = to; }
        public String getTimestamp() { return timestamp; }
        public void setTimestamp(String timestamp) { this.timestamp = timestamp; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ApprovalRecord {
        private String type;
        private boolean approved;
        private String notes;
        private String timestamp;

        public ApprovalRecord() {
        }

        public ApprovalRecord(String type, boolean approved, String notes, String timestamp) {
            this.type = type;
            this.approved = approved;
            this.notes = notes;
            this.timestamp = timestamp;
        }

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }
        public boolean isApproved() { return approved; }
        public void setApproved(boolean approved) { this.approved = approved; }
        public String getNotes() { return notes; }
        public void setNotes(String notes) { this.notes = notes; }
        public String getTimestamp() { return timestamp; }
        public void setTimestamp(String timestamp) { this.timestamp = timestamp; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ErrorRecord {
        private String type;
        private String message;
        private Phase phase;
        private String timestamp;

        public ErrorRecord() {
        }

        public ErrorRecord(String type, String message, Phase phase, String timestamp) {
            this.type = type;
            this.message = message;
            this.phase = phase;
            this.timestamp = timestamp;
        }

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }
        public String getMessage() { return message; }
        public void setMessage(String message) { this.message = message; }
        public Phase getPhase() { return phase; }
        public void setPhase(Phase phase) { this.phase = phase; }
        public String getTimestamp() { return timestamp; }
        public void setTimestamp(String timestamp) { this.timestamp = timestamp; }
    }
}
