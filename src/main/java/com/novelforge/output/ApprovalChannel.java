package com.novelforge.output;

import com.novelforge.models.PendingApproval;

/**
 * Where pending checkpoints are surfaced to a human. Decisions come back through
 * {@link com.novelforge.pipeline.ApprovalService}.
 */
@FunctionalInterface
public interface ApprovalChannel {

    void requestApproval(String projectId, PendingApproval approval);

    ApprovalChannel NONE = (projectId, approval) -> { };
}
