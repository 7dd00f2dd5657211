package com.reviewengine.core.repair;

/**
 * What one stage did during a pipeline run.
 */
public final class StageReport {

    private final String stage;
    private final StageOutcome outcome;
    private final String reason;

    public StageReport(String stage, StageOutcome outcome, String reason) {
        this.stage = stage;
        this.outcome = outcome;
        this.reason = reason;
    }

    public String getStage() {
        return stage;
    }

    public StageOutcome getOutcome() {
        return outcome;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return stage + "=" + (reason == null ? outcome.name() : outcome + "(" + reason + ")");
    }
}
