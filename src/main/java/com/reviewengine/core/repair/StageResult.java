package com.reviewengine.core.repair;

/**
 * Output of one {@link RepairStage}: the text to hand to the next stage plus
 * what happened to it.
 */
public final class StageResult {

    private final StageOutcome outcome;
    private final String text;
    private final String reason;

    private StageResult(StageOutcome outcome, String text, String reason) {
        this.outcome = outcome;
        this.text = text;
        this.reason = reason;
    }

    /**
     * APPLIED when the stage changed the text, UNCHANGED otherwise.
     */
    public static StageResult of(String input, String output) {
        if (input.equals(output)) {
            return new StageResult(StageOutcome.UNCHANGED, input, null);
        }
        return new StageResult(StageOutcome.APPLIED, output, null);
    }

    public static StageResult skipped(String input, String reason) {
        return new StageResult(StageOutcome.SKIPPED, input, reason);
    }

    public StageOutcome getOutcome() {
        return outcome;
    }

    public String getText() {
        return text;
    }

    /** Why the stage was skipped; null unless SKIPPED. */
    public String getReason() {
        return reason;
    }

    public boolean isSkipped() {
        return outcome == StageOutcome.SKIPPED;
    }

    @Override
    public String toString() {
        return reason == null ? outcome.name() : outcome + "(" + reason + ")";
    }
}
