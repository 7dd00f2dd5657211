package com.reviewengine.core.repair;

/**
 * One text-to-text step of the repair pipeline.
 *
 * A stage must not throw for any input; when it cannot do its work it returns
 * {@link StageResult#skipped(String, String)} with its input unchanged.
 */
public interface RepairStage {

    String getName();

    StageResult apply(String text);
}
