package com.reviewengine.core.repair;

import java.util.List;
import java.util.Optional;

/**
 * RepairResult - original text, repaired text and one report per stage, in
 * stage order.
 */
public final class RepairResult {

    private final String original;
    private final String repaired;
    private final List<StageReport> stages;

    public RepairResult(String original, String repaired, List<StageReport> stages) {
        this.original = original;
        this.repaired = repaired;
        this.stages = List.copyOf(stages);
    }

    public String getOriginal() {
        return original;
    }

    public String getRepaired() {
        return repaired;
    }

    public List<StageReport> getStages() {
        return stages;
    }

    public boolean isChanged() {
        return !original.equals(repaired);
    }

    public Optional<StageReport> stage(String name) {
        return stages.stream().filter(report -> report.getStage().equals(name)).findFirst();
    }

    @Override
    public String toString() {
        return "RepairResult{changed=" + isChanged() + ", stages=" + stages + "}";
    }
}
