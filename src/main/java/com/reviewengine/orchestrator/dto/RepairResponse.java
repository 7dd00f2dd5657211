package com.reviewengine.orchestrator.dto;

import com.reviewengine.core.repair.RepairResult;
import com.reviewengine.core.repair.StageReport;

import java.util.List;

public class RepairResponse {

    private final String original;
    private final String repaired;
    private final boolean changed;
    private final List<StageReport> stages;

    public RepairResponse(
            String original,
            String repaired,
            boolean changed,
            List<StageReport> stages
    ) {
        this.original = original;
        this.repaired = repaired;
        this.changed = changed;
        this.stages = stages;
    }

    public static RepairResponse from(RepairResult result) {
        return new RepairResponse(
                result.getOriginal(),
                result.getRepaired(),
                result.isChanged(),
                result.getStages()
        );
    }

    public String getOriginal() {
        return original;
    }

    public String getRepaired() {
        return repaired;
    }

    public boolean isChanged() {
        return changed;
    }

    public List<StageReport> getStages() {
        return stages;
    }
}
