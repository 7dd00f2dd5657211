package com.reviewengine.core.repair;

public enum StageOutcome {
    APPLIED,
    UNCHANGED,
    SKIPPED
}
