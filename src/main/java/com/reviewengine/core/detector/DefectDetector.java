package com.reviewengine.core.detector;

import com.reviewengine.core.issue.Issue;

import java.util.List;

/**
 * One independent check over source text.
 *
 * Implementations never throw for bad input; a check that cannot run reports
 * nothing or a single tool error.
 */
public interface DefectDetector {

    String getName();

    List<Issue> detect(String source);
}
