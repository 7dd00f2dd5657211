package com.reviewengine.orchestrator.dto;

import com.reviewengine.core.issue.Issue;
import com.reviewengine.core.issue.IssueKind;
import com.reviewengine.core.issue.ReviewReport;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class ReviewResponse {

    private final List<Issue> issues;
    private final Map<String, Integer> counts;
    private final String summary;

    public ReviewResponse(
            List<Issue> issues,
            Map<String, Integer> counts,
            String summary
    ) {
        this.issues = issues;
        this.counts = counts;
        this.summary = summary;
    }

    public static ReviewResponse from(ReviewReport report) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (Map.Entry<IssueKind, Integer> entry : report.countsByKind().entrySet()) {
            counts.put(entry.getKey().getLabel(), entry.getValue());
        }
        return new ReviewResponse(report.getIssues(), counts, report.render());
    }

    public List<Issue> getIssues() {
        return issues;
    }

    public Map<String, Integer> getCounts() {
        return counts;
    }

    public String getSummary() {
        return summary;
    }
}
