package com.reviewengine.core.issue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * ReviewReport - issues from every detector, in detector-execution order.
 *
 * No deduplication across detectors; two detectors reporting the same line
 * both appear.
 */
public final class ReviewReport {

    private final List<Issue> issues = new ArrayList<>();

    public ReviewReport() {
    }

    public ReviewReport(List<Issue> issues) {
        addAll(issues);
    }

    public void addAll(List<Issue> more) {
        issues.addAll(more);
    }

    public List<Issue> getIssues() {
        return Collections.unmodifiableList(issues);
    }

    public boolean isEmpty() {
        return issues.isEmpty();
    }

    public int size() {
        return issues.size();
    }

    public List<Issue> byKind(IssueKind kind) {
        return issues.stream()
                .filter(issue -> issue.getKind() == kind)
                .collect(Collectors.toList());
    }

    public boolean hasKind(IssueKind kind) {
        return issues.stream().anyMatch(issue -> issue.getKind() == kind);
    }

    /**
     * Issue count per kind; kinds with no issues are omitted.
     */
    public Map<IssueKind, Integer> countsByKind() {
        Map<IssueKind, Integer> counts = new EnumMap<>(IssueKind.class);
        for (Issue issue : issues) {
            counts.merge(issue.getKind(), 1, Integer::sum);
        }
        return counts;
    }

    /**
     * One {@link Issue#render()} line per issue, newline separated.
     */
    public String render() {
        return issues.stream().map(Issue::render).collect(Collectors.joining("\n"));
    }

    @Override
    public String toString() {
        return "ReviewReport{issues=" + issues.size() + ", counts=" + countsByKind() + "}";
    }
}
