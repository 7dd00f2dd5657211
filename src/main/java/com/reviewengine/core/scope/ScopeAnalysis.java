package com.reviewengine.core.scope;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * ScopeAnalysis - the scope sets computed by one {@link ScopeAnalyzer} run.
 *
 * Fields:
 *   - defined:             names bound by a simple assignment target or a parameter
 *   - loopBound:           names bound as a loop iteration variable
 *   - used:                names read in Load context
 *   - undefinedReferences: reads the analyzer's resolution mode judged undefined,
 *                          one per occurrence, in walk order
 *
 * Lives only as long as the analysis call that produced it.
 */
public final class ScopeAnalysis {

    private final Set<String> defined;
    private final Set<String> loopBound;
    private final Set<String> used;
    private final Set<String> builtins;
    private final List<NameReference> undefinedReferences;

    ScopeAnalysis(
            Set<String> defined,
            Set<String> loopBound,
            Set<String> used,
            Set<String> builtins,
            List<NameReference> undefinedReferences
    ) {
        this.defined = Collections.unmodifiableSet(new LinkedHashSet<>(defined));
        this.loopBound = Collections.unmodifiableSet(new LinkedHashSet<>(loopBound));
        this.used = Collections.unmodifiableSet(new LinkedHashSet<>(used));
        this.builtins = builtins;
        this.undefinedReferences = List.copyOf(undefinedReferences);
    }

    public Set<String> getDefined() {
        return defined;
    }

    public Set<String> getLoopBound() {
        return loopBound;
    }

    public Set<String> getUsed() {
        return used;
    }

    public List<NameReference> getUndefinedReferences() {
        return undefinedReferences;
    }

    /**
     * Distinct names of {@link #getUndefinedReferences()}, in first-reference order.
     */
    public Set<String> undefinedNames() {
        Set<String> names = new LinkedHashSet<>();
        for (NameReference reference : undefinedReferences) {
            names.add(reference.getName());
        }
        return Collections.unmodifiableSet(names);
    }

    /**
     * {@code used - defined - loopBound - builtins}, independent of resolution mode,
     * in first-use order.
     */
    public Set<String> unboundNames() {
        Set<String> names = new LinkedHashSet<>(used);
        names.removeAll(defined);
        names.removeAll(loopBound);
        names.removeAll(builtins);
        return Collections.unmodifiableSet(names);
    }

    public boolean isBound(String name) {
        return defined.contains(name) || loopBound.contains(name) || builtins.contains(name);
    }

    @Override
    public String toString() {
        return String.format(
            "ScopeAnalysis{defined=%d, loopBound=%d, used=%d, undefined=%s}",
            defined.size(),
            loopBound.size(),
            used.size(),
            undefinedNames()
        );
    }
}
