package com.reviewengine.core.scope;

import com.reviewengine.config.BuiltinNames;
import com.reviewengine.config.ResolutionMode;
import com.reviewengine.core.syntax.PythonParser;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ScopeAnalyzerTest {

    private static final Set<String> BUILTINS = BuiltinNames.defaults().getNames();

    private final PythonParser parser = new PythonParser();

    private ScopeAnalysis analyze(String source, ResolutionMode mode, boolean trackDeclarations) throws Exception {
        return new ScopeAnalyzer(BUILTINS, mode, trackDeclarations).analyze(parser.parse(source));
    }

    private ScopeAnalysis analyze(String source) throws Exception {
        return analyze(source, ResolutionMode.ORDERED, false);
    }

    @Test
    void testAssignmentThenRead() throws Exception {
        ScopeAnalysis analysis = analyze("x = 1\nprint(x)\n");

        assertEquals(Set.of("x"), analysis.getDefined());
        assertEquals(Set.of("print", "x"), analysis.getUsed());
        assertTrue(analysis.getUndefinedReferences().isEmpty());
    }

    @Test
    void testUndefinedReadCarriesLine() throws Exception {
        ScopeAnalysis analysis = analyze("a = 1\n\nprint(y)\n");

        assertEquals(List.of(new NameReference("y", 3)), analysis.getUndefinedReferences());
        assertEquals(Set.of("y"), analysis.undefinedNames());
    }

    @Test
    void testEveryUndefinedReadIsReported() throws Exception {
        ScopeAnalysis analysis = analyze("print(z)\nprint(z)\n");

        assertEquals(2, analysis.getUndefinedReferences().size());
        assertEquals(1, analysis.getUndefinedReferences().get(0).getLine());
        assertEquals(2, analysis.getUndefinedReferences().get(1).getLine());
        assertEquals(Set.of("z"), analysis.undefinedNames());
    }

    @Test
    void testLoopVariableIsLoopBound() throws Exception {
        ScopeAnalysis analysis = analyze("for i in range(3):\n    print(i)\n");

        assertEquals(Set.of("i"), analysis.getLoopBound());
        assertFalse(analysis.getDefined().contains("i"));
        assertTrue(analysis.getUndefinedReferences().isEmpty());
    }

    @Test
    void testParametersAreDefined() throws Exception {
        ScopeAnalysis analysis = analyze(
                "def f(a, *args, b=2, **kw):\n    return a + b + len(args) + len(kw)\n");

        assertEquals(Set.of("a", "args", "b", "kw"), analysis.getDefined());
        assertTrue(analysis.getUndefinedReferences().isEmpty());
    }

    @Test
    void testBuiltinsAreNeverUndefined() throws Exception {
        ScopeAnalysis analysis = analyze("print(len(str(range(10))), __name__)\n");

        assertTrue(analysis.getUndefinedReferences().isEmpty());
        assertTrue(analysis.unboundNames().isEmpty());
    }

    @Test
    void testOrderedModeFlagsReadBeforeDeeperBinding() throws Exception {
        String source = "y = x\nfor i in range(3):\n    if i:\n        x = i\n";

        ScopeAnalysis ordered = analyze(source, ResolutionMode.ORDERED, false);
        ScopeAnalysis twoPhase = analyze(source, ResolutionMode.TWO_PHASE, false);

        assertEquals(List.of(new NameReference("x", 1)), ordered.getUndefinedReferences());
        assertTrue(twoPhase.getUndefinedReferences().isEmpty());

        // Set difference does not depend on the mode
        assertTrue(ordered.unboundNames().isEmpty());
        assertTrue(twoPhase.unboundNames().isEmpty());
    }

    @Test
    void testDestructuringIsNotABinding() throws Exception {
        String source = "a, b = 1, 2\nprint(a)\n";

        assertEquals(Set.of("a"), analyze(source).undefinedNames());
        assertTrue(analyze(source, ResolutionMode.ORDERED, true).undefinedNames().isEmpty());
    }

    @Test
    void testComprehensionVariableIsNotABinding() throws Exception {
        String source = "squares = [n * n for n in range(5)]\n";

        ScopeAnalysis analysis = analyze(source);
        assertEquals(Set.of("n"), analysis.undefinedNames());
        assertEquals(2, analysis.getUndefinedReferences().size());

        assertTrue(analyze(source, ResolutionMode.ORDERED, true).undefinedNames().isEmpty());
    }

    @Test
    void testImportsOnlyCountWhenTrackingDeclarations() throws Exception {
        String source = "import os.path\nfrom json import loads as parse\nprint(os.sep, parse)\n";

        assertEquals(Set.of("os", "parse"), analyze(source).undefinedNames());
        assertTrue(analyze(source, ResolutionMode.ORDERED, true).undefinedNames().isEmpty());
    }

    @Test
    void testAttributeTargetDoesNotDefineName() throws Exception {
        ScopeAnalysis analysis = analyze("obj.attr = 1\n");

        assertTrue(analysis.getDefined().isEmpty());
        assertEquals(Set.of("obj"), analysis.undefinedNames());
    }

    @Test
    void testUnboundNamesInFirstUseOrder() throws Exception {
        ScopeAnalysis analysis = analyze("total = a + b\nprint(c)\n");

        assertEquals(List.of("a", "b", "c"), List.copyOf(analysis.unboundNames()));
    }

    @Test
    void testMatchCapturesOnlyCountWhenTrackingDeclarations() throws Exception {
        String source = "match command:\n"
                + "    case [first, *rest]:\n"
                + "        print(first, rest)\n"
                + "    case {'key': value, **others}:\n"
                + "        print(value, others)\n";

        assertEquals(Set.of("command", "first", "rest", "value", "others"), analyze(source).undefinedNames());
        assertEquals(Set.of("command"), analyze(source, ResolutionMode.ORDERED, true).undefinedNames());
    }
}
