package com.reviewengine.core.repair;

import com.reviewengine.config.BuiltinNames;
import com.reviewengine.config.ResolutionMode;
import com.reviewengine.core.scope.ScopeAnalyzer;
import com.reviewengine.core.syntax.PythonParser;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ReturnSanitizationStageTest {

    private final ReturnSanitizationStage stage = new ReturnSanitizationStage(
            new PythonParser(),
            new ScopeAnalyzer(BuiltinNames.defaults().getNames(), ResolutionMode.ORDERED, false));

    @Test
    void testUnknownNameBecomesNone() {
        StageResult result = stage.apply("def f():\n    return y\n");

        assertEquals(StageOutcome.APPLIED, result.getOutcome());
        assertEquals("def f():\n    return None\n", result.getText());
    }

    @Test
    void testCommentIsKept() {
        assertEquals("def f():\n    return None  # done\n",
                stage.apply("def f():\n    return result  # done\n").getText());
    }

    @Test
    void testDefinedNamesAndParametersStay() {
        String source = "limit = 3\ndef f(a):\n    if a:\n        return a\n    return limit\n";

        assertEquals(StageOutcome.UNCHANGED, stage.apply(source).getOutcome());
    }

    @Test
    void testOnlyBareIdentifiersAreRewritten() {
        String source = "def f():\n    return x + 1\n\ndef g():\n    return True\n\ndef h():\n    return obj.attr\n";

        assertEquals(StageOutcome.UNCHANGED, stage.apply(source).getOutcome());
    }

    @Test
    void testReturnInsideDocstringIsNotTouched() {
        String source = "def f():\n    \"\"\"\n    return value\n    \"\"\"\n    return 1\n";

        assertEquals(StageOutcome.UNCHANGED, stage.apply(source).getOutcome());
    }

    @Test
    void testUnparseableSourceIsSkipped() {
        StageResult result = stage.apply("def f(\n    return y\n");

        assertTrue(result.isSkipped());
        assertEquals("def f(\n    return y\n", result.getText());
    }
}
