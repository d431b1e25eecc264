package org.pragmatica.purify.transform;

import org.pragmatica.purify.analysis.MakefileAnalyzer;
import org.pragmatica.purify.analysis.MakefileRules;
import org.pragmatica.purify.make.Makefile;
import org.pragmatica.purify.make.MakefileParser;
import org.pragmatica.purify.make.MakefileRenderer;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MakefileRewriterTest {

    private static Makefile parse(String source) {
        return MakefileParser.parse(source).unwrap();
    }

    private static List<Transformation> plan(Makefile makefile, PlanOptions options) {
        return TransformationPlanner.planMakefile(makefile, MakefileAnalyzer.analyze(makefile), options);
    }

    private static String purify(String source) {
        var makefile = parse(source);
        return MakefileRenderer.render(MakefileRewriter.apply(makefile, plan(makefile, PlanOptions.DEFAULT)).tree());
    }

    @Test
    void apply_wildcard_wrappedWithSort() {
        assertEquals("SRCS := $(sort $(wildcard src/*.c))\n", purify("SRCS := $(wildcard src/*.c)\n"));
    }

    @Test
    void apply_shellFind_wrappedWithSort() {
        assertEquals("OBJS := $(sort $(shell find build -name '*.o'))\n",
                     purify("OBJS := $(shell find build -name '*.o')\n"));
    }

    @Test
    void apply_variableInsideConditional_rewritten() {
        var result = purify("ifdef CI\nSRCS := $(wildcard *.c)\nendif\n");

        assertTrue(result.contains("SRCS := $(sort $(wildcard *.c))"));
        assertTrue(result.startsWith("ifdef CI"));
        assertTrue(result.endsWith("endif\n"));
    }

    @Test
    void apply_orderingRewritesDisabled_leavesAdvisory() {
        var makefile = parse("SRCS := $(wildcard src/*.c)\n");
        var planned = plan(makefile, new PlanOptions(false, false));
        var outcome = MakefileRewriter.apply(makefile, planned);

        assertTrue(outcome.applied().isEmpty());
        assertEquals(1, outcome.transformations().size());
        var t = outcome.transformations().get(0);
        assertEquals(MakefileRules.NO_WILDCARD, t.ruleId());
        assertFalse(t.safe());
        assertEquals("SRCS := $(wildcard src/*.c)\n", MakefileRenderer.render(outcome.tree()));
    }

    @Test
    void apply_targetAlreadySorted_downgrades() {
        var planned = plan(parse("SRCS := $(wildcard src/*.c)\n"), PlanOptions.DEFAULT);
        var outcome = MakefileRewriter.apply(parse("SRCS := $(sort $(wildcard src/*.c))\n"), planned);

        assertEquals(1, outcome.downgraded().size());
        var advisory = outcome.downgraded().get(0);
        assertTrue(advisory.message().startsWith("Not applied: Wrapped $(wildcard ...)"));
    }

    @Test
    void apply_recipeIssues_passedThroughAsAdvisories() {
        var makefile = parse("build:\n\tcd src\n\tmake\n");
        var outcome = MakefileRewriter.apply(makefile, plan(makefile, PlanOptions.DEFAULT));

        assertTrue(outcome.applied().isEmpty());
        assertFalse(outcome.transformations().isEmpty());
        assertTrue(outcome.transformations().stream().noneMatch(Transformation::safe));
    }
}
