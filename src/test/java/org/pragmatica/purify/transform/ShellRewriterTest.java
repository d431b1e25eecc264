package org.pragmatica.purify.transform;

import org.pragmatica.purify.analysis.ShellAnalyzer;
import org.pragmatica.purify.shell.ShellParser;
import org.pragmatica.purify.shell.ShellRenderer;
import org.pragmatica.purify.shell.ShellScript;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ShellRewriterTest {

    private static ShellScript parse(String source) {
        return ShellParser.parse(source).unwrap();
    }

    private static List<Transformation> plan(ShellScript script) {
        return TransformationPlanner.planShell(script, ShellAnalyzer.analyze(script), PlanOptions.DEFAULT);
    }

    private static String purify(String source) {
        var script = parse(source);
        return ShellRenderer.render(ShellRewriter.apply(script, plan(script)).tree());
    }

    // === Commands ===

    @Test
    void apply_mkdirWithoutParents_addsFlag() {
        assertEquals("mkdir -p /tmp/build\n", purify("mkdir /tmp/build\n"));
    }

    @Test
    void apply_symlinkFlag_mergedIntoExistingOptions() {
        assertEquals("ln -sf target link\n", purify("ln -s target link\n"));
    }

    @Test
    void apply_flagAndQuoting_onSameCommand() {
        assertEquals("rm -f \"$f\"\n", purify("rm $f\n"));
    }

    @Test
    void apply_sourceCommand_renamedToDot() {
        assertEquals(". ./env.sh\n", purify("source ./env.sh\n"));
    }

    @Test
    void apply_functionKeyword_convertedToPosixSyntax() {
        var result = purify("function greet {\n    echo hi\n}\n");

        assertTrue(result.startsWith("greet() {"));
        assertFalse(result.contains("function"));
    }

    // === Expressions ===

    @Test
    void apply_extendedTest_convertedWithQuotedOperand() {
        var result = purify("if [[ -f $cfg ]]; then\n    echo ok\nfi\n");

        assertTrue(result.contains("[ -f \"$cfg\" ]"));
        assertFalse(result.contains("[["));
    }

    @Test
    void apply_regexTest_leftAsAdvisory() {
        var script = parse("[[ $a =~ ^x ]] && echo y\n");
        var outcome = ShellRewriter.apply(script, plan(script));

        assertTrue(outcome.applied().isEmpty());
        assertEquals(1, outcome.transformations().size());
        var t = outcome.transformations().get(0);
        assertEquals("PORT002", t.ruleId());
        assertFalse(t.safe());
    }

    @Test
    void apply_unsortedFind_pipedThroughSort() {
        assertEquals("files=$(find src -type f | sort)\n", purify("files=$(find src -type f)\n"));
    }

    @Test
    void plan_orderingRewritesDisabled_findBecomesAdvisory() {
        var script = parse("files=$(find src -type f)\n");
        var planned = TransformationPlanner.planShell(script, ShellAnalyzer.analyze(script), new PlanOptions(false, false));

        assertEquals(1, planned.size());
        assertInstanceOf(Transformation.Advisory.class, planned.get(0));
        assertEquals("files=$(find src -type f)\n",
                     ShellRenderer.render(ShellRewriter.apply(script, planned).tree()));
    }

    // === Shebang ===

    @Test
    void apply_bashShebang_replacedWhenScriptIsPortable() {
        assertEquals("#!/bin/sh\necho hi\n", purify("#!/bin/bash\necho hi\n"));
    }

    @Test
    void plan_bashOnlyConstructLeft_keepsShebang() {
        var script = parse("#!/bin/bash\narr=(a b)\n");
        var planned = plan(script);

        var shebang = planned.stream().filter(t -> t.ruleId().equals("PORT001")).toList();

        assertEquals(1, shebang.size());
        assertFalse(shebang.get(0).safe());
        assertTrue(shebang.get(0).description().startsWith("Shebang kept: script still uses non-POSIX constructs"));
        assertTrue(ShellRenderer.render(ShellRewriter.apply(script, planned).tree()).startsWith("#!/bin/bash\n"));
    }

    // === Downgrades ===

    @Test
    void apply_targetNoLongerMatches_downgradesToAdvisory() {
        var planned = plan(parse("mkdir a\n"));
        var outcome = ShellRewriter.apply(parse("echo a\n"), planned);

        assertTrue(outcome.applied().isEmpty());
        assertEquals(1, outcome.downgraded().size());
        var advisory = outcome.downgraded().get(0);
        assertEquals("IDEM001", advisory.ruleId());
        assertTrue(advisory.downgraded());
        assertEquals("Not applied: Added -p to mkdir (target changed or not found)", advisory.message());
        assertEquals("echo a\n", ShellRenderer.render(outcome.tree()));
    }

    @Test
    void apply_flagAlreadyPresent_downgrades() {
        var planned = plan(parse("mkdir a\n"));
        var outcome = ShellRewriter.apply(parse("mkdir -p\n"), planned);

        assertEquals(1, outcome.downgraded().size());
    }

    @Test
    void apply_inputScriptUnchanged() {
        var script = parse("mkdir out\n");
        ShellRewriter.apply(script, plan(script));

        assertEquals("mkdir out\n", ShellRenderer.render(script));
    }

    // === Type guards ===

    @Test
    void plan_emitGuards_insertsGuardOnce() {
        var options = new PlanOptions(true, true);
        var script = parse("# @type n: int\nn=5\n");
        var planned = TransformationPlanner.planShell(script, List.of(), options);

        assertEquals(1, planned.size());
        assertInstanceOf(Transformation.InsertTypeGuard.class, planned.get(0));

        var guarded = ShellRenderer.render(ShellRewriter.apply(script, planned).tree());
        assertTrue(guarded.contains("n=5\ncase \"${n#-}\" in"));
        assertTrue(guarded.contains("echo \"n: expected int\" >&2"));
        assertTrue(TransformationPlanner.planShell(parse(guarded), List.of(), options).isEmpty());
    }

    @Test
    void plan_boolGuard_acceptsTrueAndFalse() {
        var script = parse("# @type ok: bool\nok=true\n");
        var planned = TransformationPlanner.planShell(script, List.of(), new PlanOptions(true, true));
        var guarded = ShellRenderer.render(ShellRewriter.apply(script, planned).tree());

        assertTrue(guarded.contains("case \"$ok\" in"));
        assertTrue(guarded.contains("true|false)"));
        assertTrue(guarded.contains("echo \"ok: expected bool\" >&2"));
    }

    // === Planning ===

    @Test
    void plan_repeatedIssue_plannedOnce() {
        var script = parse("mkdir a\n");
        var issues = ShellAnalyzer.analyze(script);
        var doubled = List.of(issues.get(0), issues.get(0));

        assertEquals(1, TransformationPlanner.planShell(script, doubled, PlanOptions.DEFAULT).size());
    }

    @Test
    void plan_issueWithoutTemplate_becomesAdvisoryWithSuggestion() {
        var script = parse("x=$RANDOM\n");
        var planned = plan(script);

        assertEquals(1, planned.size());
        var t = planned.get(0);
        assertEquals("DET001", t.ruleId());
        assertTrue(t.description().contains("Suggestion: "));
    }
}
