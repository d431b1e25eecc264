package org.pragmatica.purify.analysis;

import org.pragmatica.purify.make.MakefileParser;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MakefileAnalyzerTest {

    private static List<SemanticIssue> analyze(String source) {
        return MakefileAnalyzer.analyze(MakefileParser.parse(source).unwrap());
    }

    private static List<String> rules(String source) {
        return analyze(source).stream().map(SemanticIssue::rule).toList();
    }

    // === Determinism ===

    @Test
    void analyze_unsortedWildcard_flagged() {
        var issues = analyze("SRCS := $(wildcard src/*.c)\n");

        assertEquals(1, issues.size());
        var issue = issues.get(0);
        assertEquals(MakefileRules.NO_WILDCARD, issue.rule());
        assertEquals(IssueCategory.DETERMINISM, issue.category());
        assertEquals("SRCS := $(sort $(wildcard ...))", issue.fix().orElseThrow());
    }

    @Test
    void analyze_sortedCalls_notFlagged() {
        assertTrue(rules("SRCS := $(sort $(wildcard src/*.c))\nOBJS := $(sort $(shell find . -name '*.o'))\n").isEmpty());
    }

    @Test
    void analyze_unorderedFind_flagged() {
        assertEquals(List.of(MakefileRules.NO_UNORDERED_FIND), rules("OBJS := $(shell find build -name '*.o')\n"));
    }

    @Test
    void analyze_timestampsAndRandom_flagReproducibility() {
        assertEquals(List.of("NO_TIMESTAMPS"), rules("VERSION := $(shell date +%Y%m%d)\n"));
        assertEquals(List.of("NO_RANDOM"), rules("SEED := $$RANDOM\n"));
        assertEquals(List.of("NO_HOSTNAME"), rules("HOST := $(shell hostname)\n"));
    }

    @Test
    void analyze_recursiveShellVariable_flagsPerformance() {
        assertEquals(List.of("PERF_SHELL_RECURSIVE"), rules("REV = $(shell git rev-parse HEAD)\n"));
    }

    @Test
    void analyze_performanceIssueWithoutSuffixes_recommendsSuffixes() {
        var issues = analyze("x:\n\trm -f a\n\trm -f b\n");

        assertEquals(List.of("PERF_REPEATED_RM", "PERF_SUFFIXES"), issues.stream().map(SemanticIssue::rule).toList());
        assertEquals(".SUFFIXES:", issues.get(1).fix().orElseThrow());
        assertEquals(issues.get(0).span(), issues.get(1).span());
    }

    @Test
    void analyze_suffixesDeclared_noRecommendation() {
        assertEquals(List.of("PERF_REPEATED_RM"), rules(".SUFFIXES:\nx:\n\trm -f a\n\trm -f b\n"));
    }

    // === Targets ===

    @Test
    void analyze_commonTargetWithoutPhony_flagged() {
        var issues = analyze("clean:\n\trm -f app\n");

        assertEquals(List.of("AUTO_PHONY"), issues.stream().map(SemanticIssue::rule).toList());
        assertEquals(".PHONY: clean", issues.get(0).fix().orElseThrow());
    }

    @Test
    void analyze_phonyDeclared_notFlagged() {
        assertTrue(rules(".PHONY: clean\nclean:\n\trm -f app\n").isEmpty());
    }

    @Test
    void analyze_unpinnedPackageInRecipe_flagged() {
        var issues = analyze("deps:\n\tpip install requests flask==3.0.0\n");

        assertEquals(1, issues.size());
        var issue = issues.get(0);
        assertEquals("UNPINNED_PACKAGE", issue.rule());
        assertEquals("requests==<version>", issue.fix().orElseThrow());
    }

    // === Parallel safety ===

    @Test
    void analyze_twoTargetsWritingSameFile_flagConflictAndSummary() {
        var source = """
            a:
            \techo a > out.txt
            b:
            \techo b > out.txt
            """;

        assertEquals(List.of("PARALLEL_OUTPUT_CONFLICT", "PARALLEL_NOT_PARALLEL"), rules(source));
    }

    @Test
    void analyze_readWithoutDependency_flagsMissingDependency() {
        var source = """
            gen:
            \techo data > data.txt
            use:
            \tcat data.txt
            """;

        assertTrue(rules(source).contains("PARALLEL_MISSING_DEPENDENCY"));
        assertFalse(rules(source.replace("use:", "use: gen")).contains("PARALLEL_MISSING_DEPENDENCY"));
    }

    @Test
    void analyze_notParallelTarget_suppressesSummary() {
        var source = """
            .NOTPARALLEL:
            a:
            \techo a > out.txt
            b:
            \techo b > out.txt
            """;

        assertEquals(List.of("PARALLEL_OUTPUT_CONFLICT"), rules(source));
    }

    // === Error handling ===

    @Test
    void analyze_ignoredFailure_flagsSilentFailureAndSummary() {
        assertEquals(List.of("ERR_SILENT_FAILURE", "ERR_DELETE_ON_ERROR"), rules("x:\n\t-rm stale\n"));
    }

    @Test
    void analyze_cdOnOwnLine_flagsOneShell() {
        var source = "x:\n\tcd src\n\tmake\n.DELETE_ON_ERROR:\n";

        assertEquals(List.of("ERR_NO_ONESHELL"), rules(source));
    }

    @Test
    void analyze_semicolonAfterCheckedCommand_flagsUnchecked() {
        var issues = analyze("x:\n\tmkdir out; cp a out\n.DELETE_ON_ERROR:\n");

        assertEquals(List.of("ERR_UNCHECKED_COMMAND"), issues.stream().map(SemanticIssue::rule).toList());
        assertEquals("mkdir out && cp a out", issues.get(0).fix().orElseThrow());
    }

    @Test
    void analyze_bashCommandWithoutSetE_flagged() {
        assertEquals(List.of("ERR_MISSING_SET_E"), rules("x:\n\tbash -c 'make all'\n.DELETE_ON_ERROR:\n"));
        assertTrue(rules("x:\n\tbash -c 'set -e; make all'\n.DELETE_ON_ERROR:\n").isEmpty());
    }

    @Test
    void analyze_loopWithoutExit_flagged() {
        var issues = analyze("x:\n\t@for f in a b; do cp $$f out; done\n");

        assertEquals(List.of("ERR_LOOP_UNCHECKED", "ERR_DELETE_ON_ERROR"), issues.stream().map(SemanticIssue::rule).toList());
        assertEquals(IssueCategory.ERROR_HANDLING, issues.get(0).category());
    }

    @Test
    void analyze_loopWithExit_notFlagged() {
        assertTrue(rules("x:\n\tfor f in a b; do cp $$f out || exit 1; done\n").isEmpty());
    }

    // === Portability ===

    @Test
    void analyze_bashismWithoutBashShell_flagged() {
        assertEquals(List.of("PORT_BASHISM"), rules("x:\n\t[[ -f a ]] && echo ok\n"));
        assertTrue(rules("SHELL := /bin/bash\nx:\n\t[[ -f a ]] && echo ok\n").isEmpty());
    }

    @Test
    void analyze_unameInRecipe_flagsPlatformDetection() {
        var issues = analyze("x:\n\t@echo building for $$(uname -s)\n");

        assertEquals(List.of("PORT_PLATFORM"), issues.stream().map(SemanticIssue::rule).toList());
        assertEquals(IssueCategory.PORTABILITY, issues.get(0).category());
    }

    // === Options ===

    @Test
    void analyze_nestedConditional_analyzedLikeTopLevel() {
        assertEquals(List.of(MakefileRules.NO_WILDCARD), rules("ifdef CI\nSRCS := $(wildcard *.c)\nendif\n"));
    }

    @Test
    void analyze_disabledCategory_skipsRules() {
        var makefile = MakefileParser.parse("SRCS := $(wildcard *.c)\nclean:\n\trm -f x\n").unwrap();
        var options = new AnalysisOptions(true, false, EnumSet.of(IssueCategory.IDEMPOTENCY));
        var issues = MakefileAnalyzer.analyze(makefile, options);

        assertEquals(List.of("AUTO_PHONY"), issues.stream().map(SemanticIssue::rule).toList());
    }
}
