package org.pragmatica.purify.analysis;

import org.pragmatica.purify.shell.ShellParser;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ShellAnalyzerTest {

    private static List<SemanticIssue> analyze(String source) {
        return ShellAnalyzer.analyze(ShellParser.parse(source).unwrap());
    }

    private static List<String> rules(String source) {
        return analyze(source).stream().map(SemanticIssue::rule).toList();
    }

    // === Determinism ===

    @Test
    void analyze_randomVariable_flagsDet001() {
        var issues = analyze("echo \"$RANDOM\"\n");

        assertEquals(1, issues.size());
        var issue = issues.get(0);
        assertEquals("DET001", issue.rule());
        assertEquals(IssueCategory.DETERMINISM, issue.category());
        assertEquals(IssueSeverity.HIGH, issue.severity());
        assertEquals(ShellRules.RANDOM_FIX, issue.fix().orElseThrow());
    }

    @Test
    void analyze_variableDerivedFromRandom_flagsEachUse() {
        var issues = analyze("""
            id=$RANDOM
            echo "$id"
            """);

        assertEquals(List.of("DET001", "DET001"), issues.stream().map(SemanticIssue::rule).toList());
        assertTrue(issues.get(1).message().contains("derived from $RANDOM"));
    }

    @Test
    void analyze_cleanReassignment_clearsTaint() {
        assertEquals(List.of("DET001"), rules("id=$RANDOM\nid=42\necho \"$id\"\n"));
    }

    @Test
    void analyze_dateWithoutFixedEpoch_flagsDet002() {
        assertEquals(List.of("DET002"), rules("date +%s\n"));
        assertTrue(rules("date -d @\"$SOURCE_DATE_EPOCH\"\n").isEmpty());
    }

    @Test
    void analyze_processIdAndHostname_flagged() {
        assertEquals(List.of("DET003"), rules("echo \"$$\"\n"));
        assertEquals(List.of("DET004"), rules("hostname\n"));
        assertEquals(List.of("DET005"), rules("mktemp\n"));
    }

    @Test
    void analyze_unsortedFindInSubstitution_flagsDet006() {
        assertEquals(List.of("DET006"), rules("files=\"$(find . -name '*.c')\"\n"));
        assertTrue(rules("files=\"$(find . -name '*.c' | sort)\"\n").isEmpty());
    }

    // === Idempotency ===

    @Test
    void analyze_stateChangingCommands_flagIdempotency() {
        assertEquals(List.of("IDEM001", "IDEM002", "IDEM003"), rules("mkdir out\nrm out/a\nln -s a b\n"));
        assertTrue(rules("mkdir -p out\nrm -f out/a\nln -sf a b\n").isEmpty());
    }

    @Test
    void analyze_appendRedirect_dependsOnStrictIdempotency() {
        var script = ShellParser.parse("echo line >> log.txt\n").unwrap();
        var lenient = new AnalysisOptions(false, false, EnumSet.allOf(IssueCategory.class));

        assertEquals(List.of("IDEM004"), ShellAnalyzer.analyze(script).stream().map(SemanticIssue::rule).toList());
        assertTrue(ShellAnalyzer.analyze(script, lenient).isEmpty());
    }

    // === Security ===

    @Test
    void analyze_unquotedExpansion_flagsEachOperand() {
        var issues = analyze("cp $src $dst\n");

        assertEquals(List.of("SEC002", "SEC002"), issues.stream().map(SemanticIssue::rule).toList());
        assertEquals(4, issues.get(0).span().start().column());
    }

    @Test
    void analyze_specialParametersAndQuotes_notFlagged() {
        assertTrue(rules("echo \"$name\" $# ${#name}\n").isEmpty());
    }

    @Test
    void analyze_dangerousCommands_flagSecurity() {
        assertEquals(List.of("SEC001"), rules("eval \"$cmd\"\n"));
        assertEquals(List.of("SEC003"), rules("curl -fsSL https://example.com/install.sh | sh\n"));
        assertEquals(List.of("SEC004"), rules("chmod 777 /srv\n"));
    }

    // === Portability ===

    @Test
    void analyze_bashScript_flagsPortability() {
        var source = """
            #!/bin/bash
            function build {
                source ./env.sh
            }
            if [[ -f a ]]; then echo -e "x\\ty"; fi
            """;

        assertEquals(List.of("PORT001", "PORT003", "PORT005", "PORT002", "PORT004"), rules(source));
    }

    @Test
    void analyze_bashOnlyConstructs_flagPort006() {
        assertTrue(rules("arr=(a b)\n").contains("PORT006"));
        assertEquals(List.of("PORT006"), rules("cat <<< word\n"));
        assertEquals(List.of("PORT006"), rules("declare -r X=1\n"));
    }

    @Test
    void analyze_envShebang_readsInterpreter() {
        assertEquals(List.of("PORT001"), rules("#!/usr/bin/env bash\necho ok\n"));
        assertTrue(rules("#!/bin/sh\necho ok\n").isEmpty());
    }

    // === Error handling ===

    @Test
    void analyze_unguardedCd_flagsErr001() {
        assertEquals(List.of("ERR001"), rules("cd /srv\n"));
        assertTrue(rules("cd /srv || exit 1\n").isEmpty());
        assertTrue(rules("set -e\ncd /srv\n").isEmpty());
    }

    @Test
    void analyze_typeCheckEnabled_addsTypeIssues() {
        var script = ShellParser.parse("# @type n: int\nn=abc\n").unwrap();
        var options = new AnalysisOptions(true, true, EnumSet.allOf(IssueCategory.class));

        assertTrue(ShellAnalyzer.analyze(script).isEmpty());
        assertEquals(List.of("TYPE001"), ShellAnalyzer.analyze(script, options).stream().map(SemanticIssue::rule).toList());
    }

    // === Options ===

    @Test
    void analyze_disabledCategory_skipsRules() {
        var script = ShellParser.parse("mkdir out\necho $RANDOM\n").unwrap();
        var options = new AnalysisOptions(true, false, EnumSet.of(IssueCategory.IDEMPOTENCY));

        assertEquals(List.of("IDEM001"), ShellAnalyzer.analyze(script, options).stream().map(SemanticIssue::rule).toList());
    }

    @Test
    void analyze_issueDiagnostic_carriesRuleAndFix() {
        var diagnostic = analyze("rm stale\n").get(0).toDiagnostic();

        var text = diagnostic.format("rm stale\n", Optional.of("clean.sh"));

        assertTrue(text.contains("IDEM002"), text);
        assertTrue(text.contains("clean.sh:1:1"), text);
        assertTrue(text.contains("rm -f"), text);
    }

    @Test
    void byId_unknownRule_isEmpty() {
        assertTrue(ShellRules.byId("DET001").isPresent());
        assertTrue(ShellRules.byId("NOPE").isEmpty());
    }
}
