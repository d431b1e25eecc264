package org.pragmatica.purify;

import org.pragmatica.purify.analysis.IssueCategory;
import org.pragmatica.purify.error.ParseError;
import org.pragmatica.purify.transform.Transformation;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class ShellPurifierTest {

    // === Scenarios ===

    @Test
    void purify_makefileWildcard_wrapsWithSort() {
        var result = ShellPurifier.purify("FILES := $(wildcard *.c)\n", Dialect.MAKEFILE);

        assertTrue(result.isSuccess());
        var purified = result.unwrap();
        assertEquals("FILES := $(sort $(wildcard *.c))\n", purified.text());
        assertEquals(1, purified.report().transformationsApplied());
        assertEquals(1, purified.report().issuesFixed());
        assertEquals(0, purified.report().manualFixesNeeded());
    }

    @Test
    void purify_mkdirWithoutParents_addsParentsFlag() {
        var purified = ShellPurifier.purify("mkdir /tmp/build\n", Dialect.SHELL).unwrap();

        assertEquals("mkdir -p /tmp/build\n", purified.text());
        assertEquals(1, purified.report().issuesFixed());
        assertEquals(0, purified.report().manualFixesNeeded());
    }

    @Test
    void purify_timedCommand_keepsTimeKeyword() {
        var purified = ShellPurifier.purify("time make build\n", Dialect.SHELL).unwrap();

        assertEquals("time make build\n", purified.text());
        assertEquals(0, purified.report().transformationsApplied());
    }

    @Test
    void purify_symlinkWithoutForce_mergesForceIntoCluster() {
        var purified = ShellPurifier.purify("ln -s /opt/app/current /usr/local/app\n", Dialect.SHELL).unwrap();

        assertEquals("ln -sf /opt/app/current /usr/local/app\n", purified.text());
        assertEquals(1, purified.appliedTransformations().size());
        assertInstanceOf(Transformation.AddFlag.class, purified.appliedTransformations().get(0));
    }

    @Test
    void purify_randomVariable_reportedAsManualFix() {
        var purified = ShellPurifier.purify("echo \"$RANDOM\"\n", Dialect.SHELL).unwrap();

        assertEquals("echo \"$RANDOM\"\n", purified.text());
        assertEquals(0, purified.report().issuesFixed());
        assertEquals(1, purified.report().manualFixesNeeded());
        assertEquals(1, purified.advisories().size());
        var advisory = purified.advisories().get(0);
        assertEquals("DET001", advisory.ruleId());
        assertFalse(advisory.downgraded());
        assertTrue(advisory.suggestion().isPresent());
    }

    @Test
    void purify_missingEsac_returnsParseError() {
        var result = ShellPurifier.purify("""
            case $x in
              a) echo a ;;
            """, Dialect.SHELL);

        assertTrue(result.isFailure());
        var error = assertInstanceOf(ParseError.UnterminatedBlock.class, result.error());
        assertEquals(1, error.location().line());
        assertEquals("'esac'", error.expected());
    }

    // === Properties ===

    @Test
    void purify_purifiedScript_isFixpoint() {
        var source = """
            #!/bin/bash
            function deploy {
                mkdir /srv/app
                files=$(find /srv/app -name '*.conf')
                if [[ $files == "" ]]; then
                    source ./defaults.sh
                fi
                rm /srv/app/lock
                cp $files /backup
            }
            deploy
            """;

        var once = ShellPurifier.purify(source, Dialect.SHELL).unwrap();
        var twice = ShellPurifier.purify(once.text(), Dialect.SHELL).unwrap();

        assertEquals(once.text(), twice.text());
        assertEquals(0, twice.report().issuesFixed());
    }

    @Test
    void purify_safeRewrites_keepStatementCount() {
        var source = """
            mkdir build
            rm build/stamp
            ln -s build latest
            list=$(find . -name '*.o')
            echo $list
            """;

        var original = ShellPurifier.parse(source, Dialect.SHELL).unwrap();
        var purified = ShellPurifier.purify(source, Dialect.SHELL).unwrap();

        assertEquals(original.statementCount(), purified.statementCount());
        assertTrue(purified.report().issuesFixed() >= 5);
    }

    @Test
    void purify_sameInput_producesSameOutput() {
        var source = """
            SRC := $(wildcard src/*.c)
            OBJ := $(shell find build -name '*.o')
            build:
            \tmkdir -p out
            \tgcc -o out/app $(SRC)
            """;

        var first = ShellPurifier.purify(source, Dialect.MAKEFILE).unwrap();
        var second = ShellPurifier.purify(source, Dialect.MAKEFILE).unwrap();

        assertEquals(first.text(), second.text());
        assertEquals(first.transformations(), second.transformations());
        assertEquals(first.report(), second.report());
    }

    @Test
    void purify_dockerfile_appliesSafeFixesAndKeepsAdvisories() {
        var source = """
            FROM ubuntu
            RUN apt-get update && apt-get install -y curl
            ADD app.conf /etc/app.conf
            CMD ["app"]
            """;

        var purified = ShellPurifier.purify(source, Dialect.DOCKERFILE).unwrap();

        assertEquals("""
            FROM ubuntu:22.04
            RUN apt-get update && apt-get install -y --no-install-recommends curl && rm -rf /var/lib/apt/lists/*
            COPY app.conf /etc/app.conf
            CMD ["app"]
            """, purified.text());
        assertEquals(4, purified.report().issuesFixed());
        assertEquals(Set.of("DOCKER_ROOT_USER", "UNPINNED_PACKAGE"),
                     purified.advisories().stream().map(Transformation::ruleId).collect(Collectors.toSet()));
    }

    // === Configuration ===

    @Test
    void builder_withoutNonDeterministicRemoval_plansAdvisory() {
        var purified = ShellPurifier.builder(Dialect.MAKEFILE)
                                    .removeNonDeterministic(false)
                                    .purify("FILES := $(wildcard *.c)\n")
                                    .unwrap();

        assertEquals("FILES := $(wildcard *.c)\n", purified.text());
        assertEquals(0, purified.report().issuesFixed());
        assertEquals(1, purified.report().manualFixesNeeded());
    }

    @Test
    void builder_disabledCategory_skipsItsRules() {
        var purified = ShellPurifier.builder(Dialect.SHELL)
                                    .disable(IssueCategory.IDEMPOTENCY)
                                    .purify("mkdir /tmp/build\n")
                                    .unwrap();

        assertEquals("mkdir /tmp/build\n", purified.text());
        assertTrue(purified.issues().isEmpty());
    }

    @Test
    void builder_trackSideEffects_listsStateChangingCommands() {
        var tracked = ShellPurifier.purify("mkdir /tmp/build\n", Dialect.SHELL).unwrap();
        var untracked = ShellPurifier.builder(Dialect.SHELL)
                                     .trackSideEffects(false)
                                     .purify("mkdir /tmp/build\n")
                                     .unwrap();

        assertEquals(List.of("line 1: mkdir /tmp/build (creates directory)"), tracked.report().sideEffects());
        assertTrue(untracked.report().sideEffects().isEmpty());
    }

    @Test
    void builder_emitGuardsWithTypeCheck_insertsGuardOnce() {
        var source = """
            # @type count: int
            count=3
            echo "$count"
            """;
        var builder = ShellPurifier.builder(Dialect.SHELL)
                                   .typeCheck(true)
                                   .emitGuards(true);

        var once = builder.purify(source).unwrap();
        var twice = builder.purify(once.text()).unwrap();

        assertTrue(once.text().contains("case \"${count#-}\" in"));
        assertTrue(once.text().contains("echo \"count: expected int\" >&2"));
        assertEquals(once.text(), twice.text());
    }

    @Test
    void builder_emitGuardsWithoutTypeCheck_changesNothing() {
        var source = """
            # @type count: int
            count=3
            """;

        var purified = ShellPurifier.builder(Dialect.SHELL)
                                    .emitGuards(true)
                                    .purify(source)
                                    .unwrap();

        assertEquals(source, purified.text());
    }

    @Test
    void builder_sourceFile_recordedInMetadata() {
        var purified = ShellPurifier.builder(Dialect.SHELL)
                                    .sourceFile("deploy.sh")
                                    .purify("echo done\n")
                                    .unwrap();

        assertEquals(Optional.of("deploy.sh"), purified.tree().metadata().sourceFile());
    }

    // === Views ===

    @Test
    void analyze_returnsIssuesWithoutRewriting() {
        var issues = ShellPurifier.analyze("rm /tmp/lock\n", Dialect.SHELL).unwrap();

        assertEquals(List.of("IDEM002"), issues.stream().map(issue -> issue.rule()).toList());
    }

    @Test
    void dialect_forFileName_recognizesBuildFiles() {
        assertEquals(Dialect.MAKEFILE, Dialect.forFileName("project/Makefile"));
        assertEquals(Dialect.MAKEFILE, Dialect.forFileName("rules.mk"));
        assertEquals(Dialect.DOCKERFILE, Dialect.forFileName("Dockerfile.dev"));
        assertEquals(Dialect.SHELL, Dialect.forFileName("install.sh"));
    }
}
