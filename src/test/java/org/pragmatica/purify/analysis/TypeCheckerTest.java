package org.pragmatica.purify.analysis;

import org.pragmatica.purify.analysis.TypeChecker.ShellType;
import org.pragmatica.purify.analysis.TypeChecker.TypedAssignment;
import org.pragmatica.purify.shell.ShellParser;
import org.pragmatica.purify.shell.ShellScript;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TypeCheckerTest {

    private static ShellScript parse(String source) {
        return ShellParser.parse(source).unwrap();
    }

    // === Annotations ===

    @Test
    void check_intAnnotationWithTextValue_reportsMismatch() {
        var issues = TypeChecker.check(parse("# @type port: int\nport=http\n"));

        assertEquals(1, issues.size());
        var issue = issues.get(0);
        assertEquals("TYPE001", issue.rule());
        assertEquals(IssueCategory.ERROR_HANDLING, issue.category());
        assertTrue(issue.message().contains("'http'"));
    }

    @Test
    void check_validValues_noIssues() {
        var script = parse("""
            # @type port: int
            # @type verbose: bool
            port=8080
            verbose=true
            port=$((port + 1))
            port=$1
            """);

        assertTrue(TypeChecker.check(script).isEmpty());
    }

    @Test
    void check_untypedVariable_neverChecked() {
        assertTrue(TypeChecker.check(parse("port=http\n")).isEmpty());
    }

    @Test
    void check_declareInteger_checksLiteral() {
        var issues = TypeChecker.check(parse("declare -i count=abc\n"));

        assertEquals(List.of("TYPE001"), issues.stream().map(SemanticIssue::rule).toList());
        assertTrue(TypeChecker.check(parse("declare -i count=10\n")).isEmpty());
    }

    @Test
    void check_stringInArithmetic_reportsType002() {
        var issues = TypeChecker.check(parse("# @type name: string\nx=$((name + 1))\n"));

        assertEquals(List.of("TYPE002"), issues.stream().map(SemanticIssue::rule).toList());
    }

    // === Typed assignments ===

    @Test
    void typedAssignments_listsIntAndBoolOnly() {
        var script = parse("""
            # @type n: int
            # @type dir: path
            # @type ok: bool
            n=1
            dir=/tmp
            ok=false
            """);

        var typed = TypeChecker.typedAssignments(script);

        assertEquals(List.of("n", "ok"), typed.stream().map(TypedAssignment::name).toList());
        assertEquals(List.of(ShellType.INT, ShellType.BOOL), typed.stream().map(TypedAssignment::type).toList());
    }

    @Test
    void fromName_acceptsAliases() {
        assertEquals(ShellType.INT, ShellType.fromName("Integer").orElseThrow());
        assertEquals(ShellType.STRING, ShellType.fromName("str").orElseThrow());
        assertTrue(ShellType.fromName("float").isEmpty());
    }
}
