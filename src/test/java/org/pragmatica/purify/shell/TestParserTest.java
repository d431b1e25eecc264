package org.pragmatica.purify.shell;

import org.pragmatica.purify.error.ParseError;
import org.pragmatica.purify.shell.TestExpr.BinaryOperator;
import org.pragmatica.purify.shell.TestExpr.UnaryOperator;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TestParserTest {

    private static ShellExpression.Test condition(String test) {
        var statement = ShellParser.parse("if " + test + "; then :; fi\n").unwrap().statements().get(0);
        return assertInstanceOf(ShellExpression.Test.class, ((ShellStatement.If) statement).condition());
    }

    // === Single bracket ===

    @Test
    void parse_unaryFileTest_readsOperator() {
        var unary = assertInstanceOf(TestExpr.Unary.class, condition("[ -d /tmp ]").test());

        assertEquals(UnaryOperator.DIRECTORY, unary.operator());
        assertEquals("/tmp", ShellTrees.literalText(unary.operand()).orElseThrow());
    }

    @Test
    void parse_integerComparison_isBinary() {
        var binary = assertInstanceOf(TestExpr.Binary.class, condition("[ \"$n\" -gt 3 ]").test());

        assertEquals(BinaryOperator.INT_GREATER, binary.operator());
        assertTrue(binary.operator().isIntegerComparison());
    }

    @Test
    void parse_connectives_bindAndTighterThanOr() {
        var or = assertInstanceOf(TestExpr.Or.class, condition("[ -f a -o -f b -a -f c ]").test());

        assertInstanceOf(TestExpr.Unary.class, or.left());
        assertInstanceOf(TestExpr.And.class, or.right());
    }

    @Test
    void parse_negation_wrapsOperand() {
        var not = assertInstanceOf(TestExpr.Not.class, condition("[ ! -e lock ]").test());

        assertInstanceOf(TestExpr.Unary.class, not.operand());
    }

    @Test
    void parse_singleWord_isNonEmptyCheck() {
        assertInstanceOf(TestExpr.Word.class, condition("[ \"$flag\" ]").test());
    }

    @Test
    void parse_testCommand_isTestStatement() {
        var statement = ShellParser.parse("test -z \"$x\"\n").unwrap().statements().get(0);

        var test = assertInstanceOf(ShellStatement.TestCommand.class, statement);
        assertFalse(test.test().extended());
    }

    @Test
    void parse_unbalancedBracket_staysPlainCommand() {
        var statement = ShellParser.parse("[ -f a\n").unwrap().statements().get(0);

        assertInstanceOf(ShellStatement.Command.class, statement);
    }

    // === Double bracket ===

    @Test
    void parse_extendedTest_usesLogicalOperators() {
        var test = condition("[[ -n $a && $b == x* ]]");

        assertTrue(test.extended());
        var and = assertInstanceOf(TestExpr.And.class, test.test());
        var binary = assertInstanceOf(TestExpr.Binary.class, and.right());
        assertEquals(BinaryOperator.STRING_EQUAL_EXTENDED, binary.operator());
    }

    @Test
    void parse_regexMatch_isBinary() {
        var binary = assertInstanceOf(TestExpr.Binary.class, condition("[[ $v =~ ^[0-9]+ ]]").test());

        assertEquals(BinaryOperator.REGEX_MATCH, binary.operator());
    }

    @Test
    void parse_groupedExtendedTest_keepsGroup() {
        var and = assertInstanceOf(TestExpr.And.class, condition("[[ ( -f a || -f b ) && -r c ]]").test());

        assertInstanceOf(TestExpr.Group.class, and.left());
    }

    @Test
    void parse_unclosedExtendedTest_reportsBlock() {
        var result = ShellParser.parse("[[ -f a\n");

        assertTrue(result.isFailure());
        var error = assertInstanceOf(ParseError.UnterminatedBlock.class, result.error());
        assertEquals("]]", error.closer());
    }

    @Test
    void parse_strayWord_reportsInvalidSyntax() {
        var result = ShellParser.parse("[[ a b ]]\n");

        assertTrue(result.isFailure());
        assertInstanceOf(ParseError.InvalidSyntax.class, result.error());
    }

    // === Operators ===

    @Test
    void fromSymbol_escapedComparison_normalized() {
        assertEquals(BinaryOperator.STRING_LESS, BinaryOperator.fromSymbol("\\<").orElseThrow());
        assertTrue(UnaryOperator.fromSymbol("-q").isEmpty());
    }
}
