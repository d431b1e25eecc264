package org.pragmatica.purify.shell;

import org.pragmatica.purify.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * Shell arithmetic expressions, as found in {@code $((...))} and {@code ((...))}.
 */
public sealed interface ArithExpr {
    SourceSpan span();

    /**
     * Numeric literal as written (decimal, {@code 0x..}, or {@code base#digits}).
     */
    record Number(String literal, SourceSpan span) implements ArithExpr {}

    /**
     * Variable reference, written bare or with a leading {@code $}.
     */
    record Variable(String name, boolean dollar, SourceSpan span) implements ArithExpr {}

    record Unary(String operator, ArithExpr operand, SourceSpan span) implements ArithExpr {}

    record Binary(String operator, ArithExpr left, ArithExpr right, SourceSpan span) implements ArithExpr {}

    record Ternary(ArithExpr condition, ArithExpr whenTrue, ArithExpr whenFalse, SourceSpan span) implements ArithExpr {}

    record Assign(String name, String operator, ArithExpr value, SourceSpan span) implements ArithExpr {}

    record Increment(String name, String operator, boolean prefix, SourceSpan span) implements ArithExpr {}

    record Group(ArithExpr inner, SourceSpan span) implements ArithExpr {}

    /**
     * Names of all variables read or written by this expression, in source order.
     */
    default List<String> variables() {
        var names = new ArrayList<String>();
        collectVariables(this, names);
        return names;
    }

    private static void collectVariables(ArithExpr expr, List<String> names) {
        if (expr instanceof Variable variable) {
            names.add(variable.name());
        } else if (expr instanceof Unary unary) {
            collectVariables(unary.operand(), names);
        } else if (expr instanceof Binary binary) {
            collectVariables(binary.left(), names);
            collectVariables(binary.right(), names);
        } else if (expr instanceof Ternary ternary) {
            collectVariables(ternary.condition(), names);
            collectVariables(ternary.whenTrue(), names);
            collectVariables(ternary.whenFalse(), names);
        } else if (expr instanceof Assign assign) {
            names.add(assign.name());
            collectVariables(assign.value(), names);
        } else if (expr instanceof Increment increment) {
            names.add(increment.name());
        } else if (expr instanceof Group group) {
            collectVariables(group.inner(), names);
        }
    }
}
