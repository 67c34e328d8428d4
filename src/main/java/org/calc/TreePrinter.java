package org.calc;

import java.math.BigDecimal;

import org.calc.Expr.Assignment;
import org.calc.Expr.BinaryApplication;
import org.calc.Expr.FunctionCall;
import org.calc.Expr.Literal;
import org.calc.Expr.UnaryApplication;
import org.calc.Expr.VariableRef;

/**
 * Renders a tree one node per line, children indented two spaces below their parent:
 * <pre>
 * *
 *   +
 *     2
 *     3
 *   x
 * </pre>
 */
public final class TreePrinter implements Expr.Visitor<Void> {
    private final StringBuilder out;
    private int level;

    private TreePrinter(StringBuilder out, int level) { this.out = out; this.level = level; }

    public static String print(Expr e, int level) {
        if (level < 0) throw new IllegalArgumentException("negative indent level: " + level);
        StringBuilder sb = new StringBuilder();
        e.accept(new TreePrinter(sb, level));
        return sb.toString();
    }

    public static String print(Expr e) { return print(e, 0); }

    /** Plain decimal without trailing zeros: {@code 8000}, {@code 5.3}, {@code -4}. */
    public static String formatNumber(double v) {
        if (Double.isNaN(v) || Double.isInfinite(v)) return Double.toString(v);
        return BigDecimal.valueOf(v).stripTrailingZeros().toPlainString();
    }

    private void line(String label) {
        for (int i = 0; i < level; i++) out.append("  ");
        out.append(label).append('\n');
    }

    private void child(Expr e) {
        level++;
        e.accept(this);
        level--;
    }

    @Override
    public Void visitLiteral(Literal e) { line(formatNumber(e.value)); return null; }

    @Override
    public Void visitVariableRef(VariableRef e) { line(e.name); return null; }

    @Override
    public Void visitUnaryApplication(UnaryApplication e) {
        line(e.op.symbol);
        child(e.operand);
        return null;
    }

    @Override
    public Void visitBinaryApplication(BinaryApplication e) {
        line(e.op.symbol);
        child(e.left);
        child(e.right);
        return null;
    }

    @Override
    public Void visitFunctionCall(FunctionCall e) {
        line(e.fn.name);
        for (Expr a : e.args) child(a);
        return null;
    }

    @Override
    public Void visitAssignment(Assignment e) {
        line(e.name);
        child(e.value);
        return null;
    }
}
