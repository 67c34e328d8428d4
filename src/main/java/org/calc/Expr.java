package org.calc;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.calc.OperatorRegistry.BinaryOpInfo;
import org.calc.OperatorRegistry.FunctionInfo;
import org.calc.OperatorRegistry.UnaryOpInfo;

/**
 * Expression tree produced by {@link Parser}. The set of node kinds is closed: the constructor is
 * private, so the nested classes below are the only subclasses, and every operation over the tree
 * is a {@link Visitor}. Trees are immutable once built.
 */
public abstract class Expr {

    private Expr() {}

    public interface Visitor<R> {
        R visitLiteral(Literal e);
        R visitVariableRef(VariableRef e);
        R visitUnaryApplication(UnaryApplication e);
        R visitBinaryApplication(BinaryApplication e);
        R visitFunctionCall(FunctionCall e);
        R visitAssignment(Assignment e);
    }

    public abstract <R> R accept(Visitor<R> visitor);

    /** Evaluates against {@code env}; only assignments modify it. */
    public double eval(Environment env) {
        return new Evaluator(env).evaluate(this);
    }

    /** Indented one-node-per-line rendering starting at {@code level}. */
    public String print(int level) {
        return TreePrinter.print(this, level);
    }

    @Override
    public String toString() {
        return print(0);
    }

    // =========================================================
    // Variants
    // =========================================================
    public static final class Literal extends Expr {
        final double value;
        Literal(double value) { this.value = value; }
        public double value() { return value; }
        @Override public <R> R accept(Visitor<R> v) { return v.visitLiteral(this); }
    }

    public static final class VariableRef extends Expr {
        final String name;
        VariableRef(String name) { this.name = name; }
        public String name() { return name; }
        @Override public <R> R accept(Visitor<R> v) { return v.visitVariableRef(this); }
    }

    public static final class UnaryApplication extends Expr {
        final UnaryOpInfo op; final Expr operand;
        UnaryApplication(UnaryOpInfo op, Expr operand) {
            this.op = Objects.requireNonNull(op); this.operand = Objects.requireNonNull(operand);
        }
        public UnaryOpInfo op() { return op; }
        public Expr operand() { return operand; }
        @Override public <R> R accept(Visitor<R> v) { return v.visitUnaryApplication(this); }
    }

    public static final class BinaryApplication extends Expr {
        final BinaryOpInfo op; final Expr left, right;
        BinaryApplication(BinaryOpInfo op, Expr left, Expr right) {
            if (op.isAssignment()) {
                throw new IllegalArgumentException("'" + op.symbol() + "' cannot form a binary application");
            }
            this.op = op; this.left = Objects.requireNonNull(left); this.right = Objects.requireNonNull(right);
        }
        public BinaryOpInfo op() { return op; }
        public Expr left() { return left; }
        public Expr right() { return right; }
        @Override public <R> R accept(Visitor<R> v) { return v.visitBinaryApplication(this); }
    }

    public static final class FunctionCall extends Expr {
        final FunctionInfo fn; final List<Expr> args;
        FunctionCall(FunctionInfo fn, List<Expr> args) {
            this.fn = Objects.requireNonNull(fn);
            this.args = Collections.unmodifiableList(new ArrayList<>(args));
        }
        public FunctionInfo fn() { return fn; }
        public List<Expr> args() { return args; }
        @Override public <R> R accept(Visitor<R> v) { return v.visitFunctionCall(this); }
    }

    public static final class Assignment extends Expr {
        final String name; final Expr value;
        Assignment(String name, Expr value) { this.name = name; this.value = Objects.requireNonNull(value); }
        public String name() { return name; }
        public Expr value() { return value; }
        @Override public <R> R accept(Visitor<R> v) { return v.visitAssignment(this); }
    }
}
