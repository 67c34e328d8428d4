package org.calc;

import java.util.ArrayList;
import java.util.List;

import org.calc.Expr.Assignment;
import org.calc.Expr.BinaryApplication;
import org.calc.Expr.FunctionCall;
import org.calc.Expr.Literal;
import org.calc.Expr.UnaryApplication;
import org.calc.Expr.VariableRef;

/**
 * Evaluates expression trees against an {@link Environment}. Operands are evaluated left to right.
 */
public final class Evaluator implements Expr.Visitor<Double> {
    private final Environment env;

    public Evaluator(Environment env) { this.env = env; }

    public double evaluate(Expr e) { return e.accept(this); }

    @Override
    public Double visitLiteral(Literal e) { return e.value; }

    @Override
    public Double visitVariableRef(VariableRef e) { return env.lookup(e.name); }

    @Override
    public Double visitUnaryApplication(UnaryApplication e) {
        return e.op.apply(evaluate(e.operand));
    }

    @Override
    public Double visitBinaryApplication(BinaryApplication e) {
        double l = evaluate(e.left);
        double r = evaluate(e.right);
        return e.op.apply(l, r);
    }

    @Override
    public Double visitFunctionCall(FunctionCall e) {
        List<Double> av = new ArrayList<>(e.args.size());
        for (Expr a : e.args) av.add(evaluate(a));
        return e.fn.apply(av);
    }

    @Override
    public Double visitAssignment(Assignment e) {
        double v = evaluate(e.value);
        env.assign(e.name, v);
        return v;
    }
}
