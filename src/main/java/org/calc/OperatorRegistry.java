package org.calc;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.DoubleBinaryOperator;
import java.util.function.DoubleUnaryOperator;

import org.calc.CalcException.ErrorKind;

/**
 * Tables of unary operators, binary operators and named functions the parser resolves against.
 * Operator tables are fixed at construction; functions may be appended with {@link #registerFunction}.
 * Table order is significant: lookups scan front to back and the first match wins.
 */
public final class OperatorRegistry {

    public enum Assoc { LEFT, RIGHT }

    @FunctionalInterface
    public interface NumericFunction { double apply(List<Double> args); }

    // =========================================================
    // Descriptors
    // =========================================================
    public static final class UnaryOpInfo {
        final String symbol; final DoubleUnaryOperator fn;
        UnaryOpInfo(String symbol, DoubleUnaryOperator fn){ this.symbol = symbol; this.fn = fn; }
        public String symbol(){ return symbol; }
        double apply(double x){ return fn.applyAsDouble(x); }
        public String toString(){ return "unary " + symbol; }
    }

    public static final class BinaryOpInfo {
        final String symbol; final int precedence; final Assoc assoc;
        final DoubleBinaryOperator fn; // null marks assignment

        BinaryOpInfo(String symbol, int precedence, Assoc assoc, DoubleBinaryOperator fn){
            this.symbol = symbol; this.precedence = precedence; this.assoc = assoc; this.fn = fn;
        }
        public String symbol(){ return symbol; }
        public int precedence(){ return precedence; }
        public Assoc assoc(){ return assoc; }
        public boolean isAssignment(){ return fn == null; }

        /**
         * Whether an occurrence of this operator should replace the current best split whose
         * precedence is {@code min}. Ties go to the later occurrence only when left-associative.
         */
        boolean bindsWeakerThan(int min){
            return assoc == Assoc.LEFT ? precedence <= min : precedence < min;
        }

        double apply(double l, double r){
            if (fn == null) throw new IllegalStateException("'" + symbol + "' has no binary function");
            return fn.applyAsDouble(l, r);
        }
        public String toString(){ return "binary " + symbol + " (" + precedence + ", " + assoc + ")"; }
    }

    public static final class FunctionInfo {
        final String name; final NumericFunction fn;
        FunctionInfo(String name, NumericFunction fn){ this.name = name; this.fn = fn; }
        public String name(){ return name; }
        double apply(List<Double> args){ return fn.apply(args); }
        public String toString(){ return "function " + name; }
    }

    // =========================================================
    // Tables
    // =========================================================
    private final List<UnaryOpInfo> unaryOps;
    private final List<BinaryOpInfo> binaryOps;
    private final List<FunctionInfo> functions = new ArrayList<>();

    private OperatorRegistry(List<UnaryOpInfo> unaryOps, List<BinaryOpInfo> binaryOps){
        this.unaryOps = Collections.unmodifiableList(unaryOps);
        this.binaryOps = Collections.unmodifiableList(binaryOps);
    }

    /** Registry with the standard operators and functions. */
    public static OperatorRegistry standard(){
        List<BinaryOpInfo> bin = new ArrayList<>();
        bin.add(new BinaryOpInfo("==", 10, Assoc.LEFT, (a, b) -> truth(a == b)));
        bin.add(new BinaryOpInfo("!=", 10, Assoc.LEFT, (a, b) -> truth(a != b)));
        bin.add(new BinaryOpInfo("<",  10, Assoc.LEFT, (a, b) -> truth(a < b)));
        bin.add(new BinaryOpInfo("<=", 10, Assoc.LEFT, (a, b) -> truth(a <= b)));
        bin.add(new BinaryOpInfo(">",  10, Assoc.LEFT, (a, b) -> truth(a > b)));
        bin.add(new BinaryOpInfo(">=", 10, Assoc.LEFT, (a, b) -> truth(a >= b)));

        bin.add(new BinaryOpInfo("+", 20, Assoc.LEFT, (a, b) -> a + b));
        bin.add(new BinaryOpInfo("-", 20, Assoc.LEFT, (a, b) -> a - b));
        bin.add(new BinaryOpInfo("*", 40, Assoc.LEFT, (a, b) -> a * b));
        bin.add(new BinaryOpInfo("/", 40, Assoc.LEFT, (a, b) -> a / b));
        // weaker than * and /: 2 * 10 ^ 3 is (2 * 10) ^ 3
        bin.add(new BinaryOpInfo("^", 30, Assoc.RIGHT, Math::pow));

        bin.add(new BinaryOpInfo("=", 5, Assoc.LEFT, null));

        List<UnaryOpInfo> un = new ArrayList<>();
        un.add(new UnaryOpInfo("+", x -> x));
        un.add(new UnaryOpInfo("-", x -> -x));

        OperatorRegistry r = new OperatorRegistry(un, bin);
        StandardFunctions.registerAll(r);
        return r;
    }

    private static double truth(boolean b){ return b ? 1.0 : 0.0; }

    /** Appends a function. Names are not deduplicated; an earlier registration shadows later ones. */
    public void registerFunction(String name, NumericFunction fn){
        functions.add(new FunctionInfo(Objects.requireNonNull(name, "name"), Objects.requireNonNull(fn, "fn")));
    }

    public List<UnaryOpInfo> unaryOperators(){ return unaryOps; }
    public List<BinaryOpInfo> binaryOperators(){ return binaryOps; }
    public List<FunctionInfo> functions(){ return Collections.unmodifiableList(functions); }

    /** First function registered under {@code name}, or null. */
    FunctionInfo findFunction(CharSequence name){
        String n = name.toString();
        for (FunctionInfo f : functions) if (f.name.equals(n)) return f;
        return null;
    }

    // =========================================================
    // Standard functions
    // =========================================================
    static final class StandardFunctions {
        private StandardFunctions(){}

        static void registerAll(OperatorRegistry r){
            r.registerFunction("sum", a -> {
                double acc = 0.0;
                for (double v : a) acc += v;
                return acc;
            });
            r.registerFunction("sin", a -> Math.sin(arg("sin", a, 0)));
            r.registerFunction("cos", a -> Math.cos(arg("cos", a, 0)));
            r.registerFunction("max", a -> {
                double m = arg("max", a, 0);
                for (double v : a) m = Math.max(m, v);
                return m;
            });
            r.registerFunction("min", a -> {
                double m = arg("min", a, 0);
                for (double v : a) m = Math.min(m, v);
                return m;
            });
            r.registerFunction("sqrt", a -> Math.sqrt(arg("sqrt", a, 0)));
        }

        /** Argument at {@code index}; fails with ARITY_ERROR when fewer were supplied. */
        static double arg(String name, List<Double> a, int index){
            if (index >= a.size()) {
                throw new CalcException(ErrorKind.ARITY_ERROR,
                        "'" + name + "' reads argument " + (index + 1) + " but got " + a.size());
            }
            return a.get(index);
        }
    }
}
