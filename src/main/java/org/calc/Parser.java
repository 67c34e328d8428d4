package org.calc;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

import org.calc.CalcException.ErrorKind;
import org.calc.OperatorRegistry.BinaryOpInfo;
import org.calc.OperatorRegistry.FunctionInfo;
import org.calc.OperatorRegistry.NumericFunction;
import org.calc.OperatorRegistry.UnaryOpInfo;
import org.calc.Scan.Slice;

import static org.calc.Scan.simplifyParens;
import static org.calc.Scan.startsWith;
import static org.calc.Scan.trimWhitespace;
import static org.calc.Scan.validParens;

/**
 * Recursive-descent parser working directly on the expression text, without a token stream.
 * Each candidate substring is tried against the grammar rules in a fixed order; binary operators
 * are found by a precedence scan over the raw characters.
 *
 * <p>Trees hold the registry's descriptors, so a registry must not be altered in ways that
 * invalidate them while trees built from it are in use. Only appending functions is allowed.
 */
public final class Parser {

    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");
    private static final Pattern HEX = Pattern.compile("[+-]?0[xX]([0-9a-fA-F]+(\\.[0-9a-fA-F]*)?|\\.[0-9a-fA-F]+)([pP][+-]?\\d+)?");
    private static final Pattern INFINITY = Pattern.compile("[+-]?(inf|infinity)", Pattern.CASE_INSENSITIVE);
    private static final Pattern NAN = Pattern.compile("[+-]?nan", Pattern.CASE_INSENSITIVE);

    /** One grammar production; returns null when it does not apply. */
    private interface Rule { Expr apply(Slice text); }

    private final OperatorRegistry registry;
    private final List<Rule> rules;

    public Parser() { this(OperatorRegistry.standard()); }

    public Parser(OperatorRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
        // numbers before the binary scan so "-5" stays one literal; binary before unary so "1 - 2" splits
        this.rules = Collections.unmodifiableList(Arrays.<Rule>asList(this::parseNumber,
                this::parseBinaryOrAssignment, this::parseUnary, this::parseFunction, this::parseVariable));
    }

    public OperatorRegistry registry() { return registry; }

    public void registerFunction(String name, NumericFunction fn) { registry.registerFunction(name, fn); }

    /**
     * Parses {@code text}; empty when no grammar rule matches.
     *
     * @throws CalcException INVALID_PARENTHESES if parentheses are unbalanced,
     *         ASSIGNMENT_TO_NON_IDENTIFIER if {@code =} has an expression on its left
     */
    public Optional<Expr> parse(String text) {
        Objects.requireNonNull(text, "text");
        return Optional.ofNullable(parseExpr(new Slice(text)));
    }

    Expr parseExpr(Slice text) {
        if (!validParens(text)) {
            throw new CalcException(ErrorKind.INVALID_PARENTHESES, "unbalanced parentheses in '" + text + "'");
        }
        text = simplifyParens(text);
        for (Rule rule : rules) {
            Expr e = rule.apply(text);
            if (e != null) return e;
        }
        return null;
    }

    // =========================================================
    // Rules
    // =========================================================
    /**
     * Whole text as a floating literal: decimal, hexadecimal with optional binary exponent,
     * {@code inf}/{@code infinity} or {@code nan}, each with an optional sign.
     */
    private Expr parseNumber(Slice text) {
        Double v = parseDouble(text);
        return v == null ? null : new Expr.Literal(v);
    }

    static Double parseDouble(CharSequence text) {
        String s = text.toString();
        if (DECIMAL.matcher(s).matches()) return Double.parseDouble(s);
        if (HEX.matcher(s).matches()) {
            // Double.parseDouble insists on the binary exponent
            boolean hasExponent = s.indexOf('p') >= 0 || s.indexOf('P') >= 0;
            return Double.parseDouble(hasExponent ? s : s + "p0");
        }
        boolean negative = s.startsWith("-");
        if (INFINITY.matcher(s).matches()) return negative ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
        if (NAN.matcher(s).matches()) return Double.NaN;
        return null;
    }

    private Expr parseVariable(Slice text) {
        return isValidVariableName(text) ? new Expr.VariableRef(text.toString()) : null;
    }

    private Expr parseUnary(Slice text) {
        for (UnaryOpInfo op : registry.unaryOperators()) {
            if (startsWith(text, op.symbol)) {
                Expr operand = parseExpr(text.drop(op.symbol.length()));
                if (operand != null) return new Expr.UnaryApplication(op, operand);
            }
        }
        return null;
    }

    private Expr parseBinaryOrAssignment(Slice text) {
        Split split = findBinaryOperator(text);
        if (split == null) return null;

        Expr rhs = parseExpr(text.slice(split.at + split.op.symbol.length(), text.length()));
        if (rhs == null) return null;

        Slice lhsText = trimWhitespace(text.slice(0, split.at));
        if (split.op.isAssignment()) {
            if (isValidVariableName(lhsText)) return new Expr.Assignment(lhsText.toString(), rhs);
            if (parseExpr(lhsText) != null) {
                throw new CalcException(ErrorKind.ASSIGNMENT_TO_NON_IDENTIFIER,
                        "cannot assign to '" + lhsText + "'");
            }
            return null;
        }
        Expr lhs = parseExpr(lhsText);
        return lhs == null ? null : new Expr.BinaryApplication(split.op, lhs, rhs);
    }

    private Expr parseFunction(Slice text) {
        int open = text.indexOf('(');
        if (open < 0 || text.last() != ')') return null;

        FunctionInfo fn = registry.findFunction(trimWhitespace(text.slice(0, open)));
        if (fn == null) return null;

        List<Expr> args = new ArrayList<>();
        Slice rest = simplifyParens(text.slice(open, text.length()));
        while (rest.length() > 0) {
            int comma = topLevelComma(rest);
            Expr arg = parseExpr(rest.slice(0, comma));
            if (arg == null) return null;
            args.add(arg);
            rest = simplifyParens(rest.drop(comma + 1));
        }
        return new Expr.FunctionCall(fn, args);
    }

    // =========================================================
    // Scanning
    // =========================================================
    static final class Split {
        final int at; final BinaryOpInfo op;
        Split(int at, BinaryOpInfo op){ this.at = at; this.op = op; }
    }

    /**
     * Picks the operator occurrence to split {@code text} at: the weakest-binding one at depth 0,
     * never at offset 0. Among equal precedence the rightmost left-associative occurrence wins,
     * or the leftmost right-associative one. Null if there is none.
     */
    Split findBinaryOperator(Slice text) {
        Split best = null;
        int min = Integer.MAX_VALUE;
        int depth = 0;
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (ch == '(') depth++;
            if (ch == ')') depth--;
            if (depth != 0 || i == 0) continue;

            Slice tail = text.slice(i, text.length());
            for (BinaryOpInfo op : registry.binaryOperators()) {
                if (startsWith(tail, op.symbol) && op.bindsWeakerThan(min)) {
                    min = op.precedence;
                    best = new Split(i, op);
                }
            }
        }
        return best;
    }

    /** Offset of the first comma outside parentheses, or the length when there is none. */
    private static int topLevelComma(Slice text) {
        int depth = 0;
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (ch == '(') depth++;
            if (ch == ')') depth--;
            if (ch == ',' && depth == 0) return i;
        }
        return text.length();
    }

    static boolean isValidVariableName(CharSequence text) {
        if (text.length() == 0) return false;
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (!Character.isLetter(ch) && ch != '_') return false;
        }
        return true;
    }
}
