package org.calc;

import java.util.Optional;

import org.calc.CalcException.ErrorKind;
import org.calc.Scan.Slice;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ParserTest {

    private final Parser parser = new Parser();

    private Expr parse(String text) {
        Optional<Expr> e = parser.parse(text);
        assertTrue(e.isPresent(), "cannot parse '" + text + "'");
        return e.get();
    }

    private double eval(String text) {
        return parse(text).eval(new Environment());
    }

    private int splitAt(String text) {
        Parser.Split s = parser.findBinaryOperator(new Slice(text));
        return s == null ? -1 : s.at;
    }

    @Test
    void emptyAndBlankInputHaveNoMatch() {
        assertFalse(parser.parse("").isPresent());
        assertFalse(parser.parse("    ").isPresent());
    }

    @Test
    void unbalancedParenthesesAbortTheParse() {
        CalcException e = assertThrows(CalcException.class, () -> parser.parse("()("));
        assertEquals(ErrorKind.INVALID_PARENTHESES, e.kind());
        assertThrows(CalcException.class, () -> parser.parse(")1 + 2("));
        assertThrows(CalcException.class, () -> parser.parse("max(1, 2"));
    }

    @Test
    void binaryOperators() {
        assertEquals(5.3, eval("2.1 + 3.2"), 1e-12);
        assertEquals(-1.1, eval("2.1 - 3.2"), 1e-12);
        assertEquals(6.72, eval("2.1 * 3.2"), 1e-12);
        assertEquals(3.0, eval("6.3 / 2.1"), 1e-12);
    }

    @Test
    void operatorPrecedence() {
        assertEquals(9.0, eval("(2 + 3) * (3 - 1) - 1"));
        assertEquals(4.0, eval("+(1 + 3)"));
        assertEquals(-4.0, eval("-(1 + 3)"));
        assertEquals(7.0, eval("1 + 2 * 3"));
    }

    @Test
    void exponentBindsWeakerThanMultiplication() {
        assertEquals(8000.0, eval("2 * 10 ^ 3"));
        assertEquals(8000.0, eval("(2 * 10) ^ 3"));
        assertEquals(2000.0, eval("2 * (10 ^ 3)"));
    }

    @Test
    void leftAssociativeOperatorsGroupLeftToRight() {
        assertEquals(3.0, eval("8 - 3 - 2"));
        assertEquals(2.0, eval("16 / 4 / 2"));
        assertEquals(1.0, eval("1 - 2 + 2"));
        assertEquals(6, splitAt("1 + 2 + 3"));
    }

    @Test
    void comparisonsGroupLeftToRight() {
        assertEquals(1.0, eval("1 < 2 < 3"));
        assertEquals(0.0, eval("3 > 2 > 1"));
        assertEquals(6, splitAt("3 > 2 > 1"));
        Expr.BinaryApplication top = (Expr.BinaryApplication) parse("3 > 2 > 1");
        assertTrue(top.left() instanceof Expr.BinaryApplication);
        assertTrue(top.right() instanceof Expr.Literal);
    }

    @Test
    void rightAssociativeOperatorsGroupRightToLeft() {
        assertEquals(512.0, eval("2 ^ 3 ^ 2"));
        assertEquals(2, splitAt("2 ^ 3 ^ 2"));
        Expr.BinaryApplication top = (Expr.BinaryApplication) parse("2 ^ 3 ^ 2");
        assertTrue(top.left() instanceof Expr.Literal);
        assertTrue(top.right() instanceof Expr.BinaryApplication);
    }

    @Test
    void scanSkipsOffsetZeroAndNestedOperators() {
        assertEquals(-1, splitAt("-5"));
        assertEquals(-1, splitAt("(1 + 2)"));
        assertEquals(3, splitAt("-1 + 2"));
        assertEquals(8, splitAt("(1 + 2) * 3"));
    }

    @Test
    void signedNumberIsOneLiteral() {
        Expr e = parse("-5");
        assertTrue(e instanceof Expr.Literal);
        assertEquals(-5.0, ((Expr.Literal) e).value());
        assertTrue(parse("+2.5e2") instanceof Expr.Literal);
        assertEquals(250.0, eval("+2.5e2"));
        assertEquals(0.5, eval(".5"));
    }

    @Test
    void infinityAndNanAreLiterals() {
        for (String text : new String[] { "inf", "INF", "+Infinity", "-inf", "nan", "-NaN" }) {
            assertTrue(parse(text) instanceof Expr.Literal, text);
        }
        assertEquals(Double.POSITIVE_INFINITY, eval("inf"));
        assertEquals(Double.POSITIVE_INFINITY, eval("+Infinity"));
        assertEquals(Double.NEGATIVE_INFINITY, eval("-inf"));
        assertTrue(Double.isNaN(eval("-nan")));
        assertEquals(0.0, eval("1 / inf"));
        assertTrue(parse("infinit") instanceof Expr.VariableRef);
        assertFalse(parser.parse("nan1").isPresent());
    }

    @Test
    void hexadecimalLiterals() {
        assertTrue(parse("0x10") instanceof Expr.Literal);
        assertEquals(16.0, eval("0x10"));
        assertEquals(-255.0, eval("-0XfF"));
        assertEquals(3.0, eval("0x1.8p1"));
        assertEquals(0.5, eval("0x.8"));
        assertEquals(26.0, eval("0x1A + 0"));
        assertFalse(parser.parse("0x").isPresent());
        assertFalse(parser.parse("0x1g").isPresent());
    }

    @Test
    void spacedSignIsUnaryApplication() {
        Expr e = parse("- 5");
        assertTrue(e instanceof Expr.UnaryApplication);
        assertEquals(-5.0, e.eval(new Environment()));
    }

    @Test
    void numberMustConsumeWholeText() {
        assertFalse(parser.parse("1e").isPresent());
        assertFalse(parser.parse("12abc").isPresent());
        assertFalse(parser.parse("1 2").isPresent());
    }

    @Test
    void subtractionIsBinaryNotUnary() {
        assertTrue(parse("1 - 2") instanceof Expr.BinaryApplication);
    }

    @Test
    void redundantParenthesesAreDropped() {
        assertTrue(parse("((7))") instanceof Expr.Literal);
        assertEquals(3.0, eval("((1 + 2))"));
        assertEquals(7.0, eval("  7  "));
    }

    @Test
    void variables() {
        assertTrue(parse("foo_bar") instanceof Expr.VariableRef);
        assertFalse(parser.parse("x1").isPresent());
        assertFalse(parser.parse("foo bar").isPresent());
    }

    @Test
    void functionCalls() {
        assertEquals(6.0, eval("sum(1, 2, 3)"));
        assertEquals(0.0, eval("sum()"));
        assertEquals(2.0, eval("max((1), 2)"));
        assertEquals(-1.0, eval("min(4, -1, 2)"));
        assertEquals(4.0, eval("sqrt(16)"));
        assertEquals(5.0, eval("max(sqrt(16), sum(1, (2 + 2)), 3)"));
        assertEquals(1.0, eval("cos(0)"));
        assertEquals(-3.0, eval("-sqrt(9)"));
        assertEquals(14.0, eval("2 * max(3, 7)"));
    }

    @Test
    void functionCallNeedsKnownNameAndParsableArguments() {
        assertFalse(parser.parse("unknown(1)").isPresent());
        assertFalse(parser.parse("max(1,,2)").isPresent());
        assertFalse(parser.parse("max(1, 2) 3").isPresent());
    }

    @Test
    void functionArityIsCheckedWhenEvaluated() {
        Expr e = parse("sin()");
        CalcException ex = assertThrows(CalcException.class, () -> e.eval(new Environment()));
        assertEquals(ErrorKind.ARITY_ERROR, ex.kind());
    }

    @Test
    void registeredFunctionsAreAvailableAfterConstruction() {
        assertFalse(parser.parse("twice(4)").isPresent());
        parser.registerFunction("twice", a -> 2 * a.get(0));
        assertEquals(8.0, eval("twice(4)"));
    }

    @Test
    void earlierRegistrationShadowsLater() {
        parser.registerFunction("sum", a -> -1.0);
        assertEquals(3.0, eval("sum(1, 2)"));
    }

    @Test
    void assignmentRoundTrip() {
        Environment env = new Environment();
        Expr assign = parse("x = 5");
        assertTrue(assign instanceof Expr.Assignment);
        assertEquals(5.0, assign.eval(env));
        assertEquals(5.0, parse("x").eval(env));
        assertEquals(11.0, parse("x = x * 2 + 1").eval(env));
        assertEquals(11.0, env.lookup("x"));
    }

    @Test
    void assignmentToExpressionIsRejected() {
        CalcException e = assertThrows(CalcException.class, () -> parser.parse("2 * x = 3"));
        assertEquals(ErrorKind.ASSIGNMENT_TO_NON_IDENTIFIER, e.kind());
        e = assertThrows(CalcException.class, () -> parser.parse("x = y = 3"));
        assertEquals(ErrorKind.ASSIGNMENT_TO_NON_IDENTIFIER, e.kind());
    }

    @Test
    void assignmentWithoutRightHandSideHasNoMatch() {
        assertFalse(parser.parse("x =").isPresent());
    }

    @Test
    void comparisons() {
        assertEquals(1.0, eval("1 < 2"));
        assertEquals(0.0, eval("3 < 2"));
        assertEquals(1.0, eval("2 > 1"));
        assertEquals(1.0, eval("1 + 1 > 1"));
    }

    @Test
    void comparisonsContainingEqualsSignSplitAtAssignment() {
        // '=' (precedence 5) is found inside '==' and '<=' and wins the scan
        assertFalse(parser.parse("1 == 1").isPresent());
        assertFalse(parser.parse("1 <= 2").isPresent());
        assertEquals(1.0, eval("(1 < 2)"));
    }
}
