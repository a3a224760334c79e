package com.formulasheet.app.formula;

import com.formulasheet.app.exceptions.FormulaFormatException;
import com.formulasheet.app.models.CellValue;
import com.formulasheet.app.models.ValueType;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for Formula parsing, evaluation, rendering and equality.
 */
class FormulaTest {

    private static final UnaryOperator<String> UPPER = String::toUpperCase;

    private static final Function<String, Double> NO_VARIABLES = name -> {
        throw new IllegalArgumentException("Unknown variable " + name);
    };

    private static double evaluate(String text) {
        CellValue result = new Formula(text).evaluate(NO_VARIABLES);
        assertEquals(ValueType.NUMBER, result.getType(), () -> text + " gave " + result);
        return result.getNumber();
    }

    // ------------------------
    // Evaluation
    // ------------------------

    @Test
    void testPrecedence() {
        assertEquals(7, evaluate("1+2*3"), 1e-9);
        assertEquals(9, evaluate("(1+2)*3"), 1e-9);
        assertEquals(2, evaluate("2*(3+4)/7"), 1e-9);
    }

    /**
     * Subtraction and division read left to right: 10-4-3 is 3, 8/2/2 is 2.
     */
    @Test
    void testOperandOrder() {
        assertEquals(3, evaluate("10-4-3"), 1e-9);
        assertEquals(2, evaluate("8/2/2"), 1e-9);
        assertEquals(2, evaluate("6/(1+2)"), 1e-9);
        assertEquals(-1, evaluate("(2-3)"), 1e-9);
        assertEquals(0.5, evaluate("1 / 2"), 1e-9);
    }

    @Test
    void testDecimalAndExponentLiterals() {
        assertEquals(3.75, evaluate("1.5 + 2.25"), 1e-9);
        assertEquals(2000, evaluate("2e3"), 1e-9);
        assertEquals(0.5, evaluate(".5"), 1e-9);
        assertEquals(5, evaluate("5."), 1e-9);
    }

    @Test
    void testVariablesUseLookup() {
        Map<String, Double> values = Map.of("x", 2.0, "X", 4.0);
        Function<String, Double> lookup = values::get;

        assertEquals(9, new Formula("x+7").evaluate(lookup).getNumber(), 1e-9);
        assertEquals(11, new Formula("x+7", UPPER, s -> true).evaluate(lookup).getNumber(), 1e-9);
    }

    @Test
    void testDivisionByZeroIsAnErrorValue() {
        CellValue result = new Formula("1/0").evaluate(NO_VARIABLES);
        assertTrue(result.isError());
        assertEquals("Cannot divide by zero.", result.getError().getReason());

        assertTrue(new Formula("5/(2-2)").evaluate(NO_VARIABLES).isError());
    }

    @Test
    void testFailedLookupIsAnErrorValue() {
        CellValue result = new Formula("y * 2").evaluate(NO_VARIABLES);
        assertTrue(result.isError());
        assertEquals("Unknown variable y", result.getError().getReason());
    }

    @Test
    void testNullLookupIsAnErrorValue() {
        CellValue result = new Formula("a1 + 1").evaluate(name -> null);
        assertTrue(result.isError());
    }

    // ------------------------
    // Construction errors
    // ------------------------

    @Test
    void testEmptyFormulaRejected() {
        assertThrows(FormulaFormatException.class, () -> new Formula(""));
        assertThrows(FormulaFormatException.class, () -> new Formula("   "));
    }

    @Test
    void testIllegalTokensRejected() {
        assertThrows(FormulaFormatException.class, () -> new Formula("2 $ 3"));
        assertThrows(FormulaFormatException.class, () -> new Formula("a1 % 2"));
        assertThrows(FormulaFormatException.class, () -> new Formula("2^3"));
    }

    @Test
    void testSyntaxRulesRejected() {
        List<String> bad = Arrays.asList(
                "+2",      // first token
                "2+",      // last token
                "2 3",     // number followed by number
                "2x+y3",   // number followed by variable
                "(2",      // unbalanced
                "2)",      // closing without opening
                ")2(",     // closing before opening
                "()",      // empty parentheses
                "(+2)",    // operator after "("
                "2*/3",    // operator after operator
                "x y"      // variable followed by variable
        );
        for (String text : bad) {
            assertThrows(FormulaFormatException.class, () -> new Formula(text), text);
        }
    }

    @Test
    void testValidatorAppliesToNormalizedVariables() {
        // one letter followed by one digit
        Predicate<String> oneLetterOneDigit = s -> s.matches("[A-Z][0-9]");

        assertDoesNotThrow(() -> new Formula("x2+y3", UPPER, oneLetterOneDigit));
        assertThrows(FormulaFormatException.class, () -> new Formula("x+y3", UPPER, oneLetterOneDigit));
        assertThrows(FormulaFormatException.class, () -> new Formula("2x+y3", UPPER, oneLetterOneDigit));
    }

    @Test
    void testNormalizerMustProduceLegalVariables() {
        FormulaFormatException ex = assertThrows(FormulaFormatException.class,
                () -> new Formula("a + b", s -> s + "!", s -> true));
        assertTrue(ex.getMessage().contains("not a legal variable"));
    }

    // ------------------------
    // Variables, rendering, equality
    // ------------------------

    @Test
    void testGetVariables() {
        assertEquals(List.of("X", "Z"), List.copyOf(new Formula("x+X*z", UPPER, s -> true).getVariables()));
        assertEquals(List.of("x", "X", "z"), List.copyOf(new Formula("x+X*z").getVariables()));
        assertEquals(List.of("a"), List.copyOf(new Formula("a+a*a").getVariables()));
        assertTrue(new Formula("1+2").getVariables().isEmpty());
    }

    @Test
    void testToString() {
        assertEquals("X+Y", new Formula("x + y", UPPER, s -> true).toString());
        assertEquals("x+Y", new Formula("x + Y").toString());
        assertEquals("2+x7", new Formula("2.0 + x7").toString());
        assertEquals("(A1-0.5)/3", new Formula(" ( A1 - 0.50 ) / 3.0 ").toString());
    }

    @Test
    void testEquality() {
        assertEquals(new Formula("x1+y2", UPPER, s -> true), new Formula("X1  +  Y2"));
        assertNotEquals(new Formula("x1+y2"), new Formula("X1+Y2"));
        assertNotEquals(new Formula("x1+y2"), new Formula("y2+x1"));
        assertEquals(new Formula("2.0 + x7"), new Formula("2.000 + x7"));
        assertEquals(new Formula("2.0 + x7").hashCode(), new Formula("2.000 + x7").hashCode());
        assertNotEquals(new Formula("1+2"), new Formula("1+2+3"));
        assertNotEquals(new Formula("1+2"), "1+2");
    }

    @Test
    void testOverflowingLiteralsAreEqualWithEqualHashes() {
        Formula a = new Formula("1e400 + x");
        Formula b = new Formula("2e400 + x");

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertEquals(new Formula("0.5*y").hashCode(), new Formula("0.50 * y").hashCode());
        assertNotEquals(new Formula("1e400 + x"), new Formula("1e300 + x"));
    }

    @Test
    void testToStringRoundTrip() {
        List<String> texts = Arrays.asList("1+2*3", "(a1 - 2.50) / b_2", "2e3 * x", "((1))", "0.125+_x");
        for (String text : texts) {
            Formula formula = new Formula(text);
            assertEquals(formula, new Formula(formula.toString()), text);
        }
    }

    @Test
    void testFormatNumber() {
        assertEquals("2", Formula.formatNumber(2.0));
        assertEquals("-15", Formula.formatNumber(-15.0));
        assertEquals("2.5", Formula.formatNumber(2.5));
    }
}
