package com.formulasheet.app.formula;

import com.formulasheet.app.exceptions.FormulaFormatException;
import com.formulasheet.app.models.CellValue;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * An infix arithmetic formula such as "A1 * (B2 + 3.5)".
 * <p>
 * Allowed symbols are non-negative double literals (no unary sign), variables made of a letter
 * or underscore followed by letters, digits or underscores, parentheses, and the operators
 * + - * /. Whitespace only separates tokens: "xy" is one variable, "x y" is two.
 * <p>
 * Every variable goes through a normalizer (for example upper-casing) and must then satisfy a
 * validator (for example "is inside the grid"). A Formula that was constructed is always
 * syntactically valid; evaluating it can still produce an error value.
 */
public final class Formula {

    private static final Pattern TOKEN_PATTERN = Pattern.compile(
            "\\(|\\)|[+\\-*/]|[a-zA-Z_][a-zA-Z0-9_]*|(?:\\d+\\.\\d*|\\d*\\.\\d+|\\d+)(?:[eE][+-]?\\d+)?");
    private static final Pattern VARIABLE_PATTERN = Pattern.compile("[a-zA-Z_][a-zA-Z0-9_]*");
    private static final Pattern NUMBER_PATTERN = Pattern.compile(
            "(?:\\d+\\.\\d*|\\d*\\.\\d+|\\d+)(?:[eE][+-]?\\d+)?");

    // Normalized tokens in their original order
    private final List<String> tokens;
    private final Set<String> variables;

    /**
     * Creates a formula with the identity normalizer and a validator that accepts every variable.
     */
    public Formula(String formula) {
        this(formula, s -> s, s -> true);
    }

    /**
     * Creates a formula from infix text.
     * <p>
     * Throws {@link FormulaFormatException} if the text is empty, contains a symbol that is not a
     * legal token, contains a variable v such that normalize(v) is not a legal variable or
     * isValid(normalize(v)) is false, or breaks one of the syntax rules.
     */
    public Formula(String formula, UnaryOperator<String> normalize, Predicate<String> isValid) {
        if (formula == null || formula.isBlank()) {
            throw new FormulaFormatException("Formula cannot be empty.");
        }

        List<String> parsed = new ArrayList<>();
        for (String token : tokenize(formula)) {
            if (isVariable(token)) {
                String normalized = normalize.apply(token);
                if (normalized == null || !isVariable(normalized)) {
                    throw new FormulaFormatException("Variable " + token + " normalizes to " + normalized
                            + ", which is not a legal variable.");
                }
                if (!isValid.test(normalized)) {
                    throw new FormulaFormatException("Variable " + normalized + " is not valid in this spreadsheet.");
                }
                parsed.add(normalized);
            } else {
                parsed.add(token);
            }
        }
        checkSyntax(parsed);

        this.tokens = Collections.unmodifiableList(parsed);
        Set<String> found = new LinkedHashSet<>();
        for (String token : parsed) {
            if (isVariable(token)) {
                found.add(token);
            }
        }
        this.variables = Collections.unmodifiableSet(found);
    }

    /**
     * Evaluates this formula, resolving every variable through {@code lookup}.
     * <p>
     * Never throws: if the lookup fails for a variable, the result is an error value carrying the
     * lookup's message; a division by zero gives an error value as well. Otherwise the result is
     * a NUMBER value.
     */
    public CellValue evaluate(Function<String, Double> lookup) {
        Deque<Double> values = new ArrayDeque<>();
        Deque<String> operators = new ArrayDeque<>();

        try {
            for (String token : tokens) {
                if (isNumber(token) || isVariable(token)) {
                    double value = isNumber(token) ? Double.parseDouble(token) : lookupVariable(token, lookup);
                    if (isOnTop(operators, "*") || isOnTop(operators, "/")) {
                        values.push(calculate(value, values.pop(), operators.pop()));
                    } else {
                        values.push(value);
                    }
                } else if (token.equals("+") || token.equals("-")) {
                    if (isOnTop(operators, "+") || isOnTop(operators, "-")) {
                        values.push(calculate(values.pop(), values.pop(), operators.pop()));
                    }
                    operators.push(token);
                } else if (token.equals(")")) {
                    if (isOnTop(operators, "+") || isOnTop(operators, "-")) {
                        values.push(calculate(values.pop(), values.pop(), operators.pop()));
                    }
                    // the matching "("
                    operators.pop();
                    if (isOnTop(operators, "*") || isOnTop(operators, "/")) {
                        values.push(calculate(values.pop(), values.pop(), operators.pop()));
                    }
                } else {
                    // "*", "/" or "("
                    operators.push(token);
                }
            }

            while (!operators.isEmpty()) {
                values.push(calculate(values.pop(), values.pop(), operators.pop()));
            }
            return CellValue.number(values.pop());
        } catch (EvaluationException e) {
            return CellValue.error(e.getMessage());
        }
    }

    /**
     * The distinct normalized variables of this formula, in order of first appearance.
     * For example "x+X*z" normalized by upper-casing gives X and Z.
     */
    public Set<String> getVariables() {
        return variables;
    }

    /**
     * The formula without whitespace, variables normalized and numbers in canonical form.
     * Passing it back to the constructor gives an equal formula.
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (String token : tokens) {
            if (isNumber(token)) {
                double value = Double.parseDouble(token);
                sb.append(Double.isFinite(value) ? formatNumber(value) : token);
            } else {
                sb.append(token);
            }
        }
        return sb.toString();
    }

    /**
     * Two formulas are equal when they have the same tokens in the same order.
     * Numbers compare by value ("2.0" equals "2.000"); everything else compares as text.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Formula)) {
            return false;
        }
        List<String> other = ((Formula) o).tokens;
        if (tokens.size() != other.size()) {
            return false;
        }
        for (int i = 0; i < tokens.size(); i++) {
            String mine = tokens.get(i);
            String theirs = other.get(i);
            if (isNumber(mine) && isNumber(theirs)) {
                if (Double.parseDouble(mine) != Double.parseDouble(theirs)) {
                    return false;
                }
            } else if (!mine.equals(theirs)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Hashes the same view {@link #equals} compares: numbers by value, other tokens as text.
     */
    @Override
    public int hashCode() {
        int hash = 1;
        for (String token : tokens) {
            int tokenHash = isNumber(token) ? Double.hashCode(Double.parseDouble(token)) : token.hashCode();
            hash = 31 * hash + tokenHash;
        }
        return hash;
    }

    /**
     * Renders a number the way cells and formulas display it:
     * integral values without a fractional part, everything else via {@link Double#toString}.
     */
    public static String formatNumber(double number) {
        if (number == Math.rint(number) && !Double.isInfinite(number) && Math.abs(number) < 1e15) {
            return Long.toString((long) number);
        }
        return Double.toString(number);
    }

    /**
     * Whether {@code token} is a legal variable: a letter or underscore
     * followed by letters, digits or underscores.
     */
    public static boolean isVariable(String token) {
        return VARIABLE_PATTERN.matcher(token).matches();
    }

    // ----------------------------------------------------------------
    // Internal Helpers
    // ----------------------------------------------------------------

    private static List<String> tokenize(String formula) {
        List<String> result = new ArrayList<>();
        Matcher matcher = TOKEN_PATTERN.matcher(formula);
        int end = 0;
        while (matcher.find()) {
            rejectIllegalText(formula.substring(end, matcher.start()));
            result.add(matcher.group());
            end = matcher.end();
        }
        rejectIllegalText(formula.substring(end));
        return result;
    }

    // Anything between two tokens must be whitespace
    private static void rejectIllegalText(String between) {
        String stripped = between.strip();
        if (!stripped.isEmpty()) {
            throw new FormulaFormatException("Formula contains an illegal token: '" + stripped + "'.");
        }
    }

    private static void checkSyntax(List<String> tokens) {
        String first = tokens.get(0);
        if (!isOperand(first) && !first.equals("(")) {
            throw new FormulaFormatException("The first token of a formula must be a number, a variable, "
                    + "or an opening parenthesis.");
        }
        String last = tokens.get(tokens.size() - 1);
        if (!isOperand(last) && !last.equals(")")) {
            throw new FormulaFormatException("The last token of a formula must be a number, a variable, "
                    + "or a closing parenthesis.");
        }

        int open = 0;
        int close = 0;
        for (int i = 0; i < tokens.size(); i++) {
            String token = tokens.get(i);
            if (token.equals("(")) {
                open++;
            } else if (token.equals(")")) {
                close++;
                if (close > open) {
                    throw new FormulaFormatException("A closing parenthesis at token " + i
                            + " has no matching opening parenthesis.");
                }
            }

            if (i + 1 == tokens.size()) {
                break;
            }
            String next = tokens.get(i + 1);
            if ((isOperator(token) || token.equals("(")) && !(isOperand(next) || next.equals("("))) {
                throw new FormulaFormatException("A token that follows an operator or opening parenthesis must be "
                        + "a number, a variable, or an opening parenthesis (found '" + next + "').");
            }
            if ((isOperand(token) || token.equals(")")) && !(isOperator(next) || next.equals(")"))) {
                throw new FormulaFormatException("A number, variable, or closing parenthesis must be followed by "
                        + "an operator or a closing parenthesis (found '" + next + "').");
            }
        }

        if (open != close) {
            throw new FormulaFormatException("Parenthesis mismatch: " + open + " opening and "
                    + close + " closing.");
        }
    }

    private static boolean isNumber(String token) {
        return NUMBER_PATTERN.matcher(token).matches();
    }

    private static boolean isOperand(String token) {
        return isNumber(token) || isVariable(token);
    }

    private static boolean isOperator(String token) {
        return token.equals("+") || token.equals("-") || token.equals("*") || token.equals("/");
    }

    private static boolean isOnTop(Deque<String> operators, String op) {
        return op.equals(operators.peek());
    }

    private static double lookupVariable(String name, Function<String, Double> lookup) {
        Double value;
        try {
            value = lookup.apply(name);
        } catch (RuntimeException e) {
            String message = e.getMessage() != null ? e.getMessage() : "Could not look up " + name + ".";
            throw new EvaluationException(message);
        }
        if (value == null) {
            throw new EvaluationException("Variable " + name + " has no value.");
        }
        return value;
    }

    /**
     * {@code left} is the value read most recently, {@code right} the one popped from the stack,
     * so "-" and "/" compute right op left.
     */
    private static double calculate(double left, double right, String op) {
        switch (op) {
            case "-":
                return right - left;
            case "*":
                return left * right;
            case "/":
                if (left == 0) {
                    throw new EvaluationException("Cannot divide by zero.");
                }
                return right / left;
            case "+":
                return left + right;
            default:
                throw new IllegalStateException("Unknown operator " + op);
        }
    }

    // Carries an evaluation failure out of the stack loop; never leaves evaluate()
    private static final class EvaluationException extends RuntimeException {
        EvaluationException(String message) {
            super(message);
        }
    }
}
