package com.formulasheet.app.formula;

import java.util.Objects;

/**
 * The result of a formula evaluation that could not produce a number,
 * for example a division by zero or a reference to a cell without a numeric value.
 * It is a value, never thrown.
 */
public final class FormulaError {
    private final String reason;

    public FormulaError(String reason) {
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FormulaError)) {
            return false;
        }
        return Objects.equals(reason, ((FormulaError) o).reason);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(reason);
    }

    @Override
    public String toString() {
        return "FormulaError(" + reason + ")";
    }
}
