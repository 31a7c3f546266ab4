package io.dynaform.core.model;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Comparison operators accepted in criteria text. An empty symbol means {@link #EQUALS}; any symbol
 * not listed here maps to {@link #STRICT_EQUALS}.
 */
public enum CriteriaOperator {
    EQUALS("="),
    DOUBLE_EQUALS("=="),
    NOT_EQUALS("!="),
    GREATER_THAN(">"),
    GREATER_OR_EQUAL(">="),
    LESS_THAN("<"),
    LESS_OR_EQUAL("<="),
    CONTAINS("~"),
    /** Case-sensitive equality, used for unrecognized operator symbols. */
    STRICT_EQUALS(null);

    private static final Map<String, CriteriaOperator> BY_SYMBOL = Arrays.stream(values())
            .filter(op -> op.symbol != null)
            .collect(Collectors.toUnmodifiableMap(op -> op.symbol, Function.identity()));

    private final String symbol;

    CriteriaOperator(String symbol) {
        this.symbol = symbol;
    }

    /** The canonical symbol, or {@code null} for {@link #STRICT_EQUALS}. */
    public String symbol() {
        return symbol;
    }

    /** Whether both operands are coerced to numbers before comparing. */
    public boolean isNumeric() {
        return this == GREATER_THAN || this == GREATER_OR_EQUAL || this == LESS_THAN || this == LESS_OR_EQUAL;
    }

    /**
     * Resolves an operator symbol as written in criteria text.
     *
     * @param symbol the raw symbol, may be {@code null} or empty
     * @return the matching operator; {@link #EQUALS} for empty input, {@link #STRICT_EQUALS} for an
     *     unknown symbol
     */
    public static CriteriaOperator fromSymbol(String symbol) {
        if (symbol == null || symbol.isEmpty()) {
            return EQUALS;
        }
        return BY_SYMBOL.getOrDefault(symbol, STRICT_EQUALS);
    }
}
