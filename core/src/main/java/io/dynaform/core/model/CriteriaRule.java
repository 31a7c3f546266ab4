package io.dynaform.core.model;

import java.util.Objects;

/**
 * One parsed criteria atom: a target field, an operator and the expected literal.
 *
 * @param target   the field whose value is compared
 * @param symbol   the operator symbol as written, {@code "="} when the text had none
 * @param operator the resolved operator
 * @param expected the expected literal with one layer of matching quotes removed
 */
public record CriteriaRule(RuleTarget target, String symbol, CriteriaOperator operator, String expected) {

    public CriteriaRule {
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(symbol, "symbol must not be null");
        Objects.requireNonNull(operator, "operator must not be null");
        Objects.requireNonNull(expected, "expected must not be null");
    }

    /** Creates a rule, resolving the operator from its symbol. Empty symbols become {@code "="}. */
    public static CriteriaRule of(RuleTarget target, String symbol, String expected) {
        String normalized = symbol == null || symbol.isEmpty() ? "=" : symbol;
        return new CriteriaRule(target, normalized, CriteriaOperator.fromSymbol(normalized), expected);
    }

    @Override
    public String toString() {
        return target.describe() + "{" + symbol + expected + "}";
    }
}
