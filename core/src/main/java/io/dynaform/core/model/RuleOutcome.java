package io.dynaform.core.model;

/**
 * Result of evaluating a single criteria atom.
 *
 * @param satisfied whether the atom holds
 * @param detail    explanation, always present so callers can say why something is hidden
 */
public record RuleOutcome(boolean satisfied, String detail) {

    public static RuleOutcome pass(String detail) {
        return new RuleOutcome(true, detail);
    }

    public static RuleOutcome fail(String detail) {
        return new RuleOutcome(false, detail);
    }
}
