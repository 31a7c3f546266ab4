package io.dynaform.core.model;

import java.util.List;

/**
 * Result of parsing one criteria string: the atoms that matched the grammar, implicitly AND-ed,
 * plus a diagnostic for every fragment that was dropped.
 *
 * @param rules       parsed atoms in source order; empty means "always visible"
 * @param diagnostics one message per dropped fragment
 */
public record ParsedCriteria(List<CriteriaRule> rules, List<String> diagnostics) {

    private static final ParsedCriteria NONE = new ParsedCriteria(List.of(), List.of());

    public ParsedCriteria {
        rules = List.copyOf(rules);
        diagnostics = List.copyOf(diagnostics);
    }

    /** No criteria at all (absent or blank text). */
    public static ParsedCriteria none() {
        return NONE;
    }

    /** {@code true} if no atom survived parsing. */
    public boolean isEmpty() {
        return rules.isEmpty();
    }
}
