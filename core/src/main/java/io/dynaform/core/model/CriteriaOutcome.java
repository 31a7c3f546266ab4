package io.dynaform.core.model;

import java.util.List;

/**
 * Result of evaluating a complete criteria string (all atoms AND-ed), together with the
 * diagnostics collected while parsing and evaluating it.
 *
 * @param satisfied whether every atom holds; {@code true} when there are no atoms
 * @param details   parse diagnostics followed by one detail per evaluated atom
 */
public record CriteriaOutcome(boolean satisfied, List<String> details) {

    private static final CriteriaOutcome NO_CRITERIA = new CriteriaOutcome(true, List.of());

    public CriteriaOutcome {
        details = List.copyOf(details);
    }

    /** Outcome for an owner without any criteria text. */
    public static CriteriaOutcome noCriteria() {
        return NO_CRITERIA;
    }
}
