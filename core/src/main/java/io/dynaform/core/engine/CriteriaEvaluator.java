package io.dynaform.core.engine;

import io.dynaform.core.model.CriteriaOperator;
import io.dynaform.core.model.CriteriaOutcome;
import io.dynaform.core.model.CriteriaRule;
import io.dynaform.core.model.FieldDefinition;
import io.dynaform.core.model.FormSchema;
import io.dynaform.core.model.ParsedCriteria;
import io.dynaform.core.model.RuleOutcome;
import io.dynaform.core.model.RuleTarget;
import io.dynaform.core.model.SectionDefinition;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Evaluates parsed criteria against the live values held by a {@link FormSchema}.
 *
 * <p>Fail-closed: an unresolvable target, a missing value or a non-numeric operand under a numeric
 * operator makes the atom unsatisfied. Every result carries a detail string so callers can explain
 * why something is hidden. Nothing here throws for bad data.
 *
 * <p>Thread-safe and stateless: all methods are static.
 */
public final class CriteriaEvaluator {

    private CriteriaEvaluator() {}

    /**
     * Evaluates all atoms of a parsed criteria string and AND-s them. Every atom is evaluated so
     * that each contributes a detail. No atoms means satisfied.
     *
     * @param criteria parsed criteria, including parse diagnostics
     * @param schema   the schema holding the current values
     * @return the combined outcome; details list parse diagnostics first, then one per atom
     */
    public static CriteriaOutcome evaluate(ParsedCriteria criteria, FormSchema schema) {
        if (criteria.isEmpty()) {
            return criteria.diagnostics().isEmpty()
                    ? CriteriaOutcome.noCriteria()
                    : new CriteriaOutcome(true, criteria.diagnostics());
        }
        List<String> details = new ArrayList<>(criteria.diagnostics());
        boolean satisfied = true;
        for (CriteriaRule rule : criteria.rules()) {
            RuleOutcome outcome = evaluate(rule, schema);
            details.add(outcome.detail());
            satisfied &= outcome.satisfied();
        }
        return new CriteriaOutcome(satisfied, details);
    }

    /**
     * Evaluates one atom: resolves its target in the schema, reads the target's current value and
     * compares it with the expected literal.
     *
     * @param rule   the atom
     * @param schema the schema holding the current values
     * @return the outcome with a detail describing the comparison or the failure
     */
    public static RuleOutcome evaluate(CriteriaRule rule, FormSchema schema) {
        Optional<FieldDefinition> target = resolve(rule.target(), schema);
        if (target.isEmpty()) {
            return RuleOutcome.fail(rule + ": " + unresolvedReason(rule.target(), schema));
        }
        Object actual = target.get().value();
        if (actual == null) {
            return RuleOutcome.fail(rule + ": target has no value");
        }
        String actualText = String.valueOf(actual);
        if (rule.operator().isNumeric() && (toNumber(actualText) == null || toNumber(rule.expected()) == null)) {
            return RuleOutcome.fail(rule + ": non-numeric operand (actual '" + actualText + "')");
        }
        boolean result = compare(actual, rule.operator(), rule.expected());
        String detail = rule + ": actual '" + actualText + "' -> " + result;
        return result ? RuleOutcome.pass(detail) : RuleOutcome.fail(detail);
    }

    /**
     * Compares an actual value with an expected literal.
     *
     * <ul>
     *   <li>{@code null} actual: always {@code false}
     *   <li>{@code > >= < <=}: both sides coerced to decimals; {@code false} if either is not a
     *       number
     *   <li>{@code = ==}: case-insensitive equality of the string forms; {@code !=} its negation
     *   <li>{@code ~}: case-insensitive containment of {@code expected} in {@code actual}
     *   <li>anything else: case-sensitive equality
     * </ul>
     *
     * @param actual   current value: a string, a boolean or {@code null}
     * @param operator the operator
     * @param expected the expected literal
     * @return whether the comparison holds
     */
    public static boolean compare(Object actual, CriteriaOperator operator, String expected) {
        if (actual == null || expected == null) {
            return false;
        }
        String actualText = String.valueOf(actual);
        switch (operator) {
            case GREATER_THAN, GREATER_OR_EQUAL, LESS_THAN, LESS_OR_EQUAL -> {
                BigDecimal a = toNumber(actualText);
                BigDecimal e = toNumber(expected);
                if (a == null || e == null) {
                    return false;
                }
                int cmp = a.compareTo(e);
                return switch (operator) {
                    case GREATER_THAN -> cmp > 0;
                    case GREATER_OR_EQUAL -> cmp >= 0;
                    case LESS_THAN -> cmp < 0;
                    default -> cmp <= 0;
                };
            }
            case EQUALS, DOUBLE_EQUALS -> {
                return actualText.equalsIgnoreCase(expected);
            }
            case NOT_EQUALS -> {
                return !actualText.equalsIgnoreCase(expected);
            }
            case CONTAINS -> {
                return actualText.toLowerCase(Locale.ROOT).contains(expected.toLowerCase(Locale.ROOT));
            }
            default -> {
                return actualText.equals(expected);
            }
        }
    }

    /** Locates the field a target refers to, by declaration position or by name. */
    static Optional<FieldDefinition> resolve(RuleTarget target, FormSchema schema) {
        if (target instanceof RuleTarget.Positional p) {
            return schema.sectionAt(p.sectionIndex()).flatMap(s -> s.fieldAt(p.fieldIndex()));
        }
        RuleTarget.Named n = (RuleTarget.Named) target;
        return schema.section(n.sectionName()).flatMap(s -> s.field(n.fieldName()));
    }

    private static String unresolvedReason(RuleTarget target, FormSchema schema) {
        if (target instanceof RuleTarget.Positional p) {
            Optional<SectionDefinition> section = schema.sectionAt(p.sectionIndex());
            return section.isEmpty()
                    ? "no section at position " + p.sectionIndex()
                    : "section '" + section.get().name() + "' has no field at position " + p.fieldIndex();
        }
        RuleTarget.Named n = (RuleTarget.Named) target;
        return schema.section(n.sectionName()).isEmpty()
                ? "section '" + n.sectionName() + "' not found"
                : "field '" + n.fieldName() + "' not found in section '" + n.sectionName() + "'";
    }

    /** Parses trimmed decimal text, or returns {@code null} if it is not a number. */
    static BigDecimal toNumber(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        try {
            return new BigDecimal(text.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
