package io.dynaform.core.engine.dialect;

import io.dynaform.core.error.CriteriaParseException;
import io.dynaform.core.model.CriteriaRule;
import io.dynaform.core.model.RuleTarget;
import io.dynaform.core.spi.CriteriaDialect;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Legacy criteria dialect that addresses the target by 1-based declaration position:
 *
 * <pre>
 * 1-1{Yes}
 * 2-3{&gt;=10}; 2-4{~'pump'}
 * </pre>
 *
 * <p>Several rules may be separated by newlines or semicolons; they are AND-ed. The operator is
 * optional and defaults to {@code =}. Kept for metadata authored before the name-addressed
 * dialect existed; references break when sections or fields are inserted ahead of the target.
 */
public final class PositionalDialect implements CriteriaDialect {

    public static final String ID = "positional";

    private static final Pattern SEPARATOR = Pattern.compile("[;\\r\\n]+");

    private static final Pattern RULE =
            Pattern.compile("^(\\d+)\\s*-\\s*(\\d+)\\s*\\{\\s*(==|!=|>=|<=|=|>|<|~)?(.*?)\\s*\\}$");

    @Override
    public String id() {
        return ID;
    }

    @Override
    public List<String> split(String criteria) {
        return Arrays.stream(SEPARATOR.split(criteria))
                .map(String::trim)
                .filter(piece -> !piece.isEmpty())
                .toList();
    }

    @Override
    public CriteriaRule parse(String fragment) {
        Matcher m = RULE.matcher(fragment);
        if (!m.matches()) {
            throw new CriteriaParseException(
                    "Criteria does not match <section>-<field>{<op><value>}: '" + fragment + "'", fragment, ID);
        }
        RuleTarget target;
        try {
            target = new RuleTarget.Positional(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)));
        } catch (IllegalArgumentException e) {
            // NumberFormatException (overflow) is an IllegalArgumentException too
            throw new CriteriaParseException(
                    "Invalid position in criteria '" + fragment + "': " + e.getMessage(), fragment, ID);
        }
        return CriteriaRule.of(target, m.group(3), Literals.unquote(m.group(4).trim()));
    }
}
