package io.dynaform.core.engine.dialect;

import io.dynaform.core.error.CriteriaParseException;
import io.dynaform.core.model.CriteriaRule;
import io.dynaform.core.model.RuleTarget;
import io.dynaform.core.spi.CriteriaDialect;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Criteria dialect that addresses the target by section and field name:
 *
 * <pre>
 * [Inspection].[Result]{=Failed}
 * [Meter].[Reading]{&gt;=100}
 * </pre>
 *
 * <p>The whole criteria text is one rule. Names are matched exactly as written between the
 * brackets. The operator is the run of {@code ! < > = ~} characters after the opening brace;
 * runs that are not a known operator compare with case-sensitive equality. This is the default
 * dialect.
 */
public final class NameAddressedDialect implements CriteriaDialect {

    public static final String ID = "name";

    private static final Pattern RULE =
            Pattern.compile("^\\s*\\[([^\\]]+)\\]\\.\\[([^\\]]+)\\]\\s*\\{\\s*([!<>=~]*)(.*?)\\s*\\}\\s*$");

    @Override
    public String id() {
        return ID;
    }

    @Override
    public List<String> split(String criteria) {
        return List.of(criteria);
    }

    @Override
    public CriteriaRule parse(String fragment) {
        Matcher m = RULE.matcher(fragment);
        if (!m.matches()) {
            throw new CriteriaParseException(
                    "Criteria does not match [Section].[Field]{<op><value>}: '" + fragment + "'", fragment, ID);
        }
        RuleTarget target = new RuleTarget.Named(m.group(1), m.group(2));
        return CriteriaRule.of(target, m.group(3), Literals.unquote(m.group(4).trim()));
    }
}
