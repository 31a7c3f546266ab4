package io.dynaform.core.engine.dialect;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.dynaform.core.error.CriteriaParseException;
import io.dynaform.core.model.CriteriaOperator;
import io.dynaform.core.model.CriteriaRule;
import io.dynaform.core.model.RuleTarget;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("NameAddressedDialect")
class NameAddressedDialectTest {

    private final NameAddressedDialect dialect = new NameAddressedDialect();

    @Test
    @DisplayName("[Section].[Field]{value} defaults to '='")
    void defaultOperator() {
        CriteriaRule rule = dialect.parse("[Inspection].[Result]{Failed}");

        assertThat(rule.target()).isEqualTo(new RuleTarget.Named("Inspection", "Result"));
        assertThat(rule.operator()).isEqualTo(CriteriaOperator.EQUALS);
        assertThat(rule.expected()).isEqualTo("Failed");
    }

    @Test
    @DisplayName("names keep inner spaces and the operator run is captured")
    void namesWithSpaces() {
        CriteriaRule rule = dialect.parse("  [Meter Reading].[Current Value] { >= 100 }  ");

        assertThat(rule.target()).isEqualTo(new RuleTarget.Named("Meter Reading", "Current Value"));
        assertThat(rule.symbol()).isEqualTo(">=");
        assertThat(rule.expected()).isEqualTo("100");
    }

    @Test
    @DisplayName("contains operator and quoted literal")
    void containsQuoted() {
        CriteriaRule rule = dialect.parse("[A].[B]{~'pump'}");

        assertThat(rule.operator()).isEqualTo(CriteriaOperator.CONTAINS);
        assertThat(rule.expected()).isEqualTo("pump");
    }

    @Test
    @DisplayName("unknown operator runs fall back to strict equality")
    void unknownOperator() {
        CriteriaRule rule = dialect.parse("[A].[B]{=>5}");

        assertThat(rule.symbol()).isEqualTo("=>");
        assertThat(rule.operator()).isEqualTo(CriteriaOperator.STRICT_EQUALS);
        assertThat(rule.expected()).isEqualTo("5");
    }

    @Test
    @DisplayName("the whole text is one fragment")
    void singleFragment() {
        assertThat(dialect.split("[A].[B]{x}; [C].[D]{y}")).containsExactly("[A].[B]{x}; [C].[D]{y}");
    }

    @ParameterizedTest
    @ValueSource(strings = {"A.B{x}", "[A].[B]", "[A][B]{x}", "[].[B]{x}", "1-1{Yes}", "[A].[B]{x} trailing"})
    @DisplayName("non-matching text throws CriteriaParseException")
    void rejects(String text) {
        assertThatThrownBy(() -> dialect.parse(text)).isInstanceOf(CriteriaParseException.class);
    }
}
