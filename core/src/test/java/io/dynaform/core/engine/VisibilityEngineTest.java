package io.dynaform.core.engine;

import static io.dynaform.core.testkit.TestRecords.field;
import static io.dynaform.core.testkit.TestRecords.schema;
import static io.dynaform.core.testkit.TestRecords.sectionWithCriteria;
import static org.assertj.core.api.Assertions.assertThat;

import io.dynaform.core.engine.VisibilityEngine.PassSummary;
import io.dynaform.core.engine.dialect.NameAddressedDialect;
import io.dynaform.core.model.FieldDefinition;
import io.dynaform.core.model.FormSchema;
import io.dynaform.core.model.SectionDefinition;
import io.dynaform.core.spec.CriteriaParser;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("VisibilityEngine")
class VisibilityEngineTest {

    private VisibilityEngine engine;
    private FormSchema schema;

    @BeforeEach
    void setUp() {
        engine = new VisibilityEngine(new CriteriaParser(new NameAddressedDialect()));
        schema = schema(
                field("General", 1, "Status", "picklist", 1),
                field("General", 1, "Reason", "textarea", 2, "[General].[Status]{=Closed}"),
                sectionWithCriteria("Meter", 2, "[General].[Status]{!=Draft}", "Reading", "number", 1),
                field("Meter", 2, "Unit", "text", 2, "[Meter].[Reading]{>0}"),
                field("Notes", 3, "Comment", "textarea", 1));
    }

    private SectionDefinition section(String name) {
        return schema.section(name).orElseThrow();
    }

    private FieldDefinition fieldOf(String section, String name) {
        return section(section).field(name).orElseThrow();
    }

    @Test
    @DisplayName("fields with criteria on empty values start hidden")
    void initialPass() {
        PassSummary summary = engine.recompute(schema);

        assertThat(fieldOf("General", "Reason").isVisible()).isFalse();
        // '!=' on a missing value is false, so the section is hidden
        assertThat(section("Meter").isVisible()).isFalse();
        assertThat(section("Notes").isVisible()).isTrue();
        assertThat(summary).isEqualTo(new PassSummary(3, 2, 5, 2));
    }

    @Test
    @DisplayName("section criteria cascade to every field of the section")
    void sectionCascade() {
        fieldOf("General", "Status").assignValue("Open");
        fieldOf("Meter", "Reading").assignValue("5");
        engine.recompute(schema);
        assertThat(section("Meter").isVisible()).isTrue();
        assertThat(fieldOf("Meter", "Unit").isVisible()).isTrue();

        fieldOf("General", "Status").assignValue("draft");
        engine.recompute(schema);

        assertThat(section("Meter").isVisible()).isFalse();
        assertThat(fieldOf("Meter", "Reading").isVisible()).isFalse();
        assertThat(fieldOf("Meter", "Unit").isVisible()).isFalse();
        // own criteria still evaluated for diagnostics
        assertThat(fieldOf("Meter", "Unit").criteriaOutcome().satisfied()).isTrue();
    }

    @Test
    @DisplayName("field visibility follows its own criteria")
    void fieldCriteria() {
        fieldOf("General", "Status").assignValue("closed");

        engine.recompute(schema);

        assertThat(fieldOf("General", "Reason").isVisible()).isTrue();
        assertThat(fieldOf("General", "Reason").criteriaOutcome().details())
                .singleElement()
                .satisfies(d -> assertThat(d).contains("[General].[Status]"));
    }

    @Test
    @DisplayName("a second pass without edits yields identical flags")
    void idempotent() {
        fieldOf("General", "Status").assignValue("Open");
        PassSummary first = engine.recompute(schema);
        List<Boolean> firstFlags = flags();

        PassSummary second = engine.recompute(schema);

        assertThat(second).isEqualTo(first);
        assertThat(flags()).isEqualTo(firstFlags);
    }

    @Test
    @DisplayName("render key changes when a section flips")
    void renderKey() {
        engine.recompute(schema);
        String hidden = section("Meter").renderKey();

        fieldOf("General", "Status").assignValue("Open");
        engine.recompute(schema);

        assertThat(hidden).isEqualTo("Meter-false");
        assertThat(section("Meter").renderKey()).isEqualTo("Meter-true");
    }

    @Test
    @DisplayName("unparseable criteria leave the owner visible with a diagnostic")
    void unparseableCriteria() {
        FormSchema broken = schema(field("General", 1, "Status", "text", 1, "Status is Open"));

        engine.recompute(broken);

        FieldDefinition status = broken.section("General").orElseThrow().field("Status").orElseThrow();
        assertThat(status.isVisible()).isTrue();
        assertThat(status.criteriaOutcome().details())
                .singleElement()
                .satisfies(d -> assertThat(d).startsWith("dropped:"));
    }

    @Test
    @DisplayName("empty schema is a no-op")
    void emptySchema() {
        assertThat(engine.recompute(FormSchema.empty())).isEqualTo(new PassSummary(0, 0, 0, 0));
    }

    private List<Boolean> flags() {
        return schema.sections().stream()
                .flatMap(s -> Stream.concat(
                        Stream.of(s.isVisible()), s.fields().stream().map(FieldDefinition::isVisible)))
                .toList();
    }
}
