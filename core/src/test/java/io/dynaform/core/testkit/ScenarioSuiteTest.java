package io.dynaform.core.testkit;

import static org.assertj.core.api.Assertions.assertThat;

import io.dynaform.core.engine.FormController;
import io.dynaform.core.engine.FormEngineOptions;
import io.dynaform.core.model.FormSchema;
import io.dynaform.core.model.MetadataRecord;
import io.dynaform.core.model.SectionDefinition;
import io.dynaform.core.spi.MetadataSource;
import io.dynaform.core.testkit.ScenarioLoader.ScenarioDefinition;
import io.dynaform.core.testkit.ScenarioLoader.Step;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.stream.Stream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

/**
 * Parameterized scenario suite. Loads every scenario under {@code scenarios/} on the test
 * classpath, builds the form through a {@link FormController} and replays its steps.
 */
@DisplayName("Scenario Suite")
class ScenarioSuiteTest {

    static Stream<Arguments> scenarios() throws Exception {
        return ScenarioLoader.loadAll(scenarioDir()).stream().map(s -> Arguments.of(s.displayName(), s));
    }

    private static Path scenarioDir() throws URISyntaxException {
        var url = ScenarioSuiteTest.class.getResource("/scenarios");
        if (url == null) {
            throw new IllegalStateException("scenarios/ not found on the test classpath");
        }
        return Path.of(url.toURI());
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("scenarios")
    void runScenario(String displayName, ScenarioDefinition scenario) {
        FormController controller = new FormController(FormEngineOptions.DEFAULT.withDialect(scenario.dialect()));
        MetadataSource source = scenario.upstreamErrors().isEmpty()
                ? StaticMetadataSource.of(scenario.id(), scenario.records().toArray(new MetadataRecord[0]))
                : StaticMetadataSource.failing(scenario.id(), scenario.upstreamErrors().toArray(new String[0]));

        controller.load(source);

        if (!scenario.upstreamErrors().isEmpty()) {
            assertThat(controller.schema().hasSections()).as("schema cleared").isFalse();
            assertThat(controller.schemaError()).contains(String.join("; ", scenario.upstreamErrors()));
        }

        int stepNo = 0;
        for (Step step : scenario.steps()) {
            stepNo++;
            if (step.editField() != null) {
                if (step.editValue() instanceof Boolean checked) {
                    controller.applyEdit(step.editField(), checked);
                } else {
                    controller.applyEdit(step.editField(), (String) step.editValue());
                }
            }
            FormSchema schema = controller.schema();
            String at = scenario.id() + " step " + stepNo;
            if (!step.order().isEmpty()) {
                assertThat(schema.sections())
                        .as(at + " section order")
                        .extracting(SectionDefinition::name)
                        .containsExactlyElementsOf(step.order());
            }
            for (String ref : step.visible()) {
                assertThat(isVisible(schema, ref)).as(at + " visible: " + ref).isTrue();
            }
            for (String ref : step.hidden()) {
                assertThat(isVisible(schema, ref)).as(at + " hidden: " + ref).isFalse();
            }
        }
    }

    private static boolean isVisible(FormSchema schema, String ref) {
        int dot = ref.indexOf('.');
        String sectionName = dot < 0 ? ref : ref.substring(0, dot);
        SectionDefinition section = schema.section(sectionName)
                .orElseThrow(() -> new AssertionError("no section " + sectionName));
        if (dot < 0) {
            return section.isVisible();
        }
        String fieldName = ref.substring(dot + 1);
        return section.field(fieldName)
                .orElseThrow(() -> new AssertionError("no field " + ref))
                .isVisible();
    }
}
