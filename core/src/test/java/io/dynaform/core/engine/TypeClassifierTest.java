package io.dynaform.core.engine;

import static org.assertj.core.api.Assertions.assertThat;

import io.dynaform.core.model.FieldKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("TypeClassifier")
class TypeClassifierTest {

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
        "text, TEXT",
        "string, TEXT",
        "textarea, TEXTAREA",
        "longtext, TEXTAREA",
        "number, NUMBER",
        "double, NUMBER",
        "currency, NUMBER",
        "percent, NUMBER",
        "date, DATE",
        "datetime, DATETIME",
        "checkbox, CHECKBOX",
        "boolean, CHECKBOX",
        "picklist, PICKLIST"
    })
    @DisplayName("known tags map to their kind")
    void knownTags(String tag, FieldKind expected) {
        assertThat(TypeClassifier.classify(tag)).isEqualTo(expected);
    }

    @ParameterizedTest
    @ValueSource(strings = {"Picklist", "PICKLIST", "  picklist  "})
    @DisplayName("matching ignores case and surrounding whitespace")
    void caseAndWhitespaceInsensitive(String tag) {
        assertThat(TypeClassifier.classify(tag)).isEqualTo(FieldKind.PICKLIST);
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"lookup", "multipicklist", "date time", "email"})
    @DisplayName("unknown, blank and null tags degrade to OTHER")
    void unknownTagsAreOther(String tag) {
        assertThat(TypeClassifier.classify(tag)).isEqualTo(FieldKind.OTHER);
    }

    @Test
    @DisplayName("every kind except OTHER is reachable from some tag")
    void classificationCoversAllKinds() {
        String[] tags = {"text", "textarea", "number", "date", "datetime", "checkbox", "picklist", "unknown"};
        assertThat(java.util.Arrays.stream(tags).map(TypeClassifier::classify))
                .containsExactlyInAnyOrder(FieldKind.values());
    }
}
