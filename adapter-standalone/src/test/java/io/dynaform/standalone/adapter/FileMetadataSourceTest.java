package io.dynaform.standalone.adapter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.dynaform.core.error.MetadataSourceException;
import io.dynaform.core.model.MetadataRecord;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("FileMetadataSource")
class FileMetadataSourceTest {

    @TempDir
    Path tempDir;

    private static Path resource(String name) throws Exception {
        return Path.of(FileMetadataSourceTest.class.getClassLoader().getResource(name).toURI());
    }

    @Test
    @DisplayName("reads rows and edits from YAML")
    void yamlDocument() throws Exception {
        FileMetadataSource source = new FileMetadataSource(resource("forms/work-order.yaml"));

        List<MetadataRecord> records = source.fetch();

        assertThat(source.formId()).isEqualTo("wo-1042");
        assertThat(records).hasSize(2);
        assertThat(records.get(1))
                .isEqualTo(MetadataRecord.builder()
                        .section("B")
                        .sectionOrder("1")
                        .field("Y")
                        .type("text")
                        .fieldOrder("1")
                        .fieldCriteria("1-1{>5}")
                        .build());
        assertThat(source.edits()).containsExactly(new FieldEdit("X", "10"));
    }

    @Test
    @DisplayName("reads JSON documents and keeps boolean edits")
    void jsonDocument() throws Exception {
        FileMetadataSource source = new FileMetadataSource(resource("forms/inspection.json"));

        List<MetadataRecord> records = source.fetch();

        assertThat(source.formId()).isEqualTo("inspection-7");
        assertThat(records).hasSize(4);
        assertThat(records.get(3).sectionName()).isNull();
        assertThat(records.get(2).picklistValues()).isEqualTo("Passed, Failed");
        assertThat(source.edits())
                .containsExactly(new FieldEdit("LockoutRequired", true), new FieldEdit("Outcome", "Failed"));
    }

    @Test
    @DisplayName("listed upstream errors fail the fetch")
    void upstreamErrors() throws Exception {
        FileMetadataSource source = new FileMetadataSource(resource("forms/upstream-error.yaml"));

        assertThatThrownBy(source::fetch)
                .isInstanceOf(MetadataSourceException.class)
                .hasMessageContaining("INVALID_FIELD")
                .satisfies(e -> assertThat(((MetadataSourceException) e).formId()).isEqualTo("wo-broken"));
    }

    @Test
    @DisplayName("missing file fails the fetch and the form id falls back to the file name")
    void missingFile() {
        FileMetadataSource source = new FileMetadataSource(tempDir.resolve("absent.yaml"));

        assertThat(source.formId()).isEqualTo("absent");
        assertThatThrownBy(source::fetch)
                .isInstanceOf(MetadataSourceException.class)
                .hasMessageContaining("Cannot read metadata document");
    }

    @Test
    @DisplayName("malformed documents fail the fetch")
    void malformed() throws Exception {
        Path file = tempDir.resolve("broken.yaml");
        Files.writeString(file, "records: [\n");

        assertThatThrownBy(() -> new FileMetadataSource(file).fetch())
                .isInstanceOf(MetadataSourceException.class)
                .hasMessageContaining("Invalid metadata document");
    }

    @Test
    @DisplayName("edits need a field name and a scalar value")
    void invalidEdits() throws Exception {
        Path noField = tempDir.resolve("no-field.yaml");
        Files.writeString(noField, "records: []\nedits:\n  - value: x\n");
        Path nested = tempDir.resolve("nested.yaml");
        Files.writeString(nested, "records: []\nedits:\n  - field: X\n    value: {a: 1}\n");

        assertThatThrownBy(() -> new FileMetadataSource(noField).fetch())
                .isInstanceOf(MetadataSourceException.class)
                .hasMessageContaining("without 'field'");
        assertThatThrownBy(() -> new FileMetadataSource(nested).fetch())
                .isInstanceOf(MetadataSourceException.class)
                .hasMessageContaining("must be a scalar");
    }
}
