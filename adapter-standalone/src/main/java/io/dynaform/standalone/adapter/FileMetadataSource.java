package io.dynaform.standalone.adapter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.dynaform.core.error.MetadataSourceException;
import io.dynaform.core.model.MetadataRecord;
import io.dynaform.core.spi.MetadataSource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link MetadataSource} backed by a YAML or JSON document on disk.
 *
 * <pre>
 * form: work-order-inspection        # optional, defaults to the file name
 * errors: []                         # upstream errors to report instead of rows
 * records:
 *   - section: Meter
 *     section_order: 2
 *     section_criteria: "[General].[Status]{!=Draft}"
 *     field: Reading
 *     type: number
 *     field_order: 1
 *     field_criteria: ...
 *     picklist: "A, B"
 * edits:
 *   - field: Reading
 *     value: "120"
 * </pre>
 *
 * <p>A non-empty {@code errors} list makes {@link #fetch()} fail the way a remote metadata query
 * would. Edits are read together with the rows and exposed through {@link #edits()}.
 */
public final class FileMetadataSource implements MetadataSource {

    private static final Logger LOG = LoggerFactory.getLogger(FileMetadataSource.class);

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private final Path path;
    private final String formId;
    private volatile List<FieldEdit> edits = List.of();

    /**
     * @param path the metadata document
     */
    public FileMetadataSource(Path path) {
        this.path = Objects.requireNonNull(path, "path must not be null");
        this.formId = readFormId(path);
    }

    @Override
    public String formId() {
        return formId;
    }

    /** The document this source reads. */
    public Path path() {
        return path;
    }

    /**
     * Reads the document and returns its rows.
     *
     * @throws MetadataSourceException if the file cannot be read or parsed, or the document lists
     *     upstream errors
     */
    @Override
    public List<MetadataRecord> fetch() {
        JsonNode root = readDocument(path, formId);

        List<String> errors = new ArrayList<>();
        root.path("errors").forEach(e -> errors.add(e.asText()));
        if (!errors.isEmpty()) {
            throw new MetadataSourceException(errors, formId, path.toString());
        }

        List<MetadataRecord> records = new ArrayList<>();
        for (JsonNode r : root.path("records")) {
            records.add(MetadataRecord.builder()
                    .section(text(r, "section"))
                    .sectionOrder(text(r, "section_order"))
                    .sectionCriteria(text(r, "section_criteria"))
                    .field(text(r, "field"))
                    .type(text(r, "type"))
                    .fieldOrder(text(r, "field_order"))
                    .fieldCriteria(text(r, "field_criteria"))
                    .picklistValues(text(r, "picklist"))
                    .build());
        }
        this.edits = readEdits(root.path("edits"));
        LOG.debug("Read {} records and {} edits from {}", records.size(), edits.size(), path);
        return records;
    }

    /** Edits listed in the document, as of the last {@link #fetch()}. */
    public List<FieldEdit> edits() {
        return edits;
    }

    private List<FieldEdit> readEdits(JsonNode array) {
        List<FieldEdit> result = new ArrayList<>();
        for (JsonNode e : array) {
            String field = text(e, "field");
            if (field == null) {
                throw new MetadataSourceException(
                        List.of("edit without 'field' in " + path.getFileName()), formId, path.toString());
            }
            JsonNode value = e.path("value");
            Object v;
            if (value.isBoolean()) {
                v = value.booleanValue();
            } else if (value.isNull() || value.isMissingNode()) {
                v = null;
            } else if (value.isValueNode()) {
                v = value.asText();
            } else {
                throw new MetadataSourceException(
                        List.of("edit value for '" + field + "' must be a scalar"), formId, path.toString());
            }
            result.add(new FieldEdit(field, v));
        }
        return List.copyOf(result);
    }

    private static JsonNode readDocument(Path path, String formId) {
        try {
            JsonNode root = YAML_MAPPER.readTree(Files.readString(path));
            if (root == null || !root.isObject()) {
                throw new MetadataSourceException(
                        List.of("metadata document is empty or not a mapping: " + path), formId, path.toString());
            }
            return root;
        } catch (JsonProcessingException e) {
            throw new MetadataSourceException(
                    "Invalid metadata document " + path + ": " + e.getOriginalMessage(), e, formId, path.toString());
        } catch (IOException e) {
            throw new MetadataSourceException(
                    "Cannot read metadata document " + path + ": " + e.getMessage(), e, formId, path.toString());
        }
    }

    /** The {@code form} key if the file is readable and has one, otherwise the file name stem. */
    private static String readFormId(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;
        if (!Files.isReadable(path)) {
            return stem;
        }
        try {
            JsonNode root = YAML_MAPPER.readTree(Files.readString(path));
            return root != null && root.hasNonNull("form") ? root.get("form").asText() : stem;
        } catch (IOException e) {
            LOG.debug("Cannot read form id from {}, using '{}'", path, stem, e);
            return stem;
        }
    }

    private static String text(JsonNode node, String key) {
        return node.hasNonNull(key) ? node.get(key).asText() : null;
    }
}
