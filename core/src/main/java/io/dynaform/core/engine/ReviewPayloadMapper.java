package io.dynaform.core.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.dynaform.core.error.ReviewPayloadException;
import io.dynaform.core.model.FieldDefinition;
import io.dynaform.core.model.FormSchema;
import io.dynaform.core.model.ReviewPayload;
import io.dynaform.core.model.ReviewPayload.ReviewField;
import io.dynaform.core.model.ReviewPayload.ReviewSection;
import io.dynaform.core.model.SectionDefinition;
import java.math.BigDecimal;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts between a live {@link FormSchema} and its {@link ReviewPayload} snapshot, and between
 * payloads and JSON.
 *
 * <p>Thread-safe and stateless: all methods are static.
 */
public final class ReviewPayloadMapper {

    private static final Logger LOG = LoggerFactory.getLogger(ReviewPayloadMapper.class);

    /** Upper bound on the digits a decimal may expand to when written as a plain string. */
    static final int MAX_PLAIN_DIGITS = 100;

    private static final ObjectMapper JSON = new ObjectMapper()
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private ReviewPayloadMapper() {}

    /**
     * Snapshots every section and field of the schema.
     *
     * @param schema the live schema
     * @return a detached payload; later edits to the schema do not affect it
     */
    public static ReviewPayload toPayload(FormSchema schema) {
        List<ReviewSection> sections = schema.sections().stream()
                .map(ReviewPayloadMapper::toSection)
                .toList();
        return new ReviewPayload(sections);
    }

    private static ReviewSection toSection(SectionDefinition section) {
        List<ReviewField> fields =
                section.fields().stream().map(ReviewPayloadMapper::toField).toList();
        return new ReviewSection(
                section.name(),
                section.order(),
                section.isVisible(),
                section.rawCriteria(),
                section.criteriaOutcome().satisfied(),
                section.criteriaOutcome().details(),
                fields);
    }

    private static ReviewField toField(FieldDefinition field) {
        return new ReviewField(
                field.fieldApiName(),
                field.kind().id(),
                field.order(),
                field.pickOptions(),
                field.value(),
                field.isVisible(),
                field.rawCriteria(),
                field.criteriaOutcome().satisfied(),
                field.criteriaOutcome().details());
    }

    /**
     * Writes the values of a payload onto the schema. Each payload field is matched by {@code
     * fieldApiName} against every schema field of that name; schema fields without a counterpart
     * keep their value. Visibility is not recomputed here.
     *
     * @param payload the payload, typically edited by a review step
     * @param schema  the live schema
     * @return the number of schema fields written
     */
    static int applyValues(ReviewPayload payload, FormSchema schema) {
        int written = 0;
        for (ReviewSection section : payload.sections()) {
            for (ReviewField incoming : section.fields()) {
                if (incoming.fieldApiName() == null) {
                    continue;
                }
                Object value;
                try {
                    value = normalizeValue(incoming.value());
                } catch (IllegalArgumentException e) {
                    LOG.warn("Skipping review value for '{}': {}", incoming.fieldApiName(), e.getMessage());
                    continue;
                }
                List<FieldDefinition> targets = schema.fields()
                        .filter(f -> f.fieldApiName().equals(incoming.fieldApiName()))
                        .toList();
                for (FieldDefinition field : targets) {
                    field.assignValue(value);
                    written++;
                }
            }
        }
        return written;
    }

    /** Maps JSON-decoded values onto the value types fields accept: string, boolean or null. */
    static Object normalizeValue(Object value) {
        if (value == null || value instanceof String || value instanceof Boolean) {
            return value;
        }
        if (value instanceof BigDecimal d) {
            if (d.scale() > MAX_PLAIN_DIGITS || (long) d.precision() - d.scale() > MAX_PLAIN_DIGITS) {
                throw new IllegalArgumentException("number out of range " + d);
            }
            return d.toPlainString();
        }
        if (value instanceof Number n) {
            return n.toString();
        }
        throw new IllegalArgumentException("unsupported value type " + value.getClass().getSimpleName());
    }

    /**
     * Serializes a payload to JSON.
     *
     * @param payload the payload
     * @param pretty  whether to indent the output
     * @return the JSON text
     * @throws ReviewPayloadException if serialization fails
     */
    public static String toJson(ReviewPayload payload, boolean pretty) {
        try {
            return pretty
                    ? JSON.writer(SerializationFeature.INDENT_OUTPUT).writeValueAsString(payload)
                    : JSON.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new ReviewPayloadException("Failed to serialize review payload", e, null);
        }
    }

    /**
     * Reads a payload from JSON. Unknown properties are ignored.
     *
     * @param json the JSON text
     * @return the payload
     * @throws ReviewPayloadException if the text is not a valid payload
     */
    public static ReviewPayload fromJson(String json) {
        try {
            return JSON.readValue(json, ReviewPayload.class);
        } catch (JsonProcessingException e) {
            throw new ReviewPayloadException("Failed to parse review payload: " + e.getOriginalMessage(), e, null);
        }
    }
}
