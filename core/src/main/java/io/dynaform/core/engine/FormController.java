package io.dynaform.core.engine;

import io.dynaform.core.engine.VisibilityEngine.PassSummary;
import io.dynaform.core.error.MetadataSourceException;
import io.dynaform.core.model.FieldDefinition;
import io.dynaform.core.model.FormSchema;
import io.dynaform.core.model.MetadataRecord;
import io.dynaform.core.model.ReviewPayload;
import io.dynaform.core.spec.CriteriaParser;
import io.dynaform.core.spi.CriteriaDialect;
import io.dynaform.core.spi.MetadataSource;
import io.dynaform.core.spi.VisibilityListener;
import io.dynaform.core.spi.VisibilityListener.Trigger;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the {@link FormSchema} of one form and is the only component that mutates it.
 *
 * <p>Two kinds of mutation exist: a rebuild, which replaces the schema wholesale from fresh
 * metadata, and a value edit, which writes a value and then recomputes visibility. Each entry point
 * runs its visibility pass to completion before returning, and all entry points are synchronized,
 * so the pass triggered by an edit always observes that edit and two edits never interleave.
 *
 * <p>Schemas returned to callers are read-only copies taken at the time of the call; values change
 * only through {@link #applyEdit(String, String)} and {@link #applyReview(ReviewPayload)}.
 *
 * <p>Upstream failures never escape {@link #load(MetadataSource)}: the schema is cleared to empty
 * and the failure is exposed through {@link #schemaError()}.
 */
public final class FormController {

    private static final Logger LOG = LoggerFactory.getLogger(FormController.class);

    private final CriteriaDialect dialect;
    private final SchemaBuilder schemaBuilder;
    private final VisibilityEngine visibilityEngine;
    private final VisibilityListener listener;

    private FormSchema schema = FormSchema.empty();
    private String formId;
    private String schemaError;

    /** Creates a controller with default options and the built-in dialects, without a listener. */
    public FormController() {
        this(FormEngineOptions.DEFAULT, DialectRegistry.withDefaults(), null);
    }

    /**
     * Creates a controller with the given options and the built-in dialects, without a listener.
     *
     * @param options form options (dialect, fallback section)
     * @throws io.dynaform.core.error.UnknownDialectException if the configured dialect is unknown
     */
    public FormController(FormEngineOptions options) {
        this(options, DialectRegistry.withDefaults(), null);
    }

    /**
     * Creates a controller with all configuration options.
     *
     * @param options  form options (dialect, fallback section)
     * @param dialects registry the configured dialect is resolved from
     * @param listener optional listener for lifecycle events, may be null
     * @throws io.dynaform.core.error.UnknownDialectException if the configured dialect is unknown
     */
    public FormController(FormEngineOptions options, DialectRegistry dialects, VisibilityListener listener) {
        Objects.requireNonNull(options, "options must not be null");
        Objects.requireNonNull(dialects, "dialects must not be null");
        this.dialect = dialects.requireDialect(options.dialect());
        this.schemaBuilder = new SchemaBuilder(options);
        this.visibilityEngine = new VisibilityEngine(new CriteriaParser(dialect));
        this.listener = listener; // nullable
    }

    /**
     * Fetches metadata from the source, rebuilds the schema and runs the first visibility pass. If
     * the source fails, the schema is cleared and {@link #schemaError()} reports why; no partial
     * schema is kept.
     *
     * @param source the metadata collaborator
     * @return a read-only copy of the new schema, empty on failure
     */
    public synchronized FormSchema load(MetadataSource source) {
        Objects.requireNonNull(source, "source must not be null");
        List<MetadataRecord> records;
        try {
            records = source.fetch();
        } catch (MetadataSourceException e) {
            return reject(source.formId(), e.detail());
        } catch (RuntimeException e) {
            LOG.warn("Metadata source '{}' failed unexpectedly", source.formId(), e);
            return reject(source.formId(), e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
        return rebuild(source.formId(), records == null ? List.of() : records);
    }

    /**
     * Replaces the schema with one built from the given rows and runs the first visibility pass.
     * All previous values are discarded.
     *
     * @param id      identifier of the form, used in logs and events
     * @param records metadata rows in upstream order
     * @return a read-only copy of the new schema
     */
    public synchronized FormSchema rebuild(String id, List<MetadataRecord> records) {
        Objects.requireNonNull(records, "records must not be null");
        FormSchema built = schemaBuilder.build(records);
        this.formId = id;
        this.schema = built;
        this.schemaError = null;
        LOG.info("schema.loaded form_id={} sections={} fields={} dialect={}",
                id, built.sections().size(), built.fieldCount(), dialect.id());
        runPass(Trigger.LOAD);
        notifyListener(() -> listener.onSchemaLoaded(new VisibilityListener.SchemaLoadedEvent(
                id, built.sections().size(), built.fieldCount(), dialect.id())));
        return built.readOnlyCopy();
    }

    private FormSchema reject(String id, String detail) {
        LOG.warn("schema.rejected form_id={} error={}", id, detail);
        this.formId = id;
        this.schema = FormSchema.empty();
        this.schemaError = detail;
        notifyListener(() -> listener.onSchemaRejected(new VisibilityListener.SchemaRejectedEvent(id, detail)));
        return schema.readOnlyCopy();
    }

    /**
     * Writes a text value to every field with the given api name and recomputes visibility.
     *
     * @param fieldApiName the edited field
     * @param value        the new value, may be {@code null} to clear it
     * @return the number of fields written; 0 if no field has that name
     */
    public synchronized int applyEdit(String fieldApiName, String value) {
        return edit(fieldApiName, value);
    }

    /**
     * Writes a checkbox value to every field with the given api name and recomputes visibility.
     *
     * @param fieldApiName the edited field
     * @param checked      the new checkbox state
     * @return the number of fields written; 0 if no field has that name
     */
    public synchronized int applyEdit(String fieldApiName, boolean checked) {
        return edit(fieldApiName, checked);
    }

    private int edit(String fieldApiName, Object value) {
        Objects.requireNonNull(fieldApiName, "fieldApiName must not be null");
        List<FieldDefinition> targets = schema.fields()
                .filter(f -> f.fieldApiName().equals(fieldApiName))
                .toList();
        targets.forEach(f -> f.assignValue(value));
        if (targets.isEmpty()) {
            LOG.warn("Edit for unknown field '{}' ignored (form_id={})", fieldApiName, formId);
        } else {
            LOG.debug("field.edited form_id={} field={} matched={}", formId, fieldApiName, targets.size());
        }
        notifyListener(() -> listener.onFieldEdited(
                new VisibilityListener.FieldEditedEvent(formId, fieldApiName, targets.size())));
        runPass(Trigger.EDIT);
        return targets.size();
    }

    /**
     * Runs a visibility pass without changing any value.
     *
     * @return counts after the pass
     */
    public synchronized PassSummary recompute() {
        return runPass(Trigger.MANUAL);
    }

    /** Snapshots the current schema as a serializable review payload. */
    public synchronized ReviewPayload reviewPayload() {
        return ReviewPayloadMapper.toPayload(schema);
    }

    /**
     * Applies the values of a review payload by {@code fieldApiName} and recomputes visibility.
     * Fields absent from the payload keep their value.
     *
     * @param payload the reviewed payload
     * @return the number of fields written
     */
    public synchronized int applyReview(ReviewPayload payload) {
        Objects.requireNonNull(payload, "payload must not be null");
        int written = ReviewPayloadMapper.applyValues(payload, schema);
        LOG.debug("review.applied form_id={} written={}", formId, written);
        runPass(Trigger.REVIEW);
        return written;
    }

    /** Read-only copy of the current schema; empty before the first load and after an upstream failure. */
    public synchronized FormSchema schema() {
        return schema.readOnlyCopy();
    }

    /** The upstream error of the last load, or empty if it succeeded. */
    public synchronized Optional<String> schemaError() {
        return Optional.ofNullable(schemaError);
    }

    /** Identifier of the form last loaded, or {@code null} before the first load. */
    public synchronized String formId() {
        return formId;
    }

    /** The criteria dialect every criteria string is parsed with. */
    public CriteriaDialect dialect() {
        return dialect;
    }

    private PassSummary runPass(Trigger trigger) {
        long start = System.nanoTime();
        PassSummary summary = visibilityEngine.recompute(schema);
        long durationMicros = (System.nanoTime() - start) / 1_000;
        LOG.debug(
                "visibility.recomputed form_id={} trigger={} sections={} visible_sections={} fields={} "
                        + "visible_fields={} duration_micros={}",
                formId,
                trigger,
                summary.sections(),
                summary.visibleSections(),
                summary.fields(),
                summary.visibleFields(),
                durationMicros);
        notifyListener(() -> listener.onVisibilityRecomputed(new VisibilityListener.VisibilityRecomputedEvent(
                formId,
                trigger,
                summary.sections(),
                summary.visibleSections(),
                summary.fields(),
                summary.visibleFields(),
                durationMicros)));
        return summary;
    }

    private void notifyListener(Runnable call) {
        if (listener == null) {
            return;
        }
        try {
            call.run();
        } catch (RuntimeException e) {
            LOG.warn("VisibilityListener callback failed", e);
        }
    }
}
