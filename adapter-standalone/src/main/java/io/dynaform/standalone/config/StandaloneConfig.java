package io.dynaform.standalone.config;

import io.dynaform.core.engine.FormEngineOptions;

/**
 * Root configuration of the standalone form runner.
 *
 * <p>All fields have defaults except {@code metadataPath}, which is required. Use {@link
 * #builder()} to construct instances.
 *
 * @param metadataPath    path of the metadata document (rows, optional edits, optional upstream
 *                        errors)
 * @param dialect         criteria dialect id: {@code name} or {@code positional}
 * @param fallbackSection section assigned to rows without a section name
 * @param outputPretty    indent the review payload JSON
 * @param loggingFormat   {@code json} or {@code text}
 * @param loggingLevel    root log level
 */
public record StandaloneConfig(
        String metadataPath,
        String dialect,
        String fallbackSection,
        boolean outputPretty,
        String loggingFormat,
        String loggingLevel) {

    /** Creates a new builder with defaults. */
    public static Builder builder() {
        return new Builder();
    }

    /** Core options derived from this configuration. */
    public FormEngineOptions engineOptions() {
        return new FormEngineOptions(dialect, fallbackSection);
    }

    /** Builder for {@link StandaloneConfig}. All fields have defaults except {@code metadataPath}. */
    public static final class Builder {
        private String metadataPath;
        private String dialect = FormEngineOptions.DEFAULT.dialect();
        private String fallbackSection = FormEngineOptions.DEFAULT.fallbackSectionName();
        private boolean outputPretty = true;
        private String loggingFormat = "text";
        private String loggingLevel = "INFO";

        Builder() {}

        public Builder metadataPath(String metadataPath) {
            this.metadataPath = metadataPath;
            return this;
        }

        public Builder dialect(String dialect) {
            this.dialect = dialect;
            return this;
        }

        public Builder fallbackSection(String fallbackSection) {
            this.fallbackSection = fallbackSection;
            return this;
        }

        public Builder outputPretty(boolean outputPretty) {
            this.outputPretty = outputPretty;
            return this;
        }

        public Builder loggingFormat(String loggingFormat) {
            this.loggingFormat = loggingFormat;
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        /**
         * Builds the configuration.
         *
         * @throws ConfigLoadException if a required value is missing or a value is invalid
         */
        public StandaloneConfig build() {
            if (metadataPath == null || metadataPath.isBlank()) {
                throw new ConfigLoadException("form.metadata is required (or set DYNAFORM_METADATA)");
            }
            if (dialect == null || dialect.isBlank()) {
                throw new ConfigLoadException("form.dialect must not be blank");
            }
            if (fallbackSection == null || fallbackSection.isBlank()) {
                throw new ConfigLoadException("form.fallback-section must not be blank");
            }
            if (!"json".equalsIgnoreCase(loggingFormat) && !"text".equalsIgnoreCase(loggingFormat)) {
                throw new ConfigLoadException(
                        "logging.format must be 'json' or 'text', got: '" + loggingFormat + "'");
            }
            return new StandaloneConfig(
                    metadataPath, dialect, fallbackSection, outputPretty, loggingFormat, loggingLevel);
        }
    }
}
