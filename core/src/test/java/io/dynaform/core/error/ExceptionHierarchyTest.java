package io.dynaform.core.error;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

/** Tests for the exception hierarchy: abstract roots, common fields and every concrete type. */
class ExceptionHierarchyTest {

    // --- Hierarchy structure ---

    @Test
    void formExceptionIsAbstractAndRoot() {
        assertThat(FormException.class).isAbstract();
        assertThat(FormException.class.getSuperclass()).isEqualTo(RuntimeException.class);
    }

    @Test
    void formLoadExceptionIsAbstract() {
        assertThat(FormLoadException.class).isAbstract();
        assertThat(FormLoadException.class.getSuperclass()).isEqualTo(FormException.class);
    }

    // --- Concrete types ---

    @Test
    void metadataSourceExceptionJoinsUpstreamErrors() {
        var ex = new MetadataSourceException(List.of("INVALID_FIELD", "timeout"), "wo-1", "file:/tmp/wo.yaml");

        assertThat(ex).isInstanceOf(FormLoadException.class);
        assertThat(ex.formId()).isEqualTo("wo-1");
        assertThat(ex.detail()).isEqualTo("INVALID_FIELD; timeout");
        assertThat(ex.errors()).containsExactly("INVALID_FIELD", "timeout");
        assertThat(ex.source()).isEqualTo("file:/tmp/wo.yaml");
    }

    @Test
    void metadataSourceExceptionWrapsCause() {
        var cause = new RuntimeException("disk error");
        var ex = new MetadataSourceException("read failed", cause, "wo-2", "/wo.yaml");

        assertThat(ex.getCause()).isSameAs(cause);
        assertThat(ex.errors()).containsExactly("read failed");
    }

    @Test
    void criteriaParseExceptionCarriesFragment() {
        var ex = new CriteriaParseException("no match", "1-x{=1}", "positional");

        assertThat(ex).isInstanceOf(FormLoadException.class);
        assertThat(ex.fragment()).isEqualTo("1-x{=1}");
        assertThat(ex.source()).isEqualTo("positional");
        assertThat(ex.formId()).isNull();
    }

    @Test
    void unknownDialectExceptionExtendsLoadException() {
        var ex = new UnknownDialectException("no dialect", "xpath");

        assertThat(ex).isInstanceOf(FormException.class);
        assertThat(ex.source()).isEqualTo("xpath");
    }

    @Test
    void reviewPayloadExceptionUsesFixedSource() {
        var cause = new IllegalStateException("bad json");
        var ex = new ReviewPayloadException("unreadable", cause, "wo-3");

        assertThat(ex.source()).isEqualTo("review-payload");
        assertThat(ex.formId()).isEqualTo("wo-3");
        assertThat(ex.getCause()).isSameAs(cause);
    }

    @Test
    void allExceptionsAreUnchecked() {
        assertThat(RuntimeException.class).isAssignableFrom(FormException.class);
    }
}
