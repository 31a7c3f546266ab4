package io.dynaform.core.spi;

import io.dynaform.core.model.CriteriaRule;
import java.util.List;

/**
 * Pluggable criteria grammar. A dialect decides how a criteria string is split into fragments and
 * how each fragment names its target field. Implementations are registered with a {@code
 * DialectRegistry} and selected by id through configuration.
 *
 * <p>Implementations MUST be stateless and thread-safe.
 */
public interface CriteriaDialect {

    /**
     * Returns the dialect identifier used in configuration, e.g. {@code "name"}.
     *
     * @return a non-null, non-empty identifier (lowercase, no spaces)
     */
    String id();

    /**
     * Splits trimmed, non-blank criteria text into the fragments that are parsed one by one. A
     * dialect that treats the whole text as a single rule returns a one-element list.
     *
     * @param criteria trimmed criteria text, never blank
     * @return fragments in source order; blank fragments are already removed
     */
    List<String> split(String criteria);

    /**
     * Parses one fragment into an atom.
     *
     * @param fragment a trimmed, non-blank fragment produced by {@link #split(String)}
     * @return the parsed atom
     * @throws io.dynaform.core.error.CriteriaParseException if the fragment does not match the
     *     grammar
     */
    CriteriaRule parse(String fragment);
}
