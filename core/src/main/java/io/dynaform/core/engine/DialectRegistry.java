package io.dynaform.core.engine;

import io.dynaform.core.engine.dialect.NameAddressedDialect;
import io.dynaform.core.engine.dialect.PositionalDialect;
import io.dynaform.core.error.UnknownDialectException;
import io.dynaform.core.spi.CriteriaDialect;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry for criteria dialects. Manages registration and lookup by dialect id. Thread-safe:
 * registration and lookup can happen concurrently.
 */
public final class DialectRegistry {

    private final Map<String, CriteriaDialect> dialects = new ConcurrentHashMap<>();

    /** Creates a registry holding the built-in {@code name} and {@code positional} dialects. */
    public static DialectRegistry withDefaults() {
        DialectRegistry registry = new DialectRegistry();
        registry.register(new NameAddressedDialect());
        registry.register(new PositionalDialect());
        return registry;
    }

    /**
     * Registers a dialect. If a dialect with the same id is already registered, it is replaced
     * (last-write-wins semantics).
     *
     * @param dialect the dialect to register
     * @throws NullPointerException if dialect is null
     * @throws IllegalArgumentException if dialect.id() is null or empty
     */
    public void register(CriteriaDialect dialect) {
        if (dialect == null) {
            throw new NullPointerException("dialect must not be null");
        }
        String id = dialect.id();
        if (id == null || id.isEmpty()) {
            throw new IllegalArgumentException("dialect id must not be null or empty");
        }
        dialects.put(id, dialect);
    }

    /**
     * Looks up a dialect by id.
     *
     * @param dialectId the dialect identifier (e.g. "name")
     * @return the dialect, or empty if not registered
     */
    public Optional<CriteriaDialect> getDialect(String dialectId) {
        return Optional.ofNullable(dialects.get(dialectId));
    }

    /**
     * Looks up a dialect by id, throwing if not found.
     *
     * @param dialectId the dialect identifier
     * @return the registered dialect
     * @throws UnknownDialectException if no dialect is registered with the given id
     */
    public CriteriaDialect requireDialect(String dialectId) {
        return getDialect(dialectId)
                .orElseThrow(() -> new UnknownDialectException(
                        "No criteria dialect registered for id: '" + dialectId + "'", dialectId));
    }

    /** Returns the number of registered dialects. */
    public int size() {
        return dialects.size();
    }

    /** Returns {@code true} if a dialect with the given id is registered. */
    public boolean hasDialect(String dialectId) {
        return dialects.containsKey(dialectId);
    }
}
