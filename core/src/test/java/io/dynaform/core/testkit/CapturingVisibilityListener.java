package io.dynaform.core.testkit;

import io.dynaform.core.spi.VisibilityListener;
import java.util.ArrayList;
import java.util.List;

/** Records every lifecycle event in arrival order. */
public final class CapturingVisibilityListener implements VisibilityListener {

    public final List<Object> events = new ArrayList<>();

    @Override
    public void onSchemaLoaded(SchemaLoadedEvent event) {
        events.add(event);
    }

    @Override
    public void onSchemaRejected(SchemaRejectedEvent event) {
        events.add(event);
    }

    @Override
    public void onFieldEdited(FieldEditedEvent event) {
        events.add(event);
    }

    @Override
    public void onVisibilityRecomputed(VisibilityRecomputedEvent event) {
        events.add(event);
    }

    /** Events of one type, in arrival order. */
    public <T> List<T> eventsOf(Class<T> type) {
        return events.stream().filter(type::isInstance).map(type::cast).toList();
    }
}
