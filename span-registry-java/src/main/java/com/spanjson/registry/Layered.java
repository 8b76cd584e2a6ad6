package com.spanjson.registry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * A {@link Registry} with layers on top. The registry handles storage first, then each
 * layer is notified in the order it was added. On close the order is reversed: layers
 * see the span before the registry drops it.
 */
public final class Layered implements Subscriber, LookupSpan {

    private final Registry registry;
    private final List<Layer> layers;
    private final Context context;

    Layered(Registry registry) {
        this(registry, List.of());
    }

    private Layered(Registry registry, List<Layer> layers) {
        this.registry = registry;
        this.layers = layers;
        this.context = new Context(this);
    }

    public Layered with(Layer layer) {
        List<Layer> next = new ArrayList<>(layers);
        next.add(layer);
        return new Layered(registry, Collections.unmodifiableList(next));
    }

    public Registry registry() {
        return registry;
    }

    @Override
    public ScopeId newSpan(Attributes attributes) {
        ScopeId id = registry.newSpan(attributes);
        for (Layer layer : layers) {
            layer.onNewSpan(attributes, id, context);
        }
        return id;
    }

    @Override
    public void record(ScopeId id, RecordedValues values) {
        registry.record(id, values);
        for (Layer layer : layers) {
            layer.onRecord(id, values, context);
        }
    }

    @Override
    public void enter(ScopeId id) {
        registry.enter(id);
        for (Layer layer : layers) {
            layer.onEnter(id, context);
        }
    }

    @Override
    public void exit(ScopeId id) {
        registry.exit(id);
        for (Layer layer : layers) {
            layer.onExit(id, context);
        }
    }

    @Override
    public void event(Event event) {
        registry.event(event);
        for (Layer layer : layers) {
            layer.onEvent(event, context);
        }
    }

    @Override
    public void close(ScopeId id) {
        registry.require(id, "close");
        for (Layer layer : layers) {
            layer.onClose(id, context);
        }
        registry.close(id);
    }

    @Override
    public ScopeId currentSpan() {
        return registry.currentSpan();
    }

    @Override
    public SpanRef span(ScopeId id) {
        return registry.span(id);
    }

    @Override
    public SpanRef lookupCurrent() {
        return registry.lookupCurrent();
    }

    @Override
    public <T> Optional<T> downcast(Class<T> type) {
        if (type.isInstance(this)) return Optional.of(type.cast(this));
        for (Layer layer : layers) {
            Optional<T> found = layer.downcast(type);
            if (found.isPresent()) return found;
        }
        return registry.downcast(type);
    }
}
