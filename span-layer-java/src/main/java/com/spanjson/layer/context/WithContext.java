package com.spanjson.layer.context;

import com.spanjson.layer.field.FieldAccumulator;
import com.spanjson.registry.Dispatch;
import com.spanjson.registry.ScopeId;

import java.util.function.Predicate;

/**
 * Capability a {@link com.spanjson.layer.JsonLayer} exposes through
 * {@link Dispatch#downcast(Class)}. It remembers the concrete subscriber type the layer
 * was built for, so callers holding only a {@code Dispatch} can reach the layer's stored
 * fields.
 */
public final class WithContext {

    @FunctionalInterface
    public interface ContextFunction {
        void apply(Dispatch dispatch, ScopeId id, Predicate<FieldAccumulator> visitor);
    }

    private final ContextFunction function;

    public WithContext(ContextFunction function) {
        this.function = function;
    }

    /**
     * Offers the fields of span {@code id} and then of each ancestor, nearest first, to
     * {@code visitor} until it returns true.
     */
    public void withContext(Dispatch dispatch, ScopeId id, Predicate<FieldAccumulator> visitor) {
        function.apply(dispatch, id, visitor);
    }
}
