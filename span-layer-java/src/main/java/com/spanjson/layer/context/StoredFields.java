package com.spanjson.layer.context;

import com.google.gson.JsonElement;
import com.spanjson.registry.Dispatch;
import com.spanjson.registry.Span;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Reads a field previously recorded on a span or one of its ancestors, e.g. a
 * {@code correlation_id} set on the request span, from code that has no reference to
 * the layer.
 *
 * The nearest span wins: the span itself is searched first, then its parent, and so on.
 */
public final class StoredFields {

    private StoredFields() {}

    /**
     * @return the value, or empty if no span in the chain recorded {@code fieldName}, the
     *         span is disabled or already closed, or its dispatcher has no JSON layer
     */
    public static Optional<JsonElement> get(Span span, String fieldName) {
        if (span.isDisabled()) return Optional.empty();
        Dispatch dispatch = span.dispatch();
        Optional<WithContext> withContext = dispatch.downcast(WithContext.class);
        if (withContext.isEmpty()) return Optional.empty();

        AtomicReference<JsonElement> found = new AtomicReference<>();
        withContext.get().withContext(dispatch, span.id(), fields -> {
            Optional<JsonElement> value = fields.get(fieldName);
            value.ifPresent(found::set);
            return value.isPresent();
        });
        return Optional.ofNullable(found.get());
    }

    /** Looks up {@code fieldName} from the span current on this thread. */
    public static Optional<JsonElement> current(String fieldName) {
        return get(Span.current(), fieldName);
    }

    public static Optional<String> getString(Span span, String fieldName) {
        return get(span, fieldName)
            .filter(JsonElement::isJsonPrimitive)
            .map(JsonElement::getAsString);
    }

    /** Empty unless the stored value is a number with no fractional part that fits a long. */
    public static OptionalLong getLong(Span span, String fieldName) {
        return get(span, fieldName)
            .filter(v -> v.isJsonPrimitive() && v.getAsJsonPrimitive().isNumber())
            .map(v -> exactLong(v.getAsBigDecimal()))
            .orElse(OptionalLong.empty());
    }

    private static OptionalLong exactLong(BigDecimal value) {
        try {
            return OptionalLong.of(value.longValueExact());
        } catch (ArithmeticException e) {
            return OptionalLong.empty();
        }
    }
}
