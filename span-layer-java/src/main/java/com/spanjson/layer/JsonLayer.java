package com.spanjson.layer;

import com.spanjson.layer.config.LayerConfig;
import com.spanjson.layer.context.WithContext;
import com.spanjson.layer.field.DebugRenderer;
import com.spanjson.layer.field.FieldAccumulator;
import com.spanjson.layer.fmt.JsonFormatter;
import com.spanjson.layer.fmt.OccurrenceType;
import com.spanjson.layer.fmt.RecordFormatter;
import com.spanjson.layer.fmt.StaticMetadata;
import com.spanjson.layer.sink.MakeWriter;
import com.spanjson.layer.timing.ScopeTimer;
import com.spanjson.registry.*;

import java.io.IOException;
import java.io.OutputStream;
import java.io.Writer;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.LongSupplier;
import java.util.function.Predicate;

/**
 * Layer writing one JSON line per event and per span start and end.
 *
 * Per span it attaches a {@link FieldAccumulator} on creation (updated on every record)
 * and a start instant on first entry. Records carry the fields of every enclosing span,
 * see {@link JsonFormatter}.
 *
 * Usage:
 * <pre>{@code
 * JsonLayer<Layered> layer = JsonLayer.builder(Layered.class)
 *     .config(LayerConfig.parse("name=cats"))
 *     .writer(MakeWriter.stdout())
 *     .build();
 * Dispatcher.setGlobalDefault(new Dispatch(new Registry().with(layer)));
 * }</pre>
 *
 * Start records are written when the span is created, before its first entry.
 *
 * Writing is best effort: a record that cannot be encoded or written is dropped and
 * counted in {@link #droppedRecords()}, the instrumented code never sees the failure.
 * Broken host wiring (unknown span ids, a close without an enter) throws
 * {@link ContractViolationException}.
 *
 * @param <S> concrete subscriber type this layer is composed into, used to resolve
 *            stored fields from a bare {@link Dispatch}
 */
public final class JsonLayer<S extends Subscriber & LookupSpan> implements Layer {

    private final Class<S> subscriberType;
    private final LayerConfig config;
    private final RecordFormatter formatter;
    private final MakeWriter makeWriter;
    private final ScopeTimer timer;
    private final DebugRenderer renderer;
    private final WithContext withContext;
    private final LongAdder dropped = new LongAdder();

    private JsonLayer(Builder<S> b) {
        this.subscriberType = b.subscriberType;
        this.config = b.config;
        this.renderer = new DebugRenderer(config.renderLimits());
        this.formatter = b.formatter != null
            ? b.formatter
            : new JsonFormatter(StaticMetadata.capture(config.name()), renderer);
        this.makeWriter = b.makeWriter;
        this.timer = new ScopeTimer(b.clock);
        this.withContext = new WithContext(this::withFields);
    }

    public static <S extends Subscriber & LookupSpan> Builder<S> builder(Class<S> subscriberType) {
        return new Builder<>(subscriberType);
    }

    public LayerConfig config() {
        return config;
    }

    /** Records dropped because they could not be encoded or written. */
    public long droppedRecords() {
        return dropped.sum();
    }

    // -----------------------------------------------------------------------
    // Span lifecycle
    // -----------------------------------------------------------------------

    @Override
    public void onNewSpan(Attributes attributes, ScopeId id, Context ctx) {
        SpanRef span = requireSpan(ctx, id, "onNewSpan");
        FieldAccumulator fields = new FieldAccumulator(renderer);
        attributes.record(fields);
        try (Extensions ext = span.extensions()) {
            ext.insert(FieldAccumulator.class, fields);
        }
        if (config.spansEnabled()) {
            emit(out -> formatter.formatSpan(span, OccurrenceType.START, null, out));
        }
    }

    @Override
    public void onRecord(ScopeId id, RecordedValues values, Context ctx) {
        SpanRef span = requireSpan(ctx, id, "onRecord");
        try (Extensions ext = span.extensions()) {
            FieldAccumulator fields = ext.get(FieldAccumulator.class);
            if (fields == null) {
                throw new ContractViolationException(
                    "fields of span '" + span.name() + "' not found on record, this is a bug");
            }
            values.record(fields);
        }
    }

    @Override
    public void onEnter(ScopeId id, Context ctx) {
        timer.attachIfAbsent(requireSpan(ctx, id, "onEnter"));
    }

    @Override
    public void onEvent(Event event, Context ctx) {
        emit(out -> formatter.formatEvent(event, ctx, out));
    }

    @Override
    public void onClose(ScopeId id, Context ctx) {
        SpanRef span = requireSpan(ctx, id, "onClose");
        Duration elapsed = timer.elapsedSinceStart(span);
        if (config.spansEnabled()) {
            Duration reported = config.elapsedEnabled() ? elapsed : null;
            emit(out -> formatter.formatSpan(span, OccurrenceType.END, reported, out));
        }
    }

    @Override
    public <T> Optional<T> downcast(Class<T> type) {
        if (type.isInstance(this)) return Optional.of(type.cast(this));
        if (type == WithContext.class) return Optional.of(type.cast(withContext));
        return Optional.empty();
    }

    // -----------------------------------------------------------------------
    // Output
    // -----------------------------------------------------------------------

    @FunctionalInterface
    private interface RecordWriter {
        void write(Writer out) throws IOException;
    }

    private void emit(RecordWriter record) {
        ScratchBuffer buf = ScratchBuffer.borrow();
        try {
            record.write(buf.text());
            ByteBuffer bytes = buf.encode();
            OutputStream out = makeWriter.makeWriter();
            out.write(bytes.array(), bytes.arrayOffset() + bytes.position(), bytes.remaining());
        } catch (ContractViolationException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            dropped.increment();
        } finally {
            buf.release();
        }
    }

    // -----------------------------------------------------------------------
    // Stored field lookup
    // -----------------------------------------------------------------------

    /** The one place a {@link Dispatch} is narrowed to the subscriber type. */
    private void withFields(Dispatch dispatch, ScopeId id, Predicate<FieldAccumulator> visitor) {
        S subscriber = dispatch.downcast(subscriberType).orElseThrow(() -> new ContractViolationException(
            "subscriber should downcast to " + subscriberType.getName() + ", this is a bug"));
        SpanRef span = subscriber.span(id);
        if (span == null) {
            // the handle outlived its span
            return;
        }
        for (SpanRef s : span.scope()) {
            try (Extensions ext = s.extensions()) {
                FieldAccumulator fields = ext.get(FieldAccumulator.class);
                if (fields != null && visitor.test(fields)) {
                    return;
                }
            }
        }
    }

    private static SpanRef requireSpan(Context ctx, ScopeId id, String callback) {
        SpanRef span = ctx.span(id);
        if (span == null) {
            throw new ContractViolationException("span " + id + " not found on '" + callback + "', this is a bug");
        }
        return span;
    }

    // -----------------------------------------------------------------------
    // Builder
    // -----------------------------------------------------------------------

    public static final class Builder<S extends Subscriber & LookupSpan> {

        private final Class<S> subscriberType;
        private LayerConfig config = LayerConfig.defaults();
        private MakeWriter makeWriter = MakeWriter.stdout();
        private RecordFormatter formatter;
        private LongSupplier clock = System::nanoTime;

        private Builder(Class<S> subscriberType) {
            this.subscriberType = Objects.requireNonNull(subscriberType, "subscriberType");
        }

        public Builder<S> config(LayerConfig config) {
            this.config = Objects.requireNonNull(config, "config");
            return this;
        }

        /** Shorthand for {@code config(config.withName(name))}. */
        public Builder<S> name(String name) {
            this.config = config.withName(name);
            return this;
        }

        public Builder<S> writer(MakeWriter makeWriter) {
            this.makeWriter = Objects.requireNonNull(makeWriter, "makeWriter");
            return this;
        }

        /** Replaces the default {@link JsonFormatter}. */
        public Builder<S> formatter(RecordFormatter formatter) {
            this.formatter = formatter;
            return this;
        }

        /** Monotonic nanosecond clock used for span lifetimes. */
        public Builder<S> clock(LongSupplier clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public JsonLayer<S> build() {
            return new JsonLayer<>(this);
        }
    }
}
