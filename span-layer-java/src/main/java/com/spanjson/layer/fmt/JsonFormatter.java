package com.spanjson.layer.fmt;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.stream.JsonWriter;
import com.spanjson.layer.field.DebugRenderer;
import com.spanjson.layer.field.FieldAccumulator;
import com.spanjson.layer.timing.DurationFormat;
import com.spanjson.registry.Context;
import com.spanjson.registry.ContractViolationException;
import com.spanjson.registry.Event;
import com.spanjson.registry.Extensions;
import com.spanjson.registry.Metadata;
import com.spanjson.registry.SpanRef;

import java.io.IOException;
import java.io.Writer;
import java.time.Duration;
import java.util.Map;

/**
 * Writes each occurrence as one JSON object on one line.
 *
 * Key order:
 * <pre>
 *   level, title, type, span?, source.filename, source.line, source.target, source.name,
 *   source.pid, &lt;ancestor fields, root first&gt;, &lt;own fields&gt;, elapsed?
 * </pre>
 * A name may appear more than once: each ancestor contributes its own fields, and a
 * reader folding duplicate keys last-wins sees the innermost value. The {@code message}
 * field of an event becomes its title and is not repeated.
 */
public final class JsonFormatter implements RecordFormatter {

    static final String MESSAGE = "message";

    // serializeNulls: non-finite doubles are stored as JsonNull and must still be written
    private static final Gson GSON = new GsonBuilder()
        .serializeNulls()
        .disableHtmlEscaping()
        .create();

    private final StaticMetadata meta;
    private final DebugRenderer renderer;

    public JsonFormatter(StaticMetadata meta, DebugRenderer renderer) {
        this.meta = meta;
        this.renderer = renderer;
    }

    @Override
    public void formatEvent(Event event, Context ctx, Writer out) throws IOException {
        FieldAccumulator own = new FieldAccumulator(renderer);
        event.record(own);
        Metadata metadata = event.metadata();
        SpanRef current = ctx.eventSpan(event);

        JsonWriter json = newWriter(out);
        json.beginObject();
        json.name("level").value(metadata.level().asString());
        json.name("title").value(title(own, metadata));
        json.name("type").value(OccurrenceType.EVENT.marker());
        if (current != null) {
            json.name("span").value(current.name());
        }
        writeSource(json, metadata);
        if (current != null) {
            writeScopeFields(json, current);
        }
        for (Map.Entry<String, JsonElement> e : own.fields().entrySet()) {
            if (!MESSAGE.equals(e.getKey())) {
                writeEntry(json, e.getKey(), e.getValue());
            }
        }
        json.endObject();
        json.flush();
        out.write('\n');
    }

    @Override
    public void formatSpan(SpanRef span, OccurrenceType type, Duration elapsed, Writer out) throws IOException {
        Metadata metadata = span.metadata();

        JsonWriter json = newWriter(out);
        json.beginObject();
        json.name("level").value(metadata.level().asString());
        json.name("title").value(metadata.name());
        json.name("type").value(type.marker());
        if (span.parent() != null) {
            json.name("span").value(span.parent().name());
        }
        writeSource(json, metadata);
        writeScopeFields(json, span);
        if (elapsed != null) {
            json.name("elapsed").value(DurationFormat.format(elapsed));
        }
        json.endObject();
        json.flush();
        out.write('\n');
    }

    private void writeSource(JsonWriter json, Metadata metadata) throws IOException {
        json.name("source.filename").value(metadata.file());
        json.name("source.line").value(metadata.line());
        json.name("source.target").value(metadata.target());
        json.name("source.name").value(meta.name());
        json.name("source.pid").value(meta.pid());
    }

    /** Fields of {@code span} and every ancestor, root first. */
    private static void writeScopeFields(JsonWriter json, SpanRef span) throws IOException {
        for (SpanRef s : span.scopeFromRoot()) {
            try (Extensions ext = s.extensions()) {
                FieldAccumulator fields = ext.get(FieldAccumulator.class);
                if (fields == null) {
                    throw new ContractViolationException(
                        "extensions of span '" + s.name() + "' should contain its fields, this is a bug");
                }
                for (Map.Entry<String, JsonElement> e : fields.fields().entrySet()) {
                    writeEntry(json, e.getKey(), e.getValue());
                }
            }
        }
    }

    private static void writeEntry(JsonWriter json, String key, JsonElement value) throws IOException {
        json.name(key);
        GSON.toJson(value, json);
    }

    private static String title(FieldAccumulator own, Metadata metadata) {
        return own.get(MESSAGE)
            .filter(m -> m.isJsonPrimitive() && m.getAsJsonPrimitive().isString())
            .map(JsonElement::getAsString)
            .orElse(metadata.name());
    }

    private static JsonWriter newWriter(Writer out) {
        JsonWriter json = new JsonWriter(out);
        json.setHtmlSafe(false);
        json.setSerializeNulls(true);
        return json;
    }
}
