package com.spanjson.layer.fmt;

import com.spanjson.registry.Context;
import com.spanjson.registry.Event;
import com.spanjson.registry.SpanRef;

import java.io.IOException;
import java.io.Writer;
import java.time.Duration;

/**
 * Turns one occurrence into one line of output. Implementations write the complete
 * record, line terminator included, and keep no state between calls.
 */
public interface RecordFormatter {

    void formatEvent(Event event, Context ctx, Writer out) throws IOException;

    /**
     * @param elapsed lifetime to report on {@link OccurrenceType#END} records, or null to omit it
     */
    void formatSpan(SpanRef span, OccurrenceType type, Duration elapsed, Writer out) throws IOException;
}
