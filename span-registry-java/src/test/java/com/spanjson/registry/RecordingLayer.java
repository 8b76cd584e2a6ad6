package com.spanjson.registry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Layer that records the callbacks it receives as short strings, e.g. {@code "enter:outer"}. */
class RecordingLayer implements Layer {

    final List<String> calls = Collections.synchronizedList(new ArrayList<>());

    @Override
    public void onNewSpan(Attributes attributes, ScopeId id, Context ctx) {
        calls.add("new:" + attributes.metadata().name());
    }

    @Override
    public void onRecord(ScopeId id, RecordedValues values, Context ctx) {
        calls.add("record:" + ctx.span(id).name() + ":" + String.join(",", values.values().names()));
    }

    @Override
    public void onEnter(ScopeId id, Context ctx) {
        calls.add("enter:" + ctx.span(id).name());
    }

    @Override
    public void onExit(ScopeId id, Context ctx) {
        calls.add("exit:" + ctx.span(id).name());
    }

    @Override
    public void onEvent(Event event, Context ctx) {
        SpanRef span = ctx.eventSpan(event);
        calls.add("event:" + event.values().get("message") + "@" + (span == null ? "-" : span.name()));
    }

    @Override
    public void onClose(ScopeId id, Context ctx) {
        // span must still be resolvable here
        calls.add("close:" + ctx.span(id).name());
    }
}
