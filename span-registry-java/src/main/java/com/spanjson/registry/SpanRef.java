package com.spanjson.registry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A span as stored by the {@link Registry}: identity, metadata, parent link and extensions.
 *
 * The parent is held by reference, so the ancestor chain stays walkable after an outer
 * span has been closed while an inner one is still open.
 */
public final class SpanRef {

    private final ScopeId id;
    private final Metadata metadata;
    private final SpanRef parent;
    private final Extensions extensions = new Extensions();

    SpanRef(ScopeId id, Metadata metadata, SpanRef parent) {
        this.id = id;
        this.metadata = metadata;
        this.parent = parent;
    }

    public ScopeId id() {
        return id;
    }

    public Metadata metadata() {
        return metadata;
    }

    public String name() {
        return metadata.name();
    }

    /** Returns the enclosing span, or null for a root span. */
    public SpanRef parent() {
        return parent;
    }

    /** This span and its ancestors, nearest first. */
    public List<SpanRef> scope() {
        List<SpanRef> chain = new ArrayList<>();
        for (SpanRef s = this; s != null; s = s.parent) {
            chain.add(s);
        }
        return chain;
    }

    /** This span and its ancestors, root first. */
    public List<SpanRef> scopeFromRoot() {
        List<SpanRef> chain = scope();
        Collections.reverse(chain);
        return chain;
    }

    /** Locks this span's extensions until the returned handle is closed. */
    public Extensions extensions() {
        return extensions.acquire();
    }

    @Override
    public String toString() {
        return "SpanRef{" + id.value() + ", " + metadata.name() + "}";
    }
}
