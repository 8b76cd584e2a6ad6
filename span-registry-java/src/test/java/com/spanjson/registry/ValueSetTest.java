package com.spanjson.registry;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ValueSetTest {

    /** Visitor that logs "kind:name=value". */
    static class LoggingVisitor implements FieldVisitor {
        final List<String> seen = new ArrayList<>();
        @Override public void recordLong(String f, long v)       { seen.add("long:" + f + "=" + v); }
        @Override public void recordDouble(String f, double v)   { seen.add("double:" + f + "=" + v); }
        @Override public void recordBoolean(String f, boolean v) { seen.add("bool:" + f + "=" + v); }
        @Override public void recordString(String f, String v)   { seen.add("str:" + f + "=" + v); }
        @Override public void recordDebug(String f, Object v)    { seen.add("debug:" + f + "=" + v); }
    }

    @Test
    void dispatchesByValueType() {
        LoggingVisitor v = new LoggingVisitor();
        ValueSet.of("i", 1, "l", 2L, "s", (short) 3, "d", 1.5, "f", 2.5f,
                "b", true, "str", "x", "sb", new StringBuilder("y"), "list", List.of(1))
            .record(v);
        assertEquals(List.of(
            "long:i=1", "long:l=2", "long:s=3", "double:d=1.5", "double:f=2.5",
            "bool:b=true", "str:str=x", "str:sb=y", "debug:list=[1]"), v.seen);
    }

    @Test
    void nullValuesAreDeclaredButNotVisited() {
        LoggingVisitor v = new LoggingVisitor();
        ValueSet set = ValueSet.of("empty", null, "a", 1);
        set.record(v);
        assertEquals(List.of("long:a=1"), v.seen);
        assertEquals(List.of("empty", "a"), set.names());
    }

    @Test
    void oddArgumentCountIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> ValueSet.of("a", 1, "b"));
    }

    @Test
    void nonStringNameIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> ValueSet.of(1, "a"));
    }

    @Test
    void withFirstPrependsField() {
        ValueSet set = ValueSet.of("a", 1).withFirst("message", "hi");
        assertEquals(List.of("message", "a"), set.names());
        assertEquals("hi", set.get("message"));
    }

    @Test
    void emptySetVisitsNothing() {
        LoggingVisitor v = new LoggingVisitor();
        ValueSet.of().record(v);
        assertTrue(v.seen.isEmpty());
        assertTrue(ValueSet.empty().isEmpty());
    }
}
