package com.spanjson.layer.field;

import java.lang.reflect.Array;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.*;

/**
 * Renders values that have no JSON counterpart to a debug string.
 *
 * Rules:
 * - null: "null"
 * - primitives, boxed types, enums: String.valueOf
 * - classes declaring their own toString (records, collections, most value types): toString
 * - arrays: "int[]{length=3, [0]=1, [1]=2, [2]=3}"
 * - other objects: "TypeName{field=value, nested.field=value}" over declared and inherited fields
 * - depth limit: when current depth >= depthLimit, emit "&lt;TypeName&gt;" instead of recursing
 * - collections nested in objects: "length" + up to maxCollectionElements indexed entries
 * - cycles: "&lt;circular&gt;"
 *
 * Rendering never throws: a failing toString renders as "&lt;TypeName&gt;".
 */
public final class DebugRenderer {

    private final RenderLimits limits;

    public DebugRenderer(RenderLimits limits) {
        this.limits = limits;
    }

    public static DebugRenderer defaults() {
        return new DebugRenderer(RenderLimits.defaults());
    }

    public String render(Object value) {
        if (value == null) return "null";
        Class<?> cls = value.getClass();
        if (isScalar(cls)) return String.valueOf(value);
        if (!cls.isArray() && declaresToString(cls)) {
            try {
                return String.valueOf(value);
            } catch (RuntimeException e) {
                return "<" + cls.getSimpleName() + ">";
            }
        }
        return renderSnapshot(cls.getSimpleName(), snapshot(value));
    }

    /** Flattens {@code obj} into ordered key/value strings, as used by {@link #render}. */
    public Map<String, String> snapshot(Object obj) {
        Map<String, String> result = new LinkedHashMap<>();
        if (obj == null) return result;
        snapshotInto(obj, 0, "", result, new IdentityHashMap<>());
        return result;
    }

    /** "OrderRequest{customerId=cust-1, amount=100.0}" */
    static String renderSnapshot(String typeName, Map<String, String> snapshot) {
        if (snapshot.isEmpty()) return typeName + "{}";
        StringBuilder sb = new StringBuilder(typeName).append('{');
        boolean first = true;
        for (Map.Entry<String, String> e : snapshot.entrySet()) {
            if (!first) sb.append(", ");
            sb.append(e.getKey()).append('=').append(e.getValue());
            first = false;
        }
        return sb.append('}').toString();
    }

    private void snapshotInto(
            Object obj,
            int depth,
            String prefix,
            Map<String, String> out,
            IdentityHashMap<Object, Boolean> visited) {

        String key = prefix.isEmpty() ? "value" : prefix;
        if (obj == null) {
            out.put(key, "null");
            return;
        }
        Class<?> cls = obj.getClass();
        if (isScalar(cls)) {
            out.put(key, String.valueOf(obj));
            return;
        }
        if (visited.containsKey(obj)) {
            out.put(key, "<circular>");
            return;
        }
        if (cls.isArray()) {
            int len = Array.getLength(obj);
            List<Object> elements = new ArrayList<>(Math.min(len, limits.maxCollectionElements()));
            for (int i = 0; i < len && i < limits.maxCollectionElements(); i++) {
                elements.add(Array.get(obj, i));
            }
            snapshotElements(len, elements, depth, prefix, out, visited);
            return;
        }
        if (obj instanceof Collection<?> col) {
            List<Object> elements = new ArrayList<>();
            for (Object e : col) {
                if (elements.size() >= limits.maxCollectionElements()) break;
                elements.add(e);
            }
            snapshotElements(col.size(), elements, depth, prefix, out, visited);
            return;
        }
        if (obj instanceof Map<?, ?> map) {
            out.put(prefix.isEmpty() ? "length" : prefix + ".length", String.valueOf(map.size()));
            int count = 0;
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (count++ >= limits.maxCollectionElements()) break;
                String elemKey = prefix + "[" + entry.getKey() + "]";
                snapshotChild(entry.getValue(), depth, elemKey, out, visited);
            }
            return;
        }
        if (depth >= limits.depthLimit()) {
            out.put(key, "<" + cls.getSimpleName() + ">");
            return;
        }
        visited.put(obj, Boolean.TRUE);
        try {
            snapshotFields(obj, cls, depth, prefix, out, visited);
        } finally {
            visited.remove(obj);
        }
    }

    private void snapshotElements(
            int length,
            List<Object> elements,
            int depth,
            String prefix,
            Map<String, String> out,
            IdentityHashMap<Object, Boolean> visited) {

        out.put(prefix.isEmpty() ? "length" : prefix + ".length", String.valueOf(length));
        for (int i = 0; i < elements.size(); i++) {
            snapshotChild(elements.get(i), depth, prefix + "[" + i + "]", out, visited);
        }
    }

    private void snapshotFields(
            Object obj,
            Class<?> cls,
            int depth,
            String prefix,
            Map<String, String> out,
            IdentityHashMap<Object, Boolean> visited) {

        // Walk class hierarchy (including superclasses) up to Object
        List<Field> fields = new ArrayList<>();
        for (Class<?> c = cls; c != null && c != Object.class; c = c.getSuperclass()) {
            for (Field f : c.getDeclaredFields()) {
                if (f.isSynthetic() || Modifier.isStatic(f.getModifiers())) continue;
                fields.add(f);
            }
        }

        for (Field field : fields) {
            String fieldKey = prefix.isEmpty() ? field.getName() : prefix + "." + field.getName();
            Object fieldValue;
            try {
                field.setAccessible(true);
                fieldValue = field.get(obj);
            } catch (IllegalAccessException | RuntimeException e) {
                // Module system may block access to JDK internals
                out.put(fieldKey, "<inaccessible>");
                continue;
            }
            snapshotChild(fieldValue, depth, fieldKey, out, visited);
        }
    }

    private void snapshotChild(
            Object value,
            int depth,
            String key,
            Map<String, String> out,
            IdentityHashMap<Object, Boolean> visited) {

        if (value == null) {
            out.put(key, "null");
        } else if (isScalar(value.getClass())) {
            out.put(key, String.valueOf(value));
        } else if (depth + 1 >= limits.depthLimit()) {
            out.put(key, "<" + value.getClass().getSimpleName() + ">");
        } else {
            snapshotInto(value, depth + 1, key, out, visited);
        }
    }

    static boolean declaresToString(Class<?> cls) {
        try {
            return cls.getMethod("toString").getDeclaringClass() != Object.class;
        } catch (NoSuchMethodException e) {
            return false;
        }
    }

    static boolean isScalar(Class<?> cls) {
        return cls.isPrimitive()
            || cls == String.class
            || cls == Boolean.class
            || cls == Character.class
            || cls.isEnum()
            || Number.class.isAssignableFrom(cls) && cls.getPackageName().startsWith("java.");
    }
}
