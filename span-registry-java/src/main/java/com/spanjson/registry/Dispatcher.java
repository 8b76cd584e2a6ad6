package com.spanjson.registry;

import java.util.function.Supplier;

/**
 * Ambient default {@link Dispatch} for code that does not carry one explicitly.
 *
 * Lookup order: the dispatch installed for the current thread by {@link #withDefault},
 * then the process-wide one from {@link #setGlobalDefault}, then {@link Dispatch#NONE}.
 */
public final class Dispatcher {

    private Dispatcher() {}

    private static volatile Dispatch global;

    private static final ThreadLocal<Dispatch> scoped = new ThreadLocal<>();

    /**
     * Installs the process-wide default. May be called once per JVM; the global default
     * lives until the process exits.
     */
    public static synchronized void setGlobalDefault(Dispatch dispatch) {
        if (global != null) {
            throw new IllegalStateException("a global default dispatch has already been set");
        }
        global = dispatch;
    }

    public static Dispatch current() {
        Dispatch d = scoped.get();
        if (d != null) return d;
        Dispatch g = global;
        return g != null ? g : Dispatch.NONE;
    }

    /** Runs {@code action} with {@code dispatch} as this thread's default. */
    public static void withDefault(Dispatch dispatch, Runnable action) {
        withDefault(dispatch, () -> {
            action.run();
            return null;
        });
    }

    public static <T> T withDefault(Dispatch dispatch, Supplier<T> action) {
        Dispatch previous = scoped.get();
        scoped.set(dispatch);
        try {
            return action.get();
        } finally {
            if (previous == null) {
                scoped.remove();
            } else {
                scoped.set(previous);
            }
        }
    }
}
