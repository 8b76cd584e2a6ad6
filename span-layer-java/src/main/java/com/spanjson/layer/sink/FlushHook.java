package com.spanjson.layer.sink;

import java.io.IOException;

/**
 * Flushes a {@link FileSink} on JVM shutdown.
 * Registered via {@link FileSink#flushOnShutdown()}.
 */
public class FlushHook implements Runnable {

    private final FileSink sink;

    public FlushHook(FileSink sink) {
        this.sink = sink;
    }

    @Override
    public void run() {
        try {
            sink.flush();
            System.err.println("[span-json] records flushed: " + sink.path());
        } catch (IOException e) {
            System.err.println("[span-json] ERROR flushing " + sink.path() + ": " + e.getMessage());
        }
    }
}
