package com.spanjson.layer.sink;

import java.io.BufferedOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Appends records to a file through one shared buffer.
 *
 * Records reach the file when the buffer fills, on {@link #flush()}, or at JVM exit once
 * {@link #flushOnShutdown()} has been called.
 */
public final class FileSink implements MakeWriter, Closeable {

    private static final int BUFFER_SIZE = 64 * 1024;

    private final Path path;
    // BufferedOutputStream synchronizes write(byte[], int, int), so records never interleave
    private final BufferedOutputStream out;

    private FileSink(Path path, BufferedOutputStream out) {
        this.path = path;
        this.out = out;
    }

    /** Opens {@code path} for appending, creating missing parent directories. */
    public static FileSink open(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        OutputStream file = Files.newOutputStream(path,
            StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        System.err.println("[span-json] writing records to " + path);
        return new FileSink(path, new BufferedOutputStream(file, BUFFER_SIZE));
    }

    public Path path() {
        return path;
    }

    @Override
    public OutputStream makeWriter() {
        return out;
    }

    public void flush() throws IOException {
        out.flush();
    }

    /** Registers a shutdown hook flushing this sink; returns it so callers may remove it. */
    public Thread flushOnShutdown() {
        Thread hook = new Thread(new FlushHook(this), "span-json-flush");
        Runtime.getRuntime().addShutdownHook(hook);
        return hook;
    }

    @Override
    public void close() throws IOException {
        out.close();
    }
}
