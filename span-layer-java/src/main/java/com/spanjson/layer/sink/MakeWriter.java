package com.spanjson.layer.sink;

import java.io.OutputStream;

/**
 * Supplies the stream each record is written to. Called once per record; every record
 * is handed over in a single {@code write(byte[], int, int)} call and the stream is never
 * closed by the layer.
 */
@FunctionalInterface
public interface MakeWriter {

    OutputStream makeWriter();

    static MakeWriter stdout() {
        return () -> System.out;
    }

    static MakeWriter stderr() {
        return () -> System.err;
    }

    static MakeWriter of(OutputStream out) {
        return () -> out;
    }
}
