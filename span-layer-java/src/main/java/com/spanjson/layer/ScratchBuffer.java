package com.spanjson.layer;

import java.io.StringWriter;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetEncoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Per-thread text buffer and UTF-8 encoder reused across records.
 *
 * A thread that logs while already formatting (a sink or a toString that logs) finds the
 * buffer borrowed and gets a fresh one instead of waiting on itself.
 */
final class ScratchBuffer {

    // Buffers that grew past this are dropped instead of kept for reuse
    private static final int MAX_RETAINED_CHARS = 64 * 1024;

    private static final ThreadLocal<ScratchBuffer> LOCAL = ThreadLocal.withInitial(ScratchBuffer::new);

    private StringWriter text = new StringWriter(256);
    private final CharsetEncoder encoder = newEncoder();
    private final boolean shared;
    private boolean borrowed;

    private ScratchBuffer() {
        this(true);
    }

    private ScratchBuffer(boolean shared) {
        this.shared = shared;
    }

    /** Borrows this thread's buffer, or a temporary one if it is already in use. */
    static ScratchBuffer borrow() {
        ScratchBuffer local = LOCAL.get();
        if (local.borrowed) {
            return new ScratchBuffer(false);
        }
        local.borrowed = true;
        return local;
    }

    StringWriter text() {
        return text;
    }

    /** Encodes the buffered text; unpaired surrogates fail instead of becoming '?'. */
    ByteBuffer encode() throws CharacterCodingException {
        return encoder.encode(CharBuffer.wrap(text.getBuffer()));
    }

    boolean isShared() {
        return shared;
    }

    void release() {
        if (!shared) return;
        if (text.getBuffer().capacity() > MAX_RETAINED_CHARS) {
            text = new StringWriter(256);
        } else {
            text.getBuffer().setLength(0);
        }
        borrowed = false;
    }

    private static CharsetEncoder newEncoder() {
        return StandardCharsets.UTF_8.newEncoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
    }
}
