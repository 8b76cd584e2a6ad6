package com.spanjson.layer.sink;

import com.google.gson.JsonParser;
import com.spanjson.layer.JsonLayer;
import com.spanjson.registry.*;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FileSinkTest {

    @Test
    void recordsReachFileOnFlush(@TempDir Path tmp) throws Exception {
        Path logPath = tmp.resolve("records.jsonl");
        try (FileSink sink = FileSink.open(logPath)) {
            JsonLayer<Layered> layer = JsonLayer.builder(Layered.class).name("files").writer(sink).build();
            Tracer tracer = new Tracer(new Dispatch(new Registry().with(layer)));
            tracer.info("first");
            tracer.info("second");
            sink.flush();

            List<String> lines = Files.readAllLines(logPath);
            assertEquals(2, lines.size());
            assertEquals("second", JsonParser.parseString(lines.get(1)).getAsJsonObject().get("title").getAsString());
        }
    }

    @Test
    void appendsToExistingFile(@TempDir Path tmp) throws Exception {
        Path logPath = tmp.resolve("records.jsonl");
        Files.writeString(logPath, "{\"old\":true}\n");
        try (FileSink sink = FileSink.open(logPath)) {
            byte[] line = "{\"new\":true}\n".getBytes(StandardCharsets.UTF_8);
            sink.makeWriter().write(line, 0, line.length);
        }
        assertEquals(List.of("{\"old\":true}", "{\"new\":true}"), Files.readAllLines(logPath));
    }

    @Test
    void parentDirectoriesCreated(@TempDir Path tmp) throws Exception {
        Path nested = tmp.resolve("a/b/c/records.jsonl");
        try (FileSink sink = FileSink.open(nested)) {
            assertEquals(nested, sink.path());
        }
        assertTrue(nested.toFile().exists(), "file should be created including parent dirs");
    }

    // --- Flush hook ---

    @Test
    void flushHookWritesBufferedRecords(@TempDir Path tmp) throws Exception {
        Path logPath = tmp.resolve("records.jsonl");
        try (FileSink sink = FileSink.open(logPath)) {
            byte[] line = "{\"a\":1}\n".getBytes(StandardCharsets.UTF_8);
            sink.makeWriter().write(line, 0, line.length);
            assertEquals(0, Files.size(logPath), "record should still be buffered");

            new FlushHook(sink).run();
            assertEquals("{\"a\":1}\n", Files.readString(logPath));
        }
    }

    @Test
    void flushHookSurvivesClosedSink(@TempDir Path tmp) throws Exception {
        FileSink sink = FileSink.open(tmp.resolve("records.jsonl"));
        sink.close();
        assertDoesNotThrow(() -> new FlushHook(sink).run());
    }

    @Test
    void shutdownHookCanBeRemoved(@TempDir Path tmp) throws IOException {
        try (FileSink sink = FileSink.open(tmp.resolve("records.jsonl"))) {
            Thread hook = sink.flushOnShutdown();
            assertEquals("span-json-flush", hook.getName());
            assertTrue(Runtime.getRuntime().removeShutdownHook(hook));
        }
    }

    @Test
    void providedWritersTargetStandardStreams() {
        assertSame(System.out, MakeWriter.stdout().makeWriter());
        assertSame(System.err, MakeWriter.stderr().makeWriter());
    }
}
