package com.questrail.harness.supervisor;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.PipedInputStream;
import java.io.PipedOutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OutputCaptureTest {

    @Test
    void keepsABoundedTail() throws InterruptedException {
        OutputCapture capture = new OutputCapture("test", 2, e -> fail(e));
        capture.pump(stream("one\ntwo\nthree\n"));

        assertTrue(capture.awaitClosed(Duration.ofSeconds(2)));
        assertEquals(List.of("two", "three"), capture.lines());
        assertEquals(3, capture.totalLines());
        assertEquals("... 1 earlier lines dropped\ntwo\nthree\n", capture.render());
    }

    @Test
    void firstLineReleasesTheWaiter() throws Exception {
        PipedOutputStream out = new PipedOutputStream();
        OutputCapture capture = new OutputCapture("piped", 10, e -> fail(e));
        capture.pump(new PipedInputStream(out));

        assertFalse(capture.awaitFirstLine(Duration.ofMillis(50)));
        out.write("ready\n".getBytes(StandardCharsets.UTF_8));
        out.flush();
        assertTrue(capture.awaitFirstLine(Duration.ofSeconds(2)));
        out.close();
    }

    @Test
    void endOfStreamWithoutOutputIsNotReady() throws InterruptedException {
        OutputCapture capture = new OutputCapture("empty", 10, e -> fail(e));
        capture.pump(stream(""));

        assertFalse(capture.awaitFirstLine(Duration.ofSeconds(2)));
    }

    @Test
    void pumpingTwiceIsRejected() {
        OutputCapture capture = new OutputCapture("twice", 10, e -> fail(e));
        capture.pump(stream("x\n"));
        assertThrows(IllegalStateException.class, () -> capture.pump(stream("y\n")));
    }

    private static ByteArrayInputStream stream(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    private static void fail(IOException e) {
        throw new AssertionError("unexpected pump failure", e);
    }
}
