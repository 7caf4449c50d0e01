package de.leidenheit.fixtura.infrastructure.io;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

/**
 * Redirects {@code System.out} and {@code System.err} into memory until closed.
 * Closing restores the streams that were installed when the capture started.
 */
public final class OutputCapture implements AutoCloseable {

    private final PrintStream originalOut;
    private final PrintStream originalErr;
    private final ByteArrayOutputStream capturedOut = new ByteArrayOutputStream();
    private final ByteArrayOutputStream capturedErr = new ByteArrayOutputStream();
    private boolean closed;

    private OutputCapture() {
        this.originalOut = System.out;
        this.originalErr = System.err;
    }

    public static OutputCapture start() {
        var capture = new OutputCapture();
        System.setOut(new PrintStream(capture.capturedOut, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(capture.capturedErr, true, StandardCharsets.UTF_8));
        return capture;
    }

    public String getStdout() {
        return capturedOut.toString(StandardCharsets.UTF_8);
    }

    public String getStderr() {
        return capturedErr.toString(StandardCharsets.UTF_8);
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        System.out.flush();
        System.err.flush();
        System.setOut(originalOut);
        System.setErr(originalErr);
    }
}
