package de.leidenheit.fixtura.infrastructure.io;

import java.io.PrintStream;
import java.util.Objects;

public class PrintStreamOutputSink implements OutputSink {

    private final PrintStream target;

    public PrintStreamOutputSink(final PrintStream target) {
        this.target = Objects.requireNonNull(target, "target");
    }

    /**
     * Binds to the stream that is {@code System.out} right now, so later redirection does not affect it.
     */
    public static PrintStreamOutputSink ofStdout() {
        return new PrintStreamOutputSink(System.out);
    }

    @Override
    public void print(final String text) {
        target.print(text);
    }

    @Override
    public void flush() {
        target.flush();
    }
}
