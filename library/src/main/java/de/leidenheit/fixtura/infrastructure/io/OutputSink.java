package de.leidenheit.fixtura.infrastructure.io;

/**
 * The single channel for user facing output of a run.
 */
public interface OutputSink {

    void print(final String text);

    void flush();

    default void println(final String text) {
        print(text + System.lineSeparator());
    }

    default void println() {
        print(System.lineSeparator());
    }
}
