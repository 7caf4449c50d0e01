package de.leidenheit.fixtura.infrastructure.io;

/**
 * Collects all output in memory.
 */
public class BufferedOutputSink implements OutputSink {

    private final StringBuilder buffer = new StringBuilder();

    @Override
    public void print(final String text) {
        buffer.append(text);
    }

    @Override
    public void flush() {
        // nothing buffered outside memory
    }

    public String getContent() {
        return buffer.toString();
    }

    @Override
    public String toString() {
        return getContent();
    }
}
