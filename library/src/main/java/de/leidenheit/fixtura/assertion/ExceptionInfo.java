package de.leidenheit.fixtura.assertion;

/**
 * The exception caught by {@link Raises} together with its concrete type.
 */
public record ExceptionInfo<T extends Throwable>(Class<? extends Throwable> type, T value) {

    public String getMessage() {
        return value.getMessage();
    }

    @Override
    public String toString() {
        return "<ExceptionInfo: type=%s value=%s>".formatted(type.getName(), value);
    }
}
