package de.leidenheit.fixtura.assertion;

import java.util.regex.Pattern;

/**
 * Asserts that a piece of code throws.
 */
public final class Raises {

    @FunctionalInterface
    public interface Action {
        void run() throws Exception;
    }

    private Raises() {
    }

    public static <T extends Throwable> ExceptionInfo<T> raises(final Class<T> expectedType, final Action action) throws Exception {
        return raises(expectedType, null, action);
    }

    /**
     * @param match regular expression the exception message has to match from its start, or {@code null}
     * @throws AssertionError if nothing was thrown or the message does not match
     * @throws Exception      the thrown exception itself when it is not of the expected type
     */
    public static <T extends Throwable> ExceptionInfo<T> raises(final Class<T> expectedType,
                                                                final String match,
                                                                final Action action) throws Exception {
        try {
            action.run();
        } catch (Exception | Error e) {
            if (!expectedType.isInstance(e)) {
                throw e;
            }
            if (match != null && !Pattern.compile(match).matcher(String.valueOf(e.getMessage())).lookingAt()) {
                throw new AssertionError("Pattern '%s' does not match '%s'".formatted(match, e.getMessage()), e);
            }
            return new ExceptionInfo<>(e.getClass(), expectedType.cast(e));
        }
        throw new AssertionError("Did not raise " + expectedType.getName());
    }
}
