package de.leidenheit.fixtura.infrastructure.diagnostics;

import com.google.common.base.Strings;
import com.google.common.base.Throwables;
import de.leidenheit.fixtura.core.exception.FixtureProtocolViolationException;
import de.leidenheit.fixtura.core.model.Arguments;
import de.leidenheit.fixtura.infrastructure.io.OutputSink;
import de.leidenheit.fixtura.infrastructure.settings.FixturaSettings;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;

/**
 * Renders progress and failure reports of single test invocations to the output sink.
 */
@Slf4j
public class OutcomeReporter {

    private final OutputSink sink;
    private final FixturaSettings settings;
    private final AssertionAnalyzer assertionAnalyzer;

    public OutcomeReporter(final OutputSink sink, final FixturaSettings settings) {
        this(sink, settings, new AssertionAnalyzer(settings.getSourceRoots()));
    }

    public OutcomeReporter(final OutputSink sink, final FixturaSettings settings, final AssertionAnalyzer assertionAnalyzer) {
        this.sink = sink;
        this.settings = settings;
        this.assertionAnalyzer = assertionAnalyzer;
    }

    public void started(final String displayName) {
        if (settings.isVerbose()) {
            sink.print(displayName + "...");
            sink.flush();
        }
    }

    public void success() {
        if (settings.isVerbose()) {
            sink.println(" Success");
        } else {
            sink.print(".");
            sink.flush();
        }
    }

    public void aborted() {
        sink.println();
        sink.println("ABORTED");
    }

    public void failure(final String displayName,
                        final Throwable failure,
                        final String stdout,
                        final String stderr,
                        final Arguments arguments) {
        sink.println();
        if (!settings.isVerbose()) {
            sink.println();
        }
        sink.println("Failed: " + displayName);
        sink.println();
        sink.println(Throwables.getStackTraceAsString(failure));

        if (!Strings.isNullOrEmpty(stdout)) {
            sink.println("--- stdout ---");
            sink.println(stdout);
        }
        if (!Strings.isNullOrEmpty(stderr)) {
            sink.println("--- stderr ---");
            sink.println(stderr);
        }

        if (!settings.isQuiet()) {
            printLocalVariables(arguments);
            if (settings.isAnalyzeAssertions() && failure instanceof AssertionError assertionError) {
                assertionAnalyzer.analyze(assertionError, sink);
            }
        }
    }

    public void teardownFailures(final String displayName, final List<Exception> failures) {
        for (Exception failure : failures) {
            sink.println();
            sink.println("Teardown failed: " + displayName);
            sink.println(Throwables.getStackTraceAsString(failure));
        }
    }

    public void protocolViolation(final String displayName, final FixtureProtocolViolationException violation) {
        log.error("Stopping run, fixture '{}' violated the setup/teardown protocol in '{}'",
                violation.getFixtureName(), displayName);
        sink.println();
        sink.println("Setup/teardown fixture '%s' has more than one teardown (in %s)"
                .formatted(violation.getFixtureName(), displayName));
    }

    private void printLocalVariables(final Arguments arguments) {
        sink.println("--- Local variables ---");
        for (Map.Entry<String, Object> entry : arguments.asMap().entrySet()) {
            sink.println(entry.getKey() + ":");
            try {
                sink.println("    " + repr(entry.getValue()));
            } catch (RuntimeException e) {
                log.warn("Representation of '{}' failed", entry.getKey(), e);
                sink.println("    Error getting local variable repr: " + e);
            }
        }
    }

    private static String repr(final Object value) {
        if (value instanceof CharSequence text) {
            return "\"" + text + "\"";
        }
        return String.valueOf(value);
    }
}
