package de.leidenheit.fixtura.core.execution.context;

import de.leidenheit.fixtura.core.exception.FixturaIllegalStateException;
import de.leidenheit.fixtura.core.exception.FixtureProtocolViolationException;
import de.leidenheit.fixtura.core.model.FixtureScope;
import de.leidenheit.fixtura.core.model.Yield;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExecutionContextTest {

    @Test
    void testFinalizersRunInReverseOrderExactlyOnce() {
        // given
        List<String> events = new ArrayList<>();
        var context = ExecutionContext.forFunction(ExecutionContext.forModule(), null);
        context.addFinalizer(() -> events.add("first"));
        context.addFinalizer(() -> events.add("second"));
        context.addFinalizer(() -> events.add("third"));

        // when
        var failures = context.teardown();
        var again = context.teardown();

        // then
        assertThat(events).containsExactly("third", "second", "first");
        assertThat(failures).isEmpty();
        assertThat(again).isEmpty();
        assertThat(context.isTornDown()).isTrue();
        assertThat(context.getScope()).isEqualTo(FixtureScope.FUNCTION);
        assertThat(context.getParent().getScope()).isEqualTo(FixtureScope.MODULE);
    }

    @Test
    void testFailingFinalizerDoesNotStopTheOthers() {
        // given
        List<String> events = new ArrayList<>();
        var context = ExecutionContext.forModule();
        context.addFinalizer(() -> events.add("outer"));
        context.addFinalizer(() -> {
            throw new IllegalStateException("cleanup broke");
        });
        context.addFinalizer(() -> events.add("inner"));

        // when
        var failures = context.teardown();

        // then
        assertThat(events).containsExactly("inner", "outer");
        assertThat(failures).singleElement()
                .satisfies(failure -> assertThat(failure).hasMessage("cleanup broke"));
    }

    @Test
    void testProtocolViolationIsRaisedAfterAllFinalizers() throws Exception {
        // given
        List<String> events = new ArrayList<>();
        var guard = Yield.of("value", () -> events.add("resumed"));
        guard.resume("twice");
        var context = ExecutionContext.forModule();
        context.addFinalizer(() -> events.add("last"));
        context.addFinalizer(() -> guard.resume("twice"));
        context.addFinalizer(() -> events.add("first"));

        // when & then
        assertThatThrownBy(context::teardown)
                .isInstanceOf(FixtureProtocolViolationException.class)
                .hasMessageContaining("'twice'");
        assertThat(events).containsExactly("resumed", "first", "last");
    }

    @Test
    void testNoFinalizersAfterTeardown() {
        // given
        var context = ExecutionContext.forModule();
        context.teardown();

        // when & then
        assertThatThrownBy(() -> context.addFinalizer(() -> {
        })).isInstanceOf(FixturaIllegalStateException.class);
    }
}
