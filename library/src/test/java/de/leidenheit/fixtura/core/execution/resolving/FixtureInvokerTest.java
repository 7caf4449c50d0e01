package de.leidenheit.fixtura.core.execution.resolving;

import de.leidenheit.fixtura.core.exception.FixtureProtocolViolationException;
import de.leidenheit.fixtura.core.execution.context.ExecutionContext;
import de.leidenheit.fixtura.core.model.Arguments;
import de.leidenheit.fixtura.core.model.Fixture;
import de.leidenheit.fixtura.core.model.Yield;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FixtureInvokerTest {

    private final FixtureInvoker invoker = new FixtureInvoker();

    @Test
    void testPlainProviderIsCachedPerContext() throws Exception {
        // given
        var calls = new AtomicInteger();
        var fixture = Fixture.builder().name("counter").provider(arguments -> calls.incrementAndGet()).build();
        var context = ExecutionContext.forFunction(null, null);

        // when
        var first = invoker.invoke(fixture, context, Arguments.empty());
        var second = invoker.invoke(fixture, context, Arguments.empty());
        var other = invoker.invoke(fixture, ExecutionContext.forFunction(null, null), Arguments.empty());

        // then
        assertThat(first).isEqualTo(1);
        assertThat(second).isEqualTo(1);
        assertThat(other).isEqualTo(2);
        assertThat(context.hasResult("counter")).isTrue();
        assertThat(context.finalizerCount()).isZero();
    }

    @Test
    void testSetupTeardownProviderSchedulesTeardown() throws Exception {
        // given
        List<String> events = new ArrayList<>();
        var fixture = Fixture.builder()
                .name("resource")
                .provider(arguments -> {
                    events.add("setup");
                    return Yield.of("handle", () -> events.add("teardown"));
                })
                .build();
        var context = ExecutionContext.forFunction(null, null);

        // when
        var value = invoker.invoke(fixture, context, Arguments.empty());
        var cached = invoker.invoke(fixture, context, Arguments.empty());

        // then
        assertThat(value).isEqualTo("handle");
        assertThat(cached).isEqualTo("handle");
        assertThat(context.getResult("resource")).isInstanceOf(Yield.class);
        assertThat(events).containsExactly("setup");

        context.teardown();
        assertThat(events).containsExactly("setup", "teardown");
    }

    @Test
    void testCurrentFixtureSetupIsTracked() throws Exception {
        // given
        var context = ExecutionContext.forFunction(null, null);
        List<String> seen = new ArrayList<>();
        var fixture = Fixture.builder()
                .name("observer")
                .provider(arguments -> seen.add(context.getCurrentFixtureSetup()))
                .build();

        // when
        invoker.invoke(fixture, context, Arguments.empty());

        // then
        assertThat(seen).containsExactly("observer");
        assertThat(context.getCurrentFixtureSetup()).isNull();
    }

    @Test
    void testReusedYieldViolatesProtocol() throws Exception {
        // given
        var shared = Yield.of("once", () -> {
        });
        var fixture = Fixture.builder().name("reused").provider(arguments -> shared).build();
        var firstContext = ExecutionContext.forFunction(null, null);
        invoker.invoke(fixture, firstContext, Arguments.empty());
        firstContext.teardown();

        // when & then
        assertThatThrownBy(() -> invoker.invoke(fixture, ExecutionContext.forFunction(null, null), Arguments.empty()))
                .isInstanceOf(FixtureProtocolViolationException.class)
                .hasMessageContaining("'reused'");
    }
}
