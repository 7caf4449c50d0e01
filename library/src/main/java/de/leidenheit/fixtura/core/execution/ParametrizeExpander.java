package de.leidenheit.fixtura.core.execution;

import de.leidenheit.fixtura.core.execution.context.ExecutionContext;
import de.leidenheit.fixtura.core.model.Arguments;
import de.leidenheit.fixtura.core.model.Invocation;
import de.leidenheit.fixtura.core.model.ParametrizeBinding;
import de.leidenheit.fixtura.core.model.TestCase;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Runs a test once per combination of its parametrize groups, first group varying slowest.
 */
@Slf4j
public class ParametrizeExpander {

    private final TestExecutor executor;
    private final RunController runController;

    public ParametrizeExpander(final TestExecutor executor, final RunController runController) {
        this.executor = executor;
        this.runController = runController;
    }

    /**
     * Executes every combination in order and stops as soon as the run controller asks to.
     */
    public void expand(final TestCase testCase, final ExecutionContext parent) {
        expand(testCase.getName(), testCase, testCase.getParametrizeGroups(), parent);
    }

    public void expand(final String testName,
                       final TestCase testCase,
                       final List<ParametrizeBinding> bindingStack,
                       final ExecutionContext parent) {
        visit(testName, bindingStack, new LinkedHashMap<>(), invocation -> {
            executor.execute(testCase, invocation.displayName(), invocation.arguments(), parent);
            return !runController.shouldStop();
        });
    }

    /**
     * @return every combination of the test's parametrize groups without running anything
     */
    public static List<Invocation> invocations(final TestCase testCase) {
        List<Invocation> invocations = new ArrayList<>();
        visit(testCase.getName(), testCase.getParametrizeGroups(), new LinkedHashMap<>(), invocations::add);
        return invocations;
    }

    /**
     * @param leaf consumes one combination; returning {@code false} ends the expansion
     * @return {@code false} if the expansion was ended early
     */
    private static boolean visit(final String testName,
                                 final List<ParametrizeBinding> bindingStack,
                                 final Map<String, Object> accumulated,
                                 final Predicate<Invocation> leaf) {
        if (bindingStack.isEmpty()) {
            return leaf.test(new Invocation(displayName(testName, accumulated), Arguments.of(accumulated)));
        }

        var binding = bindingStack.get(0);
        var names = binding.parameterNames();
        for (Object row : binding.rows()) {
            var values = ParametrizeBinding.rowValues(row);
            if (values.size() != names.size()) {
                log.warn("Parametrize row {} of '{}' does not match names {}", values, testName, names);
            }

            Map<String, Object> bound = new LinkedHashMap<>(accumulated);
            for (int i = 0; i < Math.min(names.size(), values.size()); i++) {
                // bindings of an outer group win over inner ones of the same name
                bound.putIfAbsent(names.get(i), values.get(i));
            }
            if (!visit(testName, bindingStack.subList(1, bindingStack.size()), bound, leaf)) {
                return false;
            }
        }
        return true;
    }

    static String displayName(final String testName, final Map<String, Object> bindings) {
        return bindings.entrySet().stream()
                .map(entry -> entry.getKey() + "=" + entry.getValue())
                .collect(Collectors.joining(", ", testName + "[", "]"));
    }
}
