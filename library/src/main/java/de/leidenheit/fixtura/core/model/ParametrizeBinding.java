package de.leidenheit.fixtura.core.model;

import com.google.common.base.Splitter;
import de.leidenheit.fixtura.core.exception.FixturaIllegalStateException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * One parametrize group: comma separated argument names and the rows bound to them in turn.
 * A row is a {@link List}, an {@code Object[]} or a bare scalar for a single name.
 */
public record ParametrizeBinding(String namesCsv, List<Object> rows) {

    private static final Splitter NAME_SPLITTER = Splitter.on(',').trimResults();

    public ParametrizeBinding {
        if (namesCsv == null || namesCsv.isBlank()) {
            throw new FixturaIllegalStateException("Parametrize names must not be empty");
        }
        // rows may hold null scalars
        rows = Collections.unmodifiableList(new ArrayList<>(rows));
    }

    public static ParametrizeBinding of(final String namesCsv, final Object... rows) {
        return new ParametrizeBinding(namesCsv, Arrays.asList(rows));
    }

    public List<String> parameterNames() {
        return NAME_SPLITTER.splitToList(namesCsv);
    }

    public static List<Object> rowValues(final Object row) {
        if (row instanceof List<?> list) return Collections.unmodifiableList(list);
        if (row instanceof Object[] array) return Arrays.asList(array);
        return Collections.singletonList(row);
    }
}
