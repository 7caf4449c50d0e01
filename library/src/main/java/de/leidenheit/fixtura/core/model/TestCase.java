package de.leidenheit.fixtura.core.model;

import lombok.Builder;
import lombok.Data;
import lombok.Singular;

import java.util.List;
import java.util.Set;

/**
 * A test callable together with the fixture names it declares, its markers and its parametrize groups.
 */
@Data
@Builder
public class TestCase {
    private final String name;
    @Singular
    private final List<String> parameters;
    private final TestBody body;
    @Singular
    private final Set<Marker> markers;
    @Singular("parametrize")
    private final List<ParametrizeBinding> parametrizeGroups;

    public boolean isSkipped() {
        return markers.stream().anyMatch(Marker::isSkip);
    }

    public boolean isParametrized() {
        return !parametrizeGroups.isEmpty();
    }
}
