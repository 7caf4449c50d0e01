package de.leidenheit.fixtura.core.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class Fixture {
    private final String name;
    @Builder.Default
    private final List<String> dependencies = List.of();
    private final FixtureProvider provider;
    @Builder.Default
    private final FixtureScope scope = FixtureScope.FUNCTION;
    private final boolean autouse;
}
