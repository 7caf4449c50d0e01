package de.leidenheit.fixtura.core.registry;

import com.google.common.base.Strings;
import de.leidenheit.fixtura.core.exception.FixturaIllegalStateException;
import de.leidenheit.fixtura.core.exception.FixturaUnsupportedException;
import de.leidenheit.fixtura.core.model.Fixture;
import de.leidenheit.fixtura.core.model.FixtureProvider;
import de.leidenheit.fixtura.core.model.FixtureScope;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Name to fixture mapping. Entries are never removed; registering a name again shadows the previous entry.
 */
@Slf4j
public class FixtureRegistry {

    private final Map<String, Fixture> fixtures = new LinkedHashMap<>();

    public void register(final String name, final FixtureProvider provider) {
        register(name, List.of(), provider, false, FixtureScope.FUNCTION);
    }

    public void register(final String name, final List<String> dependencies, final FixtureProvider provider) {
        register(name, dependencies, provider, false, FixtureScope.FUNCTION);
    }

    public void register(final String name,
                         final List<String> dependencies,
                         final FixtureProvider provider,
                         final boolean autouse,
                         final String scope) {
        register(name, dependencies, provider, autouse, FixtureScope.of(scope));
    }

    public void register(final String name,
                         final List<String> dependencies,
                         final FixtureProvider provider,
                         final boolean autouse,
                         final FixtureScope scope) {
        register(Fixture.builder()
                .name(name)
                .dependencies(List.copyOf(dependencies))
                .provider(provider)
                .autouse(autouse)
                .scope(scope)
                .build());
    }

    public void register(final Fixture fixture) {
        if (Strings.isNullOrEmpty(fixture.getName())) {
            throw new FixturaIllegalStateException("A fixture needs a name");
        }
        Objects.requireNonNull(fixture.getProvider(), "provider");
        if (fixture.getScope() == FixtureScope.PACKAGE) {
            throw new FixturaUnsupportedException("Package scope is not supported at this time (fixture '%s')"
                    .formatted(fixture.getName()));
        }
        if (fixture.getScope() == FixtureScope.CLASS) {
            // class based tests do not exist here
            log.debug("Ignoring class scoped fixture '{}'", fixture.getName());
            return;
        }
        var shadowed = fixtures.put(fixture.getName(), fixture);
        if (shadowed != null) {
            log.debug("Fixture '{}' shadows {}", fixture.getName(), shadowed);
        } else {
            log.debug("Registered fixture '{}' (scope={}, autouse={}, dependencies={})",
                    fixture.getName(), fixture.getScope().label(), fixture.isAutouse(), fixture.getDependencies());
        }
    }

    public Optional<Fixture> lookup(final String name) {
        return Optional.ofNullable(fixtures.get(name));
    }

    public boolean contains(final String name) {
        return fixtures.containsKey(name);
    }

    /**
     * @return names of all fixtures currently registered as autouse, in registration order
     */
    public Set<String> autouseNames() {
        var names = new LinkedHashSet<String>();
        fixtures.values().stream()
                .filter(Fixture::isAutouse)
                .forEach(fixture -> names.add(fixture.getName()));
        return names;
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(fixtures.keySet());
    }
}
