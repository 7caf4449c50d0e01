package de.leidenheit.fixtura.core.model;

import com.google.common.base.Strings;
import de.leidenheit.fixtura.core.exception.FixturaUnsupportedException;

import java.util.Arrays;
import java.util.Locale;

public enum FixtureScope {
    FUNCTION,
    CLASS,
    MODULE,
    PACKAGE,
    SESSION;

    public static FixtureScope of(final String scope) {
        if (Strings.isNullOrEmpty(scope)) return FUNCTION;
        return Arrays.stream(values())
                .filter(value -> value.name().equals(scope.trim().toUpperCase(Locale.ROOT)))
                .findFirst()
                .orElseThrow(() -> new FixturaUnsupportedException("Unknown fixture scope '%s'".formatted(scope)));
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
