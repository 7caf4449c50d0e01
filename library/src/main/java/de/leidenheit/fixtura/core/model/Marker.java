package de.leidenheit.fixtura.core.model;

public record Marker(String name, String reason) {

    public static final String SKIP = "skip";

    public static Marker skip() {
        return new Marker(SKIP, null);
    }

    public static Marker skip(final String reason) {
        return new Marker(SKIP, reason);
    }

    public boolean isSkip() {
        return SKIP.equals(name);
    }
}
