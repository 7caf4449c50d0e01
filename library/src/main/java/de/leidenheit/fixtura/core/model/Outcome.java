package de.leidenheit.fixtura.core.model;

public enum Outcome {
    SUCCESS,
    FAILED,
    ABORTED,
    SKIPPED
}
