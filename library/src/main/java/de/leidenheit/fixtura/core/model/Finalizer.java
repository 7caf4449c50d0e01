package de.leidenheit.fixtura.core.model;

@FunctionalInterface
public interface Finalizer {

    void run() throws Exception;
}
