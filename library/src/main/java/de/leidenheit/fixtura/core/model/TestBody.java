package de.leidenheit.fixtura.core.model;

@FunctionalInterface
public interface TestBody {

    void run(final Arguments arguments) throws Exception;
}
