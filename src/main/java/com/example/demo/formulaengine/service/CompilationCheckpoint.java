package com.example.demo.formulaengine.service;

/**
 * Called before each phase of a compilation run. Throwing from it aborts the run; no partial
 * result is returned.
 */
@FunctionalInterface
public interface CompilationCheckpoint {

    CompilationCheckpoint NONE = phase -> { };

    void beforePhase(CompilationPhase phase);
}
