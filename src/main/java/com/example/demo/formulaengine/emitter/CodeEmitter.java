package com.example.demo.formulaengine.emitter;

/**
 * Writes an evaluation plan out as source code of a target language.
 *
 * Implementations must keep the plan's order, emit exactly one loop per vectorized group and
 * guard every assignment so one failing cell cannot stop the rest of the script.
 */
public interface CodeEmitter {

    /**
     * @return the generated script and its runtime support module
     */
    EmittedScript emit(EmitRequest request);

    /**
     * Language the emitter writes, e.g. "python"
     */
    String getLanguage();
}
