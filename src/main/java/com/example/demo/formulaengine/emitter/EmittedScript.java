package com.example.demo.formulaengine.emitter;

import com.example.demo.formulaengine.model.Diagnostic;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class EmittedScript {

    String fileName;

    String source;

    /** Module the script imports its Excel functions from */
    String runtimeFileName;

    String runtimeSource;

    /** TRANSLATION_FAILURE diagnostics raised while emitting */
    List<Diagnostic> diagnostics;

    int loopCount;

    int assignmentCount;
}
