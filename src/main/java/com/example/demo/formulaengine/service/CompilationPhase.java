package com.example.demo.formulaengine.service;

public enum CompilationPhase {
    RESOLVE,
    TRANSLATE,
    GRAPH,
    SCHEDULE,
    GROUP,
    PLAN,
    EMIT
}
