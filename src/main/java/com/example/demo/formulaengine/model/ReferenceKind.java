package com.example.demo.formulaengine.model;

public enum ReferenceKind {
    CELL,
    RANGE,
    TABLE
}
