package com.example.demo.formulaengine.model;

import lombok.Value;

import java.util.List;

/**
 * Identity of a formula up to dragging: two cells whose formulas were produced by copying one
 * cell across a sheet share the same key.
 */
@Value
public class PatternKey {

    String sheet;

    /** Formula text with the i-th reference replaced by "@i" */
    String skeleton;

    List<ReferenceDescriptor> references;
}
