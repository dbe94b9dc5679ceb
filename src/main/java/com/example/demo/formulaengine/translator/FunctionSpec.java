package com.example.demo.formulaengine.translator;

import lombok.Value;

/**
 * Mapping of one Excel function to its runtime helper.
 */
@Value
public class FunctionSpec {

    String targetName;
}
