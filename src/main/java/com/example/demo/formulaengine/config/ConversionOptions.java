package com.example.demo.formulaengine.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * Per-upload overrides of the compiler settings, read from a YAML document such as:
 *
 * vectorize: false
 * delete_unreferenced_hardcoded_values: true
 *
 * Absent keys keep the application defaults.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ConversionOptions {

    private Boolean vectorize;

    @JsonProperty("delete_unreferenced_hardcoded_values")
    private Boolean deleteUnreferencedHardcodedValues;

    public CompilerProperties applyTo(CompilerProperties defaults) {
        CompilerProperties.CompilerPropertiesBuilder builder = defaults.toBuilder();
        if (vectorize != null) {
            builder.vectorize(vectorize);
        }
        if (deleteUnreferencedHardcodedValues != null) {
            builder.deleteUnreferencedHardcodedValues(deleteUnreferencedHardcodedValues);
        }
        return builder.build();
    }
}
