package com.example.demo.formulaengine.config;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Compiler settings.
 *
 * Example application.yml:
 *
 * formula-engine:
 *   compiler:
 *     vectorize: true
 *     delete-unreferenced-hardcoded-values: false
 *     parallelism: 4
 *     range-expansion-limit: 10000
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Component
@ConfigurationProperties(prefix = "formula-engine.compiler")
public class CompilerProperties {

    /**
     * Collapse dragged formulas into loops. When false every formula cell is emitted on its own.
     */
    @Builder.Default
    private boolean vectorize = true;

    /**
     * Only emit hardcoded input cells that some formula reads
     */
    @Builder.Default
    private boolean deleteUnreferencedHardcodedValues = false;

    /**
     * Worker threads used to translate formulas; 1 translates on the calling thread
     */
    @Builder.Default
    private int parallelism = 1;

    /**
     * Ranges covering more cells than this are matched against formula cells by containment
     * instead of being enumerated
     */
    @Builder.Default
    private long rangeExpansionLimit = 10000;
}
