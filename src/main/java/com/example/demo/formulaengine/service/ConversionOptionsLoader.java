package com.example.demo.formulaengine.service;

import com.example.demo.formulaengine.config.CompilerProperties;
import com.example.demo.formulaengine.config.ConversionOptions;
import com.example.demo.formulaengine.exception.WorkbookLoadingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;

/**
 * Resolves the compiler settings for one conversion from an optional uploaded YAML file.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConversionOptionsLoader {

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final CompilerProperties defaults;

    /**
     * @param yaml options document, or null for the application defaults
     * @throws WorkbookLoadingException with code INVALID_OPTIONS when the document is not valid YAML
     */
    public CompilerProperties load(InputStream yaml) {
        if (yaml == null) {
            return defaults;
        }
        try {
            ConversionOptions options = yamlMapper.readValue(yaml, ConversionOptions.class);
            if (options == null) {
                return defaults;
            }
            log.debug("Applying conversion options: {}", options);
            return options.applyTo(defaults);
        } catch (IOException e) {
            throw new WorkbookLoadingException("INVALID_OPTIONS", "Options file is not valid YAML: " + e.getMessage(), e);
        }
    }
}
