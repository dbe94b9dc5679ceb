package com.example.demo.formulaengine.service;

import com.example.demo.formulaengine.emitter.EmittedScript;
import com.example.demo.formulaengine.model.WorkbookSnapshot;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Packs every artifact of a compilation into one zip: the script, its runtime module, the input
 * template and, when the workbook links other files, the external file configuration.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BundleWriter {

    public static final String EXTERNAL_CONFIG_FILE = "input_files_config.json";

    private final ObjectMapper jsonMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    private final ReferenceAnalyzer referenceAnalyzer;
    private final InputTemplateWriter inputTemplateWriter;
    private final WorkbookOutputService workbookOutputService;

    public byte[] write(WorkbookSnapshot snapshot, CompilationResult result) {
        EmittedScript script = result.getScript();
        byte[] template = workbookOutputService.toBytes(inputTemplateWriter.write(snapshot, result.getInputCells()));
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream();
             ZipOutputStream zip = new ZipOutputStream(baos)) {
            entry(zip, script.getFileName(), script.getSource().getBytes(StandardCharsets.UTF_8));
            entry(zip, script.getRuntimeFileName(), script.getRuntimeSource().getBytes(StandardCharsets.UTF_8));
            entry(zip, InputTemplateWriter.TEMPLATE_FILE, template);
            Map<String, String> externalConfig = referenceAnalyzer.externalFilesConfig(result.getReferences());
            if (!externalConfig.isEmpty()) {
                entry(zip, EXTERNAL_CONFIG_FILE, jsonMapper.writeValueAsBytes(externalConfig));
            }
            zip.finish();
            log.info("Bundle written: {} bytes, {} external files", baos.size(), externalConfig.size());
            return baos.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write conversion bundle", e);
        }
    }

    private static void entry(ZipOutputStream zip, String name, byte[] content) throws IOException {
        zip.putNextEntry(new ZipEntry(name));
        zip.write(content);
        zip.closeEntry();
    }
}
