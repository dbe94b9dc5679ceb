package com.example.demo.formulaengine.controller;

import com.example.demo.formulaengine.config.CompilerProperties;
import com.example.demo.formulaengine.exception.FormulaCompilationException;
import com.example.demo.formulaengine.exception.WorkbookLoadingException;
import com.example.demo.formulaengine.model.WorkbookSnapshot;
import com.example.demo.formulaengine.service.BundleWriter;
import com.example.demo.formulaengine.service.CompilationCheckpoint;
import com.example.demo.formulaengine.service.CompilationResult;
import com.example.demo.formulaengine.service.ConversionOptionsLoader;
import com.example.demo.formulaengine.service.FormulaCompilationService;
import com.example.demo.formulaengine.service.WorkbookLoader;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.util.HashMap;
import java.util.Map;

/**
 * REST API for workbook conversion
 */
@Slf4j
@RestController
@RequestMapping("/api/conversions")
@RequiredArgsConstructor
public class ConversionController {
    private final WorkbookLoader workbookLoader;
    private final ConversionOptionsLoader conversionOptionsLoader;
    private final FormulaCompilationService compilationService;
    private final BundleWriter bundleWriter;

    /**
     * Compile an uploaded workbook and return the generated script with its diagnostics.
     *
     * POST /api/conversions (multipart)
     *   file:   the .xlsx workbook
     *   config: optional YAML, e.g. "vectorize: false"
     *
     * @return {script, diagnostics, groups, externalFiles, crossSheetReferences, externalReferences, summary}
     */
    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> convert(
            @RequestParam("file") MultipartFile file,
            @RequestParam(value = "config", required = false) MultipartFile config) {
        log.info("Received conversion request for workbook: {} ({} bytes)", file.getOriginalFilename(), file.getSize());
        try {
            WorkbookSnapshot snapshot = load(file);
            CompilationResult result = compilationService.compile(snapshot, options(config), CompilationCheckpoint.NONE);
            return ResponseEntity.ok(ConversionResponse.from(result));
        } catch (WorkbookLoadingException wle) {
            return loadingError(wle);
        } catch (FormulaCompilationException fce) {
            return compilationError(fce);
        }
    }

    /**
     * Compile an uploaded workbook and download calculate.py, xl_runtime.py, input_template.xlsx
     * and input_files_config.json as one zip.
     */
    @PostMapping(value = "/bundle", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> bundle(
            @RequestParam("file") MultipartFile file,
            @RequestParam(value = "config", required = false) MultipartFile config) {
        log.info("Received bundle request for workbook: {}", file.getOriginalFilename());
        try {
            WorkbookSnapshot snapshot = load(file);
            CompilationResult result = compilationService.compile(snapshot, options(config), CompilationCheckpoint.NONE);
            byte[] zip = bundleWriter.write(snapshot, result);

            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.parseMediaType("application/zip"));
            headers.setContentDispositionFormData("attachment", "calculator.zip");
            headers.setContentLength(zip.length);

            return new ResponseEntity<>(zip, headers, HttpStatus.OK);
        } catch (WorkbookLoadingException wle) {
            return loadingError(wle);
        } catch (FormulaCompilationException fce) {
            return compilationError(fce);
        }
    }

    /**
     * Health check endpoint
     */
    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("Formula conversion service is running");
    }

    private WorkbookSnapshot load(MultipartFile file) {
        try (InputStream in = file.getInputStream()) {
            return workbookLoader.load(in);
        } catch (IOException e) {
            throw new WorkbookLoadingException("WORKBOOK_UNREADABLE", "Upload could not be read: " + e.getMessage(), e);
        }
    }

    private CompilerProperties options(MultipartFile config) {
        if (config == null || config.isEmpty()) {
            return conversionOptionsLoader.load(null);
        }
        try (InputStream in = config.getInputStream()) {
            return conversionOptionsLoader.load(in);
        } catch (IOException e) {
            throw new WorkbookLoadingException("INVALID_OPTIONS", "Options file could not be read: " + e.getMessage(), e);
        }
    }

    private ResponseEntity<Map<String, String>> loadingError(WorkbookLoadingException wle) {
        log.warn("Rejected workbook: {}", wle.getMessage());
        Map<String, String> body = new HashMap<>();
        body.put("code", wle.getCode());
        body.put("description", wle.getDescription());
        return new ResponseEntity<>(body, HttpStatus.BAD_REQUEST);
    }

    private ResponseEntity<Map<String, String>> compilationError(FormulaCompilationException fce) {
        log.error("Compilation failed: {}", fce.getMessage(), fce);
        Map<String, String> body = new HashMap<>();
        body.put("code", "COMPILATION_FAILED");
        body.put("description", fce.getMessage());
        return new ResponseEntity<>(body, HttpStatus.UNPROCESSABLE_ENTITY);
    }
}
