package com.example.demo.formulaengine.service;

import org.apache.poi.ss.usermodel.Workbook;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Serializes generated workbooks to bytes for HTTP responses and bundles.
 */
@Component
public class WorkbookOutputService {

    /**
     * Write and close the workbook.
     */
    public byte[] toBytes(Workbook workbook) {
        try (Workbook wb = workbook; ByteArrayOutputStream baos = new ByteArrayOutputStream()) {
            wb.write(baos);
            return baos.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to serialize Excel workbook", e);
        }
    }
}
