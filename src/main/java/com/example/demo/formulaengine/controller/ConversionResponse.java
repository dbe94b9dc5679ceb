package com.example.demo.formulaengine.controller;

import com.example.demo.formulaengine.model.CrossSheetReference;
import com.example.demo.formulaengine.model.Diagnostic;
import com.example.demo.formulaengine.model.ExternalReference;
import com.example.demo.formulaengine.model.GroupDescriptor;
import com.example.demo.formulaengine.model.IssueKind;
import com.example.demo.formulaengine.service.CompilationResult;
import com.example.demo.formulaengine.service.CompilationSummary;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * JSON body returned by the conversion endpoint.
 */
@Value
@Builder
public class ConversionResponse {

    String script;
    List<DiagnosticView> diagnostics;
    List<GroupDescriptor> groups;
    Map<String, Set<String>> externalFiles;
    List<CrossSheetReference> crossSheetReferences;
    List<ExternalReference> externalReferences;
    CompilationSummary summary;

    @Value
    public static class DiagnosticView {
        /** e.g. "Sheet1!A1" */
        String cell;
        IssueKind kind;
        String message;
    }

    public static ConversionResponse from(CompilationResult result) {
        return ConversionResponse.builder()
                .script(result.getScript().getSource())
                .diagnostics(result.getDiagnostics().stream()
                        .map(ConversionResponse::view)
                        .collect(Collectors.toList()))
                .groups(result.getGroups())
                .externalFiles(result.getReferences().getExternalFiles())
                .crossSheetReferences(result.getReferences().getCrossSheetReferences())
                .externalReferences(result.getReferences().getExternalReferences())
                .summary(result.getSummary())
                .build();
    }

    private static DiagnosticView view(Diagnostic diagnostic) {
        return new DiagnosticView(diagnostic.getCell().toString(), diagnostic.getKind(), diagnostic.getMessage());
    }
}
