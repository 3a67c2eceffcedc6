package org.camunda.bpm.getstarted.migration.web;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.camunda.bpm.getstarted.migration.analysis.BpmnMigrationAnalyzer;
import org.camunda.bpm.getstarted.migration.analysis.models.AnalysisReport;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Upload endpoint for one-off analyses.
 */
@RestController
@Slf4j
@RequiredArgsConstructor
public class AnalysisController {

    private final BpmnMigrationAnalyzer analyzer;
    private final UploadProperties uploadProperties;

    /**
     * Analyzes an uploaded BPMN file.
     *
     * Example:
     * curl -F file=@process.bpmn http://localhost:8080/analyze
     *
     * The file is stored in the upload folder while it is analyzed and removed afterwards,
     * whether or not the analysis succeeds.
     */
    @PostMapping("/analyze")
    public ResponseEntity<Map<String, Object>> analyze(
            @RequestParam(value = "file", required = false) MultipartFile file) throws IOException {
        if (file == null) {
            throw new InvalidUploadException("No file uploaded");
        }
        String filename = sanitize(file.getOriginalFilename());
        if (filename.isEmpty()) {
            throw new InvalidUploadException("No file selected");
        }
        if (!uploadProperties.isAllowed(filename)) {
            throw new InvalidUploadException("Invalid file type. Only .bpmn and .xml files are allowed");
        }

        Path folder = Path.of(uploadProperties.getFolder());
        Files.createDirectories(folder);
        Path stored = Files.createTempFile(folder, "upload-", "-" + filename);
        log.info("Received {} ({} bytes)", filename, file.getSize());
        try {
            file.transferTo(stored);
            AnalysisReport report;
            try (InputStream in = Files.newInputStream(stored)) {
                report = analyzer.analyze(in, filename);
            }
            return ResponseEntity.ok(Map.of("success", true, "data", report));
        } finally {
            Files.deleteIfExists(stored);
        }
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of("status", "ok"));
    }

    // keeps the last path segment and replaces anything outside [A-Za-z0-9._-]
    static String sanitize(String originalFilename) {
        if (originalFilename == null) {
            return "";
        }
        String name = originalFilename.replace('\\', '/');
        name = name.substring(name.lastIndexOf('/') + 1);
        name = name.replaceAll("[^A-Za-z0-9._-]", "_");
        return name.replaceAll("^[._]+", "");
    }
}
