package com.lawgraph.controller;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.lawgraph.dto.request.BatchExtractionRequest;
import com.lawgraph.dto.request.ExtractionRequest;
import com.lawgraph.dto.response.ExtractionResponse;
import com.lawgraph.model.ExtractionResult;
import com.lawgraph.service.data.DictionaryLoaderService;
import com.lawgraph.service.extraction.BatchExtractionService;
import com.lawgraph.service.extraction.CitationExtractionService;
import com.lawgraph.service.verify.VerificationService;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class CitationController {

    private final CitationExtractionService extractionService;
    private final BatchExtractionService batchExtractionService;
    private final DictionaryLoaderService dictionaryLoaderService;
    private final VerificationService verificationService;

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        log.debug("Health check requested");

        Map<String, Object> health = new HashMap<>();
        health.put("status", "healthy");
        health.put("timestamp", Instant.now().toString());
        health.put("service", "Law Graph API");

        Map<String, Object> features = new HashMap<>();
        try {
            features.put("verifier", verificationService.isActive());
            features.put("dictionary_laws", dictionaryLoaderService.getDictionary().size());
        } catch (Exception e) {
            log.warn("Failed to get feature status: {}", e.getMessage());
            features.put("verifier", false);
        }
        health.put("features", features);

        return ResponseEntity.ok(health);
    }

    @PostMapping("/citations/extract")
    public ResponseEntity<?> extract(@Valid @RequestBody ExtractionRequest request) {
        log.info("Extraction requested for {}", request.getLawId());

        boolean hasXml = request.getXml() != null && !request.getXml().isBlank();
        boolean hasText = request.getText() != null && !request.getText().isBlank();
        if (!hasXml && !hasText) {
            return ResponseEntity.badRequest()
                    .body(Map.of("error", "Either xml or text is required", "lawId", request.getLawId()));
        }

        try {
            ExtractionResult result = hasXml
                    ? extractionService.extractXml(request.getXml(), request.getLawId())
                    : extractionService.extractText(request.getText(), request.getLawId());
            return ResponseEntity.ok(ExtractionResponse.from(result, Boolean.TRUE.equals(request.getIncludeCitations())));

        } catch (Exception e) {
            log.error("Extraction failed for: {}", request.getLawId(), e);
            return ResponseEntity.internalServerError()
                    .body(Map.of(
                        "error", String.valueOf(e.getMessage()),
                        "lawId", request.getLawId()
                    ));
        }
    }

    @PostMapping("/citations/batch")
    public ResponseEntity<?> extractBatch(@Valid @RequestBody BatchExtractionRequest request) {
        log.info("Batch extraction requested: {} documents", request.getDocuments().size());

        try {
            List<ExtractionResponse> responses = batchExtractionService.extractAll(request.getDocuments()).stream()
                    .map(r -> ExtractionResponse.from(r, false))
                    .toList();
            return ResponseEntity.ok(Map.of("total", responses.size(), "results", responses));

        } catch (Exception e) {
            log.error("Batch extraction failed", e);
            return ResponseEntity.internalServerError()
                    .body(Map.of("error", String.valueOf(e.getMessage())));
        }
    }
}
