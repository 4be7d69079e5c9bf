package com.lawgraph.service.extraction;

import com.lawgraph.model.ExtractionResult;
import com.lawgraph.model.ParseWarning;
import com.lawgraph.model.WarningType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Extracts many laws in parallel, one worker per document.
 *
 * <p>Workers share nothing but the read-only dictionary. A document that
 * fails yields a failed result carrying a warning; the rest of the batch is
 * unaffected. Results come back in input order.
 */
@Slf4j
@Service
public class BatchExtractionService {

    private final CitationExtractionService extractionService;
    private final Executor extractionExecutor;

    public BatchExtractionService(CitationExtractionService extractionService,
                                  @Qualifier("extractionExecutor") Executor extractionExecutor) {
        this.extractionService = extractionService;
        this.extractionExecutor = extractionExecutor;
    }

    /**
     * @param documents law id to statute XML, in the order results should be returned
     */
    public List<ExtractionResult> extractAll(Map<String, String> documents) {
        log.info("Batch extraction started: {} documents", documents.size());
        long start = System.currentTimeMillis();

        Map<String, CompletableFuture<ExtractionResult>> futures = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : documents.entrySet()) {
            String lawId = entry.getKey();
            String xml = entry.getValue();
            futures.put(lawId, CompletableFuture
                    .supplyAsync(() -> extractionService.extractXml(xml, lawId), extractionExecutor)
                    .exceptionally(e -> failed(lawId, e)));
        }

        List<ExtractionResult> results = new ArrayList<>(futures.size());
        for (CompletableFuture<ExtractionResult> future : futures.values()) {
            results.add(future.join());
        }

        long failures = results.stream().filter(ExtractionResult::isFailed).count();
        int edges = results.stream().mapToInt(r -> r.getEdges().size()).sum();
        log.info("Batch extraction finished: {} documents, {} edges, {} failed in {}ms",
                results.size(), edges, failures, System.currentTimeMillis() - start);
        return results;
    }

    private ExtractionResult failed(String lawId, Throwable e) {
        Throwable cause = e.getCause() != null ? e.getCause() : e;
        log.error("Extraction failed for {}: {}", lawId, cause.getMessage(), cause);
        return ExtractionResult.builder()
                .lawId(lawId)
                .warning(ParseWarning.of(WarningType.STRUCTURAL_PARSE,
                        "Document could not be processed: " + cause.getMessage(), lawId))
                .error(cause.getClass().getSimpleName() + ": " + cause.getMessage())
                .build();
    }
}
