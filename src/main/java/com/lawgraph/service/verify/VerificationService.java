package com.lawgraph.service.verify;

import com.lawgraph.config.LawGraphConfig;
import com.lawgraph.model.ParseWarning;
import com.lawgraph.model.WarningType;
import com.lawgraph.model.citation.Citation;
import com.lawgraph.model.citation.ResolutionMethod;
import com.lawgraph.service.scoring.ConfidenceScorer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * Offers weak citations to the optional {@link CitationVerifier}.
 *
 * <p>A citation is offered when it is unresolved or scored below the
 * configured threshold. Every call is bounded by the configured timeout; a
 * timeout, a failure, a full verifier pool or an empty answer leaves the
 * citation as it was. A timed-out call is cancelled with an interrupt so the
 * pool thread is handed back.
 */
@Slf4j
@Service
public class VerificationService {

    private final LawGraphConfig lawGraphConfig;
    private final ObjectProvider<CitationVerifier> verifierProvider;
    private final ConfidenceScorer confidenceScorer;
    private final Executor verifierExecutor;

    public VerificationService(LawGraphConfig lawGraphConfig,
                               ObjectProvider<CitationVerifier> verifierProvider,
                               ConfidenceScorer confidenceScorer,
                               @Qualifier("verifierExecutor") Executor verifierExecutor) {
        this.lawGraphConfig = lawGraphConfig;
        this.verifierProvider = verifierProvider;
        this.confidenceScorer = confidenceScorer;
        this.verifierExecutor = verifierExecutor;
    }

    public boolean isActive() {
        return lawGraphConfig.isVerifierEnabled() && verifierProvider.getIfAvailable() != null;
    }

    /**
     * Verify the weak citations of one text unit.
     *
     * @param citations scored citations
     * @param surroundingContext the text the citations were found in
     * @param warnings receives one warning per failed or timed-out call
     */
    public List<Citation> verify(List<Citation> citations, String surroundingContext, Consumer<ParseWarning> warnings) {
        CitationVerifier verifier = lawGraphConfig.isVerifierEnabled() ? verifierProvider.getIfAvailable() : null;
        if (verifier == null) {
            return citations;
        }

        List<Citation> result = new ArrayList<>(citations.size());
        for (Citation citation : citations) {
            if (!needsVerification(citation)) {
                result.add(citation);
                continue;
            }
            result.add(verifyOne(verifier, citation, surroundingContext, warnings));
        }
        return result;
    }

    boolean needsVerification(Citation citation) {
        return citation.getMethod() == ResolutionMethod.UNRESOLVED
                || citation.getConfidence() < lawGraphConfig.getVerifierThreshold();
    }

    // ============================================================
    // Private Helper Methods
    // ============================================================

    private Citation verifyOne(CitationVerifier verifier, Citation citation, String context,
                               Consumer<ParseWarning> warnings) {
        // cancel(true) on a FutureTask interrupts the running verifier
        FutureTask<Optional<Citation>> task = new FutureTask<>(() -> verifier.verify(citation, context));
        try {
            verifierExecutor.execute(task);
            Optional<Citation> improved = task.get(lawGraphConfig.getVerifierTimeoutSeconds(), TimeUnit.SECONDS);
            if (improved == null || improved.isEmpty()) {
                return citation;
            }
            Citation verified = improved.get();
            log.debug("Verifier improved '{}' -> {}", citation.getText(), verified.getTarget());
            return verified.toBuilder()
                    .confidence(confidenceScorer.confidence(verified.getMethod(), verified.getCertainty()))
                    .build();

        } catch (RejectedExecutionException e) {
            return failed(citation, "verifier pool full: " + e.getMessage(), warnings);
        } catch (TimeoutException e) {
            task.cancel(true);
            return failed(citation, "timed out after " + lawGraphConfig.getVerifierTimeoutSeconds() + "s", warnings);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return failed(citation, cause.getMessage(), warnings);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            task.cancel(true);
            return failed(citation, "interrupted", warnings);
        }
    }

    private Citation failed(Citation citation, String reason, Consumer<ParseWarning> warnings) {
        log.warn("Verifier failed for '{}' at {}: {}", citation.getText(), citation.getSource(), reason);
        warnings.accept(ParseWarning.of(WarningType.VERIFIER_FAILURE,
                "Verifier failed for '" + citation.getText() + "': " + reason,
                String.valueOf(citation.getSource())));
        return citation;
    }
}
