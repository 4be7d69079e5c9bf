package com.lawgraph.service.verify;

import com.lawgraph.config.LawGraphConfig;
import com.lawgraph.exception.VerifierException;
import com.lawgraph.model.ParseWarning;
import com.lawgraph.model.WarningType;
import com.lawgraph.model.citation.Certainty;
import com.lawgraph.model.citation.Citation;
import com.lawgraph.model.citation.CitationKind;
import com.lawgraph.model.citation.CitationTarget;
import com.lawgraph.model.citation.ResolutionMethod;
import com.lawgraph.model.citation.SourceLocation;
import com.lawgraph.model.citation.Span;
import com.lawgraph.model.document.ArticleNumber;
import com.lawgraph.model.document.DivisionTag;
import com.lawgraph.service.scoring.ConfidenceScorer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class VerificationServiceTest {

    private static final String LAW = "405AC0000000099";
    private static final SourceLocation SOURCE =
            new SourceLocation(LAW, DivisionTag.main(), ArticleNumber.of(6), 1, null);

    @Mock
    private CitationVerifier verifier;

    @Mock
    private ObjectProvider<CitationVerifier> verifierProvider;

    private final ConfidenceScorer scorer = new ConfidenceScorer();
    private final List<ParseWarning> warnings = new ArrayList<>();
    private final ExecutorService executor = Executors.newSingleThreadExecutor();

    private LawGraphConfig config;
    private VerificationService service;

    @BeforeEach
    void setUp() {
        config = new LawGraphConfig();
        LawGraphConfig.Verifier settings = new LawGraphConfig.Verifier();
        settings.setEnabled(true);
        settings.setThreshold(0.5);
        settings.setTimeoutSeconds(1);
        config.setVerifier(settings);
        service = new VerificationService(config, verifierProvider, scorer, executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void shouldReturnCitationsUnchanged_whenVerifierDisabled() {
        // Given
        config.getVerifier().setEnabled(false);
        List<Citation> citations = List.of(unresolved());

        // When
        List<Citation> result = service.verify(citations, "文脈", warnings::add);

        // Then
        assertThat(result).isSameAs(citations);
        assertThat(service.isActive()).isFalse();
        verifyNoInteractions(verifierProvider);
    }

    @Test
    void shouldOfferOnlyWeakCitations() {
        // Given
        when(verifierProvider.getIfAvailable()).thenReturn(verifier);
        Citation strong = resolved();
        Citation weak = unresolved();
        when(verifier.verify(any(Citation.class), anyString())).thenReturn(Optional.empty());

        // When
        List<Citation> result = service.verify(List.of(strong, weak), "文脈", warnings::add);

        // Then
        assertThat(result).containsExactly(strong, weak);
        verify(verifier).verify(weak, "文脈");
        verify(verifier, never()).verify(strong, "文脈");
        assertThat(warnings).isEmpty();
    }

    @Test
    void shouldRescoreImprovedCitation() {
        // Given
        when(verifierProvider.getIfAvailable()).thenReturn(verifier);
        Citation weak = unresolved();
        Citation improved = weak.toBuilder()
                .kind(CitationKind.EXTERNAL)
                .target(CitationTarget.article("129AC0000000089", ArticleNumber.of(3), null, null))
                .method(ResolutionMethod.VERIFIER)
                .certainty(Certainty.EXACT)
                .build();
        when(verifier.verify(weak, "文脈")).thenReturn(Optional.of(improved));

        // When
        List<Citation> result = service.verify(List.of(weak), "文脈", warnings::add);

        // Then
        assertThat(result).hasSize(1);
        assertThat(result.get(0).getMethod()).isEqualTo(ResolutionMethod.VERIFIER);
        assertThat(result.get(0).getConfidence()).isEqualTo(ConfidenceScorer.VERIFIER);
        assertThat(result.get(0).getTarget().getLawId()).isEqualTo("129AC0000000089");
    }

    @Test
    void shouldKeepCitationAndWarn_whenVerifierFails() {
        // Given
        when(verifierProvider.getIfAvailable()).thenReturn(verifier);
        Citation weak = unresolved();
        when(verifier.verify(weak, "文脈")).thenThrow(new VerifierException("model unavailable"));

        // When
        List<Citation> result = service.verify(List.of(weak), "文脈", warnings::add);

        // Then
        assertThat(result).containsExactly(weak);
        assertThat(warnings).hasSize(1);
        assertThat(warnings.get(0).type()).isEqualTo(WarningType.VERIFIER_FAILURE);
        assertThat(warnings.get(0).message()).contains("model unavailable");
    }

    @Test
    void shouldKeepCitationAndWarn_whenVerifierTimesOut() {
        // Given
        when(verifierProvider.getIfAvailable()).thenReturn(verifier);
        Citation weak = unresolved();
        CountDownLatch never = new CountDownLatch(1);
        when(verifier.verify(weak, "文脈")).thenAnswer(invocation -> {
            never.await();
            return Optional.empty();
        });

        // When
        List<Citation> result = service.verify(List.of(weak), "文脈", warnings::add);

        // Then
        assertThat(result).containsExactly(weak);
        assertThat(warnings).extracting(ParseWarning::type).containsExactly(WarningType.VERIFIER_FAILURE);
        assertThat(warnings.get(0).message()).contains("timed out");
    }

    @Test
    void shouldKeepCitationAndWarn_whenVerifierPoolRejects() {
        // Given
        when(verifierProvider.getIfAvailable()).thenReturn(verifier);
        VerificationService rejecting = new VerificationService(config, verifierProvider, scorer, task -> {
            throw new TaskRejectedException("ExecutorService in active state did not accept task");
        });
        Citation weak = unresolved();

        // When
        List<Citation> result = rejecting.verify(List.of(weak), "文脈", warnings::add);

        // Then
        assertThat(result).containsExactly(weak);
        assertThat(warnings).extracting(ParseWarning::type).containsExactly(WarningType.VERIFIER_FAILURE);
        assertThat(warnings.get(0).message()).contains("verifier pool full");
        verifyNoInteractions(verifier);
    }

    @Test
    void shouldFreePoolThread_whenHungVerifierTimesOut() {
        // Given
        ThreadPoolTaskExecutor bounded = new ThreadPoolTaskExecutor();
        bounded.setCorePoolSize(1);
        bounded.setMaxPoolSize(1);
        bounded.setQueueCapacity(1);
        bounded.initialize();
        VerificationService boundedService = new VerificationService(config, verifierProvider, scorer, bounded);
        when(verifierProvider.getIfAvailable()).thenReturn(verifier);
        Citation weak = unresolved();
        AtomicInteger started = new AtomicInteger();
        CountDownLatch never = new CountDownLatch(1);
        when(verifier.verify(weak, "文脈")).thenAnswer(invocation -> {
            started.incrementAndGet();
            never.await();
            return Optional.empty();
        });

        try {
            // When
            List<Citation> kept = new ArrayList<>();
            for (int unit = 0; unit < 3; unit++) {
                kept.addAll(boundedService.verify(List.of(weak), "文脈", warnings::add));
            }

            // Then
            assertThat(kept).containsExactly(weak, weak, weak);
            assertThat(warnings).hasSize(3)
                    .allSatisfy(warning -> assertThat(warning.message()).contains("timed out"));
            assertThat(started).hasValue(3);
            verify(verifier, times(3)).verify(weak, "文脈");
        } finally {
            bounded.shutdown();
        }
    }

    @Test
    void shouldOfferResolvedCitationBelowThreshold() {
        Citation degraded = resolved().toBuilder().certainty(Certainty.DEGRADED).confidence(0.5).build();
        config.getVerifier().setThreshold(0.6);

        assertThat(service.needsVerification(degraded)).isTrue();
        assertThat(service.needsVerification(resolved())).isFalse();
    }

    private static Citation resolved() {
        return Citation.builder()
                .source(SOURCE)
                .text("第三条")
                .span(new Span(0, 3))
                .kind(CitationKind.INTERNAL)
                .target(CitationTarget.article(LAW, ArticleNumber.of(3), null, null))
                .confidence(0.95)
                .method(ResolutionMethod.DIRECT_PATTERN)
                .certainty(Certainty.EXACT)
                .groupId(1)
                .build();
    }

    private static Citation unresolved() {
        return Citation.builder()
                .source(SOURCE)
                .text("架空振興法第三条")
                .span(new Span(0, 8))
                .kind(CitationKind.EXTERNAL_UNRESOLVED)
                .target(CitationTarget.unresolved())
                .confidence(0.2)
                .method(ResolutionMethod.UNRESOLVED)
                .certainty(Certainty.IDENTITY_MISS)
                .groupId(2)
                .build();
    }
}
