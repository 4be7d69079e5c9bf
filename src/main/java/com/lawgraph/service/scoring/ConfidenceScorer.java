package com.lawgraph.service.scoring;

import com.lawgraph.model.citation.Certainty;
import com.lawgraph.model.citation.Citation;
import com.lawgraph.model.citation.ResolutionMethod;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Assigns confidence from resolution method and certainty.
 */
@Service
public class ConfidenceScorer {

    public static final double DIRECT_PATTERN = 0.95;
    public static final double DICTIONARY = 0.90;
    public static final double RANGE_EXPANSION = 0.85;
    public static final double CONTEXT_EXACT = 0.85;
    public static final double CONTEXT_RECALLED = 0.80;
    public static final double CONTEXT_SYMBOLIC = 0.75;
    public static final double DEGRADED = 0.5;
    public static final double VERIFIER = 0.7;
    public static final double EXTERNAL_UNRESOLVED = 0.2;
    public static final double NUMERAL_FALLBACK = 0.1;
    public static final double UNSPECIFIABLE = 0.0;

    public List<Citation> score(List<Citation> citations) {
        return citations.stream()
                .map(c -> c.toBuilder().confidence(confidence(c.getMethod(), c.getCertainty())).build())
                .collect(Collectors.toList());
    }

    public double confidence(ResolutionMethod method, Certainty certainty) {
        if (certainty == Certainty.DEGRADED) {
            return DEGRADED;
        }
        return switch (method) {
            case DIRECT_PATTERN -> DIRECT_PATTERN;
            case DICTIONARY -> DICTIONARY;
            case RANGE_EXPANSION -> RANGE_EXPANSION;
            case CONTEXT -> certainty == Certainty.RECALLED ? CONTEXT_RECALLED
                    : certainty == Certainty.SYMBOLIC ? CONTEXT_SYMBOLIC
                    : CONTEXT_EXACT;
            case VERIFIER -> VERIFIER;
            case UNRESOLVED -> certainty == Certainty.IDENTITY_MISS ? EXTERNAL_UNRESOLVED
                    : certainty == Certainty.NUMERAL_FALLBACK ? NUMERAL_FALLBACK
                    : UNSPECIFIABLE;
        };
    }
}
