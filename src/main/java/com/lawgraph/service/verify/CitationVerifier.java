package com.lawgraph.service.verify;

import com.lawgraph.model.citation.Citation;

import java.util.Optional;

/**
 * Second opinion on a weak citation. Returns an improved citation, or empty
 * when the verifier has nothing better. Implementations may be slow or fail;
 * callers bound them with a timeout.
 */
public interface CitationVerifier {

    Optional<Citation> verify(Citation candidate, String surroundingContext);
}
